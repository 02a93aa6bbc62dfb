package org.grammardfa.core;

/**
 * 文法符号的种类标签。
 */
public enum SymbolType {

    EPSILON,        // 空串标记
    TERMINAL,       // 终结符
    NONTERMINAL;    // 非终结符

    /**
     * 该种类的符号是否会在自动机上消耗一个输入符号。
     */
    public boolean isConsuming() {
        return this == TERMINAL;
    }
}
