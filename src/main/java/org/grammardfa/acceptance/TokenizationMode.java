package org.grammardfa.acceptance;

import org.grammardfa.grammar.SymbolNotation;

/**
 * 测试串切分为终结符的方式。默认由文法的记法决定，可在配置中覆盖。
 */
public enum TokenizationMode {

    /**
     * 每个字符必须恰好是一个终结符。
     */
    CHARACTER,

    /**
     * 每一步取最长的终结符前缀，记号之间的空白被跳过。
     */
    LONGEST_MATCH;

    /**
     * 文法记法对应的默认切分方式。
     */
    public static TokenizationMode forNotation(SymbolNotation notation) {
        return switch (notation) {
            case CHARACTER -> CHARACTER;
            case TOKEN -> LONGEST_MATCH;
        };
    }
}
