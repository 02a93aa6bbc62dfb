package org.grammardfa.grammar;

/**
 * 文法右部符号的书写约定。
 */
public enum SymbolNotation {

    /**
     * 逐字符：小写字母和数字是单字符终结符，大写字母是单字符非终结符，空白忽略。
     * 例如 {@code S -> aS | bS | ε}。
     */
    CHARACTER,

    /**
     * 以空白分隔的记号：大写开头或尖括号包围的是非终结符，小写开头或引号包围的是终结符。
     * 例如 {@code Expr -> 'if' Cond | <stmt>}。
     */
    TOKEN
}
