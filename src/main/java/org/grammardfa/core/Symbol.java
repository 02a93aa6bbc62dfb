package org.grammardfa.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 文法中的一个原子符号：终结符、非终结符或 epsilon。
 * Symbol 是不可变对象，相等性由文本值和种类标签共同决定。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    // epsilon 的唯一实例，文本为空串
    public static final Symbol EPSILON = new Symbol("", SymbolType.EPSILON);

    private final String text;
    private final SymbolType type;

    private final int hashCode;

    private Symbol(String text, SymbolType type) {
        this.text = Objects.requireNonNull(text, "Symbol text cannot be null");
        this.type = Objects.requireNonNull(type, "Symbol type cannot be null");
        this.hashCode = Objects.hash(text, type);
    }

    /**
     * 工厂方法：创建一个终结符。
     * @param text 终结符文本，不能为空串。
     * @return 终结符实例。
     */
    public static Symbol terminal(String text) {
        requireNonEmpty(text);
        return new Symbol(text, SymbolType.TERMINAL);
    }

    /**
     * 工厂方法：创建一个非终结符。
     * @param name 非终结符名称，不能为空串。
     * @return 非终结符实例。
     */
    public static Symbol nonterminal(String name) {
        requireNonEmpty(name);
        return new Symbol(name, SymbolType.NONTERMINAL);
    }

    private static void requireNonEmpty(String text) {
        if (text == null || text.isEmpty()) {
            logger.warn("尝试用空文本创建非 epsilon 符号");
            throw new IllegalArgumentException("Symbol text cannot be empty; use Symbol.EPSILON");
        }
    }

    public boolean isEpsilon() {
        return type == SymbolType.EPSILON;
    }

    public boolean isTerminal() {
        return type == SymbolType.TERMINAL;
    }

    public boolean isNonterminal() {
        return type == SymbolType.NONTERMINAL;
    }

    public int length() {
        return text.length();
    }

    @Override
    public int compareTo(Symbol other) {
        // epsilon 最前，其次终结符，最后非终结符；同类按文本排序
        int byType = this.type.compareTo(other.type);
        if (byType != 0) {
            return byType;
        }
        return this.text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return type == symbol.type && text.equals(symbol.text);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return isEpsilon() ? "ε" : text;
    }
}
