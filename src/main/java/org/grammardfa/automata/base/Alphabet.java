package org.grammardfa.automata.base;

import lombok.Getter;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 自动机的输入字母表，只包含终结符。
 * Alphabet 是不可变对象，一旦创建，其包含的符号集合就不会改变。
 */
public final class Alphabet implements Iterable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    public static final Alphabet EMPTY = new Alphabet(Collections.emptySet());

    @Getter
    private final SortedSet<Symbol> symbols;
    private final Map<String, Symbol> symbolsByText;
    // 按长度降序，用于最长匹配
    private final List<Symbol> byDescendingLength;
    @Getter
    private final int maxSymbolLength;
    private final int hashCode;

    private Alphabet(Collection<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols cannot be null");
        for (Symbol symbol : symbols) {
            if (!symbol.isTerminal()) {
                logger.warn("字母表只能包含终结符，收到 {} ({})", symbol, symbol.getType());
                throw new IllegalArgumentException("Alphabet may only contain terminals, got: " + symbol);
            }
        }
        this.symbols = Collections.unmodifiableSortedSet(new TreeSet<>(symbols));
        this.symbolsByText = this.symbols.stream()
                .collect(Collectors.toUnmodifiableMap(Symbol::getText, symbol -> symbol));
        this.byDescendingLength = this.symbols.stream()
                .sorted(Comparator.comparingInt(Symbol::length).reversed().thenComparing(Comparator.naturalOrder()))
                .toList();
        this.maxSymbolLength = this.symbols.stream().mapToInt(Symbol::length).max().orElse(0);
        this.hashCode = Objects.hash(this.symbols);
        logger.debug("创建 Alphabet，包含 {} 个终结符：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从终结符集合创建字母表。
     * @param symbols 终结符集合。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Collection<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列终结符文本创建字母表。
     */
    public static Alphabet of(String... texts) {
        return new Alphabet(Arrays.stream(texts).map(Symbol::terminal).toList());
    }

    /**
     * 根据文本获取终结符。
     * @param text 终结符文本。
     * @return 对应的终结符，如果不存在则返回 null。
     */
    public Symbol getSymbolByText(String text) {
        return symbolsByText.get(text);
    }

    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /**
     * 每个终结符是否都只有一个字符。
     */
    public boolean isCharacterLevel() {
        return maxSymbolLength <= 1;
    }

    /**
     * 在 input 的 offset 处寻找最长的终结符前缀。
     * @return 匹配到的终结符；没有任何终结符匹配时返回空。
     */
    public Optional<Symbol> longestMatch(String input, int offset) {
        for (Symbol candidate : byDescendingLength) {
            if (input.startsWith(candidate.getText(), offset)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
