package org.grammardfa.grammar;

import lombok.Getter;
import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.core.Symbol;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 一次解析得到的文法上下文：有序的产生式、终结符字母表、非终结符集合和开始符号。
 * 此类是不可变的，每次解析都会重新创建，并显式传递给后续阶段。
 */
@Getter
public final class Grammar {

    private final List<ProductionRule> rules;
    private final Alphabet terminals;
    // 按首次出现的顺序
    private final Set<Symbol> nonterminals;
    private final Symbol startSymbol;
    private final SymbolNotation notation;

    private final int hashCode;

    public Grammar(List<ProductionRule> rules, Alphabet terminals, Set<Symbol> nonterminals,
                   Symbol startSymbol, SymbolNotation notation) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null."));
        this.terminals = Objects.requireNonNull(terminals, "Terminal alphabet cannot be null.");
        // Set.copyOf 不保留顺序
        this.nonterminals = Collections.unmodifiableSet(
                new LinkedHashSet<>(Objects.requireNonNull(nonterminals, "Nonterminals cannot be null.")));
        this.startSymbol = Objects.requireNonNull(startSymbol, "Start symbol cannot be null.");
        this.notation = Objects.requireNonNull(notation, "Notation cannot be null.");
        if (!this.nonterminals.contains(startSymbol)) {
            throw new IllegalArgumentException("Start symbol " + startSymbol + " is not a nonterminal of the grammar");
        }
        this.hashCode = Objects.hash(this.rules, terminals, startSymbol, notation);
    }

    /**
     * 获取指定非终结符的所有产生式。
     */
    public List<ProductionRule> getRulesFor(Symbol head) {
        return rules.stream()
                .filter(rule -> rule.getHead().equals(head))
                .toList();
    }

    /**
     * 作为某条产生式左部出现过的非终结符。
     */
    public Set<Symbol> getDefinedNonterminals() {
        return rules.stream()
                .map(ProductionRule::getHead)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Grammar grammar = (Grammar) o;
        return rules.equals(grammar.rules)
                && terminals.equals(grammar.terminals)
                && List.copyOf(nonterminals).equals(List.copyOf(grammar.nonterminals))
                && startSymbol.equals(grammar.startSymbol)
                && notation == grammar.notation;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return rules.stream()
                .map(ProductionRule::toString)
                .collect(Collectors.joining("\n", "Grammar(start=" + startSymbol + ")\n", ""));
    }
}
