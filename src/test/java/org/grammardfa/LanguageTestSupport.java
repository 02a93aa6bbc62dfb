package org.grammardfa;

import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.automata.base.Transition;
import org.grammardfa.automata.models.Automaton;
import org.grammardfa.core.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 测试辅助：枚举有限长度内的全部符号串，用于比较两个自动机的语言。
 */
public final class LanguageTestSupport {

    private LanguageTestSupport() {
    }

    /**
     * 字母表上长度不超过 maxLength 的全部符号串（含空串）。
     */
    public static List<List<Symbol>> allWords(Alphabet alphabet, int maxLength) {
        List<List<Symbol>> words = new ArrayList<>();
        List<List<Symbol>> frontier = new ArrayList<>();
        frontier.add(List.of());
        words.add(List.of());
        for (int length = 1; length <= maxLength; length++) {
            List<List<Symbol>> next = new ArrayList<>();
            for (List<Symbol> prefix : frontier) {
                for (Symbol symbol : alphabet) {
                    List<Symbol> word = new ArrayList<>(prefix);
                    word.add(symbol);
                    next.add(List.copyOf(word));
                }
            }
            words.addAll(next);
            frontier = next;
        }
        return words;
    }

    /**
     * 返回第一个两个判定不一致的符号串；完全一致时返回 null。
     */
    public static List<Symbol> firstDisagreement(Alphabet alphabet, int maxLength,
                                                 Predicate<List<Symbol>> left, Predicate<List<Symbol>> right) {
        for (List<Symbol> word : allWords(alphabet, maxLength)) {
            if (left.test(word) != right.test(word)) {
                return word;
            }
        }
        return null;
    }

    /**
     * 以 (from id, symbol, to id) 表示的迁移结构，用于比较同构（恒等编号）的自动机。
     */
    public static List<String> structure(Automaton automaton) {
        List<String> triples = new ArrayList<>();
        for (Transition t : automaton.getTransitions()) {
            triples.add(t.getSource().getId() + " " + t.getSymbol() + " " + t.getTarget().getId());
        }
        return triples;
    }
}
