package org.grammardfa.utils;

import org.apache.commons.lang3.StringUtils;
import org.grammardfa.automata.base.State;
import org.grammardfa.automata.base.Transition;
import org.grammardfa.automata.models.Automaton;
import org.grammardfa.core.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 把自动机渲染为文本迁移表：每行一个状态，每列一个符号。
 * {@code ->} 标记开始状态，{@code *} 标记接受状态，{@code -} 表示没有迁移；
 * NFA 的单元格是目标集合，有 epsilon 迁移时额外有一列 ε。
 */
public final class AutomatonFormatter {

    private static final String NO_TRANSITION = "-";

    private AutomatonFormatter() {
    }

    public static String toTransitionTable(Automaton automaton) {
        List<Symbol> columns = new ArrayList<>();
        boolean hasEpsilon = automaton.getTransitions().stream().anyMatch(Transition::isEpsilon);
        if (hasEpsilon) {
            columns.add(Symbol.EPSILON);
        }
        automaton.getAlphabet().forEach(columns::add);

        Map<State, Map<Symbol, SortedSet<State>>> cells = new LinkedHashMap<>();
        for (Transition t : automaton.getTransitions()) {
            cells.computeIfAbsent(t.getSource(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(t.getSymbol(), k -> new TreeSet<>())
                    .add(t.getTarget());
        }

        List<List<String>> rows = new ArrayList<>();
        List<String> header = new ArrayList<>();
        header.add("State");
        columns.forEach(symbol -> header.add(symbol.toString()));
        rows.add(header);

        for (State state : automaton.getStates()) {
            List<String> row = new ArrayList<>();
            String marker = (state.equals(automaton.getStartState()) ? "->" : "")
                    + (automaton.isAccepting(state) ? "*" : "");
            row.add(marker + state.getLabel());
            Map<Symbol, SortedSet<State>> outgoing = cells.getOrDefault(state, Map.of());
            for (Symbol symbol : columns) {
                SortedSet<State> targets = outgoing.get(symbol);
                row.add(render(targets, automaton.getKind().isDeterministic()));
            }
            rows.add(row);
        }

        int[] widths = new int[header.size()];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        List<String> lines = new ArrayList<>();
        for (List<String> row : rows) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < row.size(); i++) {
                line.append(StringUtils.rightPad(row.get(i), widths[i])).append("  ");
            }
            lines.add(StringUtils.stripEnd(line.toString(), null));
        }
        return String.join("\n", lines);
    }

    private static String render(SortedSet<State> targets, boolean deterministic) {
        if (targets == null || targets.isEmpty()) {
            return NO_TRANSITION;
        }
        if (deterministic) {
            return targets.first().getLabel();
        }
        return targets.stream().map(State::getLabel).collect(Collectors.joining(",", "{", "}"));
    }
}
