package org.grammardfa.automata.models;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.automata.base.State;
import org.grammardfa.automata.base.Transition;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 非确定有限自动机。
 * 迁移关系为 (状态, 符号) 到状态集合的映射，epsilon 作为一个普通的符号值存放在同一个映射中。
 * 此类是不可变的，通过 {@link Builder} 构造。
 */
@Getter
public final class NFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(NFA.class);

    private final SortedSet<State> states;
    private final State startState;
    private final SortedSet<State> acceptingStates;
    private final Alphabet alphabet;
    private final List<Transition> transitions;
    private final Map<Pair<State, Symbol>, SortedSet<State>> transitionMap;

    private NFA(SortedSet<State> states, State startState, Alphabet alphabet, List<Transition> transitions) {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        this.startState = Objects.requireNonNull(startState, "Start state cannot be null.");
        if (!this.states.contains(startState)) {
            throw new IllegalArgumentException("Start state " + startState + " is not a state of the NFA");
        }
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.acceptingStates = Collections.unmodifiableSortedSet(this.states.stream()
                .filter(State::isAccepting)
                .collect(Collectors.toCollection(TreeSet::new)));

        List<Transition> sorted = new ArrayList<>(new TreeSet<>(transitions));
        this.transitions = Collections.unmodifiableList(sorted);

        Map<Pair<State, Symbol>, SortedSet<State>> map = new HashMap<>();
        for (Transition t : sorted) {
            map.computeIfAbsent(Pair.of(t.getSource(), t.getSymbol()), k -> new TreeSet<>()).add(t.getTarget());
        }
        map.replaceAll((k, v) -> Collections.unmodifiableSortedSet(v));
        this.transitionMap = Collections.unmodifiableMap(map);
    }

    @Override
    public AutomatonKind getKind() {
        return AutomatonKind.NFA;
    }

    /**
     * 获取 (state, symbol) 的目标状态集合。
     * @return 目标状态集合，可能为空、单元素或多元素。
     */
    public SortedSet<State> targets(State state, Symbol symbol) {
        SortedSet<State> targets = transitionMap.get(Pair.of(state, symbol));
        return targets == null ? Collections.emptySortedSet() : targets;
    }

    /**
     * 计算状态集合的 epsilon 闭包：从集合中任一状态只经 epsilon 迁移可达的所有状态，包括集合本身。
     * 反复加入 epsilon 迁移的目标直到集合不再增长。
     */
    public SortedSet<State> epsilonClosure(Collection<State> from) {
        SortedSet<State> closure = new TreeSet<>(from);
        Deque<State> pending = new ArrayDeque<>(from);
        while (!pending.isEmpty()) {
            State current = pending.pop();
            for (State next : targets(current, Symbol.EPSILON)) {
                if (closure.add(next)) {
                    pending.push(next);
                }
            }
        }
        return closure;
    }

    /**
     * 集合中所有状态在 symbol 上的目标的并集（不含闭包）。
     */
    public SortedSet<State> move(Collection<State> from, Symbol symbol) {
        SortedSet<State> result = new TreeSet<>();
        for (State state : from) {
            result.addAll(targets(state, symbol));
        }
        return result;
    }

    /**
     * 直接模拟 NFA 判断符号序列是否被接受。
     */
    public boolean accepts(List<Symbol> input) {
        SortedSet<State> current = epsilonClosure(List.of(startState));
        for (Symbol symbol : input) {
            current = epsilonClosure(move(current, symbol));
            if (current.isEmpty()) {
                return false;
            }
        }
        return current.stream().anyMatch(State::isAccepting);
    }

    public boolean hasEpsilonTransitions() {
        return transitions.stream().anyMatch(Transition::isEpsilon);
    }

    @Override
    public String toString() {
        return "NFA(states=" + states.size() + ", start=" + startState.getLabel()
                + ", accepting=" + acceptingStates + ", transitions=" + transitions.size() + ")";
    }

    /**
     * 逐步构造 NFA。状态 ID 按添加顺序从 0 开始分配。
     */
    public static final class Builder {

        private final Alphabet alphabet;
        private final SortedSet<State> states = new TreeSet<>();
        private final List<Transition> transitions = new ArrayList<>();
        private State startState;

        public Builder(Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        }

        public State addState(String label, boolean accepting) {
            State state = new State(states.size(), label, accepting);
            states.add(state);
            return state;
        }

        public Builder setStartState(State state) {
            requireKnown(state);
            this.startState = state;
            return this;
        }

        public Builder addTransition(State from, Symbol symbol, State to) {
            requireKnown(from);
            requireKnown(to);
            if (!symbol.isEpsilon() && !alphabet.contains(symbol)) {
                logger.warn("迁移符号 {} 不在字母表 {} 中", symbol, alphabet);
                throw new IllegalArgumentException("Symbol " + symbol + " is not in the alphabet");
            }
            transitions.add(new Transition(from, symbol, to));
            return this;
        }

        private void requireKnown(State state) {
            Objects.requireNonNull(state, "State cannot be null.");
            if (!states.contains(state)) {
                throw new IllegalArgumentException("State " + state + " was not created by this builder");
            }
        }

        public NFA build() {
            if (startState == null) {
                throw new IllegalStateException("NFA start state has not been set");
            }
            NFA nfa = new NFA(states, startState, alphabet, transitions);
            logger.debug("构造 {}", nfa);
            return nfa;
        }
    }
}
