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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 确定有限自动机，也用于表示最小化后的 DFA（由 {@link AutomatonKind} 区分）。
 * 每个 (状态, 符号) 至多一条迁移；不要求完全，缺失的迁移表示隐式拒绝。
 * 此类是不可变的，通过 {@link Builder} 构造。
 */
@Getter
public final class DFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(DFA.class);

    private final AutomatonKind kind;
    private final SortedSet<State> states;
    private final State startState;
    private final SortedSet<State> acceptingStates;
    private final Alphabet alphabet;
    private final List<Transition> transitions;
    private final Map<Pair<State, Symbol>, State> transitionMap;

    private DFA(AutomatonKind kind, SortedSet<State> states, State startState, Alphabet alphabet,
                Map<Pair<State, Symbol>, State> transitionMap) {
        this.kind = kind;
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        this.startState = Objects.requireNonNull(startState, "Start state cannot be null.");
        if (!this.states.contains(startState)) {
            throw new IllegalArgumentException("Start state " + startState + " is not a state of the DFA");
        }
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.acceptingStates = Collections.unmodifiableSortedSet(this.states.stream()
                .filter(State::isAccepting)
                .collect(Collectors.toCollection(TreeSet::new)));
        this.transitionMap = Collections.unmodifiableMap(new HashMap<>(transitionMap));
        this.transitions = transitionMap.entrySet().stream()
                .map(e -> new Transition(e.getKey().getLeft(), e.getKey().getRight(), e.getValue()))
                .sorted()
                .toList();
    }

    /**
     * 获取 (state, symbol) 的唯一目标状态。
     * @return 目标状态；没有迁移时为空（隐式拒绝）。
     */
    public Optional<State> next(State state, Symbol symbol) {
        return Optional.ofNullable(transitionMap.get(Pair.of(state, symbol)));
    }

    /**
     * 获取某个状态的所有出迁移，按符号排序。
     */
    public Map<Symbol, State> outgoing(State state) {
        Map<Symbol, State> result = new LinkedHashMap<>();
        for (Symbol symbol : alphabet) {
            State target = transitionMap.get(Pair.of(state, symbol));
            if (target != null) {
                result.put(symbol, target);
            }
        }
        return result;
    }

    /**
     * 从开始状态出发经任意迁移序列可达的状态集合（包括开始状态）。
     */
    public SortedSet<State> reachableStates() {
        SortedSet<State> visited = new TreeSet<>();
        Queue<State> queue = new ArrayDeque<>();
        visited.add(startState);
        queue.add(startState);
        while (!queue.isEmpty()) {
            State current = queue.poll();
            for (State target : outgoing(current).values()) {
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return visited;
    }

    /**
     * 判断符号序列是否被接受，遇到缺失的迁移立即拒绝。
     */
    public boolean accepts(List<Symbol> input) {
        State current = startState;
        for (Symbol symbol : input) {
            State target = transitionMap.get(Pair.of(current, symbol));
            if (target == null) {
                return false;
            }
            current = target;
        }
        return current.isAccepting();
    }

    @Override
    public String toString() {
        return kind + "(states=" + states.size() + ", start=" + startState.getLabel()
                + ", accepting=" + acceptingStates + ", transitions=" + transitions.size() + ")";
    }

    /**
     * 逐步构造 DFA。状态 ID 按添加顺序从 0 开始分配。
     * 同一 (状态, 符号) 上出现两个不同目标属于内部一致性错误。
     */
    public static final class Builder {

        private final AutomatonKind kind;
        private final Alphabet alphabet;
        private final List<State> states = new ArrayList<>();
        private final Map<Pair<State, Symbol>, State> transitionMap = new HashMap<>();
        private State startState;

        public Builder(AutomatonKind kind, Alphabet alphabet) {
            this.kind = Objects.requireNonNull(kind, "Kind cannot be null.");
            if (!kind.isDeterministic()) {
                throw new IllegalArgumentException("DFA.Builder cannot build an automaton of kind " + kind);
            }
            this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        }

        public Builder(Alphabet alphabet) {
            this(AutomatonKind.DFA, alphabet);
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
            if (symbol.isEpsilon()) {
                throw new IllegalArgumentException("A DFA cannot have epsilon transitions");
            }
            if (!alphabet.contains(symbol)) {
                logger.warn("迁移符号 {} 不在字母表 {} 中", symbol, alphabet);
                throw new IllegalArgumentException("Symbol " + symbol + " is not in the alphabet");
            }
            State previous = transitionMap.putIfAbsent(Pair.of(from, symbol), to);
            if (previous != null && !previous.equals(to)) {
                logger.error("DFA 确定性被破坏：{} 在 {} 上同时到达 {} 和 {}", from, symbol, previous, to);
                throw new IllegalStateException("Nondeterministic transition from " + from + " on " + symbol);
            }
            return this;
        }

        private void requireKnown(State state) {
            Objects.requireNonNull(state, "State cannot be null.");
            if (state.getId() >= states.size() || !states.get(state.getId()).equals(state)) {
                throw new IllegalArgumentException("State " + state + " was not created by this builder");
            }
        }

        public DFA build() {
            if (startState == null) {
                throw new IllegalStateException("DFA start state has not been set");
            }
            DFA dfa = new DFA(kind, new TreeSet<>(states), startState, alphabet, transitionMap);
            logger.debug("构造 {}", dfa);
            return dfa;
        }
    }
}
