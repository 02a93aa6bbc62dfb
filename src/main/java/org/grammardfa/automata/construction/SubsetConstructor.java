package org.grammardfa.automata.construction;

import org.grammardfa.automata.base.State;
import org.grammardfa.automata.base.StateSubset;
import org.grammardfa.automata.models.AutomatonKind;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.automata.models.NFA;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * 子集构造：NFA -> DFA。
 * <p>
 * 每个 DFA 状态以一个规范化的 NFA 状态子集 ({@link StateSubset}) 标识，
 * 开始状态为 ε-closure({NFA 开始状态})，按广度优先处理工作队列中尚未处理的子集。
 * 目标子集为空时不添加迁移（隐式拒绝）。子集空间有限，每个子集至多处理一次，因此必然终止。
 */
public final class SubsetConstructor {

    private static final Logger logger = LoggerFactory.getLogger(SubsetConstructor.class);

    public DFA determinize(NFA nfa) {
        Objects.requireNonNull(nfa, "NFA cannot be null.");

        DFA.Builder builder = new DFA.Builder(AutomatonKind.DFA, nfa.getAlphabet());
        Map<StateSubset, State> dfaStateOf = new HashMap<>();
        Map<State, SortedSet<State>> members = new HashMap<>();
        Queue<StateSubset> worklist = new ArrayDeque<>();

        SortedSet<State> startClosure = nfa.epsilonClosure(List.of(nfa.getStartState()));
        StateSubset startLabel = StateSubset.ofStates(startClosure);
        State dfaStart = builder.addState(render(startClosure), containsAccepting(startClosure));
        dfaStateOf.put(startLabel, dfaStart);
        members.put(dfaStart, startClosure);
        worklist.add(startLabel);
        builder.setStartState(dfaStart);

        while (!worklist.isEmpty()) {
            StateSubset currentLabel = worklist.poll();
            State current = dfaStateOf.get(currentLabel);
            SortedSet<State> currentMembers = members.get(current);

            for (Symbol symbol : nfa.getAlphabet()) {
                SortedSet<State> targetMembers = nfa.epsilonClosure(nfa.move(currentMembers, symbol));
                if (targetMembers.isEmpty()) {
                    continue;
                }
                StateSubset targetLabel = StateSubset.ofStates(targetMembers);
                State target = dfaStateOf.get(targetLabel);
                if (target == null) {
                    target = builder.addState(render(targetMembers), containsAccepting(targetMembers));
                    dfaStateOf.put(targetLabel, target);
                    members.put(target, targetMembers);
                    worklist.add(targetLabel);
                    logger.debug("发现新子集 {} -> DFA 状态 {}", targetLabel, target.getId());
                }
                builder.addTransition(current, symbol, target);
            }
        }

        DFA dfa = builder.build();
        logger.info("子集构造完成：NFA {} 个状态 -> DFA {} 个状态，{} 条迁移",
                nfa.size(), dfa.size(), dfa.getTransitions().size());
        return dfa;
    }

    private static boolean containsAccepting(SortedSet<State> subset) {
        return subset.stream().anyMatch(State::isAccepting);
    }

    /**
     * 构造期标签，形如 {A,B}，只用于显示。
     */
    private static String render(SortedSet<State> subset) {
        return subset.stream().map(State::getLabel).collect(Collectors.joining(",", "{", "}"));
    }
}
