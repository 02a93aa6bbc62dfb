package org.grammardfa.automata.minimization;

import org.grammardfa.automata.base.State;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.core.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * 最小化用的完全化视图：只保留从开始状态可达的状态，并加入一个合成的死状态 {@link #SINK}，
 * 缺失的迁移一律指向它，死状态在所有符号上自环。
 */
final class SinkCompletedDFA {

    static final int SINK = -1;

    private final DFA dfa;
    private final List<Integer> stateIds;
    private final Map<Integer, State> statesById;

    SinkCompletedDFA(DFA dfa) {
        this.dfa = dfa;
        SortedSet<State> reachable = dfa.reachableStates();
        this.statesById = new HashMap<>();
        List<Integer> ids = new ArrayList<>();
        ids.add(SINK);
        for (State state : reachable) {
            ids.add(state.getId());
            statesById.put(state.getId(), state);
        }
        this.stateIds = Collections.unmodifiableList(ids);
    }

    DFA getDfa() {
        return dfa;
    }

    /**
     * @return 死状态 ID 在前，其后为按 ID 排序的可达状态。
     */
    List<Integer> getStateIds() {
        return stateIds;
    }

    int reachableCount() {
        return statesById.size();
    }

    boolean isAccepting(int id) {
        return id != SINK && statesById.get(id).isAccepting();
    }

    int successor(int id, Symbol symbol) {
        if (id == SINK) {
            return SINK;
        }
        return dfa.next(statesById.get(id), symbol).map(State::getId).orElse(SINK);
    }
}
