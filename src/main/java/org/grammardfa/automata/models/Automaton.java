package org.grammardfa.automata.models;

import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.automata.base.State;
import org.grammardfa.automata.base.Transition;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * 流水线各阶段输出的只读自动机快照。
 * 提供状态、开始状态、接受状态集合和完整的迁移三元组序列，足以让外部渲染器绘图。
 */
public interface Automaton {

    AutomatonKind getKind();

    /**
     * @return 按 ID 排序的全部状态。
     */
    SortedSet<State> getStates();

    State getStartState();

    SortedSet<State> getAcceptingStates();

    /**
     * @return 终结符字母表，不含 epsilon。
     */
    Alphabet getAlphabet();

    /**
     * @return 按 (from, symbol, to) 排序的全部迁移。
     */
    List<Transition> getTransitions();

    default int size() {
        return getStates().size();
    }

    default State getStateById(int id) {
        for (State state : getStates()) {
            if (state.getId() == id) {
                return state;
            }
        }
        throw new NoSuchElementException("No state with id " + id + " in " + getKind());
    }

    default List<Integer> getStateIds() {
        return getStates().stream().map(State::getId).collect(Collectors.toList());
    }

    default List<Integer> getAcceptingStateIds() {
        return getAcceptingStates().stream().map(State::getId).collect(Collectors.toList());
    }

    default boolean isAccepting(State state) {
        return getAcceptingStates().contains(state);
    }
}
