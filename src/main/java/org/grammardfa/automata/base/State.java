package org.grammardfa.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 自动机中的一个状态。
 * State 是不可变对象；ID 只在所属自动机内唯一，由构造该自动机的阶段分配，
 * 不存在跨请求共享的全局计数器。
 */
@Getter
public final class State implements Comparable<State> {

    private final int id;
    private final String label;
    private final boolean accepting;

    private final int hashCode;

    /**
     * @param id        状态在所属自动机内的唯一 ID。
     * @param label     状态的显示标签。
     * @param accepting 是否为接受状态。
     */
    public State(int id, String label, boolean accepting) {
        if (id < 0) {
            throw new IllegalArgumentException("State id must be non-negative: " + id);
        }
        this.id = id;
        this.label = Objects.requireNonNull(label, "State label cannot be null");
        this.accepting = accepting;
        this.hashCode = Objects.hash(id, label, accepting);
    }

    /**
     * 创建一个标签为 "q" + ID 的状态。
     */
    public static State of(int id, boolean accepting) {
        return new State(id, "q" + id, accepting);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return id == state.id && accepting == state.accepting && label.equals(state.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }

    @Override
    public int compareTo(State other) {
        return Integer.compare(this.id, other.id);
    }
}
