package org.grammardfa.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 状态 ID 的规范化集合，用作子集构造中 DFA 状态的标识以及最小化中等价块的标识。
 * 内部为有序集合，相同成员的两个实例无论构造顺序如何都相等且哈希一致。
 * 此类是不可变的。
 */
public final class StateSubset implements Comparable<StateSubset>, Iterable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(StateSubset.class);

    public static final StateSubset EMPTY = new StateSubset(Collections.emptySet());

    @Getter
    private final SortedSet<Integer> ids;
    private final int hashCode;

    private StateSubset(Collection<Integer> ids) {
        Objects.requireNonNull(ids, "State ids cannot be null");
        this.ids = Collections.unmodifiableSortedSet(new TreeSet<>(ids));
        this.hashCode = Objects.hash(this.ids);
    }

    public static StateSubset of(Collection<Integer> ids) {
        return ids.isEmpty() ? EMPTY : new StateSubset(ids);
    }

    public static StateSubset of(Integer... ids) {
        return of(Arrays.asList(ids));
    }

    /**
     * 由状态集合构造，取各状态的 ID。
     */
    public static StateSubset ofStates(Collection<State> states) {
        return of(states.stream().map(State::getId).collect(Collectors.toList()));
    }

    public boolean contains(int id) {
        return ids.contains(id);
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public int size() {
        return ids.size();
    }

    public int first() {
        if (ids.isEmpty()) {
            logger.warn("对空 StateSubset 调用了 first()");
            throw new IllegalStateException("Empty subset has no first element");
        }
        return ids.first();
    }

    /**
     * 与另一个集合是否有交集。
     */
    public boolean intersects(Collection<Integer> other) {
        for (Integer id : other) {
            if (ids.contains(id)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<Integer> iterator() {
        return ids.iterator();
    }

    /**
     * 按成员序列的字典序比较，较短的前缀排在前面。
     */
    @Override
    public int compareTo(StateSubset other) {
        Iterator<Integer> mine = this.ids.iterator();
        Iterator<Integer> theirs = other.ids.iterator();
        while (mine.hasNext() && theirs.hasNext()) {
            int cmp = Integer.compare(mine.next(), theirs.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(mine.hasNext(), theirs.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StateSubset that = (StateSubset) o;
        return ids.equals(that.ids);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }
}
