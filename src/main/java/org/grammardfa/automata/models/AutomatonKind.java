package org.grammardfa.automata.models;

/**
 * 自动机的三种形态，共享同一个 {@link Automaton} 接口。
 */
public enum AutomatonKind {

    NFA,
    DFA,
    MINIMIZED_DFA;

    public boolean isDeterministic() {
        return this != NFA;
    }
}
