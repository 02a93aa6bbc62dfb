package org.grammardfa.automata.minimization;

import org.grammardfa.automata.models.DFA;

/**
 * DFA 最小化策略。结果是一个 {@link org.grammardfa.automata.models.AutomatonKind#MINIMIZED_DFA}，
 * 与输入语言等价，每个 Myhill-Nerode 等价类对应一个状态。
 */
public interface DFAMinimizer {

    DFA minimize(DFA dfa);
}
