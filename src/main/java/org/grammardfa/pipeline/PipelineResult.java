package org.grammardfa.pipeline;

import lombok.Getter;
import org.grammardfa.acceptance.AcceptanceResult;
import org.grammardfa.acceptance.Acceptor;
import org.grammardfa.acceptance.TokenizationMode;
import org.grammardfa.automata.models.Automaton;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.automata.models.NFA;
import org.grammardfa.grammar.Grammar;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次完整流水线运行的输出：文法以及 NFA、DFA、最小化 DFA 三个快照。
 * 所有成员都是不可变的，外部只读取不修改。
 */
@Getter
public final class PipelineResult {

    // 由正则表达式构造时没有文法
    private final Grammar grammar;
    private final NFA nfa;
    private final DFA dfa;
    private final DFA minimizedDfa;
    private final Acceptor acceptor;

    PipelineResult(Grammar grammar, NFA nfa, DFA dfa, DFA minimizedDfa, TokenizationMode tokenizationMode) {
        this.grammar = grammar;
        this.nfa = Objects.requireNonNull(nfa, "NFA cannot be null.");
        this.dfa = Objects.requireNonNull(dfa, "DFA cannot be null.");
        this.minimizedDfa = Objects.requireNonNull(minimizedDfa, "Minimized DFA cannot be null.");
        this.acceptor = new Acceptor(minimizedDfa, tokenizationMode);
    }

    public Optional<Grammar> findGrammar() {
        return Optional.ofNullable(grammar);
    }

    /**
     * @return 按阶段顺序排列的 NFA、DFA、最小化 DFA。
     */
    public List<Automaton> getAutomata() {
        return List.of(nfa, dfa, minimizedDfa);
    }

    public TokenizationMode getTokenizationMode() {
        return acceptor.getMode();
    }

    /**
     * 在最小化 DFA 上判定测试串。
     */
    public AcceptanceResult test(String input) {
        return acceptor.run(input);
    }

    public boolean accepts(String input) {
        return acceptor.accepts(input);
    }
}
