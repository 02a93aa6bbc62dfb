package org.grammardfa.pipeline;

import lombok.Getter;
import org.grammardfa.acceptance.TokenizationMode;
import org.grammardfa.automata.construction.NFABuilder;
import org.grammardfa.automata.construction.SubsetConstructor;
import org.grammardfa.automata.minimization.DFAMinimizer;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.automata.models.NFA;
import org.grammardfa.exceptions.GrammarException;
import org.grammardfa.grammar.Grammar;
import org.grammardfa.grammar.GrammarParser;
import org.grammardfa.regex.RegexToNFA;
import org.grammardfa.utils.AutomatonFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 文法 -> NFA -> DFA -> 最小化 DFA 的流水线入口。
 * <p>
 * 每次调用都从头计算，各阶段是纯函数，不共享可变状态，因此同一个实例可以被并发调用。
 * 第一个错误即中止运行，不返回部分结果。
 */
@Getter
public final class GrammarPipeline {

    private static final Logger logger = LoggerFactory.getLogger(GrammarPipeline.class);

    private final PipelineConfig config;
    private final GrammarParser parser;
    private final NFABuilder nfaBuilder;
    private final SubsetConstructor subsetConstructor;
    private final DFAMinimizer minimizer;
    private final RegexToNFA regexToNFA;

    public GrammarPipeline() {
        this(PipelineConfig.load());
    }

    public GrammarPipeline(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null.");
        this.parser = new GrammarParser(config.getNotation());
        this.nfaBuilder = new NFABuilder();
        this.subsetConstructor = new SubsetConstructor();
        this.minimizer = config.getMinimizationStrategy().create();
        this.regexToNFA = new RegexToNFA();
    }

    public PipelineResult run(String grammarText) {
        return run(grammarText, null);
    }

    /**
     * @param grammarText 原始文法文本。
     * @param startName   开始非终结符名称，为 null 时取第一条产生式的左部。
     * @throws GrammarException 文法解析或 NFA 构造失败。
     */
    public PipelineResult run(String grammarText, String startName) {
        Grammar grammar = parser.parse(grammarText, startName);
        NFA nfa = nfaBuilder.build(grammar);
        return finish(grammar, nfa, config.tokenizationFor(grammar.getNotation()));
    }

    /**
     * 由中缀正则表达式构造自动机，测试串按字符切分（除非配置另有指定）。
     */
    public PipelineResult runRegex(String regex) {
        NFA nfa = regexToNFA.fromInfix(regex);
        TokenizationMode mode = config.getTokenizationOverride() != null
                ? config.getTokenizationOverride()
                : TokenizationMode.CHARACTER;
        return finish(null, nfa, mode);
    }

    private PipelineResult finish(Grammar grammar, NFA nfa, TokenizationMode mode) {
        DFA dfa = internalStage(PipelineStage.SUBSET_CONSTRUCTION, () -> subsetConstructor.determinize(nfa));
        DFA minimized = internalStage(PipelineStage.MINIMIZATION, () -> minimizer.minimize(dfa));
        if (logger.isDebugEnabled()) {
            logger.debug("NFA:\n{}", AutomatonFormatter.toTransitionTable(nfa));
            logger.debug("DFA:\n{}", AutomatonFormatter.toTransitionTable(dfa));
            logger.debug("最小化 DFA:\n{}", AutomatonFormatter.toTransitionTable(minimized));
        }
        logger.info("流水线完成：NFA {} / DFA {} / 最小化 DFA {} 个状态",
                nfa.size(), dfa.size(), minimized.size());
        return new PipelineResult(grammar, nfa, dfa, minimized, mode);
    }

    /**
     * 子集构造和最小化对良构输入不会失败，这里的任何异常都是内部一致性错误。
     */
    private static <T> T internalStage(PipelineStage stage, Supplier<T> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            logger.error("{} 阶段发生内部一致性错误", stage.getDisplayName(), e);
            throw new IllegalStateException("Internal consistency fault during " + stage, e);
        }
    }
}
