package org.grammardfa.automata.construction;

import org.grammardfa.automata.base.State;
import org.grammardfa.automata.models.NFA;
import org.grammardfa.core.Symbol;
import org.grammardfa.exceptions.EmptyAlphabetException;
import org.grammardfa.exceptions.StructuralException;
import org.grammardfa.grammar.Grammar;
import org.grammardfa.grammar.ProductionRule;
import org.grammardfa.pipeline.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 由右线性文法构造 NFA。
 * <p>
 * 每个非终结符对应一个状态，另有一个全局接受状态。支持的右部形状：
 * <ul>
 *     <li>{@code A -> ε}：A 经 epsilon 到接受状态；</li>
 *     <li>{@code A -> t}：A 经 t 到接受状态；</li>
 *     <li>{@code A -> t B}：A 经 t 到 B；</li>
 *     <li>{@code A -> B}：A 经 epsilon 到 B；</li>
 *     <li>{@code A -> t1 ... tn [B]}：经中间状态串联。</li>
 * </ul>
 * 其余形状抛出 {@link StructuralException}。
 */
public final class NFABuilder {

    private static final Logger logger = LoggerFactory.getLogger(NFABuilder.class);

    // '#' 不会出现在任何记法的非终结符名中，标签不会冲突
    public static final String FINAL_STATE_LABEL = "#F";
    private static final String INTERMEDIATE_SEPARATOR = "#";

    /**
     * @param grammar 已解析的文法。
     * @return 与文法等价的 NFA。
     * @throws StructuralException    某条产生式不是右线性形状。
     * @throws EmptyAlphabetException 文法没有终结符。
     */
    public NFA build(Grammar grammar) {
        Objects.requireNonNull(grammar, "Grammar cannot be null.");
        if (grammar.getTerminals().isEmpty()) {
            throw new EmptyAlphabetException(PipelineStage.NFA_CONSTRUCTION, grammar.toString());
        }

        NFA.Builder builder = new NFA.Builder(grammar.getTerminals());
        Map<Symbol, State> stateOf = new LinkedHashMap<>();
        for (Symbol nonterminal : grammar.getNonterminals()) {
            stateOf.put(nonterminal, builder.addState(nonterminal.getText(), false));
        }
        State finalState = builder.addState(FINAL_STATE_LABEL, true);

        Map<Symbol, Integer> intermediateCounters = new HashMap<>();
        for (ProductionRule rule : grammar.getRules()) {
            RuleShape shape = classify(rule);
            State current = stateOf.get(rule.getHead());
            State target = shape.trailing() == null ? finalState : stateOf.get(shape.trailing());

            List<Symbol> terminals = shape.terminals();
            if (terminals.isEmpty()) {
                builder.addTransition(current, Symbol.EPSILON, target);
                logger.debug("{}: {} --ε--> {}", rule, current, target);
                continue;
            }
            for (int i = 0; i < terminals.size(); i++) {
                State next;
                if (i == terminals.size() - 1) {
                    next = target;
                } else {
                    int n = intermediateCounters.merge(rule.getHead(), 1, Integer::sum);
                    next = builder.addState(rule.getHead().getText() + INTERMEDIATE_SEPARATOR + n, false);
                }
                builder.addTransition(current, terminals.get(i), next);
                logger.debug("{}: {} --{}--> {}", rule, current, terminals.get(i), next);
                current = next;
            }
        }

        builder.setStartState(stateOf.get(grammar.getStartSymbol()));
        NFA nfa = builder.build();
        logger.info("NFA 构造完成：{} 个状态，{} 条迁移，开始状态 {}",
                nfa.size(), nfa.getTransitions().size(), nfa.getStartState());
        return nfa;
    }

    /**
     * 将右部拆成前导终结符序列和可选的末尾非终结符，形状不合法时抛出异常。
     */
    static RuleShape classify(ProductionRule rule) {
        List<Symbol> body = rule.getBody();
        int index = 0;
        while (index < body.size() && body.get(index).isEpsilon()) {
            index++;
        }

        List<Symbol> terminals = new ArrayList<>();
        Symbol trailing = null;
        for (; index < body.size(); index++) {
            Symbol symbol = body.get(index);
            if (symbol.isEpsilon()) {
                throw structural(rule, "ε may only appear alone or at the start of a body");
            }
            if (trailing != null) {
                if (symbol.isNonterminal()) {
                    throw structural(rule, "more than one nonterminal in a body");
                }
                throw structural(rule, "nonterminal " + trailing + " is followed by terminal " + symbol);
            }
            if (symbol.isNonterminal()) {
                trailing = symbol;
            } else {
                terminals.add(symbol);
            }
        }
        return new RuleShape(List.copyOf(terminals), trailing);
    }

    private static StructuralException structural(ProductionRule rule, String reason) {
        logger.warn("产生式 {}（第 {} 行）不是右线性形状：{}", rule, rule.getLineNumber(), reason);
        return new StructuralException(rule.getLineNumber(), rule.toString(),
                "rule is outside the right-linear subset: " + reason);
    }

    /**
     * 右线性产生式的右部：若干终结符后跟至多一个非终结符。
     */
    record RuleShape(List<Symbol> terminals, Symbol trailing) {
    }
}
