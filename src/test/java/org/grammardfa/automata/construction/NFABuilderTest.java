package org.grammardfa.automata.construction;

import org.grammardfa.automata.base.State;
import org.grammardfa.automata.base.Transition;
import org.grammardfa.automata.models.NFA;
import org.grammardfa.core.Symbol;
import org.grammardfa.exceptions.StructuralException;
import org.grammardfa.grammar.Grammar;
import org.grammardfa.grammar.GrammarParser;
import org.grammardfa.grammar.ProductionRule;
import org.grammardfa.pipeline.PipelineStage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NFABuilderTest {

    private static GrammarParser parser;
    private static NFABuilder builder;

    @BeforeAll
    static void setUp() {
        parser = new GrammarParser();
        builder = new NFABuilder();
    }

    private static List<String> edges(NFA nfa) {
        return nfa.getTransitions().stream()
                .map(t -> t.getSource().getLabel() + " " + t.getSymbol() + " " + t.getTarget().getLabel())
                .sorted()
                .collect(Collectors.toList());
    }

    private static List<Symbol> word(String text) {
        return text.chars().mapToObj(c -> Symbol.terminal(String.valueOf((char) c))).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("产生式形状 (Rule shapes)")
    class ShapeTests {

        @Test
        @DisplayName("S -> aA / A -> bA / A -> ε 得到三个状态")
        void testBuild_BasicRightLinearGrammar() {
            NFA nfa = builder.build(parser.parse("S -> aA\nA -> bA\nA -> ε"));

            assertAll("Basic grammar",
                    () -> assertEquals(3, nfa.size(), "One state per nonterminal plus the final state"),
                    () -> assertEquals("S", nfa.getStartState().getLabel()),
                    () -> assertEquals(List.of(NFABuilder.FINAL_STATE_LABEL),
                            nfa.getAcceptingStates().stream().map(State::getLabel).collect(Collectors.toList())),
                    () -> assertEquals(List.of("A b A", "A ε #F", "S a A"), edges(nfa)),
                    () -> assertTrue(nfa.hasEpsilonTransitions())
            );
        }

        @Test
        @DisplayName("A -> a 迁移到终止状态")
        void testBuild_TerminalOnlyBody() {
            NFA nfa = builder.build(parser.parse("S -> a | b"));

            assertAll(
                    () -> assertEquals(List.of("S a #F", "S b #F"), edges(nfa)),
                    () -> assertFalse(nfa.hasEpsilonTransitions())
            );
        }

        @Test
        @DisplayName("多个终结符经中间状态串联")
        void testBuild_TerminalChain() {
            NFA nfa = builder.build(parser.parse("S -> abA\nA -> c"));

            assertAll(
                    () -> assertEquals(4, nfa.size()),
                    () -> assertEquals(List.of("A c #F", "S a S#1", "S#1 b A"), edges(nfa)),
                    () -> assertTrue(nfa.accepts(word("abc"))),
                    () -> assertFalse(nfa.accepts(word("ab"))),
                    () -> assertFalse(nfa.getStateById(3).isAccepting(), "Intermediate states are not accepting")
            );
        }

        @Test
        @DisplayName("单位产生式 S -> A 变为 ε 迁移")
        void testBuild_UnitProduction() {
            NFA nfa = builder.build(parser.parse("S -> A\nA -> a"));

            assertAll(
                    () -> assertEquals(List.of("A a #F", "S ε A"), edges(nfa)),
                    () -> assertTrue(nfa.accepts(word("a")))
            );
        }

        @Test
        @DisplayName("未定义的非终结符成为没有出边的状态")
        void testBuild_UndefinedNonterminalIsDead() {
            NFA nfa = builder.build(parser.parse("S -> aB | b"));

            assertAll(
                    () -> assertTrue(nfa.getTransitions().stream().noneMatch(t -> t.getSource().getLabel().equals("B"))),
                    () -> assertFalse(nfa.accepts(word("a"))),
                    () -> assertTrue(nfa.accepts(word("b")))
            );
        }

        @Test
        @DisplayName("每条迁移都只使用字母表中的终结符或 ε")
        void testBuild_TransitionsUseAlphabet() {
            NFA nfa = builder.build(parser.parse("S -> aS | bA\nA -> cA | ε"));
            for (Transition t : nfa.getTransitions()) {
                assertTrue(t.isEpsilon() || nfa.getAlphabet().contains(t.getSymbol()), "Unexpected symbol " + t);
            }
        }
    }

    @Nested
    @DisplayName("结构检查 (Structural validation)")
    class StructuralTests {

        @ParameterizedTest
        @CsvSource(delimiter = ';', value = {
                "S -> AB | c\\nA -> a\\nB -> b;       1; more than one nonterminal",
                "S -> a\\nA -> Ba\\nB -> b;           2; is followed by terminal",
                "S -> aε;                           1; ε may only appear"
        })
        @DisplayName("超出右线性子集的产生式被拒绝并报告行号")
        void testBuild_RejectsNonRightLinear(String text, int line, String reason) {
            Grammar grammar = parser.parse(text.replace("\\n", "\n"));

            StructuralException ex = assertThrows(StructuralException.class, () -> builder.build(grammar));

            assertAll(
                    () -> assertEquals(PipelineStage.NFA_CONSTRUCTION, ex.getStage()),
                    () -> assertEquals(line, ex.getLineNumber()),
                    () -> assertTrue(ex.getMessage().contains(reason), ex.getMessage())
            );
        }

        @Test
        @DisplayName("classify 拆出前导终结符和末尾非终结符")
        void testClassify() {
            ProductionRule rule = new ProductionRule(Symbol.nonterminal("S"),
                    List.of(Symbol.terminal("a"), Symbol.terminal("b"), Symbol.nonterminal("A")), 1);

            NFABuilder.RuleShape shape = NFABuilder.classify(rule);

            assertAll(
                    () -> assertEquals(List.of(Symbol.terminal("a"), Symbol.terminal("b")), shape.terminals()),
                    () -> assertEquals(Symbol.nonterminal("A"), shape.trailing())
            );
        }
    }
}
