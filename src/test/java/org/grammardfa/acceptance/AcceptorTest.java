package org.grammardfa.acceptance;

import org.grammardfa.automata.construction.NFABuilder;
import org.grammardfa.automata.construction.SubsetConstructor;
import org.grammardfa.automata.minimization.PartitionRefinementMinimizer;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.core.Symbol;
import org.grammardfa.grammar.GrammarParser;
import org.grammardfa.grammar.SymbolNotation;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AcceptorTest {

    private static Acceptor abStar;
    private static Acceptor greeting;
    private static Acceptor greedy;

    @BeforeAll
    static void setUp() {
        abStar = new Acceptor(minimize("S -> aA\nA -> bA | ε", SymbolNotation.CHARACTER), TokenizationMode.CHARACTER);
        greeting = new Acceptor(minimize("Greeting -> hello Name\nName -> world | 'there' Punct\nPunct -> '!'",
                SymbolNotation.TOKEN), TokenizationMode.LONGEST_MATCH);
        greedy = new Acceptor(minimize("S -> ab | a B\nB -> b c", SymbolNotation.TOKEN),
                TokenizationMode.LONGEST_MATCH);
    }

    private static DFA minimize(String text, SymbolNotation notation) {
        return new PartitionRefinementMinimizer().minimize(new SubsetConstructor().determinize(
                new NFABuilder().build(new GrammarParser(notation).parse(text))));
    }

    @Nested
    @DisplayName("字符切分 (Character tokenization)")
    class CharacterModeTests {

        @ParameterizedTest
        @ValueSource(strings = {"a", "ab", "abb", "abbbbbb"})
        @DisplayName("a b* 接受的串")
        void testAccepts_Members(String input) {
            assertTrue(abStar.accepts(input));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "b", "ba", "aa", "aba"})
        @DisplayName("a b* 拒绝的串")
        void testAccepts_NonMembers(String input) {
            assertFalse(abStar.accepts(input));
        }

        @Test
        @DisplayName("接受时记录经过的完整状态路径")
        void testRun_RecordsPath() {
            AcceptanceResult result = abStar.run("abb");

            assertAll(
                    () -> assertTrue(result.isAccepted()),
                    () -> assertEquals(RejectionReason.NONE, result.getReason()),
                    () -> assertEquals(List.of(0, 1, 1, 1), result.getVisitedStateIds()),
                    () -> assertEquals(3, result.getConsumedSymbols().size()),
                    () -> assertEquals(3, result.getPosition())
            );
        }

        @Test
        @DisplayName("空串停在不接受的开始状态")
        void testRun_EmptyInput() {
            AcceptanceResult result = abStar.run("");

            assertAll(
                    () -> assertEquals(RejectionReason.NOT_ACCEPTING, result.getReason()),
                    () -> assertEquals(List.of(0), result.getVisitedStateIds())
            );
        }

        @Test
        @DisplayName("缺失迁移立即拒绝")
        void testRun_MissingTransition() {
            AcceptanceResult result = abStar.run("ba");

            assertAll(
                    () -> assertEquals(RejectionReason.NO_TRANSITION, result.getReason()),
                    () -> assertEquals(0, result.getPosition()),
                    () -> assertEquals(List.of(0), result.getVisitedStateIds()),
                    () -> assertTrue(result.getConsumedSymbols().isEmpty())
            );
        }

        @ParameterizedTest
        @ValueSource(strings = {"ac", "a b", "aé"})
        @DisplayName("未知字符报告其位置且不抛出异常")
        void testRun_UnknownCharacter(String input) {
            AcceptanceResult result = abStar.run(input);

            assertAll(
                    () -> assertFalse(result.isAccepted()),
                    () -> assertEquals(RejectionReason.UNKNOWN_SYMBOL, result.getReason()),
                    () -> assertEquals(1, result.getPosition())
            );
        }
    }

    @Nested
    @DisplayName("最长匹配切分 (Longest-match tokenization)")
    class LongestMatchTests {

        @ParameterizedTest
        @ValueSource(strings = {"hello world", "helloworld", "  hello   there ! ", "hello there!"})
        @DisplayName("记号之间的空白可有可无")
        void testAccepts_WhitespaceIsOptional(String input) {
            assertTrue(greeting.accepts(input));
        }

        @Test
        @DisplayName("输入读完但停在非接受状态")
        void testRun_Incomplete() {
            assertEquals(RejectionReason.NOT_ACCEPTING, greeting.run("hello").getReason());
        }

        @Test
        @DisplayName("无法识别的记号报告字符位置")
        void testRun_UnknownToken() {
            AcceptanceResult result = greeting.run("hello moon");

            assertAll(
                    () -> assertEquals(RejectionReason.UNKNOWN_SYMBOL, result.getReason()),
                    () -> assertEquals(6, result.getPosition())
            );
        }

        @Test
        @DisplayName("总是取最长的终结符，不回溯")
        void testRun_GreedyWithoutBacktracking() {
            AcceptanceResult glued = greedy.run("abc");

            assertAll(
                    () -> assertTrue(greedy.accepts("ab")),
                    () -> assertTrue(greedy.accepts("a b c"), "Whitespace separates a from b"),
                    () -> assertEquals(RejectionReason.NO_TRANSITION, glued.getReason(),
                            "'ab' is consumed as one token, leaving 'c' without a transition"),
                    () -> assertEquals(2, glued.getPosition()),
                    () -> assertEquals(List.of(Symbol.terminal("ab")), glued.getConsumedSymbols())
            );
        }

        @Test
        @DisplayName("toSymbols 返回切分结果")
        void testToSymbols() {
            assertAll(
                    () -> assertEquals(Optional.of(List.of(Symbol.terminal("a"), Symbol.terminal("b"),
                            Symbol.terminal("c"))), greedy.toSymbols("a b c")),
                    () -> assertEquals(Optional.empty(), greedy.toSymbols("a x"))
            );
        }
    }
}
