package org.grammardfa.grammar;

import org.grammardfa.core.Symbol;
import org.grammardfa.exceptions.GrammarSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarBuilderTest {

    @Test
    @DisplayName("逐条添加产生式并以冒号连接")
    void testAddProduction_JoinsWithColon() {
        GrammarBuilder builder = new GrammarBuilder(new GrammarParser())
                .addProduction("S -> aA")
                .addProduction("  A -> bA | ε ")
                .addProduction("   ");

        assertAll(
                () -> assertEquals(List.of("S -> aA", "A -> bA | ε"), builder.getProductions()),
                () -> assertEquals("S -> aA: A -> bA | ε", builder.toText()),
                () -> assertEquals(new GrammarParser().parse("S -> aA\nA -> bA | ε"), builder.build())
        );
    }

    @Test
    @DisplayName("在已有文法文本后追加")
    void testAddProduction_ToExistingText() {
        GrammarBuilder builder = new GrammarBuilder(new GrammarParser(), "S -> aA")
                .addProduction("A -> b");

        assertAll(
                () -> assertEquals("S -> aA: A -> b", builder.toText()),
                () -> assertEquals(Symbol.nonterminal("A"), builder.build("A").getStartSymbol())
        );
    }

    @Test
    @DisplayName("格式错误的产生式在添加时就被拒绝，且不会被记录")
    void testAddProduction_RejectsMalformed() {
        GrammarBuilder builder = new GrammarBuilder(new GrammarParser()).addProduction("S -> a");

        GrammarSyntaxException ex = assertThrows(GrammarSyntaxException.class,
                () -> builder.addProduction("A bA"));

        assertAll(
                () -> assertEquals(1, ex.getLineNumber(), "Appended productions share the last line of the text"),
                () -> assertEquals(List.of("S -> a"), builder.getProductions())
        );
    }

    @Test
    @DisplayName("没有右部的产生式被拒绝")
    void testAddProduction_RejectsMissingBody() {
        GrammarBuilder builder = new GrammarBuilder(new GrammarParser()).addProduction("S -> aA");

        assertAll(
                () -> assertThrows(GrammarSyntaxException.class, () -> builder.addProduction("A ->")),
                () -> assertEquals(List.of("S -> aA"), builder.getProductions())
        );
    }

    @Test
    @DisplayName("错误行号与 toText() 的行一致")
    void testAddProduction_LineNumberFollowsText() {
        GrammarBuilder builder = new GrammarBuilder(new GrammarParser(), "S -> aA\nA -> bB\nB -> c");

        GrammarSyntaxException ex = assertThrows(GrammarSyntaxException.class,
                () -> builder.addProduction("C d"));
        builder.addProduction("C -> d");

        assertAll(
                () -> assertEquals(3, ex.getLineNumber()),
                () -> assertEquals("S -> aA\nA -> bB\nB -> c: C -> d", builder.toText()),
                () -> assertEquals(3, new GrammarParser().parse(builder.toText()).getRulesFor(Symbol.nonterminal("C"))
                        .get(0).getLineNumber())
        );
    }
}
