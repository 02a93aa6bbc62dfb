package org.grammardfa.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTest {

    @Test
    @DisplayName("相同文本的终结符与非终结符不相等")
    void testEquality_DependsOnKind() {
        Symbol terminal = Symbol.terminal("a");
        Symbol nonterminal = Symbol.nonterminal("a");

        assertAll("Kind is part of identity",
                () -> assertEquals(Symbol.terminal("a"), terminal, "Same text and kind should be equal"),
                () -> assertEquals(terminal.hashCode(), Symbol.terminal("a").hashCode()),
                () -> assertNotEquals(terminal, nonterminal, "Terminal and nonterminal must differ"),
                () -> assertTrue(terminal.isTerminal()),
                () -> assertTrue(nonterminal.isNonterminal())
        );
    }

    @Test
    @DisplayName("空文本只能通过 EPSILON 表示")
    void testEmptyText_ShouldBeRejected() {
        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> Symbol.terminal("")),
                () -> assertThrows(IllegalArgumentException.class, () -> Symbol.nonterminal("")),
                () -> assertTrue(Symbol.EPSILON.isEpsilon()),
                () -> assertEquals("ε", Symbol.EPSILON.toString()),
                () -> assertFalse(Symbol.EPSILON.getType().isConsuming())
        );
    }

    @Test
    @DisplayName("排序：ε 在前，其次终结符，最后非终结符")
    void testOrdering() {
        List<Symbol> symbols = new ArrayList<>(List.of(
                Symbol.nonterminal("A"), Symbol.terminal("b"), Symbol.EPSILON, Symbol.terminal("a")));
        Collections.sort(symbols);

        assertEquals(List.of(Symbol.EPSILON, Symbol.terminal("a"), Symbol.terminal("b"), Symbol.nonterminal("A")),
                symbols);
    }
}
