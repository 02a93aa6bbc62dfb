package org.grammardfa.automata.base;

import org.grammardfa.core.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AlphabetTest {

    @Test
    @DisplayName("字母表只接受终结符")
    void testOf_RejectsNonTerminals() {
        assertAll(
                () -> assertThrows(IllegalArgumentException.class,
                        () -> Alphabet.of(List.of(Symbol.terminal("a"), Symbol.nonterminal("A")))),
                () -> assertThrows(IllegalArgumentException.class, () -> Alphabet.of(List.of(Symbol.EPSILON)))
        );
    }

    @Test
    @DisplayName("符号按文本排序，可按文本查找")
    void testLookup() {
        Alphabet alphabet = Alphabet.of("b", "a", "b");

        assertAll(
                () -> assertEquals(2, alphabet.size()),
                () -> assertEquals(List.of(Symbol.terminal("a"), Symbol.terminal("b")),
                        List.copyOf(alphabet.getSymbols())),
                () -> assertEquals(Symbol.terminal("b"), alphabet.getSymbolByText("b")),
                () -> assertNull(alphabet.getSymbolByText("c")),
                () -> assertTrue(alphabet.isCharacterLevel()),
                () -> assertTrue(Alphabet.EMPTY.isEmpty())
        );
    }

    @Test
    @DisplayName("最长匹配优先选择较长的终结符")
    void testLongestMatch() {
        Alphabet alphabet = Alphabet.of("a", "ab", "abc", "b");

        assertAll(
                () -> assertEquals(Optional.of(Symbol.terminal("abc")), alphabet.longestMatch("abcb", 0)),
                () -> assertEquals(Optional.of(Symbol.terminal("ab")), alphabet.longestMatch("xabx", 1)),
                () -> assertEquals(Optional.of(Symbol.terminal("b")), alphabet.longestMatch("abcb", 3)),
                () -> assertEquals(Optional.empty(), alphabet.longestMatch("xyz", 0)),
                () -> assertEquals(3, alphabet.getMaxSymbolLength()),
                () -> assertFalse(alphabet.isCharacterLevel())
        );
    }
}
