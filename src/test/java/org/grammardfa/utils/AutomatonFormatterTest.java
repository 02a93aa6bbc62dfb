package org.grammardfa.utils;

import org.grammardfa.pipeline.GrammarPipeline;
import org.grammardfa.pipeline.PipelineConfig;
import org.grammardfa.pipeline.PipelineResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonFormatterTest {

    private static PipelineResult result;

    @BeforeAll
    static void setUp() {
        result = new GrammarPipeline(PipelineConfig.DEFAULTS).run("S -> aA\nA -> bA | ε");
    }

    @Test
    @DisplayName("DFA 迁移表：开始状态 ->，接受状态 *，缺失迁移 -")
    void testToTransitionTable_Dfa() {
        String expected = String.join("\n",
                "State  a    b",
                "->{0}  {1}  -",
                "*{1}   -    {1}");

        assertEquals(expected, AutomatonFormatter.toTransitionTable(result.getMinimizedDfa()));
    }

    @Test
    @DisplayName("NFA 迁移表带 ε 列，单元格为目标集合")
    void testToTransitionTable_Nfa() {
        String expected = String.join("\n",
                "State  ε     a    b",
                "->S    -     {A}  -",
                "A      {#F}  -    {A}",
                "*#F    -     -    -");

        assertEquals(expected, AutomatonFormatter.toTransitionTable(result.getNfa()));
    }
}
