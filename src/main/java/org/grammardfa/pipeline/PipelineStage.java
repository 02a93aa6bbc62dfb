package org.grammardfa.pipeline;

/**
 * 流水线的各个阶段，用于在错误报告中指出出错位置。
 */
public enum PipelineStage {

    GRAMMAR_PARSING("文法解析"),
    NFA_CONSTRUCTION("NFA 构造"),
    SUBSET_CONSTRUCTION("子集构造"),
    MINIMIZATION("DFA 最小化"),
    REGEX_PARSING("正则表达式解析");

    private final String displayName;

    PipelineStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
