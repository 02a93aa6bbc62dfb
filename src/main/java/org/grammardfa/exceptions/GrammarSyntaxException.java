package org.grammardfa.exceptions;

import org.grammardfa.pipeline.PipelineStage;

/**
 * 产生式行格式错误：缺少推导符号、候选式为空、符号含非法字符等。
 */
public class GrammarSyntaxException extends GrammarException {

    public GrammarSyntaxException(int lineNumber, String offendingText, String message) {
        super(PipelineStage.GRAMMAR_PARSING, lineNumber, offendingText, message);
    }
}
