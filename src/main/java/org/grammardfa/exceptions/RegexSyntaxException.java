package org.grammardfa.exceptions;

import org.grammardfa.pipeline.PipelineStage;

/**
 * 正则表达式格式错误，offendingText 为整个表达式。
 */
public class RegexSyntaxException extends GrammarException {

    public RegexSyntaxException(String regex, String message) {
        super(PipelineStage.REGEX_PARSING, UNKNOWN_LINE, regex, message);
    }
}
