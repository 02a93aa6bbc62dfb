package org.grammardfa.exceptions;

import org.grammardfa.pipeline.PipelineStage;

/**
 * 文法中没有发现任何终结符。
 */
public class EmptyAlphabetException extends GrammarException {

    public EmptyAlphabetException(PipelineStage stage, String source) {
        super(stage, UNKNOWN_LINE, source, "no terminal symbols discovered");
    }
}
