package org.grammardfa.exceptions;

import org.grammardfa.pipeline.PipelineStage;

/**
 * 产生式右部形状超出右线性文法子集。
 */
public class StructuralException extends GrammarException {

    public StructuralException(int lineNumber, String offendingRule, String message) {
        super(PipelineStage.NFA_CONSTRUCTION, lineNumber, offendingRule, message);
    }
}
