package org.grammardfa.exceptions;

import lombok.Getter;
import org.grammardfa.pipeline.PipelineStage;

import java.util.Objects;

/**
 * 所有面向用户的输入错误的基类。
 * 携带出错的流水线阶段、源文本行号（未知时为 -1）以及出错的文本片段。
 */
@Getter
public class GrammarException extends RuntimeException {

    public static final int UNKNOWN_LINE = -1;

    private final PipelineStage stage;
    private final int lineNumber;
    private final String offendingText;

    public GrammarException(PipelineStage stage, int lineNumber, String offendingText, String message) {
        super(formatMessage(stage, lineNumber, offendingText, message));
        this.stage = Objects.requireNonNull(stage, "Stage cannot be null.");
        this.lineNumber = lineNumber;
        this.offendingText = offendingText == null ? "" : offendingText;
    }

    private static String formatMessage(PipelineStage stage, int lineNumber, String offendingText, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(stage).append(']');
        if (lineNumber != UNKNOWN_LINE) {
            sb.append(" line ").append(lineNumber);
        }
        sb.append(": ").append(message);
        if (offendingText != null && !offendingText.isEmpty()) {
            sb.append(" (at '").append(offendingText).append("')");
        }
        return sb.toString();
    }

    public boolean hasLineNumber() {
        return lineNumber != UNKNOWN_LINE;
    }
}
