package org.grammardfa.acceptance;

import lombok.Getter;
import org.grammardfa.core.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * 一次接受判定的结果：判定、经过的状态 ID 序列（含开始状态）以及已消耗的符号。
 * 此类是不可变的。
 */
@Getter
public final class AcceptanceResult {

    private final String input;
    private final boolean accepted;
    private final RejectionReason reason;
    private final List<Integer> visitedStateIds;
    private final List<Symbol> consumedSymbols;
    // 出错时在输入中的字符位置，否则为输入长度
    private final int position;

    AcceptanceResult(String input, RejectionReason reason, List<Integer> visitedStateIds,
                     List<Symbol> consumedSymbols, int position) {
        this.input = Objects.requireNonNull(input, "Input cannot be null.");
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null.");
        this.accepted = reason == RejectionReason.NONE;
        this.visitedStateIds = List.copyOf(visitedStateIds);
        this.consumedSymbols = List.copyOf(consumedSymbols);
        this.position = position;
    }

    @Override
    public String toString() {
        return "AcceptanceResult{input='" + input + "', " + (accepted ? "accepted" : "rejected: " + reason)
                + ", path=" + visitedStateIds + '}';
    }
}
