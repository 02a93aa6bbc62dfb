package org.grammardfa.grammar;

import lombok.Getter;
import org.grammardfa.core.Symbol;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一条产生式 head -> body。右部为空列表时表示 epsilon 产生式。
 * 此类是不可变的；行号只用于错误报告，不参与相等性比较。
 */
@Getter
public final class ProductionRule {

    private final Symbol head;
    private final List<Symbol> body;
    private final int lineNumber;

    private final int hashCode;

    public ProductionRule(Symbol head, List<Symbol> body, int lineNumber) {
        this.head = Objects.requireNonNull(head, "Rule head cannot be null.");
        if (!head.isNonterminal()) {
            throw new IllegalArgumentException("Rule head must be a nonterminal: " + head);
        }
        this.body = List.copyOf(Objects.requireNonNull(body, "Rule body cannot be null."));
        this.lineNumber = lineNumber;
        this.hashCode = Objects.hash(head, this.body);
    }

    public boolean isEpsilonRule() {
        return body.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProductionRule that = (ProductionRule) o;
        return head.equals(that.head) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String rhs = body.isEmpty()
                ? "ε"
                : body.stream().map(Symbol::toString).collect(Collectors.joining(" "));
        return head + " -> " + rhs;
    }
}
