package org.kleis.inference;

import lombok.Getter;
import org.kleis.expressions.OperationExpr;

import java.util.List;

/**
 * 参数信息不足以在多个候选结构间做出选择的一次运算应用。
 */
@Getter
public final class Ambiguity {

    private final OperationExpr expression;
    private final List<String> candidates;

    Ambiguity(OperationExpr expression, List<String> candidates) {
        this.expression = expression;
        this.candidates = List.copyOf(candidates);
    }

    @Override
    public String toString() {
        return expression + " ∈ " + candidates;
    }
}
