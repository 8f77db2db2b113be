package org.kleis.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * {@code if condition then thenBranch else elseBranch}
 */
@Getter
public final class ConditionalExpr implements Expression {

    private final Expression condition;
    private final Expression thenBranch;
    private final Expression elseBranch;

    private ConditionalExpr(Expression condition, Expression thenBranch, Expression elseBranch) {
        this.condition = Objects.requireNonNull(condition);
        this.thenBranch = Objects.requireNonNull(thenBranch);
        this.elseBranch = Objects.requireNonNull(elseBranch);
    }

    public static ConditionalExpr of(Expression condition, Expression thenBranch, Expression elseBranch) {
        return new ConditionalExpr(condition, thenBranch, elseBranch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConditionalExpr that = (ConditionalExpr) o;
        return condition.equals(that.condition) && thenBranch.equals(that.thenBranch) && elseBranch.equals(that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, thenBranch, elseBranch);
    }

    @Override
    public String toString() {
        return "if " + condition + " then " + thenBranch + " else " + elseBranch;
    }
}
