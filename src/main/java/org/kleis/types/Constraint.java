package org.kleis.types;

import lombok.Getter;
import org.kleis.expressions.Expression;

import java.util.Objects;

/**
 * 等式约束 {@code left = right}。{@code origin} 记录产生它的子表达式，用于报错定位，可为空。
 */
@Getter
public final class Constraint {

    private final Type left;
    private final Type right;
    private final Expression origin;

    private Constraint(Type left, Type right, Expression origin) {
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
        this.origin = origin;
    }

    public static Constraint of(Type left, Type right, Expression origin) {
        return new Constraint(left, right, origin);
    }

    public static Constraint of(Type left, Type right) {
        return new Constraint(left, right, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constraint that = (Constraint) o;
        return left.equals(that.left) && right.equals(that.right) && Objects.equals(origin, that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, origin);
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
