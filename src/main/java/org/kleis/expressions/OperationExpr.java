package org.kleis.expressions;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 运算应用 {@code name(args...)}。
 */
@Getter
public final class OperationExpr implements Expression {

    private final String name;
    private final List<Expression> args;
    private final int hashCode;

    private OperationExpr(String name, List<Expression> args) {
        this.name = Objects.requireNonNull(name, "运算名不能为空");
        this.args = List.copyOf(args);
        this.hashCode = Objects.hash(name, this.args);
    }

    public static OperationExpr of(String name, List<Expression> args) {
        return new OperationExpr(name, args);
    }

    public static OperationExpr of(String name, Expression... args) {
        return new OperationExpr(name, Arrays.asList(args));
    }

    public int arity() {
        return args.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OperationExpr that = (OperationExpr) o;
        return hashCode == that.hashCode && name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
