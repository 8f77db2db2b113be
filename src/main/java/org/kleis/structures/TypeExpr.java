package org.kleis.structures;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 声明中书写的类型表达式，例如 {@code R → R → R}、{@code Vector(n)}、{@code ℝ × ℝ → ℝ}。
 * 它只是语法；推断时由签名实例化转成 {@link org.kleis.types.Type}。
 */
@Getter
public final class TypeExpr {

    public enum Kind {
        NAMED,
        PARAMETRIC,
        FUNCTION,
        PRODUCT,
        VAR,
        FOR_ALL
    }

    private final Kind kind;
    private final String name;
    private final List<TypeExpr> children;
    private final List<String> boundVars;
    private final int hashCode;

    private TypeExpr(Kind kind, String name, List<TypeExpr> children, List<String> boundVars) {
        this.kind = kind;
        this.name = name;
        this.children = List.copyOf(children);
        this.boundVars = List.copyOf(boundVars);
        this.hashCode = Objects.hash(kind, name, this.children, this.boundVars);
    }

    public static TypeExpr named(String name) {
        return new TypeExpr(Kind.NAMED, Objects.requireNonNull(name), List.of(), List.of());
    }

    public static TypeExpr parametric(String name, List<TypeExpr> args) {
        return new TypeExpr(Kind.PARAMETRIC, Objects.requireNonNull(name), args, List.of());
    }

    public static TypeExpr parametric(String name, TypeExpr... args) {
        return parametric(name, Arrays.asList(args));
    }

    public static TypeExpr function(TypeExpr from, TypeExpr to) {
        return new TypeExpr(Kind.FUNCTION, null, List.of(from, to), List.of());
    }

    /**
     * {@code t1 → t2 → ... → tn}，至少两个元素。
     */
    public static TypeExpr arrow(TypeExpr... types) {
        if (types.length < 2) {
            throw new IllegalArgumentException("函数类型至少需要两个部分");
        }
        TypeExpr result = types[types.length - 1];
        for (int i = types.length - 2; i >= 0; i--) {
            result = function(types[i], result);
        }
        return result;
    }

    public static TypeExpr product(List<TypeExpr> members) {
        return new TypeExpr(Kind.PRODUCT, null, members, List.of());
    }

    public static TypeExpr var(String name) {
        return new TypeExpr(Kind.VAR, Objects.requireNonNull(name), List.of(), List.of());
    }

    public static TypeExpr forAll(List<String> vars, TypeExpr body) {
        return new TypeExpr(Kind.FOR_ALL, null, List.of(body), vars);
    }

    public TypeExpr getFrom() {
        return kind == Kind.FUNCTION ? children.get(0) : null;
    }

    public TypeExpr getTo() {
        return kind == Kind.FUNCTION ? children.get(1) : null;
    }

    public TypeExpr getBody() {
        return kind == Kind.FOR_ALL ? children.get(0) : null;
    }

    /**
     * 把签名拆成参数列表和返回类型。积类型参数展开为多个参数，外层 ∀ 被剥掉。
     * 非函数类型得到空参数列表，即零元运算。
     */
    public Pair<List<TypeExpr>, TypeExpr> uncurry() {
        TypeExpr current = this;
        while (current.kind == Kind.FOR_ALL) {
            current = current.getBody();
        }
        List<TypeExpr> params = new ArrayList<>();
        while (current.kind == Kind.FUNCTION) {
            TypeExpr from = current.getFrom();
            if (from.kind == Kind.PRODUCT) {
                params.addAll(from.children);
            } else {
                params.add(from);
            }
            current = current.getTo();
        }
        return Pair.of(params, current);
    }

    public int arity() {
        return uncurry().getLeft().size();
    }

    public boolean isNullary() {
        return arity() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TypeExpr that = (TypeExpr) o;
        return hashCode == that.hashCode && kind == that.kind && Objects.equals(name, that.name)
                && children.equals(that.children) && boundVars.equals(that.boundVars);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NAMED, VAR -> name;
            case PARAMETRIC -> name + children.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
            case FUNCTION -> {
                TypeExpr from = getFrom();
                String left = from.kind == Kind.FUNCTION ? "(" + from + ")" : from.toString();
                yield left + " → " + getTo();
            }
            case PRODUCT -> children.stream().map(String::valueOf).collect(Collectors.joining(" × "));
            case FOR_ALL -> "∀" + String.join(" ", boundVars) + ". " + getBody();
        };
    }
}
