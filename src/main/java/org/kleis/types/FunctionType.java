package org.kleis.types;

import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 函数类型 {@code domain → codomain}。多参数函数用柯里化表示。
 */
@Getter
public final class FunctionType implements Type {

    private final Type domain;
    private final Type codomain;
    private final int hashCode;

    private FunctionType(Type domain, Type codomain) {
        this.domain = Objects.requireNonNull(domain, "定义域不能为空");
        this.codomain = Objects.requireNonNull(codomain, "值域不能为空");
        this.hashCode = Objects.hash(domain, codomain);
    }

    public static FunctionType of(Type domain, Type codomain) {
        return new FunctionType(domain, codomain);
    }

    /**
     * 构造 {@code p1 → p2 → ... → result}；参数为空时直接返回 result。
     */
    public static Type curried(List<? extends Type> params, Type result) {
        Type type = result;
        for (int i = params.size() - 1; i >= 0; i--) {
            type = new FunctionType(params.get(i), type);
        }
        return type;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.FUNCTION;
    }

    @Override
    public Set<TypeVar> freeTypeVars() {
        Set<TypeVar> vars = new LinkedHashSet<>(domain.freeTypeVars());
        vars.addAll(codomain.freeTypeVars());
        return vars;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionType that = (FunctionType) o;
        return hashCode == that.hashCode && domain.equals(that.domain) && codomain.equals(that.codomain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String left = domain instanceof FunctionType ? "(" + domain + ")" : domain.toString();
        return left + " → " + codomain;
    }
}
