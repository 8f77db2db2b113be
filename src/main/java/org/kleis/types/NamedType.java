package org.kleis.types;

import lombok.Getter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 具名（可带参数的）类型，例如 {@code Vector(α1)} 或数据类型 {@code Color}。
 */
@Getter
public final class NamedType implements Type {

    private final String name;
    private final List<Type> typeArgs;
    private final int hashCode;

    private NamedType(String name, List<Type> typeArgs) {
        this.name = Objects.requireNonNull(name, "类型名不能为空");
        this.typeArgs = List.copyOf(typeArgs);
        this.hashCode = Objects.hash(name, this.typeArgs);
    }

    public static NamedType of(String name, List<? extends Type> typeArgs) {
        return new NamedType(name, List.copyOf(typeArgs));
    }

    public static NamedType of(String name, Type... typeArgs) {
        return new NamedType(name, Arrays.asList(typeArgs));
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.NAMED;
    }

    @Override
    public Set<TypeVar> freeTypeVars() {
        Set<TypeVar> vars = new LinkedHashSet<>();
        for (Type arg : typeArgs) {
            vars.addAll(arg.freeTypeVars());
        }
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
        NamedType that = (NamedType) o;
        return hashCode == that.hashCode && name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (typeArgs.isEmpty()) {
            return name;
        }
        return name + typeArgs.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
