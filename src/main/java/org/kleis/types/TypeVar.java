package org.kleis.types;

import lombok.Getter;

import java.util.Set;

/**
 * 类型变量。id 由所属推断会话的计数器分配，不存在全局计数器。
 */
@Getter
public final class TypeVar implements Type, Comparable<TypeVar> {

    private final int id;

    private TypeVar(int id) {
        this.id = id;
    }

    public static TypeVar of(int id) {
        return new TypeVar(id);
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.VARIABLE;
    }

    @Override
    public Set<TypeVar> freeTypeVars() {
        return Set.of(this);
    }

    @Override
    public int compareTo(TypeVar o) {
        return Integer.compare(this.id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id == ((TypeVar) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "α" + id;
    }
}
