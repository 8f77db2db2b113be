package org.kleis.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 量词绑定的变量。{@code typeAnnotation} 可为空，表示未声明排序。
 */
@Getter
public final class QuantifiedVar {

    private final String name;
    private final String typeAnnotation;

    private QuantifiedVar(String name, String typeAnnotation) {
        this.name = Objects.requireNonNull(name, "变量名不能为空");
        this.typeAnnotation = typeAnnotation;
    }

    public static QuantifiedVar of(String name, String typeAnnotation) {
        return new QuantifiedVar(name, typeAnnotation);
    }

    public static QuantifiedVar untyped(String name) {
        return new QuantifiedVar(name, null);
    }

    public boolean hasTypeAnnotation() {
        return typeAnnotation != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuantifiedVar that = (QuantifiedVar) o;
        return name.equals(that.name) && Objects.equals(typeAnnotation, that.typeAnnotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeAnnotation);
    }

    @Override
    public String toString() {
        return typeAnnotation == null ? name : name + " : " + typeAnnotation;
    }
}
