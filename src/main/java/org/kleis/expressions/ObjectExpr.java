package org.kleis.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 按名字引用的对象：变量、量词绑定的变量，或单位元这样的零元运算。
 */
@Getter
public final class ObjectExpr implements Expression {

    private final String name;

    private ObjectExpr(String name) {
        this.name = Objects.requireNonNull(name, "名字不能为空");
    }

    public static ObjectExpr of(String name) {
        return new ObjectExpr(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((ObjectExpr) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
