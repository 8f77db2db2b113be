package org.kleis.structures;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 代数数据类型的一个构造子。没有字段时是零元构造子。
 */
@Getter
public final class DataVariant {

    private final String name;
    private final List<TypeExpr> fields;

    private DataVariant(String name, List<TypeExpr> fields) {
        this.name = Objects.requireNonNull(name, "构造子名不能为空");
        this.fields = List.copyOf(fields);
    }

    public static DataVariant of(String name, TypeExpr... fields) {
        return new DataVariant(name, Arrays.asList(fields));
    }

    public boolean isNullary() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataVariant that = (DataVariant) o;
        return name.equals(that.name) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields);
    }

    @Override
    public String toString() {
        return fields.isEmpty() ? name : name + fields;
    }
}
