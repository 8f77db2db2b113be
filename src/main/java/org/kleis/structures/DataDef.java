package org.kleis.structures;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代数数据类型 {@code data Name(params) = V1 | V2(T) | ...}。
 */
@Getter
public final class DataDef {

    private final String name;
    private final List<String> typeParams;
    private final List<DataVariant> variants;

    private DataDef(String name, List<String> typeParams, List<DataVariant> variants) {
        this.name = Objects.requireNonNull(name, "数据类型名不能为空");
        this.typeParams = List.copyOf(typeParams);
        this.variants = List.copyOf(variants);
        if (this.variants.isEmpty()) {
            throw new IllegalArgumentException("数据类型 " + name + " 至少需要一个构造子");
        }
    }

    public static DataDef of(String name, List<String> typeParams, List<DataVariant> variants) {
        return new DataDef(name, typeParams, variants);
    }

    public static DataDef of(String name, DataVariant... variants) {
        return new DataDef(name, List.of(), List.of(variants));
    }

    public DataVariant getVariant(String constructor) {
        for (DataVariant v : variants) {
            if (v.getName().equals(constructor)) {
                return v;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataDef that = (DataDef) o;
        return name.equals(that.name) && typeParams.equals(that.typeParams) && variants.equals(that.variants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeParams, variants);
    }

    @Override
    public String toString() {
        return "data " + name + " = " + variants.stream().map(String::valueOf).collect(Collectors.joining(" | "));
    }
}
