package org.kleis.structures;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 按名字引用另一个结构，例如 {@code extends Monoid(M)} 或 {@code over Field(F)}。
 * 注册时不解析，直到加载时才查找。
 */
@Getter
public final class StructureRef {

    private final String name;
    private final List<TypeExpr> args;

    private StructureRef(String name, List<TypeExpr> args) {
        this.name = Objects.requireNonNull(name, "结构名不能为空");
        this.args = List.copyOf(args);
    }

    public static StructureRef of(String name, List<TypeExpr> args) {
        return new StructureRef(name, args);
    }

    public static StructureRef of(String name, TypeExpr... args) {
        return new StructureRef(name, Arrays.asList(args));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StructureRef that = (StructureRef) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return name;
        }
        return name + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
