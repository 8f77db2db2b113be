package org.kleis.structures;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * {@code implements S(T...) over F(..) where C1(..), C2(..)}：声明具体类型实现了某结构。
 */
@Getter
public final class ImplementsDef {

    private final String structureName;
    private final List<TypeExpr> typeArgs;
    private final StructureRef overRef;
    private final List<StructureRef> whereConstraints;

    private ImplementsDef(String structureName, List<TypeExpr> typeArgs, StructureRef overRef,
                          List<StructureRef> whereConstraints) {
        this.structureName = Objects.requireNonNull(structureName, "结构名不能为空");
        this.typeArgs = List.copyOf(typeArgs);
        this.overRef = overRef;
        this.whereConstraints = List.copyOf(whereConstraints);
    }

    public static ImplementsDef of(String structureName, List<TypeExpr> typeArgs) {
        return new ImplementsDef(structureName, typeArgs, null, List.of());
    }

    public static ImplementsDef of(String structureName, List<TypeExpr> typeArgs, StructureRef overRef,
                                   List<StructureRef> whereConstraints) {
        return new ImplementsDef(structureName, typeArgs, overRef, whereConstraints);
    }

    /**
     * 实现的载体类型，即第一个类型实参；没有实参时为空。
     */
    public TypeExpr getCarrier() {
        return typeArgs.isEmpty() ? null : typeArgs.get(0);
    }

    @Override
    public String toString() {
        return "implements " + structureName + typeArgs;
    }
}
