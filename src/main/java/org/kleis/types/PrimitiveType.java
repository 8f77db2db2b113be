package org.kleis.types;

import java.util.Set;

public enum PrimitiveType implements Type {
    BOOLEAN("Bool"),
    NUMERIC("Numeric"),
    STRING("String");

    private final String displayName;

    PrimitiveType(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.PRIMITIVE;
    }

    @Override
    public Set<TypeVar> freeTypeVars() {
        return Set.of();
    }

    /**
     * 把签名中的类型名映射为基本类型；不是基本类型时返回 null。
     */
    public static PrimitiveType fromName(String name) {
        return switch (name) {
            case "Bool", "Boolean", "𝔹" -> BOOLEAN;
            case "ℝ", "Real", "ℚ", "Rational", "ℤ", "Int", "Integer", "ℕ", "Nat", "Natural", "ℂ", "Complex",
                 "Scalar", "Numeric" -> NUMERIC;
            case "String", "Str" -> STRING;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
