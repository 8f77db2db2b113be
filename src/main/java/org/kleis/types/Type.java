package org.kleis.types;

import java.util.Set;

/**
 * 推断引擎中的类型。实现类均不可变，按值比较。
 */
public interface Type {

    TypeKind getKind();

    /**
     * 类型中自由出现的类型变量（∀ 绑定的不算）。
     */
    Set<TypeVar> freeTypeVars();

    default boolean occurs(TypeVar var) {
        return freeTypeVars().contains(var);
    }

    default boolean isGround() {
        return freeTypeVars().isEmpty();
    }
}
