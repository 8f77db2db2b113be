package org.kleis.inference;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.types.PrimitiveType;
import org.kleis.types.Type;
import org.kleis.types.TypeVar;

import java.util.List;
import java.util.Set;

/**
 * 注册表中没有声明时使用的内置运算签名：相等与序关系、逻辑联结词、算术。
 */
final class BuiltinSignatures {

    static final Set<String> EQUALITY = Set.of("equals", "eq", "neq", "not_equals");
    static final Set<String> ORDERING = Set.of("less_than", "lt", "leq", "less_equal",
            "greater_than", "gt", "geq", "greater_equal");
    static final Set<String> CONNECTIVES = Set.of("and", "logical_and", "or", "logical_or", "implies", "iff");
    static final Set<String> NEGATIONS = Set.of("not", "logical_not");
    static final Set<String> ARITHMETIC = Set.of("plus", "add", "minus", "subtract", "times", "multiply", "divide");

    private BuiltinSignatures() {
    }

    /**
     * 实例化内置签名为（参数类型, 返回类型）；不是内置运算时返回 null。
     */
    static Pair<List<Type>, Type> instantiate(String name, TypeContext context) {
        if (EQUALITY.contains(name) || ORDERING.contains(name)) {
            TypeVar a = context.fresh();
            return Pair.of(List.of(a, a), PrimitiveType.BOOLEAN);
        }
        if (CONNECTIVES.contains(name)) {
            return Pair.of(List.of(PrimitiveType.BOOLEAN, PrimitiveType.BOOLEAN), PrimitiveType.BOOLEAN);
        }
        if (NEGATIONS.contains(name)) {
            return Pair.of(List.of(PrimitiveType.BOOLEAN), PrimitiveType.BOOLEAN);
        }
        if (ARITHMETIC.contains(name)) {
            TypeVar a = context.fresh();
            return Pair.of(List.of(a, a), a);
        }
        if ("negate".equals(name)) {
            TypeVar a = context.fresh();
            return Pair.of(List.of(a), a);
        }
        return null;
    }
}
