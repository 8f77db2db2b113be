package org.kleis.inference;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.structures.TypeExpr;
import org.kleis.types.FunctionType;
import org.kleis.types.NamedType;
import org.kleis.types.PrimitiveType;
import org.kleis.types.Type;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把声明里的 {@link TypeExpr} 转成推断用的 {@link Type}。
 * 作用域中的名字（结构类型参数、∀ 绑定名）换成该次实例化专属的新类型变量。
 */
final class SignatureInstantiator {

    private final TypeContext context;

    SignatureInstantiator(TypeContext context) {
        this.context = context;
    }

    /**
     * 为每个作用域参数分配一个新类型变量。
     */
    Map<String, Type> freshScope(List<String> params) {
        Map<String, Type> scope = new HashMap<>();
        for (String param : params) {
            scope.put(param, context.fresh());
        }
        return scope;
    }

    /**
     * 拆成（参数类型列表, 返回类型）。
     */
    Pair<List<Type>, Type> instantiate(TypeExpr signature, Map<String, Type> scope) {
        Map<String, Type> local = new HashMap<>(scope);
        TypeExpr current = signature;
        while (current.getKind() == TypeExpr.Kind.FOR_ALL) {
            for (String bound : current.getBoundVars()) {
                local.put(bound, context.fresh());
            }
            current = current.getBody();
        }
        Pair<List<TypeExpr>, TypeExpr> parts = current.uncurry();
        List<Type> params = parts.getLeft().stream().map(p -> toType(p, local)).toList();
        return Pair.of(params, toType(parts.getRight(), local));
    }

    Type toType(TypeExpr expr, Map<String, Type> scope) {
        return switch (expr.getKind()) {
            case NAMED -> resolveName(expr.getName(), scope);
            case VAR -> scope.computeIfAbsent(expr.getName(), n -> context.fresh());
            case PARAMETRIC -> NamedType.of(expr.getName(),
                    expr.getChildren().stream().map(c -> toType(c, scope)).toList());
            case FUNCTION -> FunctionType.of(toType(expr.getFrom(), scope), toType(expr.getTo(), scope));
            case PRODUCT -> NamedType.of("×", expr.getChildren().stream().map(c -> toType(c, scope)).toList());
            case FOR_ALL -> {
                Map<String, Type> inner = new HashMap<>(scope);
                for (String bound : expr.getBoundVars()) {
                    inner.put(bound, context.fresh());
                }
                yield toType(expr.getBody(), inner);
            }
        };
    }

    private Type resolveName(String name, Map<String, Type> scope) {
        Type scoped = scope.get(name);
        if (scoped != null) {
            return scoped;
        }
        PrimitiveType primitive = PrimitiveType.fromName(name);
        if (primitive != null) {
            return primitive;
        }
        return NamedType.of(name);
    }
}
