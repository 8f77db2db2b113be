package org.kleis.inference;

import org.kleis.expressions.Expression;
import org.kleis.expressions.OperationExpr;
import org.kleis.structures.StructureRegistry;
import org.kleis.structures.TypeExpr;
import org.kleis.types.Type;
import org.kleis.types.TypeInferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 面向前端的类型检查入口。每次检查开启一个独立的 {@link TypeInference} 会话，
 * 错误不以异常形式抛出，而是转成 {@link TypeCheckResult}。
 */
public class TypeChecker {

    private static final Logger logger = LoggerFactory.getLogger(TypeChecker.class);

    private final StructureRegistry registry;

    public TypeChecker(StructureRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "注册表不能为空");
    }

    /**
     * 不带变量绑定的检查。类型错误不抛出，而是记录在结果中。
     *
     * @return 成功、带歧义候选的多态或失败
     */
    public TypeCheckResult typeCheck(Expression expr) {
        return typeCheck(expr, Map.of());
    }

    /**
     * 在给定变量绑定下检查表达式。
     *
     * @param bindings 变量名到声明类型，例如 {@code x : ℝ}
     * @return 检查结果，不会为 null
     */
    public TypeCheckResult typeCheck(Expression expr, Map<String, TypeExpr> bindings) {
        TypeContext context = new TypeContext();
        SignatureInstantiator instantiator = new SignatureInstantiator(context);
        bindings.forEach((name, declared) -> context.bind(name, instantiator.toType(declared, new HashMap<>())));

        TypeInference session = new TypeInference(registry, context);
        try {
            Type type = session.inferAndSolve(expr);
            if (!session.getAmbiguities().isEmpty()) {
                Set<String> structures = new LinkedHashSet<>();
                Set<String> types = new LinkedHashSet<>();
                for (Ambiguity ambiguity : session.getAmbiguities()) {
                    structures.addAll(ambiguity.getCandidates());
                    types.addAll(registry.typesSupporting(ambiguity.getExpression().getName()));
                }
                return TypeCheckResult.polymorphic(type, List.copyOf(structures), List.copyOf(types));
            }
            return type.isGround() ? TypeCheckResult.concrete(type) : TypeCheckResult.incomplete(type);
        } catch (TypeInferenceException e) {
            logger.debug("类型检查失败: {}", e.getMessage());
            return TypeCheckResult.error(e.getDetail(), e.getExpression(), suggestionFor(e));
        }
    }

    /**
     * 逐个独立检查一批具名表达式（如某结构的全部公理），报告每一个失败而不是在第一个处停止。
     */
    public Map<String, TypeCheckResult> checkAll(Map<String, Expression> declarations) {
        Map<String, TypeCheckResult> results = new LinkedHashMap<>();
        int errors = 0;
        for (Map.Entry<String, Expression> entry : declarations.entrySet()) {
            TypeCheckResult result = typeCheck(entry.getValue());
            if (result.isError()) {
                errors++;
                logger.info("{} 类型错误: {}", entry.getKey(), result.getMessage());
            }
            results.put(entry.getKey(), result);
        }
        logger.debug("批量检查 {} 个声明，{} 个错误", declarations.size(), errors);
        return results;
    }

    private String suggestionFor(TypeInferenceException e) {
        if (!(e.getExpression() instanceof OperationExpr op)) {
            return null;
        }
        return switch (e.getKind()) {
            case UNDEFINED_OPERATION -> "没有结构声明运算 '" + op.getName() + "'，请先注册声明它的结构";
            case NO_IMPLEMENTATION -> {
                List<String> types = registry.typesSupporting(op.getName());
                yield types.isEmpty() ? null : "运算 '" + op.getName() + "' 可用于类型: " + String.join(", ", types);
            }
            default -> null;
        };
    }
}
