package org.kleis.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;
import org.kleis.structures.StructureRegistry;
import org.kleis.structures.TypeExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 类型名到 Z3 排序的映射。数据类型用同名的未解释排序；
 * 结构的抽象载体（如 R、M）一律用 Int。
 */
public class SortResolver {

    private static final Logger logger = LoggerFactory.getLogger(SortResolver.class);

    private final Context ctx;
    private final StructureRegistry registry;
    private final Map<String, Sort> dataSorts = new HashMap<>();

    public SortResolver(Context ctx, StructureRegistry registry) {
        this.ctx = ctx;
        this.registry = registry;
    }

    public Sort resolve(String typeName) {
        if (typeName == null) {
            return ctx.getIntSort();
        }
        return switch (typeName) {
            case "Bool", "Boolean", "𝔹" -> ctx.getBoolSort();
            case "ℤ", "Int", "Integer", "ℕ", "Nat", "Natural" -> ctx.getIntSort();
            case "ℝ", "Real", "ℚ", "Rational", "Scalar" -> ctx.getRealSort();
            case "String", "Str" -> ctx.getStringSort();
            default -> {
                if (registry.isDataType(typeName)) {
                    yield dataSorts.computeIfAbsent(typeName, ctx::mkUninterpretedSort);
                }
                logger.trace("{} 按抽象载体处理，使用 Int", typeName);
                yield ctx.getIntSort();
            }
        };
    }

    /**
     * 签名中类型表达式的排序。函数类型等无法直接表示的类型退回 Int。
     */
    public Sort resolve(TypeExpr type) {
        if (type == null) {
            return ctx.getIntSort();
        }
        return switch (type.getKind()) {
            case NAMED, VAR, PARAMETRIC -> resolve(type.getName());
            case FOR_ALL -> resolve(type.getBody());
            case FUNCTION, PRODUCT -> {
                logger.warn("类型 {} 没有对应的 Z3 排序，使用 Int", type);
                yield ctx.getIntSort();
            }
        };
    }
}
