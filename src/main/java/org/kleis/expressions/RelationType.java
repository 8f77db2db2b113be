package org.kleis.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import java.util.List;

/**
 * 内置的序关系运算。每个关系可用多个运算名引用。
 */
public enum RelationType {

    LT("<", List.of("less_than", "lt")),     // Less Than
    LE("<=", List.of("leq", "less_equal")),  // Less Equal
    GT(">", List.of("greater_than", "gt")),  // Greater Than
    GE(">=", List.of("geq", "greater_equal")); // Greater Equal

    private final String symbol;
    private final List<String> operationNames;

    RelationType(String symbol, List<String> operationNames) {
        this.symbol = symbol;
        this.operationNames = operationNames;
    }

    public String getSymbol() {
        return symbol;
    }

    public List<String> getOperationNames() {
        return operationNames;
    }

    /**
     * 按运算名查找关系；不是序关系时返回 null。
     */
    public static RelationType fromOperationName(String name) {
        for (RelationType type : values()) {
            if (type.operationNames.contains(name)) {
                return type;
            }
        }
        return null;
    }

    public BoolExpr toZ3(Context ctx, ArithExpr<?> left, ArithExpr<?> right) {
        return switch (this) {
            case LT -> ctx.mkLt(left, right);
            case LE -> ctx.mkLe(left, right);
            case GT -> ctx.mkGt(left, right);
            case GE -> ctx.mkGe(left, right);
        };
    }
}
