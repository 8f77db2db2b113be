package org.kleis.symbolic;

import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import org.kleis.expressions.ConditionalExpr;
import org.kleis.expressions.ConstExpr;
import org.kleis.expressions.Expression;
import org.kleis.expressions.ObjectExpr;
import org.kleis.expressions.OperationExpr;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.QuantifierExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 把 Z3 项读回表达式，是 {@link Z3Translator} 的逆向，用于展示化简结果。
 * 算术、比较和逻辑原语读回为对应的内置运算名；单位元常量读回为裸名字。
 */
class ExpressionReader {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionReader.class);

    private final IdentityElements identities;

    ExpressionReader(IdentityElements identities) {
        this.identities = identities;
    }

    Expression read(Expr<?> expr) {
        return read(expr, new ArrayDeque<>());
    }

    /**
     * @param bound 外层量词绑定的变量名，栈顶是最内层最后一个绑定变量（de Bruijn 下标 0）
     */
    private Expression read(Expr<?> expr, Deque<String> bound) {
        if (expr.isIntNum()) {
            return ConstExpr.of(((IntNum) expr).getBigInteger().toString());
        }
        if (expr.isRatNum()) {
            RatNum rat = (RatNum) expr;
            BigInteger denominator = rat.getBigIntDenominator();
            String numerator = rat.getBigIntNumerator().toString();
            return ConstExpr.of(BigInteger.ONE.equals(denominator) ? numerator : numerator + "/" + denominator);
        }
        if (expr.isTrue()) {
            return ConstExpr.of("true");
        }
        if (expr.isFalse()) {
            return ConstExpr.of("false");
        }
        if (expr.isString()) {
            return ConstExpr.of("\"" + expr.getString() + "\"");
        }
        if (expr.isQuantifier()) {
            return readQuantifier((Quantifier) expr, bound);
        }
        if (expr.isVar()) {
            int index = expr.getIndex();
            if (index >= bound.size()) {
                throw TranslationException.unsupported(expr);
            }
            return ObjectExpr.of(new ArrayList<>(bound).get(index));
        }
        if (expr.isConst()) {
            String element = identities.nameOf(expr);
            return ObjectExpr.of(element != null ? element : expr.getFuncDecl().getName().toString());
        }
        if (!expr.isApp()) {
            throw TranslationException.unsupported(expr);
        }

        List<Expression> args = new ArrayList<>();
        for (Expr<?> arg : expr.getArgs()) {
            args.add(read(arg, bound));
        }
        if (expr.isAdd()) {
            return fold("plus", args);
        }
        if (expr.isMul()) {
            return fold("times", args);
        }
        if (expr.isSub()) {
            return fold("minus", args);
        }
        if (expr.isDiv() || expr.isIDiv()) {
            return fold("divide", args);
        }
        if (expr.isUMinus()) {
            return OperationExpr.of("negate", args);
        }
        if (expr.isIntToReal()) {
            return args.get(0);
        }
        if (expr.isLE()) {
            return OperationExpr.of("leq", args);
        }
        if (expr.isLT()) {
            return OperationExpr.of("less_than", args);
        }
        if (expr.isGE()) {
            return OperationExpr.of("geq", args);
        }
        if (expr.isGT()) {
            return OperationExpr.of("greater_than", args);
        }
        if (expr.isEq()) {
            return OperationExpr.of("equals", args);
        }
        if (expr.isDistinct() && args.size() == 2) {
            return OperationExpr.of("neq", args);
        }
        if (expr.isNot()) {
            return OperationExpr.of("not", args);
        }
        if (expr.isAnd()) {
            return OperationExpr.of("and", args);
        }
        if (expr.isOr()) {
            return OperationExpr.of("or", args);
        }
        if (expr.isImplies()) {
            return OperationExpr.of("implies", args);
        }
        if (expr.isITE()) {
            return ConditionalExpr.of(args.get(0), args.get(1), args.get(2));
        }
        if (expr.getFuncDecl().getDeclKind() != Z3_decl_kind.Z3_OP_UNINTERPRETED) {
            logger.debug("无法读回的 Z3 原语 {}", expr.getFuncDecl().getName());
            throw TranslationException.unsupported(expr);
        }
        return OperationExpr.of(expr.getFuncDecl().getName().toString(), args);
    }

    private Expression readQuantifier(Quantifier quantifier, Deque<String> bound) {
        Symbol[] names = quantifier.getBoundVariableNames();
        Sort[] sorts = quantifier.getBoundVariableSorts();
        List<QuantifiedVar> variables = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            variables.add(QuantifiedVar.of(names[i].toString(), annotationOf(sorts[i])));
            bound.push(names[i].toString());
        }
        try {
            Expression body = read(quantifier.getBody(), bound);
            return quantifier.isUniversal()
                    ? QuantifierExpr.forAll(variables, body)
                    : QuantifierExpr.exists(variables, body);
        } finally {
            for (int i = 0; i < names.length; i++) {
                bound.pop();
            }
        }
    }

    private static Expression fold(String name, List<Expression> args) {
        Expression result = args.get(0);
        for (int i = 1; i < args.size(); i++) {
            result = OperationExpr.of(name, result, args.get(i));
        }
        return result;
    }

    private static String annotationOf(Sort sort) {
        return switch (sort.getSortKind()) {
            case Z3_INT_SORT -> "ℤ";
            case Z3_REAL_SORT -> "ℝ";
            case Z3_BOOL_SORT -> "Bool";
            case Z3_SEQ_SORT -> "String";
            default -> sort.getName().toString();
        };
    }
}
