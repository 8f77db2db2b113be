package org.kleis.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.kleis.expressions.ConditionalExpr;
import org.kleis.expressions.ConstExpr;
import org.kleis.expressions.Expression;
import org.kleis.expressions.ObjectExpr;
import org.kleis.expressions.OperationExpr;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.QuantifierExpr;
import org.kleis.expressions.QuantifierKind;
import org.kleis.expressions.RelationType;
import org.kleis.structures.StructureRegistry;
import org.kleis.structures.TypeExpr;
import org.kleis.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把表达式翻译成 Z3 项。
 * <p>
 * 少数内置运算名直接映射到 Z3 的算术、比较和逻辑原语；其余运算在第一次出现时
 * 声明为未解释函数，之后的使用必须保持相同的参数个数和排序。
 * 名字的查找顺序：量词绑定（内层优先），然后是已加载的单位元。
 */
public class Z3Translator {

    private static final Logger logger = LoggerFactory.getLogger(Z3Translator.class);

    private final Context ctx;
    private final StructureRegistry registry;
    @Getter
    private final SortResolver sorts;
    private final IdentityElements identities;
    private final Map<String, FuncDecl<?>> functions = new HashMap<>();

    public Z3Translator(Context ctx, StructureRegistry registry, SortResolver sorts, IdentityElements identities) {
        this.ctx = ctx;
        this.registry = registry;
        this.sorts = sorts;
        this.identities = identities;
    }

    public Expr<?> translate(Expression expr) {
        return translate(expr, Map.of(), Set.of());
    }

    /**
     * 翻译任意表达式。
     *
     * @param binders         外层已绑定的变量
     * @param preferredOwners 同名单位元有多个来源时优先选择的结构
     * @return 对应的 Z3 项
     * @throws TranslationException 名字未绑定、参数个数或排序不一致，或表达式无法翻译
     */
    public Expr<?> translate(Expression expr, Map<String, Expr<?>> binders, Set<String> preferredOwners) {
        if (expr instanceof ConstExpr constant) {
            return translateConst(constant);
        }
        if (expr instanceof ObjectExpr obj) {
            Expr<?> bound = binders.get(obj.getName());
            if (bound != null) {
                return bound;
            }
            Expr<?> element = identities.resolve(obj.getName(), preferredOwners);
            if (element != null) {
                return element;
            }
            throw TranslationException.unboundVariable(obj.getName());
        }
        if (expr instanceof OperationExpr op) {
            List<Expr<?>> args = new ArrayList<>();
            for (Expression arg : op.getArgs()) {
                args.add(translate(arg, binders, preferredOwners));
            }
            return translateOperation(op, args);
        }
        if (expr instanceof QuantifierExpr quantifier) {
            return translateQuantifier(quantifier, binders, preferredOwners);
        }
        if (expr instanceof ConditionalExpr conditional) {
            BoolExpr cond = bool(translate(conditional.getCondition(), binders, preferredOwners), conditional.getCondition());
            Expr<?> thenExpr = translate(conditional.getThenBranch(), binders, preferredOwners);
            Expr<?> elseExpr = translate(conditional.getElseBranch(), binders, preferredOwners);
            List<Expr<?>> branches = unifySorts("if", List.of(thenExpr, elseExpr));
            return ite(cond, branches.get(0), branches.get(1));
        }
        throw TranslationException.unsupported(expr);
    }

    /**
     * 翻译必须为布尔值的公式。
     */
    public BoolExpr translateFormula(Expression expr, Set<String> preferredOwners) {
        return bool(translate(expr, Map.of(), preferredOwners), expr);
    }

    /**
     * 预先声明一个未解释函数，例如数据类型的带参构造子。
     */
    public FuncDecl<?> declareFunction(String name, Sort[] domain, Sort range) {
        FuncDecl<?> existing = functions.get(name);
        if (existing != null) {
            return existing;
        }
        FuncDecl<?> decl = ctx.mkFuncDecl(name, domain, range);
        functions.put(name, decl);
        logger.debug("声明未解释函数 {} : {} → {}", name, Arrays.toString(domain), range);
        return decl;
    }

    public int getDeclaredFunctionCount() {
        return functions.size();
    }

    // ========== 字面量 ==========

    private Expr<?> translateConst(ConstExpr constant) {
        if (constant.isBoolean()) {
            return ctx.mkBool(Boolean.parseBoolean(constant.getValue()));
        }
        if (constant.isString()) {
            return ctx.mkString(constant.stringContent());
        }
        Rational value;
        try {
            value = Rational.valueOf(constant.getValue());
        } catch (NumberFormatException e) {
            throw TranslationException.unsupported(constant);
        }
        if (value.isInteger()) {
            return ctx.mkInt(value.getNumerator().toString());
        }
        return ctx.mkReal(value.toString());
    }

    // ========== 运算 ==========

    private Expr<?> translateOperation(OperationExpr op, List<Expr<?>> args) {
        String name = op.getName();
        RelationType relation = RelationType.fromOperationName(name);
        if (relation != null) {
            requireArity(name, args, 2);
            List<ArithExpr<?>> operands = arith(name, args);
            return relation.toZ3(ctx, operands.get(0), operands.get(1));
        }
        return switch (name) {
            case "plus", "add" -> add(name, args);
            case "minus", "subtract" -> sub(name, args);
            case "times", "multiply" -> mul(name, args);
            case "divide" -> div(name, args);
            case "negate" -> {
                requireArity(name, args, 1);
                yield negate(arith(name, args).get(0));
            }
            case "equals", "eq" -> {
                requireArity(name, args, 2);
                yield equal(name, args.get(0), args.get(1));
            }
            case "neq", "not_equals" -> {
                requireArity(name, args, 2);
                yield ctx.mkNot(equal(name, args.get(0), args.get(1)));
            }
            case "and", "logical_and" -> ctx.mkAnd(bools(name, args, op));
            case "or", "logical_or" -> ctx.mkOr(bools(name, args, op));
            case "not", "logical_not" -> {
                requireArity(name, args, 1);
                yield ctx.mkNot(bools(name, args, op)[0]);
            }
            case "implies" -> {
                requireArity(name, args, 2);
                BoolExpr[] operands = bools(name, args, op);
                yield ctx.mkImplies(operands[0], operands[1]);
            }
            case "iff" -> {
                requireArity(name, args, 2);
                BoolExpr[] operands = bools(name, args, op);
                yield ctx.mkIff(operands[0], operands[1]);
            }
            default -> applyUninterpreted(name, args);
        };
    }

    private Expr<?> applyUninterpreted(String name, List<Expr<?>> args) {
        Sort[] argSorts = args.stream().map(Expr::getSort).toArray(Sort[]::new);
        FuncDecl<?> decl = functions.get(name);
        if (decl == null) {
            TypeExpr signature = registry.getOperationSignature(name, args.size());
            Sort range = signature == null ? ctx.getIntSort() : sorts.resolve(signature.uncurry().getRight());
            decl = declareFunction(name, argSorts, range);
        } else {
            Sort[] domain = decl.getDomain();
            if (domain.length != args.size()) {
                throw TranslationException.arityMismatch(name, args.size(), domain.length);
            }
            for (int i = 0; i < domain.length; i++) {
                if (!domain[i].equals(argSorts[i])) {
                    throw TranslationException.sortMismatch(name, Arrays.toString(argSorts), Arrays.toString(domain));
                }
            }
        }
        return ctx.mkApp(decl, args.toArray(new Expr<?>[0]));
    }

    // ========== 量词 ==========

    private BoolExpr translateQuantifier(QuantifierExpr quantifier, Map<String, Expr<?>> binders,
                                         Set<String> preferredOwners) {
        Map<String, Expr<?>> inner = new HashMap<>(binders);
        List<Expr<?>> bound = new ArrayList<>();
        for (QuantifiedVar var : quantifier.getVariables()) {
            Expr<?> constant = ctx.mkConst(var.getName(), sorts.resolve(var.getTypeAnnotation()));
            inner.put(var.getName(), constant);
            bound.add(constant);
        }
        BoolExpr body = bool(translate(quantifier.getBody(), inner, preferredOwners), quantifier.getBody());
        BoolExpr where = null;
        if (quantifier.hasWhereClause()) {
            where = bool(translate(quantifier.getWhereClause(), inner, preferredOwners), quantifier.getWhereClause());
        }

        boolean forAll = quantifier.getKind() == QuantifierKind.FOR_ALL;
        if (where != null) {
            // ∀ 中 where 是前提，∃ 中是合取项
            body = forAll ? ctx.mkImplies(where, body) : ctx.mkAnd(where, body);
        }
        if (bound.isEmpty()) {
            return body;
        }
        Expr<?>[] vars = bound.toArray(new Expr<?>[0]);
        return forAll
                ? ctx.mkForall(vars, body, 1, null, null, null, null)
                : ctx.mkExists(vars, body, 1, null, null, null, null);
    }

    // ========== 辅助 ==========

    private static void requireArity(String name, List<Expr<?>> args, int expected) {
        if (args.size() != expected) {
            throw TranslationException.arityMismatch(name, args.size(), expected);
        }
    }

    private BoolExpr bool(Expr<?> expr, Object source) {
        if (expr instanceof BoolExpr b) {
            return b;
        }
        throw TranslationException.notBoolean(source);
    }

    private BoolExpr[] bools(String name, List<Expr<?>> args, OperationExpr op) {
        BoolExpr[] result = new BoolExpr[args.size()];
        for (int i = 0; i < args.size(); i++) {
            result[i] = bool(args.get(i), op.getArgs().get(i));
        }
        if (result.length == 0) {
            throw TranslationException.arityMismatch(name, 0, 2);
        }
        return result;
    }

    /**
     * 算术操作数；Int 与 Real 混用时把 Int 提升为 Real。
     */
    private List<ArithExpr<?>> arith(String name, List<Expr<?>> args) {
        boolean anyReal = args.stream().anyMatch(Expr::isReal);
        List<ArithExpr<?>> result = new ArrayList<>();
        for (Expr<?> arg : args) {
            if (!(arg instanceof ArithExpr)) {
                throw TranslationException.sortMismatch(name, arg.getSort(), "Int/Real");
            }
            if (anyReal && arg.isInt()) {
                result.add(ctx.mkInt2Real((Expr<IntSort>) arg));
            } else {
                result.add((ArithExpr) arg);
            }
        }
        return result;
    }

    /**
     * 让两侧排序一致：算术两侧做提升，其他排序必须相同。
     */
    private List<Expr<?>> unifySorts(String name, List<Expr<?>> operands) {
        if (operands.stream().allMatch(e -> e instanceof ArithExpr)) {
            return new ArrayList<>(arith(name, operands));
        }
        Sort first = operands.get(0).getSort();
        for (Expr<?> operand : operands) {
            if (!operand.getSort().equals(first)) {
                throw TranslationException.sortMismatch(name, operand.getSort(), first);
            }
        }
        return operands;
    }

    private BoolExpr equal(String name, Expr<?> left, Expr<?> right) {
        List<Expr<?>> operands = unifySorts(name, List.of(left, right));
        return ctx.mkEq((Expr) operands.get(0), (Expr) operands.get(1));
    }

    private Expr<?> ite(BoolExpr cond, Expr<?> thenExpr, Expr<?> elseExpr) {
        return ctx.mkITE(cond, (Expr) thenExpr, (Expr) elseExpr);
    }

    private Expr<?> add(String name, List<Expr<?>> args) {
        if (args.size() < 2) {
            throw TranslationException.arityMismatch(name, args.size(), 2);
        }
        return ctx.mkAdd(arith(name, args).toArray(new ArithExpr[0]));
    }

    private Expr<?> sub(String name, List<Expr<?>> args) {
        requireArity(name, args, 2);
        return ctx.mkSub(arith(name, args).toArray(new ArithExpr[0]));
    }

    private Expr<?> mul(String name, List<Expr<?>> args) {
        if (args.size() < 2) {
            throw TranslationException.arityMismatch(name, args.size(), 2);
        }
        return ctx.mkMul(arith(name, args).toArray(new ArithExpr[0]));
    }

    private Expr<?> div(String name, List<Expr<?>> args) {
        requireArity(name, args, 2);
        List<ArithExpr<?>> operands = arith(name, args);
        return ctx.mkDiv(operands.get(0), operands.get(1));
    }

    private Expr<?> negate(ArithExpr operand) {
        return ctx.mkUnaryMinus(operand);
    }
}
