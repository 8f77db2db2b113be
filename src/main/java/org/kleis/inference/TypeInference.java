package org.kleis.inference;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.kleis.expressions.ConditionalExpr;
import org.kleis.expressions.ConstExpr;
import org.kleis.expressions.Expression;
import org.kleis.expressions.ObjectExpr;
import org.kleis.expressions.OperationExpr;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.QuantifierExpr;
import org.kleis.structures.DataDef;
import org.kleis.structures.ImplementsDef;
import org.kleis.structures.OperationCandidate;
import org.kleis.structures.StructureRegistry;
import org.kleis.types.Constraint;
import org.kleis.types.NamedType;
import org.kleis.types.PrimitiveType;
import org.kleis.types.Substitution;
import org.kleis.types.Type;
import org.kleis.types.TypeInferenceException;
import org.kleis.types.TypeVar;
import org.kleis.types.Unifier;
import org.kleis.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 一次类型推断会话。
 * <p>
 * 会话持有自己的类型变量计数器（经由 {@link TypeContext}）、按生成顺序排列的约束，
 * 以及这些约束到目前为止的解。运算的重载通过合一筛选候选签名来消解：
 * 唯一可行时采用它的约束；多个可行时记录为歧义并返回新的类型变量。
 * <p>
 * 会话不是线程安全的；注册表只读共享。
 */
public class TypeInference {

    private static final Logger logger = LoggerFactory.getLogger(TypeInference.class);

    private final StructureRegistry registry;
    private final TypeContext context;
    private final SignatureInstantiator instantiator;

    private final List<Constraint> constraints = new ArrayList<>();
    // 约束到目前为止的解，每加入一条约束就更新
    private Substitution current = Substitution.empty();
    @Getter
    private final List<Ambiguity> ambiguities = new ArrayList<>();

    public TypeInference(StructureRegistry registry) {
        this(registry, new TypeContext());
    }

    public TypeInference(StructureRegistry registry, TypeContext context) {
        this.registry = Objects.requireNonNull(registry, "注册表不能为空");
        this.context = Objects.requireNonNull(context, "类型上下文不能为空");
        this.instantiator = new SignatureInstantiator(context);
    }

    /**
     * 推断表达式的类型，返回（未代入的）类型和本次生成的约束。
     *
     * @param expr 待推断的表达式，其中的变量在上下文中查找
     * @return 左边是类型，可能含有待求解的类型变量；右边是本次调用新增的约束
     * @throws TypeInferenceException 定位到出错子表达式的类型错误
     */
    public Pair<Type, List<Constraint>> infer(Expression expr) {
        int start = constraints.size();
        Type type = inferExpr(expr, context);
        return Pair.of(type, List.copyOf(constraints.subList(start, constraints.size())));
    }

    /**
     * 推断并求解，返回代入最终替换后的类型。
     *
     * @param expr 待推断的表达式
     * @return 代入替换后的类型；无法确定的部分仍为类型变量
     * @throws TypeInferenceException 推断或合一失败
     */
    public Type inferAndSolve(Expression expr) {
        Pair<Type, List<Constraint>> inferred = infer(expr);
        Substitution subst = Unifier.solve(constraints);
        Type result = subst.apply(inferred.getLeft());
        logger.debug("{} : {}", expr, result);
        return result;
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public Substitution getSubstitution() {
        return current;
    }

    private Type inferExpr(Expression expr, TypeContext ctx) {
        if (expr instanceof ObjectExpr obj) {
            return inferObject(obj, ctx);
        }
        if (expr instanceof ConstExpr constant) {
            return inferConst(constant);
        }
        if (expr instanceof OperationExpr op) {
            return inferOperation(op, ctx);
        }
        if (expr instanceof QuantifierExpr quantifier) {
            return inferQuantifier(quantifier, ctx);
        }
        if (expr instanceof ConditionalExpr conditional) {
            Type cond = inferExpr(conditional.getCondition(), ctx);
            addConstraint(Constraint.of(cond, PrimitiveType.BOOLEAN, conditional.getCondition()));
            Type thenType = inferExpr(conditional.getThenBranch(), ctx);
            Type elseType = inferExpr(conditional.getElseBranch(), ctx);
            addConstraint(Constraint.of(thenType, elseType, conditional));
            return thenType;
        }
        throw new IllegalArgumentException("未知的表达式类型: " + expr.getClass().getName());
    }

    private Type inferObject(ObjectExpr obj, TypeContext ctx) {
        Type bound = ctx.lookup(obj.getName());
        if (bound != null) {
            return bound;
        }
        DataDef data = registry.getDataTypeOfConstructor(obj.getName());
        if (data != null && data.getTypeParams().isEmpty()) {
            return NamedType.of(data.getName());
        }
        // 自由变量记录在根作用域，使同名的多次出现共享同一个类型
        TypeVar fresh = ctx.fresh();
        ctx.root().bind(obj.getName(), fresh);
        logger.trace("自由变量 {} : {}", obj.getName(), fresh);
        return fresh;
    }

    private Type inferConst(ConstExpr constant) {
        if (constant.isBoolean()) {
            return PrimitiveType.BOOLEAN;
        }
        if (constant.isString()) {
            return PrimitiveType.STRING;
        }
        if (Rational.isNumeric(constant.getValue())) {
            return PrimitiveType.NUMERIC;
        }
        throw TypeInferenceException.unsupportedLiteral(constant.getValue(), constant);
    }

    private Type inferQuantifier(QuantifierExpr quantifier, TypeContext ctx) {
        TypeContext inner = ctx.child();
        // 同一量词里同名的抽象排序共享一个类型变量
        Map<String, Type> abstractSorts = new HashMap<>();
        for (QuantifiedVar var : quantifier.getVariables()) {
            inner.bind(var.getName(), resolveSort(var.getTypeAnnotation(), abstractSorts));
        }
        if (quantifier.hasWhereClause()) {
            Type where = inferExpr(quantifier.getWhereClause(), inner);
            addConstraint(Constraint.of(where, PrimitiveType.BOOLEAN, quantifier.getWhereClause()));
        }
        Type body = inferExpr(quantifier.getBody(), inner);
        addConstraint(Constraint.of(body, PrimitiveType.BOOLEAN, quantifier.getBody()));
        return PrimitiveType.BOOLEAN;
    }

    private Type resolveSort(String annotation, Map<String, Type> abstractSorts) {
        if (annotation == null) {
            return context.fresh();
        }
        PrimitiveType primitive = PrimitiveType.fromName(annotation);
        if (primitive != null) {
            return primitive;
        }
        if (registry.isDataType(annotation)) {
            return NamedType.of(annotation);
        }
        return abstractSorts.computeIfAbsent(annotation, a -> context.fresh());
    }

    // ========== 运算与重载 ==========

    /**
     * 运算的一个已实例化的候选签名。
     */
    private static final class Signature {
        private final String owner;
        private final List<Type> params;
        private final Type result;
        private final Type carrier;

        Signature(String owner, List<Type> params, Type result, Type carrier) {
            this.owner = owner;
            this.params = params;
            this.result = result;
            this.carrier = carrier;
        }
    }

    private Type inferOperation(OperationExpr op, TypeContext ctx) {
        List<Type> argTypes = new ArrayList<>();
        for (Expression arg : op.getArgs()) {
            argTypes.add(inferExpr(arg, ctx));
        }

        List<Signature> candidates = candidatesFor(op.getName());
        if (candidates.isEmpty()) {
            throw TypeInferenceException.undefinedOperation(op.getName(), op);
        }

        List<Signature> viable = new ArrayList<>();
        List<Substitution> viableSolutions = new ArrayList<>();
        int arityFailures = 0;
        TypeInferenceException firstFailure = null;
        Type unimplementedCarrier = null;

        for (Signature candidate : candidates) {
            if (candidate.params.size() != argTypes.size()) {
                arityFailures++;
                continue;
            }
            Substitution trial;
            try {
                trial = extend(current, candidateConstraints(candidate, argTypes, op));
            } catch (TypeInferenceException e) {
                logger.trace("候选 {} 不适用于 {}: {}", candidate.owner, op, e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
                continue;
            }
            if (!isImplemented(candidate, trial)) {
                unimplementedCarrier = trial.apply(candidate.carrier);
                continue;
            }
            viable.add(candidate);
            viableSolutions.add(trial);
        }

        if (viable.isEmpty()) {
            if (arityFailures == candidates.size()) {
                String expected = candidates.stream().map(c -> String.valueOf(c.params.size()))
                        .distinct().collect(Collectors.joining(" 或 "));
                throw TypeInferenceException.arityMismatch(op.getName(), argTypes.size(), expected, op);
            }
            if (firstFailure != null) {
                throw firstFailure.at(op);
            }
            throw TypeInferenceException.noImplementation(op.getName(), unimplementedCarrier, op);
        }

        if (viable.size() == 1 || agree(viable, viableSolutions, argTypes)) {
            Signature chosen = viable.get(0);
            for (Constraint c : candidateConstraints(chosen, argTypes, op)) {
                addConstraint(c);
            }
            return chosen.result;
        }

        List<String> owners = viable.stream().map(s -> s.owner).distinct().toList();
        ambiguities.add(new Ambiguity(op, owners));
        logger.warn("运算 {} 有 {} 个可行候选 {}，结果类型保持多态", op, viable.size(), owners);
        return context.fresh();
    }

    private List<Signature> candidatesFor(String name) {
        List<Signature> signatures = new ArrayList<>();
        for (OperationCandidate candidate : registry.getOperationCandidates(name)) {
            Map<String, Type> scope = instantiator.freshScope(candidate.getScopeParams());
            Pair<List<Type>, Type> sig = instantiator.instantiate(candidate.getOperation().getSignature(), scope);
            Type carrier = candidate.getCarrierParam() == null ? null : scope.get(candidate.getCarrierParam());
            signatures.add(new Signature(candidate.getOwner(), sig.getLeft(), sig.getRight(), carrier));
        }
        if (signatures.isEmpty()) {
            Pair<List<Type>, Type> builtin = BuiltinSignatures.instantiate(name, context);
            if (builtin != null) {
                signatures.add(new Signature(null, builtin.getLeft(), builtin.getRight(), null));
            }
        }
        return signatures;
    }

    private List<Constraint> candidateConstraints(Signature candidate, List<Type> argTypes, OperationExpr op) {
        List<Constraint> result = new ArrayList<>();
        for (int i = 0; i < argTypes.size(); i++) {
            result.add(Constraint.of(argTypes.get(i), candidate.params.get(i), op));
        }
        return result;
    }

    /**
     * 候选所属结构有实现声明时，载体类型一旦确定就必须是其中之一。
     */
    private boolean isImplemented(Signature candidate, Substitution solution) {
        if (candidate.owner == null || candidate.carrier == null || !registry.hasImplements(candidate.owner)) {
            return true;
        }
        Type carrier = solution.apply(candidate.carrier);
        if (carrier instanceof TypeVar) {
            return true;
        }
        for (ImplementsDef impl : registry.getImplements(candidate.owner)) {
            if (impl.getCarrier() != null
                    && instantiator.toType(impl.getCarrier(), new HashMap<>()).equals(carrier)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 所有可行候选得出相同的确定类型时，选择哪一个并不影响结果。
     */
    private boolean agree(List<Signature> viable, List<Substitution> solutions, List<Type> argTypes) {
        Set<List<Type>> outcomes = new LinkedHashSet<>();
        for (int i = 0; i < viable.size(); i++) {
            Substitution s = solutions.get(i);
            List<Type> outcome = new ArrayList<>(s.applyAll(argTypes));
            outcome.add(s.apply(viable.get(i).result));
            if (outcome.stream().anyMatch(t -> !t.isGround())) {
                return false;
            }
            outcomes.add(outcome);
        }
        return outcomes.size() == 1;
    }

    private void addConstraint(Constraint constraint) {
        current = extend(current, List.of(constraint));
        constraints.add(constraint);
    }

    private static Substitution extend(Substitution base, List<Constraint> additional) {
        Substitution subst = base;
        for (Constraint c : additional) {
            Type left = subst.apply(c.getLeft());
            Type right = subst.apply(c.getRight());
            try {
                subst = subst.compose(Unifier.unify(left, right));
            } catch (TypeInferenceException e) {
                throw e.at(c.getOrigin());
            }
        }
        return subst;
    }
}
