package org.kleis.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Robinson 合一与约束求解。
 */
public final class Unifier {

    private static final Logger logger = LoggerFactory.getLogger(Unifier.class);

    private Unifier() {
    }

    /**
     * 求 t1 与 t2 的最一般合一子。
     *
     * @throws TypeInferenceException 类型不兼容，或出现检查失败
     */
    public static Substitution unify(Type t1, Type t2) {
        if (t1.equals(t2)) {
            return Substitution.empty();
        }
        if (t1 instanceof TypeVar var) {
            return bind(var, t2);
        }
        if (t2 instanceof TypeVar var) {
            return bind(var, t1);
        }
        if (t1 instanceof FunctionType f1 && t2 instanceof FunctionType f2) {
            Substitution s1 = unify(f1.getDomain(), f2.getDomain());
            Substitution s2 = unify(s1.apply(f1.getCodomain()), s1.apply(f2.getCodomain()));
            return s1.compose(s2);
        }
        if (t1 instanceof NamedType n1 && t2 instanceof NamedType n2
                && n1.getName().equals(n2.getName())
                && n1.getTypeArgs().size() == n2.getTypeArgs().size()) {
            Substitution subst = Substitution.empty();
            for (int i = 0; i < n1.getTypeArgs().size(); i++) {
                Type a = subst.apply(n1.getTypeArgs().get(i));
                Type b = subst.apply(n2.getTypeArgs().get(i));
                subst = subst.compose(unify(a, b));
            }
            return subst;
        }
        throw TypeInferenceException.unificationFailure(t1, t2);
    }

    private static Substitution bind(TypeVar var, Type type) {
        if (type.equals(var)) {
            return Substitution.empty();
        }
        if (type.occurs(var)) {
            throw TypeInferenceException.occursCheckFailure(var, type);
        }
        return Substitution.singleton(var, type);
    }

    /**
     * 按生成顺序求解约束。每个约束两侧先应用已累积的替换再合一，
     * 失败时异常定位到约束的来源表达式。
     */
    public static Substitution solve(List<Constraint> constraints) {
        Substitution subst = Substitution.empty();
        for (Constraint c : constraints) {
            Type left = subst.apply(c.getLeft());
            Type right = subst.apply(c.getRight());
            try {
                subst = subst.compose(unify(left, right));
            } catch (TypeInferenceException e) {
                logger.debug("约束 {} 求解失败: {}", c, e.getMessage());
                throw e.at(c.getOrigin());
            }
        }
        logger.debug("求解 {} 条约束，得到替换 {}", constraints.size(), subst);
        return subst;
    }

    /**
     * 约束是否可同时满足。
     */
    public static boolean isSolvable(List<Constraint> constraints) {
        try {
            solve(constraints);
            return true;
        } catch (TypeInferenceException e) {
            return false;
        }
    }
}
