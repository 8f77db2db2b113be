package org.kleis.analysis;

import org.kleis.expressions.ConditionalExpr;
import org.kleis.expressions.Expression;
import org.kleis.expressions.ObjectExpr;
import org.kleis.expressions.OperationExpr;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.QuantifierExpr;
import org.kleis.structures.DataDef;
import org.kleis.structures.StructureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 找出验证一个表达式需要加载哪些结构。
 * <p>
 * 运算名和自由出现的单位元名都按注册表映射到声明它们的顶层结构；
 * 被外层量词绑定的名字不参与查找。
 */
public class DependencyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final StructureRegistry registry;

    public DependencyAnalyzer(StructureRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "注册表不能为空");
    }

    /**
     * @return 结构名，按首次遇到的顺序
     */
    public Set<String> analyzeDependencies(Expression expr) {
        Set<String> structures = new LinkedHashSet<>();
        collectStructures(expr, new HashSet<>(), structures);
        logger.debug("{} 依赖结构 {}", expr, structures);
        return structures;
    }

    /**
     * 表达式中出现的构造子所属的数据类型。
     */
    public Set<String> analyzeDataTypes(Expression expr) {
        Set<String> dataTypes = new LinkedHashSet<>();
        collectDataTypes(expr, new HashSet<>(), dataTypes);
        return dataTypes;
    }

    /**
     * 自由出现且注册表不认识的名字：既不是任何结构的运算或单位元，也不是构造子。
     *
     * @param expr 任意表达式
     * @return 变量名，按首次遇到的顺序
     */
    public Set<String> freeVariables(Expression expr) {
        Set<String> free = new LinkedHashSet<>();
        collectFree(expr, new HashSet<>(), free);
        return free;
    }

    private void collectFree(Expression expr, Set<String> bound, Set<String> out) {
        if (expr instanceof OperationExpr op) {
            for (Expression arg : op.getArgs()) {
                collectFree(arg, bound, out);
            }
        } else if (expr instanceof ObjectExpr obj) {
            String name = obj.getName();
            if (!bound.contains(name) && registry.getOperationOwners(name).isEmpty()
                    && registry.getDataTypeOfConstructor(name) == null) {
                out.add(name);
            }
        } else if (expr instanceof QuantifierExpr quantifier) {
            Set<String> inner = withBound(bound, quantifier);
            if (quantifier.hasWhereClause()) {
                collectFree(quantifier.getWhereClause(), inner, out);
            }
            collectFree(quantifier.getBody(), inner, out);
        } else if (expr instanceof ConditionalExpr conditional) {
            collectFree(conditional.getCondition(), bound, out);
            collectFree(conditional.getThenBranch(), bound, out);
            collectFree(conditional.getElseBranch(), bound, out);
        }
    }

    private void collectStructures(Expression expr, Set<String> bound, Set<String> out) {
        if (expr instanceof OperationExpr op) {
            out.addAll(registry.getOperationOwners(op.getName()));
            for (Expression arg : op.getArgs()) {
                collectStructures(arg, bound, out);
            }
        } else if (expr instanceof ObjectExpr obj) {
            if (!bound.contains(obj.getName())) {
                out.addAll(registry.getOperationOwners(obj.getName()));
            }
        } else if (expr instanceof QuantifierExpr quantifier) {
            Set<String> inner = withBound(bound, quantifier);
            if (quantifier.hasWhereClause()) {
                collectStructures(quantifier.getWhereClause(), inner, out);
            }
            collectStructures(quantifier.getBody(), inner, out);
        } else if (expr instanceof ConditionalExpr conditional) {
            collectStructures(conditional.getCondition(), bound, out);
            collectStructures(conditional.getThenBranch(), bound, out);
            collectStructures(conditional.getElseBranch(), bound, out);
        }
    }

    private void collectDataTypes(Expression expr, Set<String> bound, Set<String> out) {
        if (expr instanceof OperationExpr op) {
            addConstructorOwner(op.getName(), out);
            for (Expression arg : op.getArgs()) {
                collectDataTypes(arg, bound, out);
            }
        } else if (expr instanceof ObjectExpr obj) {
            if (!bound.contains(obj.getName())) {
                addConstructorOwner(obj.getName(), out);
            }
        } else if (expr instanceof QuantifierExpr quantifier) {
            Set<String> inner = withBound(bound, quantifier);
            for (QuantifiedVar var : quantifier.getVariables()) {
                if (var.hasTypeAnnotation() && registry.isDataType(var.getTypeAnnotation())) {
                    out.add(var.getTypeAnnotation());
                }
            }
            if (quantifier.hasWhereClause()) {
                collectDataTypes(quantifier.getWhereClause(), inner, out);
            }
            collectDataTypes(quantifier.getBody(), inner, out);
        } else if (expr instanceof ConditionalExpr conditional) {
            collectDataTypes(conditional.getCondition(), bound, out);
            collectDataTypes(conditional.getThenBranch(), bound, out);
            collectDataTypes(conditional.getElseBranch(), bound, out);
        }
    }

    private void addConstructorOwner(String name, Set<String> out) {
        DataDef data = registry.getDataTypeOfConstructor(name);
        if (data != null) {
            out.add(data.getName());
        }
    }

    private static Set<String> withBound(Set<String> bound, QuantifierExpr quantifier) {
        Set<String> inner = new HashSet<>(bound);
        for (QuantifiedVar var : quantifier.getVariables()) {
            inner.add(var.getName());
        }
        return inner;
    }
}
