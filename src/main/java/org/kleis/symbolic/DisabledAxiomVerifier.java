package org.kleis.symbolic;

import org.kleis.expressions.Expression;
import org.kleis.structures.FunctionDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * 未启用验证或 Z3 不可用时的验证器，所有查询返回 DISABLED。
 */
public class DisabledAxiomVerifier implements AxiomVerifier {

    private static final Logger logger = LoggerFactory.getLogger(DisabledAxiomVerifier.class);

    @Override
    public VerificationResult verifyAxiom(Expression expr) {
        logger.debug("验证未启用，跳过 {}", expr);
        return VerificationResult.disabled();
    }

    @Override
    public VerificationResult verifyAxiom(Expression expr, Duration timeout) {
        return verifyAxiom(expr);
    }

    @Override
    public SatisfiabilityResult checkSatisfiability(Expression expr) {
        return SatisfiabilityResult.disabled();
    }

    @Override
    public VerificationResult areEquivalent(Expression left, Expression right) {
        return VerificationResult.disabled();
    }

    @Override
    public SatisfiabilityResult checkConsistency() {
        return SatisfiabilityResult.disabled();
    }

    @Override
    public Expression simplify(Expression expr) {
        return expr;
    }

    @Override
    public void ensureStructureLoaded(String structureName) {
        // 没有求解器，无需加载
    }

    @Override
    public void ensureDataTypeLoaded(String dataTypeName) {
        // 同上
    }

    @Override
    public void defineFunction(FunctionDef function) {
        logger.debug("验证未启用，忽略函数定义 {}", function.getName());
    }

    @Override
    public Set<String> getLoadedStructures() {
        return Set.of();
    }

    @Override
    public VerifierStats stats() {
        return VerifierStats.empty();
    }

    @Override
    public void close() {
        // 无资源
    }
}
