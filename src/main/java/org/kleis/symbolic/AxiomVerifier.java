package org.kleis.symbolic;

import org.kleis.expressions.Expression;
import org.kleis.structures.FunctionDef;

import java.time.Duration;
import java.util.Set;

/**
 * 公理验证会话。结构按需加载，加载后在会话内一直有效。
 * 实现不是线程安全的。
 */
public interface AxiomVerifier extends AutoCloseable {

    /**
     * 在已加载的结构理论下判定命题是否恒真。命题依赖的结构和数据类型会先被加载。
     *
     * @param expr 布尔命题
     * @return 有效、无效（带反例）、未知，或验证未启用时的禁用状态
     */
    VerificationResult verifyAxiom(Expression expr);

    /**
     * 同 {@link #verifyAxiom(Expression)}，使用单次查询的超时。
     */
    VerificationResult verifyAxiom(Expression expr, Duration timeout);

    /**
     * 命题在已加载的理论下是否有模型。
     *
     * @param expr 布尔命题
     * @return 可满足时带一个模型
     */
    SatisfiabilityResult checkSatisfiability(Expression expr);

    /**
     * 两个表达式是否在所有模型中相等。
     */
    VerificationResult areEquivalent(Expression left, Expression right);

    /**
     * 已加载的背景理论本身是否可满足。结果在下一次加载之前被缓存。
     */
    SatisfiabilityResult checkConsistency();

    /**
     * 用求解器的化简器化简表达式。
     *
     * @param expr 任意可翻译的表达式，自由变量按整数处理
     * @return 化简后的表达式；验证未启用时原样返回
     */
    Expression simplify(Expression expr);

    /**
     * 加载结构、它引用的结构和嵌套子结构。已加载时什么也不做。
     *
     * @param structureName 注册表中的顶层结构名
     * @throws org.kleis.core.KleisException 结构或其引用的结构未注册；失败时该结构及其子结构都不算已加载
     */
    void ensureStructureLoaded(String structureName);

    void ensureDataTypeLoaded(String dataTypeName);

    /**
     * 断言派生函数的定义 {@code ∀params. f(params) = body}。
     */
    void defineFunction(FunctionDef function);

    Set<String> getLoadedStructures();

    VerifierStats stats();

    @Override
    void close();
}
