package org.kleis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import org.kleis.analysis.DependencyAnalyzer;
import org.kleis.config.KleisConfig;
import org.kleis.config.KleisConfigKey;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;
import org.kleis.expressions.Expression;
import org.kleis.expressions.ObjectExpr;
import org.kleis.expressions.OperationExpr;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.QuantifierExpr;
import org.kleis.structures.AxiomDecl;
import org.kleis.structures.DataDef;
import org.kleis.structures.DataVariant;
import org.kleis.structures.FunctionDef;
import org.kleis.structures.OperationDecl;
import org.kleis.structures.StructureDef;
import org.kleis.structures.StructureRef;
import org.kleis.structures.StructureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 基于 Z3 的增量公理验证器。
 * <p>
 * 结构理论（单位元、公理、派生函数定义）断言在求解器底层，加载一次后在会话内一直有效；
 * 每次查询只在 {@link ProverScope} 中断言被检查的公式，查询结束即撤销。
 * 结构在递归加载其引用之前就被标记为已加载，因此循环引用不会无限递归。
 * 一个结构连同其嵌套子结构的理论先全部翻译，再一次性断言；任何一步失败都不留下断言。
 */
public class Z3AxiomVerifier implements AxiomVerifier {

    private static final Logger logger = LoggerFactory.getLogger(Z3AxiomVerifier.class);

    private final StructureRegistry registry;
    private final Z3Oracle oracle;
    private final Context ctx;
    private final SortResolver sorts;
    private final IdentityElements identities;
    private final Z3Translator translator;
    private final DependencyAnalyzer analyzer;
    private final ExpressionReader reader;

    private final Set<String> loadedStructures = new LinkedHashSet<>();
    private final Set<String> loadedDataTypes = new LinkedHashSet<>();
    private int assertedAxioms;
    private int queries;
    // 背景理论一致性的缓存，底层有新断言时失效
    private SatisfiabilityResult consistency;

    public Z3AxiomVerifier(StructureRegistry registry) {
        this(registry, KleisConfig.load());
    }

    public Z3AxiomVerifier(StructureRegistry registry, KleisConfig config) {
        this.registry = Objects.requireNonNull(registry, "注册表不能为空");
        this.oracle = new Z3Oracle(config.getZ3TimeoutMs(), config.getProperty(KleisConfigKey.Z3_MODEL));
        this.ctx = oracle.getCtx();
        this.sorts = new SortResolver(ctx, registry);
        this.identities = new IdentityElements(ctx);
        this.translator = new Z3Translator(ctx, registry, sorts, identities);
        this.analyzer = new DependencyAnalyzer(registry);
        this.reader = new ExpressionReader(identities);
        logger.info("Z3 公理验证器已启动，注册表中有 {} 个结构", registry.size());
    }

    // ========== 查询 ==========

    @Override
    public VerificationResult verifyAxiom(Expression expr) {
        return verifyAxiom(expr, null);
    }

    /**
     * 在已加载的结构理论下判定命题是否恒真：断言其否定，不可满足即有效。
     *
     * @param expr    布尔命题，自由出现的单位元按其依赖的结构解析
     * @param timeout 单次查询的超时，为 null 时使用配置的默认值
     * @return 有效、带反例的无效，或求解器给不出结论时的未知
     * @throws TranslationException 命题无法翻译；此时求解器状态不变
     */
    @Override
    public VerificationResult verifyAxiom(Expression expr, Duration timeout) {
        Set<String> owners = loadDependencies(expr);
        queries++;
        try (ProverScope scope = oracle.openScope()) {
            BoolExpr formula = translator.translateFormula(expr, owners);
            oracle.add(ctx.mkNot(formula));
            Status status = oracle.check(timeout);
            VerificationResult result = switch (status) {
                case UNSATISFIABLE -> VerificationResult.valid();
                case SATISFIABLE -> VerificationResult.invalid(Counterexample.fromModel(oracle.getModel()));
                case UNKNOWN -> VerificationResult.unknown(oracle.getReasonUnknown());
            };
            logger.info("验证 {}: {}", expr, result.getStatus());
            return result;
        }
    }

    @Override
    public SatisfiabilityResult checkSatisfiability(Expression expr) {
        Set<String> owners = loadDependencies(expr);
        queries++;
        try (ProverScope scope = oracle.openScope()) {
            oracle.add(translator.translateFormula(expr, owners));
            return satisfiability(oracle.check());
        }
    }

    @Override
    public VerificationResult areEquivalent(Expression left, Expression right) {
        return verifyAxiom(OperationExpr.of("equals", left, right));
    }

    @Override
    public SatisfiabilityResult checkConsistency() {
        if (consistency != null) {
            logger.debug("使用缓存的一致性结果 {}", consistency.getStatus());
            return consistency;
        }
        queries++;
        try (ProverScope scope = oracle.openScope()) {
            SatisfiabilityResult result = satisfiability(oracle.check());
            if (result.getStatus() == SatisfiabilityResult.Status.UNSATISFIABLE) {
                logger.warn("已加载的结构 {} 的公理互相矛盾", loadedStructures);
            }
            if (result.getStatus() != SatisfiabilityResult.Status.UNKNOWN) {
                consistency = result;
            }
            return result;
        }
    }

    /**
     * 用 Z3 的化简器化简表达式，再读回表达式。
     * 自由变量按 Int 处理；单位元读回为其裸名字。
     *
     * @param expr 任意可翻译的表达式
     * @return 化简后的表达式
     * @throws TranslationException 表达式无法翻译，或化简结果含有无法读回的项
     */
    @Override
    public Expression simplify(Expression expr) {
        Set<String> owners = loadDependencies(expr);
        Map<String, Expr<?>> free = new LinkedHashMap<>();
        for (String name : analyzer.freeVariables(expr)) {
            if (identities.resolve(name, owners) == null) {
                free.put(name, ctx.mkConst(name, sorts.resolve((String) null)));
            }
        }
        Expr<?> simplified = translator.translate(expr, free, owners).simplify();
        Expression result = reader.read(simplified);
        logger.debug("化简 {} => {}", expr, result);
        return result;
    }

    private SatisfiabilityResult satisfiability(Status status) {
        return switch (status) {
            case SATISFIABLE -> SatisfiabilityResult.satisfiable(Counterexample.fromModel(oracle.getModel()));
            case UNSATISFIABLE -> SatisfiabilityResult.unsatisfiable();
            case UNKNOWN -> SatisfiabilityResult.unknown(oracle.getReasonUnknown());
        };
    }

    /**
     * 在底层加载表达式依赖的数据类型和结构，返回它们的名字供单位元消歧使用。
     */
    private Set<String> loadDependencies(Expression expr) {
        Set<String> owners = new LinkedHashSet<>();
        for (String dataType : analyzer.analyzeDataTypes(expr)) {
            ensureDataTypeLoaded(dataType);
            owners.add(dataType);
        }
        for (String structure : analyzer.analyzeDependencies(expr)) {
            ensureStructureLoaded(structure);
            owners.add(structure);
        }
        return owners;
    }

    // ========== 结构加载 ==========

    @Override
    public void ensureStructureLoaded(String structureName) {
        if (loadedStructures.contains(structureName)) {
            return;
        }
        StructureDef def = registry.lookup(structureName);
        List<String> marked = new ArrayList<>();
        List<BoolExpr> distinctness = new ArrayList<>();
        List<BoolExpr> axioms = new ArrayList<>();
        try {
            collectTheory(structureName, def, true, marked, distinctness, axioms);
        } catch (RuntimeException e) {
            // 连同嵌套子结构一起撤销，底层没有断言任何东西
            marked.forEach(loadedStructures::remove);
            identities.forget(structureName);
            logger.warn("结构 {} 加载失败: {}", structureName, e.getMessage());
            throw e;
        }
        oracle.add(distinctness);
        oracle.add(axioms);
        assertedAxioms += axioms.size();
        consistency = null;
        logger.info("加载结构 {}：{} 条公理，{} 条不等式", marked, axioms.size(), distinctness.size());
    }

    /**
     * 收集结构及其嵌套子结构的理论，暂不断言。被引用的其他顶层结构各自独立加载。
     *
     * @param qualifiedName 顶层结构名，或嵌套子结构的 {@code 外层.子结构}
     * @param topLevel      是否为注册表中的顶层结构
     * @param marked        本次标记为已加载的名字，失败时据此撤销
     */
    private void collectTheory(String qualifiedName, StructureDef def, boolean topLevel, List<String> marked,
                               List<BoolExpr> distinctness, List<BoolExpr> axioms) {
        loadedStructures.add(qualifiedName);
        marked.add(qualifiedName);
        for (OperationDecl element : def.getIdentityElements()) {
            Sort sort = sorts.resolve(element.getSignature().uncurry().getRight());
            distinctness.addAll(identities.declare(qualifiedName, element.getName(), sort));
        }

        // 嵌套子结构的 extendsRef 是它实例化的结构类型，未注册时忽略
        loadReference(def.getExtendsRef(), topLevel);
        loadReference(def.getOverRef(), true);
        for (StructureDef sub : def.getNested()) {
            String subName = qualifiedName + "." + sub.getName();
            if (!loadedStructures.contains(subName)) {
                collectTheory(subName, sub, false, marked, distinctness, axioms);
            }
        }
        if (topLevel) {
            for (StructureRef where : registry.getWhereConstraints(qualifiedName)) {
                loadReference(where, true);
            }
        }

        Set<String> owners = Set.of(topLevelName(qualifiedName));
        for (AxiomDecl axiom : def.getAxioms()) {
            logger.debug("翻译公理 {}.{}", qualifiedName, axiom.getName());
            axioms.add(translator.translateFormula(axiom.getProposition(), owners));
        }
        for (FunctionDef function : def.getFunctions()) {
            axioms.add(translator.translateFormula(definitionOf(function), owners));
        }
    }

    private void loadReference(StructureRef ref, boolean required) {
        if (ref == null) {
            return;
        }
        if (required || registry.contains(ref.getName())) {
            ensureStructureLoaded(ref.getName());
        } else {
            logger.debug("结构类型 {} 未注册，跳过", ref.getName());
        }
    }

    @Override
    public void ensureDataTypeLoaded(String dataTypeName) {
        if (loadedDataTypes.contains(dataTypeName)) {
            return;
        }
        DataDef def = registry.getDataType(dataTypeName);
        if (def == null) {
            throw new KleisException(ErrorMessage.UNKNOWN_DATA_TYPE, dataTypeName);
        }
        loadedDataTypes.add(dataTypeName);
        Sort sort = sorts.resolve(dataTypeName);
        for (DataVariant variant : def.getVariants()) {
            if (variant.isNullary()) {
                oracle.add(identities.declare(dataTypeName, variant.getName(), sort));
            } else {
                Sort[] domain = variant.getFields().stream().map(sorts::resolve).toArray(Sort[]::new);
                translator.declareFunction(variant.getName(), domain, sort);
            }
        }
        consistency = null;
        logger.info("加载数据类型 {}：{} 个构造子", dataTypeName, def.getVariants().size());
    }

    @Override
    public void defineFunction(FunctionDef function) {
        Expression definition = definitionOf(function);
        Set<String> owners = loadDependencies(definition);
        oracle.add(translator.translateFormula(definition, owners));
        assertedAxioms++;
        consistency = null;
        logger.debug("定义函数 {}", function.getName());
    }

    private static Expression definitionOf(FunctionDef function) {
        List<Expression> args = new ArrayList<>();
        for (QuantifiedVar param : function.getParams()) {
            args.add(ObjectExpr.of(param.getName()));
        }
        Expression equation = OperationExpr.of("equals", OperationExpr.of(function.getName(), args), function.getBody());
        if (function.getParams().isEmpty()) {
            return equation;
        }
        return QuantifierExpr.forAll(function.getParams(), equation);
    }

    private static String topLevelName(String qualifiedName) {
        int dot = qualifiedName.indexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(0, dot);
    }

    // ========== 状态 ==========

    @Override
    public Set<String> getLoadedStructures() {
        return Collections.unmodifiableSet(loadedStructures);
    }

    public Set<String> getLoadedDataTypes() {
        return Collections.unmodifiableSet(loadedDataTypes);
    }

    /**
     * 当前 push 层数，查询之间应为 0。
     */
    public int getScopeDepth() {
        return oracle.getNumScopes();
    }

    @Override
    public VerifierStats stats() {
        return new VerifierStats(loadedStructures.size(), loadedDataTypes.size(), identities.size(),
                translator.getDeclaredFunctionCount(), assertedAxioms, queries);
    }

    @Override
    public void close() {
        logger.info("关闭验证器：{}", stats());
        oracle.close();
    }
}
