package org.kleis.structures;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;
import org.kleis.expressions.Expression;
import org.kleis.types.PrimitiveType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 结构、数据类型与实现声明的注册表。类型推断与公理验证都以它为唯一的信息来源。
 * <p>
 * 注册时不解析结构间的引用，允许前向引用；引用在加载时才查找。
 * 启动阶段注册完毕后只读，可由多个推断会话共享；注册本身不是线程安全的。
 */
public class StructureRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StructureRegistry.class);

    private final Map<String, StructureDef> structures = new LinkedHashMap<>();
    private final Map<String, DataDef> dataTypes = new LinkedHashMap<>();
    private final Map<String, String> constructorOwners = new LinkedHashMap<>();
    private final Map<String, List<ImplementsDef>> implementations = new LinkedHashMap<>();

    // ========== 结构 ==========

    /**
     * 注册结构定义。
     *
     * @throws KleisException 同名结构已存在
     */
    public void register(StructureDef def) {
        if (structures.containsKey(def.getName())) {
            throw new KleisException(ErrorMessage.DUPLICATE_STRUCTURE, def.getName());
        }
        structures.put(def.getName(), def);
        logger.debug("注册结构 {}：{} 个运算，{} 条公理，{} 个嵌套子结构",
                def.getName(), def.getOperations().size(), def.getAxioms().size(), def.getNested().size());
    }

    /**
     * @throws KleisException 结构不存在
     */
    public StructureDef lookup(String name) {
        StructureDef def = structures.get(name);
        if (def == null) {
            throw new KleisException(ErrorMessage.UNKNOWN_STRUCTURE, name);
        }
        return def;
    }

    /**
     * @return 结构定义；不存在时返回 null
     */
    public StructureDef get(String name) {
        return structures.get(name);
    }

    public boolean contains(String name) {
        return structures.containsKey(name);
    }

    public Set<String> structureNames() {
        return Collections.unmodifiableSet(structures.keySet());
    }

    public int size() {
        return structures.size();
    }

    public List<OperationDecl> getOperations(String structureName) {
        return lookup(structureName).getOperations();
    }

    /**
     * 直接声明在该结构上的公理，按声明顺序。
     */
    public List<Pair<String, Expression>> getAxioms(String structureName) {
        return lookup(structureName).getAxioms().stream()
                .map(axiom -> Pair.of(axiom.getName(), axiom.getProposition()))
                .toList();
    }

    public boolean hasAxiom(String structureName, String axiomName) {
        StructureDef def = structures.get(structureName);
        return def != null && def.getAxioms().stream().anyMatch(a -> a.getName().equals(axiomName));
    }

    public List<String> structuresWithAxioms() {
        return structures.values().stream().filter(StructureDef::hasAxioms).map(StructureDef::getName).toList();
    }

    // ========== 运算查询 ==========

    /**
     * 运算的所有声明来源，按注册顺序；嵌套子结构中的声明归到顶层结构。
     *
     * @param operationName 运算名或单位元名
     * @return 候选声明；没有结构声明该名字时为空列表
     */
    public List<OperationCandidate> getOperationCandidates(String operationName) {
        List<OperationCandidate> candidates = new ArrayList<>();
        for (StructureDef def : structures.values()) {
            String carrier = def.getTypeParams().isEmpty() ? null : def.getTypeParams().get(0);
            collectCandidates(def.getName(), def.getName(), def, new LinkedHashSet<>(), carrier, operationName, candidates);
        }
        return candidates;
    }

    private void collectCandidates(String owner, String qualifiedName, StructureDef def, Set<String> outerScope,
                                   String carrier, String operationName, List<OperationCandidate> out) {
        Set<String> scope = new LinkedHashSet<>(outerScope);
        scope.addAll(def.getTypeParams());
        addReferenceParams(def.getExtendsRef(), scope);
        addReferenceParams(def.getOverRef(), scope);

        for (OperationDecl op : def.getOperations()) {
            if (op.getName().equals(operationName)) {
                out.add(new OperationCandidate(owner, qualifiedName, op, new ArrayList<>(scope), carrier));
            }
        }
        for (StructureDef sub : def.getNested()) {
            collectCandidates(owner, qualifiedName + "." + sub.getName(), sub, scope, carrier, operationName, out);
        }
    }

    /**
     * 引用实参里的裸名字（如 {@code over Field(F)} 中的 F）在签名中按类型参数处理。
     */
    private void addReferenceParams(StructureRef ref, Set<String> scope) {
        if (ref == null) {
            return;
        }
        for (TypeExpr arg : ref.getArgs()) {
            if ((arg.getKind() == TypeExpr.Kind.NAMED || arg.getKind() == TypeExpr.Kind.VAR)
                    && PrimitiveType.fromName(arg.getName()) == null
                    && !dataTypes.containsKey(arg.getName())) {
                scope.add(arg.getName());
            }
        }
    }

    /**
     * 声明了该运算（或同名单位元）的顶层结构名，按注册顺序。
     */
    public Set<String> getOperationOwners(String operationName) {
        Set<String> owners = new LinkedHashSet<>();
        for (OperationCandidate candidate : getOperationCandidates(operationName)) {
            owners.add(candidate.getOwner());
        }
        return owners;
    }

    /**
     * 第一个声明的签名；未声明时返回 null。
     */
    public TypeExpr getOperationSignature(String operationName) {
        List<OperationCandidate> candidates = getOperationCandidates(operationName);
        return candidates.isEmpty() ? null : candidates.get(0).getOperation().getSignature();
    }

    /**
     * 指定参数个数的第一个签名；没有时返回 null。
     *
     * @param arity 柯里化签名展开后的参数个数，0 表示常量
     */
    public TypeExpr getOperationSignature(String operationName, int arity) {
        for (OperationCandidate candidate : getOperationCandidates(operationName)) {
            if (candidate.getOperation().arity() == arity) {
                return candidate.getOperation().getSignature();
            }
        }
        return null;
    }

    // ========== 数据类型 ==========

    /**
     * @throws KleisException 同名数据类型已存在
     */
    public void registerDataType(DataDef def) {
        if (dataTypes.containsKey(def.getName())) {
            throw new KleisException(ErrorMessage.DUPLICATE_DATA_TYPE, def.getName());
        }
        dataTypes.put(def.getName(), def);
        for (DataVariant variant : def.getVariants()) {
            String previous = constructorOwners.put(variant.getName(), def.getName());
            if (previous != null) {
                logger.warn("构造子 {} 同时属于 {} 和 {}，以后者为准", variant.getName(), previous, def.getName());
            }
        }
        logger.debug("注册数据类型 {}：{} 个构造子", def.getName(), def.getVariants().size());
    }

    public DataDef getDataType(String name) {
        return dataTypes.get(name);
    }

    public boolean isDataType(String name) {
        return dataTypes.containsKey(name);
    }

    /**
     * @return 构造子所属的数据类型；不是构造子时返回 null
     */
    public DataDef getDataTypeOfConstructor(String constructor) {
        String owner = constructorOwners.get(constructor);
        return owner == null ? null : dataTypes.get(owner);
    }

    public Set<String> dataTypeNames() {
        return Collections.unmodifiableSet(dataTypes.keySet());
    }

    // ========== 实现 ==========

    public void registerImplements(ImplementsDef def) {
        implementations.computeIfAbsent(def.getStructureName(), k -> new ArrayList<>()).add(def);
        logger.debug("注册实现 {}", def);
    }

    public List<ImplementsDef> getImplements(String structureName) {
        return implementations.getOrDefault(structureName, List.of());
    }

    public boolean hasImplements(String structureName) {
        return !getImplements(structureName).isEmpty();
    }

    /**
     * 结构各实现块里 where 子句要求的结构。
     */
    public List<StructureRef> getWhereConstraints(String structureName) {
        List<StructureRef> constraints = new ArrayList<>();
        for (ImplementsDef impl : getImplements(structureName)) {
            constraints.addAll(impl.getWhereConstraints());
        }
        return constraints;
    }

    /**
     * 支持该运算的具体类型：声明该运算的结构的各实现的载体类型。
     */
    public List<String> typesSupporting(String operationName) {
        Set<String> types = new LinkedHashSet<>();
        for (String owner : getOperationOwners(operationName)) {
            for (ImplementsDef impl : getImplements(owner)) {
                if (impl.getCarrier() != null) {
                    types.add(impl.getCarrier().toString());
                }
            }
        }
        return new ArrayList<>(types);
    }

    public boolean supportsOperation(String typeName, String operationName) {
        return typesSupporting(operationName).contains(typeName);
    }
}
