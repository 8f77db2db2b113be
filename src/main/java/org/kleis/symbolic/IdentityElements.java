package org.kleis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单位元与零元构造子到 Z3 常量的映射，键为（所属结构或数据类型, 元素名）。
 * 同一顶层结构（连同其嵌套子结构）或同一数据类型内、同一排序的元素两两不等；
 * 不同结构的同名元素互不约束，各自的公理可以让它们取相同的值。
 */
public class IdentityElements {

    private static final Logger logger = LoggerFactory.getLogger(IdentityElements.class);

    private final Context ctx;
    private final Map<Pair<String, String>, Expr<?>> elements = new LinkedHashMap<>();
    private final Map<String, List<Pair<String, String>>> byName = new LinkedHashMap<>();
    private final Map<Expr<?>, String> names = new HashMap<>();

    public IdentityElements(Context ctx) {
        this.ctx = ctx;
    }

    public boolean contains(String owner, String name) {
        return elements.containsKey(Pair.of(owner, name));
    }

    public Expr<?> get(String owner, String name) {
        return elements.get(Pair.of(owner, name));
    }

    /**
     * 创建元素常量。
     *
     * @param owner 所属结构的限定名（如 {@code Ring.additive}）或数据类型名
     * @param name  元素名
     * @param sort  元素的排序
     * @return 需要断言的不等式：与同一顶层所有者下已有的同排序元素两两不等
     */
    public List<BoolExpr> declare(String owner, String name, Sort sort) {
        Pair<String, String> key = Pair.of(owner, name);
        if (elements.containsKey(key)) {
            return List.of();
        }
        Expr<?> constant = ctx.mkConst(owner + "." + name, sort);
        String family = topLevel(owner);
        List<BoolExpr> distinct = new ArrayList<>();
        for (Map.Entry<Pair<String, String>, Expr<?>> entry : elements.entrySet()) {
            Expr<?> existing = entry.getValue();
            if (topLevel(entry.getKey().getLeft()).equals(family) && existing.getSort().equals(sort)) {
                distinct.add(ctx.mkNot(ctx.mkEq((Expr) constant, (Expr) existing)));
            }
        }
        elements.put(key, constant);
        byName.computeIfAbsent(name, k -> new ArrayList<>()).add(key);
        names.put(constant, name);
        logger.debug("声明元素 {}.{} : {}，{} 条不等式", owner, name, sort, distinct.size());
        return distinct;
    }

    /**
     * 按裸名字查找元素。多个结构都有同名元素时，优先属于 {@code preferredOwners} 的，
     * 否则取最早声明的。
     *
     * @return 常量；没有该名字的元素时返回 null
     */
    public Expr<?> resolve(String name, Set<String> preferredOwners) {
        List<Pair<String, String>> keys = byName.get(name);
        if (keys == null || keys.isEmpty()) {
            return null;
        }
        if (keys.size() > 1) {
            for (Pair<String, String> key : keys) {
                if (preferredOwners.contains(topLevel(key.getLeft()))) {
                    return elements.get(key);
                }
            }
            logger.debug("元素 {} 有多个来源 {}，使用最早声明的", name, keys);
        }
        return elements.get(keys.get(0));
    }

    /**
     * 常量对应的裸元素名；不是元素常量时返回 null。
     */
    public String nameOf(Expr<?> constant) {
        return names.get(constant);
    }

    /**
     * 移除顶层所有者（及其嵌套子结构）下的全部元素，用于撤销加载失败的结构。
     *
     * @return 移除的元素个数
     */
    public int forget(String topLevelOwner) {
        List<Pair<String, String>> removed = new ArrayList<>();
        for (Pair<String, String> key : elements.keySet()) {
            if (topLevel(key.getLeft()).equals(topLevelOwner)) {
                removed.add(key);
            }
        }
        for (Pair<String, String> key : removed) {
            names.remove(elements.remove(key));
            List<Pair<String, String>> sameName = byName.get(key.getRight());
            sameName.remove(key);
            if (sameName.isEmpty()) {
                byName.remove(key.getRight());
            }
        }
        if (!removed.isEmpty()) {
            logger.debug("撤销 {} 的 {} 个元素", topLevelOwner, removed.size());
        }
        return removed.size();
    }

    public int size() {
        return elements.size();
    }

    private static String topLevel(String owner) {
        int dot = owner.indexOf('.');
        return dot < 0 ? owner : owner.substring(0, dot);
    }
}
