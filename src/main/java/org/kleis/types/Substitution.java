package org.kleis.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 从类型变量到类型的不可变映射。
 * <p>
 * 不变式：值域中不出现定义域里的变量，因此 {@code apply} 是幂等的。
 */
public final class Substitution {

    private static final Substitution EMPTY = new Substitution(Collections.emptyMap());

    private final Map<TypeVar, Type> mappings;

    private Substitution(Map<TypeVar, Type> mappings) {
        this.mappings = mappings;
    }

    public static Substitution empty() {
        return EMPTY;
    }

    public static Substitution singleton(TypeVar var, Type type) {
        Objects.requireNonNull(var);
        Objects.requireNonNull(type);
        if (var.equals(type)) {
            return EMPTY;
        }
        Map<TypeVar, Type> map = new LinkedHashMap<>();
        map.put(var, type);
        return new Substitution(Collections.unmodifiableMap(map));
    }

    public Map<TypeVar, Type> getMappings() {
        return mappings;
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public Type get(TypeVar var) {
        return mappings.get(var);
    }

    public Type apply(Type type) {
        if (mappings.isEmpty()) {
            return type;
        }
        if (type instanceof TypeVar var) {
            return mappings.getOrDefault(var, var);
        }
        if (type instanceof FunctionType fn) {
            return FunctionType.of(apply(fn.getDomain()), apply(fn.getCodomain()));
        }
        if (type instanceof NamedType named) {
            if (named.getTypeArgs().isEmpty()) {
                return named;
            }
            return NamedType.of(named.getName(), named.getTypeArgs().stream().map(this::apply).toList());
        }
        if (type instanceof ForAllType scheme) {
            // 绑定变量不被替换
            Map<TypeVar, Type> restricted = new LinkedHashMap<>(mappings);
            scheme.getVars().forEach(restricted::remove);
            return ForAllType.of(scheme.getVars(), new Substitution(restricted).apply(scheme.getBody()));
        }
        return type;
    }

    public List<Type> applyAll(List<? extends Type> types) {
        return types.stream().map(this::apply).toList();
    }

    /**
     * 组合：返回先应用 {@code this} 再应用 {@code later} 的替换。
     */
    public Substitution compose(Substitution later) {
        if (later.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return later;
        }
        Map<TypeVar, Type> map = new LinkedHashMap<>();
        mappings.forEach((var, type) -> map.put(var, later.apply(type)));
        later.mappings.forEach(map::putIfAbsent);
        map.entrySet().removeIf(e -> e.getKey().equals(e.getValue()));
        return new Substitution(Collections.unmodifiableMap(map));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return mappings.equals(((Substitution) o).mappings);
    }

    @Override
    public int hashCode() {
        return mappings.hashCode();
    }

    @Override
    public String toString() {
        return mappings.toString();
    }
}
