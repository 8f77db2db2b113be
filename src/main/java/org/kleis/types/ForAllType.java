package org.kleis.types;

import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 类型方案 {@code ∀vars. body}。只出现在结构签名实例化之前，
 * 合一器不直接处理它。
 */
@Getter
public final class ForAllType implements Type {

    private final List<TypeVar> vars;
    private final Type body;

    private ForAllType(List<TypeVar> vars, Type body) {
        this.vars = List.copyOf(vars);
        this.body = Objects.requireNonNull(body, "类型方案体不能为空");
    }

    public static ForAllType of(List<TypeVar> vars, Type body) {
        return new ForAllType(vars, body);
    }

    /**
     * 用新的类型变量替换所有绑定变量。
     */
    public Type instantiate(List<? extends Type> replacements) {
        if (replacements.size() != vars.size()) {
            throw new IllegalArgumentException("实例化需要 " + vars.size() + " 个类型，实际 " + replacements.size());
        }
        Substitution subst = Substitution.empty();
        for (int i = 0; i < vars.size(); i++) {
            subst = subst.compose(Substitution.singleton(vars.get(i), replacements.get(i)));
        }
        return subst.apply(body);
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.FOR_ALL;
    }

    @Override
    public Set<TypeVar> freeTypeVars() {
        Set<TypeVar> free = new LinkedHashSet<>(body.freeTypeVars());
        vars.forEach(free::remove);
        return free;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ForAllType that = (ForAllType) o;
        return vars.equals(that.vars) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vars, body);
    }

    @Override
    public String toString() {
        return "∀" + vars.stream().map(String::valueOf).collect(Collectors.joining(" ")) + ". " + body;
    }
}
