package org.kleis.structures;

import lombok.Getter;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.Expression;

import java.util.List;
import java.util.Objects;

/**
 * 派生运算 {@code define f(x, y) = body}。验证器把它断言为
 * {@code ∀x y. f(x, y) = body}。
 */
@Getter
public final class FunctionDef {

    private final String name;
    private final List<QuantifiedVar> params;
    private final Expression body;

    private FunctionDef(String name, List<QuantifiedVar> params, Expression body) {
        this.name = Objects.requireNonNull(name, "函数名不能为空");
        this.params = List.copyOf(params);
        this.body = Objects.requireNonNull(body, "函数体不能为空");
    }

    public static FunctionDef of(String name, List<QuantifiedVar> params, Expression body) {
        return new FunctionDef(name, params, body);
    }

    @Override
    public String toString() {
        return "define " + name + params + " = " + body;
    }
}
