package org.kleis.structures;

import lombok.Getter;

import java.util.Objects;

/**
 * 结构中声明的运算。签名不是函数类型时，它是一个单位元（零元运算）。
 */
@Getter
public final class OperationDecl {

    private final String name;
    private final TypeExpr signature;

    private OperationDecl(String name, TypeExpr signature) {
        this.name = Objects.requireNonNull(name, "运算名不能为空");
        this.signature = Objects.requireNonNull(signature, "运算签名不能为空");
    }

    public static OperationDecl of(String name, TypeExpr signature) {
        return new OperationDecl(name, signature);
    }

    public boolean isIdentityElement() {
        return signature.isNullary();
    }

    public int arity() {
        return signature.arity();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OperationDecl that = (OperationDecl) o;
        return name.equals(that.name) && signature.equals(that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, signature);
    }

    @Override
    public String toString() {
        return "operation " + name + " : " + signature;
    }
}
