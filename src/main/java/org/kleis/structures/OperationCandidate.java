package org.kleis.structures;

import lombok.Getter;

import java.util.List;

/**
 * 运算的一个声明来源。{@code owner} 是顶层结构名（嵌套声明归到外层结构），
 * {@code declaringStructure} 是实际声明它的（可能是嵌套的）结构的限定名。
 * {@code scopeParams} 是实例化签名时需要换成新类型变量的名字。
 */
@Getter
public final class OperationCandidate {

    private final String owner;
    private final String declaringStructure;
    private final OperationDecl operation;
    private final List<String> scopeParams;
    private final String carrierParam;

    OperationCandidate(String owner, String declaringStructure, OperationDecl operation,
                       List<String> scopeParams, String carrierParam) {
        this.owner = owner;
        this.declaringStructure = declaringStructure;
        this.operation = operation;
        this.scopeParams = List.copyOf(scopeParams);
        this.carrierParam = carrierParam;
    }

    @Override
    public String toString() {
        return declaringStructure + "." + operation.getName() + " : " + operation.getSignature();
    }
}
