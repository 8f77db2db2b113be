package org.kleis.structures;

import lombok.Getter;
import org.kleis.expressions.Expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 结构定义：类型参数、运算、公理、派生函数，以及对其他结构的引用。
 * <p>
 * 嵌套子结构本身也是 {@code StructureDef}，其 {@code extendsRef} 表示它实例化的结构类型，
 * 例如 {@code structure additive : AbelianGroup(R)}。
 */
@Getter
public final class StructureDef {

    private final String name;
    private final List<String> typeParams;
    private final List<OperationDecl> operations;
    private final List<AxiomDecl> axioms;
    private final List<FunctionDef> functions;
    private final StructureRef extendsRef;
    private final StructureRef overRef;
    private final List<StructureDef> nested;

    private StructureDef(Builder builder) {
        this.name = builder.name;
        this.typeParams = List.copyOf(builder.typeParams);
        this.operations = List.copyOf(builder.operations);
        this.axioms = List.copyOf(builder.axioms);
        this.functions = List.copyOf(builder.functions);
        this.extendsRef = builder.extendsRef;
        this.overRef = builder.overRef;
        this.nested = List.copyOf(builder.nested);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 直接声明在本结构上的单位元（零元运算），不含嵌套子结构。
     */
    public List<OperationDecl> getIdentityElements() {
        return operations.stream().filter(OperationDecl::isIdentityElement).toList();
    }

    public OperationDecl getOperation(String operationName) {
        for (OperationDecl op : operations) {
            if (op.getName().equals(operationName)) {
                return op;
            }
        }
        return null;
    }

    /**
     * 本结构或任一嵌套子结构是否带公理。
     */
    public boolean hasAxioms() {
        if (!axioms.isEmpty()) {
            return true;
        }
        return nested.stream().anyMatch(StructureDef::hasAxioms);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StructureDef that = (StructureDef) o;
        return name.equals(that.name)
                && typeParams.equals(that.typeParams)
                && operations.equals(that.operations)
                && axioms.equals(that.axioms)
                && Objects.equals(extendsRef, that.extendsRef)
                && Objects.equals(overRef, that.overRef)
                && nested.equals(that.nested);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeParams, operations, axioms, extendsRef, overRef, nested);
    }

    @Override
    public String toString() {
        return "structure " + name + "(" + String.join(", ", typeParams) + ")";
    }

    public static final class Builder {

        private final String name;
        private final List<String> typeParams = new ArrayList<>();
        private final List<OperationDecl> operations = new ArrayList<>();
        private final List<AxiomDecl> axioms = new ArrayList<>();
        private final List<FunctionDef> functions = new ArrayList<>();
        private final List<StructureDef> nested = new ArrayList<>();
        private StructureRef extendsRef;
        private StructureRef overRef;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "结构名不能为空");
        }

        public Builder typeParams(String... params) {
            typeParams.addAll(Arrays.asList(params));
            return this;
        }

        public Builder operation(String opName, TypeExpr signature) {
            operations.add(OperationDecl.of(opName, signature));
            return this;
        }

        public Builder axiom(String axiomName, Expression proposition) {
            axioms.add(AxiomDecl.of(axiomName, proposition));
            return this;
        }

        public Builder function(FunctionDef function) {
            functions.add(function);
            return this;
        }

        public Builder extendsStructure(StructureRef ref) {
            this.extendsRef = ref;
            return this;
        }

        public Builder over(StructureRef ref) {
            this.overRef = ref;
            return this;
        }

        public Builder nested(StructureDef sub) {
            nested.add(sub);
            return this;
        }

        public StructureDef build() {
            return new StructureDef(this);
        }
    }
}
