package org.kleis.structures;

import org.kleis.expressions.ConstExpr;
import org.kleis.expressions.Expression;
import org.kleis.expressions.ObjectExpr;
import org.kleis.expressions.OperationExpr;
import org.kleis.expressions.QuantifiedVar;
import org.kleis.expressions.QuantifierExpr;

import java.util.List;

/**
 * 测试共用的结构定义与表达式构造方法。
 */
public final class StructureFixtures {

    private StructureFixtures() {
    }

    // ========== 表达式 ==========

    public static Expression op(String name, Expression... args) {
        return OperationExpr.of(name, args);
    }

    public static Expression obj(String name) {
        return ObjectExpr.of(name);
    }

    public static Expression num(String value) {
        return ConstExpr.of(value);
    }

    public static Expression num(long value) {
        return ConstExpr.of(value);
    }

    public static QuantifiedVar var(String name, String sort) {
        return QuantifiedVar.of(name, sort);
    }

    public static Expression forAll(List<QuantifiedVar> vars, Expression body) {
        return QuantifierExpr.forAll(vars, body);
    }

    public static Expression forAll(List<QuantifiedVar> vars, Expression where, Expression body) {
        return QuantifierExpr.forAll(vars, where, body);
    }

    public static TypeExpr t(String name) {
        return TypeExpr.named(name);
    }

    public static TypeExpr binary(String carrier) {
        return TypeExpr.arrow(t(carrier), t(carrier), t(carrier));
    }

    // ========== 结构 ==========

    /**
     * 加法交换律 ∀(x y : R). plus(x, y) = plus(y, x)
     */
    public static Expression plusCommutes(String sort) {
        return forAll(List.of(var("x", sort), var("y", sort)),
                op("equals", op("plus", obj("x"), obj("y")), op("plus", obj("y"), obj("x"))));
    }

    public static StructureDef ring() {
        return StructureDef.builder("Ring")
                .typeParams("R")
                .operation("plus", binary("R"))
                .operation("times", binary("R"))
                .operation("zero", t("R"))
                .operation("one", t("R"))
                .axiom("plus_comm", plusCommutes("R"))
                .build();
    }

    /**
     * 右单位元 ∀(x : S). plus(x, zero) = x
     */
    public static Expression rightIdentity(String sort) {
        return forAll(List.of(var("x", sort)), op("equals", op("plus", obj("x"), obj("zero")), obj("x")));
    }

    public static StructureDef monoid() {
        return StructureDef.builder("Monoid")
                .typeParams("M")
                .operation("plus", binary("M"))
                .operation("zero", t("M"))
                .axiom("right_identity", rightIdentity("M"))
                .build();
    }

    /**
     * 与 Monoid 同名的 plus 和 zero，各自声明单位元公理。
     */
    public static StructureDef additiveGroup() {
        return StructureDef.builder("AdditiveGroup")
                .typeParams("G")
                .operation("plus", binary("G"))
                .operation("zero", t("G"))
                .operation("neg", TypeExpr.arrow(t("G"), t("G")))
                .axiom("right_identity", rightIdentity("G"))
                .build();
    }

    public static StructureDef numeric() {
        return StructureDef.builder("Numeric")
                .typeParams("N")
                .operation("plus", binary("N"))
                .operation("times", binary("N"))
                .build();
    }

    /**
     * ∀(x : F) where x ≠ zero. times(inverse(x), x) = one
     */
    public static Expression inverseLaw() {
        return forAll(List.of(var("x", "F")),
                op("neq", obj("x"), obj("zero")),
                op("equals", op("times", op("inverse", obj("x")), obj("x")), obj("one")));
    }

    public static StructureDef field() {
        return StructureDef.builder("Field")
                .typeParams("F")
                .operation("times", binary("F"))
                .operation("inverse", TypeExpr.arrow(t("F"), t("F")))
                .operation("zero", t("F"))
                .operation("one", t("F"))
                .axiom("inverse_law", inverseLaw())
                .build();
    }

    /**
     * 结构 name，带一个一元运算 f_name 和公理 ∀x. f_name(x) = f_name(x)，可选地继承 parent。
     */
    public static StructureDef chainLink(String name, String parent) {
        String fn = "f_" + name.toLowerCase();
        StructureDef.Builder builder = StructureDef.builder(name)
                .typeParams("A")
                .operation(fn, TypeExpr.arrow(t("A"), t("A")))
                .axiom(name.toLowerCase() + "_reflexive",
                        forAll(List.of(var("x", "A")), op("equals", op(fn, obj("x")), op(fn, obj("x")))));
        if (parent != null) {
            builder.extendsStructure(StructureRef.of(parent, t("A")));
        }
        return builder.build();
    }

    public static DataDef color() {
        return DataDef.of("Color", DataVariant.of("Red"), DataVariant.of("Green"), DataVariant.of("Blue"));
    }
}
