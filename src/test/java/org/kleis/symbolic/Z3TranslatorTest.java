package org.kleis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Quantifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.kleis.expressions.ConditionalExpr;
import org.kleis.expressions.ConstExpr;
import org.kleis.expressions.Expression;
import org.kleis.expressions.QuantifierExpr;
import org.kleis.structures.StructureDef;
import org.kleis.structures.StructureRegistry;
import org.kleis.structures.TypeExpr;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.kleis.structures.StructureFixtures.*;

class Z3TranslatorTest {

    private Context ctx;
    private StructureRegistry registry;
    private IdentityElements identities;
    private Z3Translator translator;

    @BeforeEach
    void setUp() {
        assumeTrue(Verifiers.isZ3Available(), "Z3 本地库不可用");
        ctx = new Context();
        registry = new StructureRegistry();
        registry.register(StructureDef.builder("Normed").typeParams("V")
                .operation("norm", TypeExpr.arrow(t("V"), t("ℝ")))
                .build());
        identities = new IdentityElements(ctx);
        translator = new Z3Translator(ctx, registry, new SortResolver(ctx, registry), identities);
    }

    @AfterEach
    void tearDown() {
        if (ctx != null) {
            ctx.close();
        }
    }

    private TranslationException.Kind failureOf(Expression expr) {
        return assertThrows(TranslationException.class, () -> translator.translate(expr)).getKind();
    }

    @Nested
    @DisplayName("字面量与算术")
    class ArithmeticTests {

        @Test
        @DisplayName("整数、分数与布尔字面量")
        void testLiterals() {
            assertAll(
                    () -> assertTrue(translator.translate(num(3)).isInt()),
                    () -> assertTrue(translator.translate(num("1/2")).isReal()),
                    () -> assertTrue(translator.translate(num("0.25")).isReal()),
                    () -> assertTrue(translator.translate(ConstExpr.of("true")).isBool())
            );
        }

        @Test
        @DisplayName("Int 与 Real 混用时提升为 Real")
        void testIntToRealCoercion() {
            Expr<?> sum = translator.translate(op("plus", num(1), num("1/2")));
            assertTrue(sum.isReal());
            assertTrue(translator.translate(op("equals", num(1), num("1.0"))).isBool());
        }

        @Test
        @DisplayName("比较运算得到布尔值")
        void testRelations() {
            assertTrue(translator.translate(op("less_than", num(1), num(2))).isLT());
            assertTrue(translator.translate(op("geq", num(1), num("1/2"))).isGE());
        }

        @Test
        @DisplayName("条件表达式")
        void testConditional() {
            Expr<?> ite = translator.translate(ConditionalExpr.of(ConstExpr.of("true"), num(1), num("2.5")));
            assertTrue(ite.isITE());
            assertTrue(ite.isReal());
        }
    }

    @Nested
    @DisplayName("名字与运算")
    class NameTests {

        @Test
        @DisplayName("未绑定的变量")
        void testUnboundVariable() {
            assertEquals(TranslationException.Kind.UNBOUND_VARIABLE, failureOf(op("plus", obj("x"), num(1))));
        }

        @Test
        @DisplayName("单位元按优先结构消歧")
        void testIdentityElementResolution() {
            identities.declare("Ring", "zero", ctx.getIntSort());
            identities.declare("Field", "zero", ctx.getIntSort());
            Expr<?> ringZero = translator.translate(obj("zero"), Map.of(), Set.of("Ring"));
            Expr<?> fieldZero = translator.translate(obj("zero"), Map.of(), Set.of("Field"));
            Expr<?> fallback = translator.translate(obj("zero"));
            assertAll(
                    () -> assertEquals("Ring.zero", ringZero.toString()),
                    () -> assertEquals("Field.zero", fieldZero.toString()),
                    () -> assertEquals("Ring.zero", fallback.toString())
            );
        }

        @Test
        @DisplayName("未解释函数的结果排序取自注册表中的签名")
        void testUninterpretedRange_FromSignature() {
            assertTrue(translator.translate(op("norm", num(1))).isReal());
            assertTrue(translator.translate(op("unknown_fn", num(1))).isInt());
            assertEquals(2, translator.getDeclaredFunctionCount());
        }

        @Test
        @DisplayName("未解释函数再次使用时参数个数必须一致")
        void testUninterpretedArityMismatch() {
            translator.translate(op("g", num(1)));
            assertEquals(TranslationException.Kind.ARITY_MISMATCH, failureOf(op("g", num(1), num(2))));
        }

        @Test
        @DisplayName("未解释函数再次使用时参数排序必须一致")
        void testUninterpretedSortMismatch() {
            translator.translate(op("g", num(1)));
            assertEquals(TranslationException.Kind.SORT_MISMATCH, failureOf(op("g", ConstExpr.of("true"))));
        }

        @Test
        @DisplayName("内置运算的参数个数")
        void testBuiltinArity() {
            assertAll(
                    () -> assertEquals(TranslationException.Kind.ARITY_MISMATCH, failureOf(op("neq", num(1)))),
                    () -> assertEquals(TranslationException.Kind.ARITY_MISMATCH, failureOf(op("plus", num(1)))),
                    () -> assertEquals(TranslationException.Kind.ARITY_MISMATCH,
                            failureOf(op("less_than", num(1), num(2), num(3))))
            );
        }

        @Test
        @DisplayName("逻辑运算的操作数必须是布尔值")
        void testNotBoolean() {
            assertEquals(TranslationException.Kind.NOT_BOOLEAN, failureOf(op("and", num(1), ConstExpr.of("true"))));
            assertThrows(TranslationException.class, () -> translator.translateFormula(num(1), Set.of()));
        }
    }

    @Nested
    @DisplayName("量词")
    class QuantifierTests {

        @Test
        @DisplayName("∀ 的 where 子句是前提")
        void testForAllWhere_IsImplication() {
            Expression expr = forAll(List.of(var("x", "ℤ")), op("neq", obj("x"), num(0)),
                    op("neq", op("times", obj("x"), obj("x")), num(0)));
            BoolExpr formula = translator.translateFormula(expr, Set.of());
            assertTrue(formula.isQuantifier());
            Quantifier q = (Quantifier) formula;
            assertTrue(q.isUniversal());
            assertTrue(q.getBody().isImplies());
        }

        @Test
        @DisplayName("∃ 的 where 子句是合取项")
        void testExistsWhere_IsConjunction() {
            Expression expr = QuantifierExpr.exists(List.of(var("x", "ℝ")), op("gt", obj("x"), num(0)),
                    op("equals", op("times", obj("x"), obj("x")), num(2)));
            Quantifier q = (Quantifier) translator.translateFormula(expr, Set.of());
            assertTrue(q.isExistential());
            assertTrue(q.getBody().isAnd());
        }

        @Test
        @DisplayName("量词变量只在其体内可见")
        void testBinderScope() {
            Expression expr = op("and",
                    forAll(List.of(var("x", "ℤ")), op("equals", obj("x"), obj("x"))),
                    op("equals", obj("x"), num(0)));
            assertEquals(TranslationException.Kind.UNBOUND_VARIABLE, failureOf(expr));
        }
    }
}
