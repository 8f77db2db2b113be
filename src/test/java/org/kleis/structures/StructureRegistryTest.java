package org.kleis.structures;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;
import org.kleis.expressions.Expression;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.kleis.structures.StructureFixtures.*;

class StructureRegistryTest {

    private StructureRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StructureRegistry();
    }

    @Nested
    @DisplayName("注册与查找")
    class RegistrationTests {

        @Test
        @DisplayName("重复注册同名结构会失败")
        void testRegister_Duplicate_ShouldFail() {
            registry.register(ring());
            KleisException e = assertThrows(KleisException.class, () -> registry.register(ring()));
            assertEquals(ErrorMessage.DUPLICATE_STRUCTURE, e.getError());
        }

        @Test
        @DisplayName("lookup 未知结构抛异常，get 返回 null")
        void testLookup_Unknown() {
            KleisException e = assertThrows(KleisException.class, () -> registry.lookup("Nope"));
            assertAll(
                    () -> assertEquals(ErrorMessage.UNKNOWN_STRUCTURE, e.getError()),
                    () -> assertNull(registry.get("Nope")),
                    () -> assertFalse(registry.contains("Nope"))
            );
        }

        @Test
        @DisplayName("注册时不解析 extends 引用，允许前向引用")
        void testRegister_ForwardReference_ShouldBeAccepted() {
            registry.register(chainLink("S", "T"));
            assertTrue(registry.contains("S"));
            assertFalse(registry.contains("T"));
        }

        @Test
        @DisplayName("getAxioms 按声明顺序返回（名字, 命题）")
        void testGetAxioms() {
            registry.register(ring());
            List<Pair<String, Expression>> axioms = registry.getAxioms("Ring");
            assertAll(
                    () -> assertEquals(1, axioms.size()),
                    () -> assertEquals("plus_comm", axioms.get(0).getLeft()),
                    () -> assertEquals(plusCommutes("R"), axioms.get(0).getRight()),
                    () -> assertTrue(registry.hasAxiom("Ring", "plus_comm")),
                    () -> assertEquals(List.of("Ring"), registry.structuresWithAxioms())
            );
        }
    }

    @Nested
    @DisplayName("运算查询")
    class OperationTests {

        @Test
        @DisplayName("getOperationOwners 按注册顺序返回所有声明者")
        void testOwners_MultipleStructures() {
            registry.register(monoid());
            registry.register(ring());
            assertAll(
                    () -> assertEquals(List.of("Monoid", "Ring"), List.copyOf(registry.getOperationOwners("plus"))),
                    () -> assertEquals(Set.of("Ring"), registry.getOperationOwners("one")),
                    () -> assertTrue(registry.getOperationOwners("unknown").isEmpty())
            );
        }

        @Test
        @DisplayName("嵌套子结构中的运算归到外层结构")
        void testOwners_NestedReportedUnderEnclosing() {
            StructureDef additive = StructureDef.builder("additive")
                    .extendsStructure(StructureRef.of("AbelianGroup", t("R")))
                    .operation("add", binary("R"))
                    .operation("zero", t("R"))
                    .build();
            registry.register(StructureDef.builder("Ring").typeParams("R").nested(additive).build());

            List<OperationCandidate> candidates = registry.getOperationCandidates("add");
            assertAll(
                    () -> assertEquals(Set.of("Ring"), registry.getOperationOwners("add")),
                    () -> assertEquals(1, candidates.size()),
                    () -> assertEquals("Ring.additive", candidates.get(0).getDeclaringStructure()),
                    () -> assertTrue(candidates.get(0).getScopeParams().contains("R")),
                    () -> assertEquals("R", candidates.get(0).getCarrierParam())
            );
        }

        @Test
        @DisplayName("over 子句实参中的名字进入实例化作用域")
        void testCandidates_OverParamsInScope() {
            registry.register(StructureDef.builder("VectorSpace")
                    .typeParams("V")
                    .over(StructureRef.of("Field", t("F")))
                    .operation("scale", TypeExpr.arrow(t("F"), t("V"), t("V")))
                    .build());
            OperationCandidate candidate = registry.getOperationCandidates("scale").get(0);
            assertEquals(List.of("V", "F"), candidate.getScopeParams());
        }

        @Test
        @DisplayName("按参数个数查找签名")
        void testOperationSignatureByArity() {
            registry.register(field());
            assertAll(
                    () -> assertEquals(TypeExpr.arrow(t("F"), t("F")), registry.getOperationSignature("inverse")),
                    () -> assertEquals(TypeExpr.arrow(t("F"), t("F")), registry.getOperationSignature("inverse", 1)),
                    () -> assertNull(registry.getOperationSignature("inverse", 2)),
                    () -> assertNull(registry.getOperationSignature("missing"))
            );
        }
    }

    @Nested
    @DisplayName("数据类型与实现")
    class DataAndImplementsTests {

        @Test
        @DisplayName("构造子映射到所属数据类型")
        void testDataType_Constructors() {
            registry.registerDataType(color());
            assertAll(
                    () -> assertTrue(registry.isDataType("Color")),
                    () -> assertEquals("Color", registry.getDataTypeOfConstructor("Green").getName()),
                    () -> assertNull(registry.getDataTypeOfConstructor("Purple")),
                    () -> assertThrows(KleisException.class, () -> registry.registerDataType(color()))
            );
        }

        @Test
        @DisplayName("typesSupporting 列出声明该运算的结构的各实现载体")
        void testTypesSupporting() {
            registry.register(numeric());
            registry.registerImplements(ImplementsDef.of("Numeric", List.of(t("ℝ"))));
            registry.registerImplements(ImplementsDef.of("Numeric", List.of(t("ℤ"))));
            assertAll(
                    () -> assertEquals(List.of("ℝ", "ℤ"), registry.typesSupporting("plus")),
                    () -> assertTrue(registry.supportsOperation("ℤ", "times")),
                    () -> assertFalse(registry.supportsOperation("String", "times"))
            );
        }

        @Test
        @DisplayName("where 约束从实现块收集")
        void testWhereConstraints() {
            registry.registerImplements(ImplementsDef.of("VectorSpace", List.of(t("V")),
                    StructureRef.of("Field", t("F")),
                    List.of(StructureRef.of("Field", t("F")), StructureRef.of("Ordered", t("F")))));
            List<StructureRef> where = registry.getWhereConstraints("VectorSpace");
            assertEquals(List.of("Field", "Ordered"), where.stream().map(StructureRef::getName).toList());
        }
    }

    @Nested
    @DisplayName("TypeExpr")
    class TypeExprTests {

        @Test
        @DisplayName("uncurry 拆出参数与返回类型，积类型展开为多个参数")
        void testUncurry() {
            TypeExpr curried = TypeExpr.arrow(t("R"), t("R"), t("Bool"));
            TypeExpr product = TypeExpr.function(TypeExpr.product(List.of(t("ℝ"), t("ℝ"))), t("ℝ"));
            TypeExpr scheme = TypeExpr.forAll(List.of("n"), TypeExpr.function(TypeExpr.parametric("Vector", t("n")), t("ℝ")));
            assertAll(
                    () -> assertEquals(2, curried.arity()),
                    () -> assertEquals(t("Bool"), curried.uncurry().getRight()),
                    () -> assertEquals(2, product.arity()),
                    () -> assertEquals(1, scheme.arity()),
                    () -> assertTrue(t("R").isNullary()),
                    () -> assertEquals("R → R → Bool", curried.toString())
            );
        }

        @Test
        @DisplayName("零元运算是单位元")
        void testIdentityElements() {
            List<OperationDecl> elements = ring().getIdentityElements();
            assertEquals(List.of("zero", "one"), elements.stream().map(OperationDecl::getName).toList());
        }
    }
}
