package org.kleis.analysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.kleis.expressions.ConditionalExpr;
import org.kleis.expressions.ConstExpr;
import org.kleis.expressions.Expression;
import org.kleis.structures.StructureRegistry;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.kleis.structures.StructureFixtures.*;

class DependencyAnalyzerTest {

    private StructureRegistry registry;
    private DependencyAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        registry = new StructureRegistry();
        registry.register(ring());
        registry.register(field());
        registry.register(monoid());
        registry.registerDataType(color());
        analyzer = new DependencyAnalyzer(registry);
    }

    @Test
    @DisplayName("运算名映射到所有声明它的结构")
    void testOperationOwners() {
        assertEquals(Set.of("Ring", "Monoid"), analyzer.analyzeDependencies(op("plus", num(1), num(2))));
        assertEquals(Set.of("Ring", "Field"), analyzer.analyzeDependencies(op("times", num(1), num(2))));
    }

    @Test
    @DisplayName("只用到某一结构独有的运算时只依赖该结构")
    void testSingleOwner() {
        Expression expr = forAll(List.of(var("x", "F")), op("equals", op("inverse", obj("x")), obj("x")));
        assertEquals(Set.of("Field"), analyzer.analyzeDependencies(expr));
    }

    @Test
    @DisplayName("自由出现的单位元带来依赖，被量词绑定的同名变量不算")
    void testIdentityElements_BoundNamesSkipped() {
        assertEquals(Set.of("Ring", "Field"), analyzer.analyzeDependencies(op("neq", obj("one"), num(1))));

        Expression shadowed = forAll(List.of(var("one", "ℤ")), op("equals", obj("one"), obj("one")));
        assertTrue(analyzer.analyzeDependencies(shadowed).isEmpty());
    }

    @Test
    @DisplayName("内置运算与字面量没有结构依赖")
    void testBuiltinsOnly() {
        Expression expr = ConditionalExpr.of(op("less_than", num(1), num(2)), ConstExpr.of("true"), obj("x"));
        assertTrue(analyzer.analyzeDependencies(expr).isEmpty());
    }

    @Test
    @DisplayName("where 子句中的运算也计入依赖")
    void testWhereClause() {
        Expression expr = forAll(List.of(var("x", "F")), op("neq", obj("x"), obj("zero")), ConstExpr.of("true"));
        assertEquals(Set.of("Ring", "Field", "Monoid"), analyzer.analyzeDependencies(expr));
    }

    @Test
    @DisplayName("构造子与量词注解中的数据类型")
    void testDataTypes() {
        assertEquals(Set.of("Color"), analyzer.analyzeDataTypes(op("equals", obj("Red"), obj("Green"))));
        assertEquals(Set.of("Color"),
                analyzer.analyzeDataTypes(forAll(List.of(var("c", "Color")), op("equals", obj("c"), obj("c")))));
        assertTrue(analyzer.analyzeDataTypes(
                forAll(List.of(var("Red", "ℤ")), op("equals", obj("Red"), num(0)))).isEmpty());
    }

    @Test
    @DisplayName("自由变量不包括单位元、构造子和被绑定的名字")
    void testFreeVariables() {
        Expression expr = op("and",
                op("equals", op("plus", obj("x"), obj("zero")), obj("y")),
                forAll(List.of(var("z", "ℤ")), op("equals", obj("z"), obj("Red"))));
        assertEquals(List.of("x", "y"), List.copyOf(analyzer.freeVariables(expr)));
    }
}
