package org.kleis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubstitutionTest {

    private static final TypeVar A = TypeVar.of(0);
    private static final TypeVar B = TypeVar.of(1);

    @Test
    @DisplayName("compose 先应用自身再应用后者")
    void testCompose_ShouldApplyLaterToRange() {
        Substitution first = Substitution.singleton(A, FunctionType.of(B, B));
        Substitution later = Substitution.singleton(B, PrimitiveType.NUMERIC);
        Substitution composed = first.compose(later);
        Type expected = FunctionType.of(PrimitiveType.NUMERIC, PrimitiveType.NUMERIC);
        assertAll(
                () -> assertEquals(expected, composed.apply(A)),
                () -> assertEquals(PrimitiveType.NUMERIC, composed.apply(B)),
                () -> assertEquals(later.apply(first.apply(A)), composed.apply(A))
        );
    }

    @Test
    @DisplayName("compose 满足结合律")
    void testCompose_ShouldBeAssociative() {
        TypeVar c = TypeVar.of(2);
        Substitution s1 = Substitution.singleton(A, NamedType.of("List", B));
        Substitution s2 = Substitution.singleton(B, c);
        Substitution s3 = Substitution.singleton(c, PrimitiveType.STRING);
        Type t = FunctionType.of(A, B);
        assertEquals(s1.compose(s2).compose(s3).apply(t), s1.compose(s2.compose(s3)).apply(t));
    }

    @Test
    @DisplayName("绑定到自身的单例是空替换")
    void testSingleton_SelfBinding_ShouldBeEmpty() {
        assertTrue(Substitution.singleton(A, A).isEmpty());
    }

    @Test
    @DisplayName("∀ 绑定的变量不被替换，实例化换成给定类型")
    void testForAll_BoundVarsAreNotSubstituted() {
        ForAllType scheme = ForAllType.of(List.of(A), FunctionType.of(A, B));
        Substitution s = Substitution.singleton(A, PrimitiveType.BOOLEAN).compose(Substitution.singleton(B, PrimitiveType.STRING));
        ForAllType applied = (ForAllType) s.apply(scheme);
        assertAll(
                () -> assertEquals(FunctionType.of(A, PrimitiveType.STRING), applied.getBody()),
                () -> assertEquals(java.util.Set.of(B), scheme.freeTypeVars()),
                () -> assertEquals(FunctionType.of(PrimitiveType.NUMERIC, B), scheme.instantiate(List.of(PrimitiveType.NUMERIC)))
        );
    }

    @Test
    @DisplayName("curried 构造柯里化的函数类型")
    void testCurried() {
        Type t = FunctionType.curried(List.of(A, B), PrimitiveType.BOOLEAN);
        assertEquals(FunctionType.of(A, FunctionType.of(B, PrimitiveType.BOOLEAN)), t);
        assertEquals("α0 → α1 → Bool", t.toString());
    }
}
