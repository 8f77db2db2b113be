package org.kleis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class Z3OracleTest {

    private Z3Oracle oracle;

    @BeforeEach
    void setUp() {
        assumeTrue(Verifiers.isZ3Available(), "Z3 本地库不可用");
        oracle = new Z3Oracle(5000, true);
    }

    @AfterEach
    void tearDown() {
        if (oracle != null) {
            oracle.close();
        }
    }

    @Test
    @DisplayName("作用域内的断言在关闭后撤销")
    void testScope_ShouldRetractAssertions() {
        Context ctx = oracle.getCtx();
        BoolExpr p = ctx.mkBoolConst("p");
        oracle.add(p);
        try (ProverScope scope = oracle.openScope()) {
            assertEquals(1, oracle.getNumScopes());
            oracle.add(ctx.mkNot(p));
            assertEquals(Status.UNSATISFIABLE, oracle.check());
        }
        assertEquals(0, oracle.getNumScopes());
        assertEquals(Status.SATISFIABLE, oracle.check());
    }

    @Test
    @DisplayName("重复关闭只 pop 一次")
    void testScope_DoubleClose() {
        ProverScope outer = oracle.openScope();
        ProverScope inner = oracle.openScope();
        inner.close();
        inner.close();
        assertEquals(1, oracle.getNumScopes());
        outer.close();
        assertEquals(0, oracle.getNumScopes());
    }

    @Test
    @DisplayName("异常退出时也会 pop")
    void testScope_PopsOnException() {
        assertThrows(IllegalStateException.class, () -> {
            try (ProverScope scope = oracle.openScope()) {
                throw new IllegalStateException("boom");
            }
        });
        assertEquals(0, oracle.getNumScopes());
    }

    @Test
    @DisplayName("指定超时的检查")
    void testCheckWithTimeout() {
        Context ctx = oracle.getCtx();
        oracle.add(ctx.mkGt(ctx.mkIntConst("n"), ctx.mkInt(3)));
        assertEquals(Status.SATISFIABLE, oracle.check(Duration.ofSeconds(2)));
        assertNotNull(oracle.getModel());
        assertEquals(Status.SATISFIABLE, oracle.check(null));
    }
}
