package org.kleis.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.kleis.config.KleisConfig;
import org.kleis.config.KleisConfigKey;
import org.kleis.structures.StructureRegistry;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.kleis.structures.StructureFixtures.*;

class VerifiersTest {

    @Test
    @DisplayName("配置关闭验证时返回禁用的验证器")
    void testDisabledByConfig() {
        StructureRegistry registry = new StructureRegistry();
        registry.register(ring());
        KleisConfig config = KleisConfig.load().with(KleisConfigKey.VERIFICATION_ENABLED, false);

        try (AxiomVerifier verifier = Verifiers.create(registry, config)) {
            assertInstanceOf(DisabledAxiomVerifier.class, verifier);
            assertEquals(VerificationResult.Status.DISABLED, verifier.verifyAxiom(plusCommutes("R")).getStatus());
            assertEquals(SatisfiabilityResult.Status.DISABLED, verifier.checkConsistency().getStatus());
            assertFalse(verifier.verifyAxiom(plusCommutes("R")).isValid());
            assertTrue(verifier.getLoadedStructures().isEmpty());
            assertEquals(0, verifier.stats().getQueries());
            assertEquals(op("plus", num(1), num(2)), verifier.simplify(op("plus", num(1), num(2))));
        }
    }

    @Test
    @DisplayName("Z3 可用且启用时返回 Z3 验证器")
    void testEnabled() {
        assumeTrue(Verifiers.isZ3Available(), "Z3 本地库不可用");
        try (AxiomVerifier verifier = Verifiers.create(new StructureRegistry(), KleisConfig.load())) {
            assertInstanceOf(Z3AxiomVerifier.class, verifier);
        }
    }
}
