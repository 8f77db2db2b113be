package org.kleis.symbolic;

import com.microsoft.z3.Version;
import org.kleis.config.KleisConfig;
import org.kleis.structures.StructureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 按配置和运行环境选择验证器。Z3 依赖是可选的：类或本地库缺失时退回 {@link DisabledAxiomVerifier}。
 */
public final class Verifiers {

    private static final Logger logger = LoggerFactory.getLogger(Verifiers.class);

    private static volatile Boolean z3Available;

    private Verifiers() {
    }

    public static AxiomVerifier create(StructureRegistry registry) {
        return create(registry, KleisConfig.load());
    }

    public static AxiomVerifier create(StructureRegistry registry, KleisConfig config) {
        if (!config.isVerificationEnabled()) {
            logger.info("配置关闭了公理验证");
            return new DisabledAxiomVerifier();
        }
        if (!isZ3Available()) {
            logger.warn("Z3 不可用，公理验证被禁用");
            return new DisabledAxiomVerifier();
        }
        return new Z3AxiomVerifier(registry, config);
    }

    /**
     * 探测 Z3 的 Java 类与本地库能否加载。结果被缓存。
     */
    public static boolean isZ3Available() {
        Boolean available = z3Available;
        if (available == null) {
            available = checkZ3();
            z3Available = available;
        }
        return available;
    }

    private static boolean checkZ3() {
        try {
            logger.debug("检测到 {}", Version.getFullVersion());
            return true;
        } catch (LinkageError e) {
            // NoClassDefFoundError 或 UnsatisfiedLinkError
            logger.debug("Z3 类或本地库缺失: {}", e.toString());
            return false;
        }
    }
}
