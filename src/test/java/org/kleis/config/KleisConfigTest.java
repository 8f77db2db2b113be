package org.kleis.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KleisConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(KleisConfigKey.Z3_TIMEOUT_MS.getName());
    }

    @Test
    @DisplayName("配置文件中的值")
    void testLoadFromResource() {
        KleisConfig config = KleisConfig.load();
        assertAll(
                () -> assertTrue(config.isVerificationEnabled()),
                () -> assertEquals(30_000, config.getZ3TimeoutMs()),
                () -> assertTrue(config.getProperty(KleisConfigKey.Z3_MODEL))
        );
    }

    @Test
    @DisplayName("缺失的项使用默认值")
    void testDefaults() {
        KleisConfig config = KleisConfig.load("no-such-file.properties");
        assertEquals(KleisConfigKey.Z3_TIMEOUT_MS.getDefaultValue(), config.getZ3TimeoutMs());
        assertTrue(KleisConfig.of(new Properties()).isVerificationEnabled());
    }

    @Test
    @DisplayName("系统属性优先于配置文件")
    void testSystemPropertyOverride() {
        System.setProperty(KleisConfigKey.Z3_TIMEOUT_MS.getName(), "1234");
        assertEquals(1234, KleisConfig.load().getZ3TimeoutMs());
    }

    @Test
    @DisplayName("with 返回新配置，原配置不变")
    void testWith() {
        KleisConfig base = KleisConfig.load();
        KleisConfig disabled = base.with(KleisConfigKey.VERIFICATION_ENABLED, false);
        assertFalse(disabled.isVerificationEnabled());
        assertTrue(base.isVerificationEnabled());
    }

    @Test
    @DisplayName("非法值报错并指出配置项")
    void testInvalidValue() {
        Properties props = new Properties();
        props.setProperty(KleisConfigKey.VERIFICATION_ENABLED.getName(), "maybe");
        props.setProperty(KleisConfigKey.Z3_TIMEOUT_MS.getName(), "soon");
        KleisConfig config = KleisConfig.of(props);

        KleisException e1 = assertThrows(KleisException.class, config::isVerificationEnabled);
        KleisException e2 = assertThrows(KleisException.class, config::getZ3TimeoutMs);
        assertAll(
                () -> assertEquals(ErrorMessage.INVALID_CONFIG_VALUE, e1.getError()),
                () -> assertTrue(e1.getMessage().contains("kleis.verification.enabled")),
                () -> assertEquals(ErrorMessage.INVALID_CONFIG_VALUE, e2.getError())
        );
    }

    @Test
    @DisplayName("读取失败时保留原始的 IOException")
    void testUnreadableResource_KeepsCause() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("磁盘错误");
            }
        };

        KleisException e = assertThrows(KleisException.class, () -> KleisConfig.load("broken.properties", broken));
        assertAll(
                () -> assertEquals(ErrorMessage.CONFIG_FILE_UNREADABLE, e.getError()),
                () -> assertTrue(e.getMessage().contains("broken.properties")),
                () -> assertInstanceOf(IOException.class, e.getCause()),
                () -> assertEquals("磁盘错误", e.getCause().getMessage())
        );
    }
}
