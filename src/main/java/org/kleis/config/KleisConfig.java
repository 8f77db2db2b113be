package org.kleis.config;

import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * 库的配置。值来自 classpath 上的 {@code kleis.properties}，JVM 系统属性优先。
 */
public final class KleisConfig {

    private static final Logger logger = LoggerFactory.getLogger(KleisConfig.class);

    public static final String DEFAULT_RESOURCE = "kleis.properties";

    private final Properties properties;

    private KleisConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * 读取默认配置文件并叠加系统属性。
     */
    public static KleisConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static KleisConfig load(String resource) {
        return load(resource, KleisConfig.class.getClassLoader().getResourceAsStream(resource));
    }

    /**
     * @param in 配置文件内容，为 null 表示文件不存在；读完后关闭
     * @throws KleisException 读取失败，原始的 {@link IOException} 作为 cause
     */
    static KleisConfig load(String resource, InputStream in) {
        Properties props = new Properties();
        try (InputStream stream = in) {
            if (stream != null) {
                props.load(stream);
                logger.debug("读取配置文件 {}，共 {} 项", resource, props.size());
            } else {
                logger.debug("classpath 上没有 {}，使用默认值", resource);
            }
        } catch (IOException e) {
            throw new KleisException(ErrorMessage.CONFIG_FILE_UNREADABLE, e, resource);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("kleis.")) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return new KleisConfig(props);
    }

    public static KleisConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(Objects.requireNonNull(properties, "properties 不能为空"));
        return new KleisConfig(copy);
    }

    public <T> T getProperty(KleisConfigKey<T> key) {
        return key.parse(properties.getProperty(key.getName()));
    }

    /**
     * 返回一个修改了单个配置项的新配置。
     */
    public <T> KleisConfig with(KleisConfigKey<T> key, T value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(key.getName(), key.valueToString(value));
        return new KleisConfig(copy);
    }

    public boolean isVerificationEnabled() {
        return getProperty(KleisConfigKey.VERIFICATION_ENABLED);
    }

    public int getZ3TimeoutMs() {
        return getProperty(KleisConfigKey.Z3_TIMEOUT_MS);
    }
}
