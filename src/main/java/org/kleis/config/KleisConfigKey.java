package org.kleis.config;

import lombok.Getter;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;

import java.util.Objects;

/**
 * 一个带类型的配置项：属性名 + 解析器 + 默认值。
 *
 * @param <T> 配置值的类型
 */
@Getter
public final class KleisConfigKey<T> {

    /**
     * 描述如何把属性字符串解析为值。
     */
    public interface KeyParser<T> {

        T read(String string);

        default String write(T value) {
            return value.toString();
        }
    }

    public static final KeyParser<String> STRING = string -> string;
    public static final KeyParser<Integer> INT = Integer::parseInt;
    public static final KeyParser<Boolean> BOOLEAN = string -> {
        String s = string.trim().toLowerCase();
        if ("true".equals(s) || "false".equals(s)) {
            return Boolean.valueOf(s);
        }
        throw new IllegalArgumentException(string);
    };

    public static final KleisConfigKey<Boolean> VERIFICATION_ENABLED = key("kleis.verification.enabled", BOOLEAN, true);
    public static final KleisConfigKey<Integer> Z3_TIMEOUT_MS = key("kleis.z3.timeout-ms", INT, 30_000);
    public static final KleisConfigKey<Boolean> Z3_MODEL = key("kleis.z3.model", BOOLEAN, true);

    private final String name;
    private final KeyParser<T> parser;
    private final T defaultValue;

    private KleisConfigKey(String name, KeyParser<T> parser, T defaultValue) {
        this.name = Objects.requireNonNull(name, "配置项名不能为空");
        this.parser = Objects.requireNonNull(parser, "解析器不能为空");
        this.defaultValue = defaultValue;
    }

    /**
     * 解析属性值；值缺失时返回默认值。
     *
     * @throws KleisException 值无法解析
     */
    public T parse(String value) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.read(value.trim());
        } catch (IllegalArgumentException e) {
            throw new KleisException(ErrorMessage.INVALID_CONFIG_VALUE, e, name, value);
        }
    }

    public String valueToString(T value) {
        return parser.write(value);
    }

    public static <T> KleisConfigKey<T> key(String name, KeyParser<T> parser, T defaultValue) {
        return new KleisConfigKey<>(name, parser, defaultValue);
    }

    @Override
    public String toString() {
        return name;
    }
}
