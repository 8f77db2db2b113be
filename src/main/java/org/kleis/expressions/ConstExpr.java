package org.kleis.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 字面量，保留其词法形式：数字（{@code 1}、{@code 2.5}、{@code 1/3}）、
 * 布尔（{@code true}/{@code false}）或带引号的字符串。
 */
@Getter
public final class ConstExpr implements Expression {

    private final String value;

    private ConstExpr(String value) {
        this.value = Objects.requireNonNull(value, "字面量不能为空");
    }

    public static ConstExpr of(String value) {
        return new ConstExpr(value);
    }

    public static ConstExpr of(long value) {
        return new ConstExpr(Long.toString(value));
    }

    public boolean isBoolean() {
        return "true".equals(value) || "false".equals(value);
    }

    public boolean isString() {
        return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"");
    }

    /**
     * 去掉引号后的字符串内容。
     */
    public String stringContent() {
        return value.substring(1, value.length() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((ConstExpr) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
