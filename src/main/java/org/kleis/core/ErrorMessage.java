package org.kleis.core;

/**
 * 所有错误信息模板。通过 {@link #getMessage(Object...)} 填充参数。
 */
public enum ErrorMessage {
    // 类型
    UNIFICATION_FAILURE("无法合一类型 %s 与 %s"),
    OCCURS_CHECK_FAILURE("出现检查失败：类型变量 %s 出现在 %s 中"),
    UNDEFINED_OPERATION("未定义的运算 '%s'"),
    ARITY_MISMATCH("运算 '%s' 的参数个数为 %s，但期望 %s"),
    NO_IMPLEMENTATION("运算 '%s' 没有适用于类型 %s 的实现"),
    UNSUPPORTED_LITERAL("无法识别的字面量 '%s'"),
    TYPE_ERROR_AT("%s（位于表达式 %s）"),

    // 结构注册表
    DUPLICATE_STRUCTURE("结构 '%s' 已注册"),
    DUPLICATE_DATA_TYPE("数据类型 '%s' 已注册"),
    UNKNOWN_STRUCTURE("未找到结构 '%s'"),
    UNKNOWN_DATA_TYPE("未找到数据类型 '%s'"),

    // 翻译
    UNBOUND_VARIABLE("未绑定的变量 '%s'"),
    UNSUPPORTED_TRANSLATION("无法翻译为 Z3：%s"),
    SORT_MISMATCH("运算 '%s' 的参数排序 %s 与先前声明的 %s 不一致"),
    NOT_BOOLEAN("表达式 %s 不是布尔公式"),

    // 配置
    INVALID_CONFIG_VALUE("配置项 '%s' 的值 '%s' 无效"),
    CONFIG_FILE_UNREADABLE("无法读取配置文件 '%s'");

    private final String message;

    ErrorMessage(String message) {
        this.message = message;
    }

    public String getMessage(Object... args) {
        return String.format(message, args);
    }
}
