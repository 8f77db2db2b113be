package org.kleis.symbolic;

import lombok.Getter;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;

/**
 * 表达式无法翻译为 Z3 项。只影响当前这一次查询，已加载的结构不受影响。
 */
@Getter
public class TranslationException extends KleisException {

    public enum Kind {
        UNBOUND_VARIABLE,
        UNSUPPORTED_TRANSLATION,
        ARITY_MISMATCH,
        SORT_MISMATCH,
        NOT_BOOLEAN
    }

    private final Kind kind;

    private TranslationException(Kind kind, ErrorMessage error, Object... args) {
        super(error, args);
        this.kind = kind;
    }

    public static TranslationException unboundVariable(String name) {
        return new TranslationException(Kind.UNBOUND_VARIABLE, ErrorMessage.UNBOUND_VARIABLE, name);
    }

    public static TranslationException unsupported(Object what) {
        return new TranslationException(Kind.UNSUPPORTED_TRANSLATION, ErrorMessage.UNSUPPORTED_TRANSLATION, what);
    }

    public static TranslationException arityMismatch(String name, int actual, int expected) {
        return new TranslationException(Kind.ARITY_MISMATCH, ErrorMessage.ARITY_MISMATCH, name, actual, expected);
    }

    public static TranslationException sortMismatch(String name, Object actual, Object expected) {
        return new TranslationException(Kind.SORT_MISMATCH, ErrorMessage.SORT_MISMATCH, name, actual, expected);
    }

    public static TranslationException notBoolean(Object expr) {
        return new TranslationException(Kind.NOT_BOOLEAN, ErrorMessage.NOT_BOOLEAN, expr);
    }
}
