package org.kleis.types;

import lombok.Getter;
import org.kleis.core.ErrorMessage;
import org.kleis.core.KleisException;
import org.kleis.expressions.Expression;

/**
 * 类型检查失败。{@code expression} 指向出错的子表达式；
 * 合一器直接抛出时尚无位置，由约束求解或推断引擎补上。
 */
@Getter
public class TypeInferenceException extends KleisException {

    public enum Kind {
        UNIFICATION_FAILURE,
        OCCURS_CHECK_FAILURE,
        UNDEFINED_OPERATION,
        ARITY_MISMATCH,
        NO_IMPLEMENTATION,
        UNSUPPORTED_LITERAL
    }

    private final Kind kind;
    private final String detail;
    private final Expression expression;

    private TypeInferenceException(Kind kind, ErrorMessage error, String detail, Expression expression) {
        super(error, expression == null ? detail : ErrorMessage.TYPE_ERROR_AT.getMessage(detail, expression), null);
        this.kind = kind;
        this.detail = detail;
        this.expression = expression;
    }

    public static TypeInferenceException unificationFailure(Type left, Type right) {
        ErrorMessage error = ErrorMessage.UNIFICATION_FAILURE;
        return new TypeInferenceException(Kind.UNIFICATION_FAILURE, error, error.getMessage(left, right), null);
    }

    public static TypeInferenceException occursCheckFailure(TypeVar var, Type type) {
        ErrorMessage error = ErrorMessage.OCCURS_CHECK_FAILURE;
        return new TypeInferenceException(Kind.OCCURS_CHECK_FAILURE, error, error.getMessage(var, type), null);
    }

    public static TypeInferenceException undefinedOperation(String name, Expression expression) {
        ErrorMessage error = ErrorMessage.UNDEFINED_OPERATION;
        return new TypeInferenceException(Kind.UNDEFINED_OPERATION, error, error.getMessage(name), expression);
    }

    public static TypeInferenceException arityMismatch(String name, int actual, String expected, Expression expression) {
        ErrorMessage error = ErrorMessage.ARITY_MISMATCH;
        return new TypeInferenceException(Kind.ARITY_MISMATCH, error, error.getMessage(name, actual, expected), expression);
    }

    public static TypeInferenceException noImplementation(String name, Type carrier, Expression expression) {
        ErrorMessage error = ErrorMessage.NO_IMPLEMENTATION;
        return new TypeInferenceException(Kind.NO_IMPLEMENTATION, error, error.getMessage(name, carrier), expression);
    }

    public static TypeInferenceException unsupportedLiteral(String literal, Expression expression) {
        ErrorMessage error = ErrorMessage.UNSUPPORTED_LITERAL;
        return new TypeInferenceException(Kind.UNSUPPORTED_LITERAL, error, error.getMessage(literal), expression);
    }

    /**
     * 返回定位到给定表达式的副本；已有位置时原样返回，保留最内层的位置。
     */
    public TypeInferenceException at(Expression location) {
        if (this.expression != null || location == null) {
            return this;
        }
        return new TypeInferenceException(kind, getError(), detail, location);
    }
}
