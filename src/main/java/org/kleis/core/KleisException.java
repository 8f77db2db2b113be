package org.kleis.core;

import lombok.Getter;

/**
 * 库内所有错误的基类。携带一个 {@link ErrorMessage} 以便调用方按种类区分。
 */
@Getter
public class KleisException extends RuntimeException {

    private final ErrorMessage error;

    public KleisException(ErrorMessage error, Object... args) {
        super(error.getMessage(args));
        this.error = error;
    }

    public KleisException(ErrorMessage error, Throwable cause, Object... args) {
        super(error.getMessage(args), cause);
        this.error = error;
    }

    protected KleisException(ErrorMessage error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
