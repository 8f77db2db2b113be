package org.kleis.symbolic;

import lombok.Getter;

/**
 * 公理验证结果：有效、被反例推翻、未知（超时或求解器放弃）、或验证未启用。
 */
@Getter
public final class VerificationResult {

    public enum Status {
        VALID,
        INVALID,
        UNKNOWN,
        DISABLED
    }

    private static final VerificationResult VALID = new VerificationResult(Status.VALID, null, null);
    private static final VerificationResult DISABLED = new VerificationResult(Status.DISABLED, null, null);

    private final Status status;
    private final Counterexample counterexample;
    private final String reason;

    private VerificationResult(Status status, Counterexample counterexample, String reason) {
        this.status = status;
        this.counterexample = counterexample;
        this.reason = reason;
    }

    public static VerificationResult valid() {
        return VALID;
    }

    public static VerificationResult invalid(Counterexample counterexample) {
        return new VerificationResult(Status.INVALID, counterexample, null);
    }

    public static VerificationResult unknown(String reason) {
        return new VerificationResult(Status.UNKNOWN, null, reason);
    }

    public static VerificationResult disabled() {
        return DISABLED;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    @Override
    public String toString() {
        return switch (status) {
            case VALID, DISABLED -> status.toString();
            case INVALID -> "INVALID " + counterexample;
            case UNKNOWN -> "UNKNOWN (" + reason + ")";
        };
    }
}
