package org.kleis.symbolic;

import lombok.Getter;

@Getter
public final class SatisfiabilityResult {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN,
        DISABLED
    }

    private final Status status;
    private final Counterexample witness;
    private final String reason;

    private SatisfiabilityResult(Status status, Counterexample witness, String reason) {
        this.status = status;
        this.witness = witness;
        this.reason = reason;
    }

    public static SatisfiabilityResult satisfiable(Counterexample witness) {
        return new SatisfiabilityResult(Status.SATISFIABLE, witness, null);
    }

    public static SatisfiabilityResult unsatisfiable() {
        return new SatisfiabilityResult(Status.UNSATISFIABLE, null, null);
    }

    public static SatisfiabilityResult unknown(String reason) {
        return new SatisfiabilityResult(Status.UNKNOWN, null, reason);
    }

    public static SatisfiabilityResult disabled() {
        return new SatisfiabilityResult(Status.DISABLED, null, null);
    }

    @Override
    public String toString() {
        return witness == null ? status.toString() : status + " " + witness;
    }
}
