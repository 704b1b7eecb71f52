package io.rowguard.sql.policy.enforce;

import java.util.Objects;

/**
 * Verdict on one row of a write.
 */
public final class WriteDecision {

    public enum Outcome {
        /** the write may proceed */
        ALLOW,
        /** the existing row is not visible to the caller; the write skips it as if it did not match */
        FILTERED,
        /** the proposed row violates the check; the whole operation must fail */
        REJECT
    }

    public static final WriteDecision ALLOW = new WriteDecision(Outcome.ALLOW, null);
    public static final WriteDecision FILTERED = new WriteDecision(Outcome.FILTERED, null);

    private final Outcome outcome;
    private final String reason;

    private WriteDecision(Outcome outcome, String reason) {
        this.outcome = outcome;
        this.reason = reason;
    }

    public static WriteDecision reject(String reason) {
        return new WriteDecision(Outcome.REJECT, Objects.requireNonNull(reason, "reason"));
    }

    public Outcome outcome() {
        return outcome;
    }

    /**
     * @return why the write was rejected, null unless {@link Outcome#REJECT}
     */
    public String reason() {
        return reason;
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECT;
    }

    @Override
    public String toString() {
        return reason == null ? outcome.name() : outcome + "(" + reason + ")";
    }
}
