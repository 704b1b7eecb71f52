package io.rowguard.sql.policy.claims;

import java.time.Instant;

/**
 * Proof that a service key was verified. Turns row level security off for every table
 * for the operation carrying it. Instances are only handed out by {@link AbstractServiceKeyVerifier}.
 */
public final class BypassCapability {

    private final String subject;
    private final String verifier;
    private final Instant grantedAt;

    BypassCapability(String subject, String verifier, Instant grantedAt) {
        this.subject = subject;
        this.verifier = verifier;
        this.grantedAt = grantedAt;
    }

    public String subject() {
        return subject;
    }

    /**
     * Class name of the verifier that granted the capability.
     */
    public String verifier() {
        return verifier;
    }

    public Instant grantedAt() {
        return grantedAt;
    }

    @Override
    public String toString() {
        return "BypassCapability{subject=" + subject + ", verifier=" + verifier + ", grantedAt=" + grantedAt + "}";
    }
}
