package io.rowguard.sql.policy.claims;

import java.time.Clock;

public abstract class AbstractServiceKeyVerifier implements ServiceKeyVerifier {

    protected Clock clock = Clock.systemUTC();

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Mints a capability. Call only after the key has been verified.
     */
    protected final BypassCapability grant(String subject) {
        return new BypassCapability(subject, getClass().getName(), clock.instant());
    }
}
