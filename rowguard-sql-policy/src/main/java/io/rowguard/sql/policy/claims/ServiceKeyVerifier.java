package io.rowguard.sql.policy.claims;

import io.rowguard.sql.commons.config.ConfigBasedProvider;

import java.util.Optional;

/**
 * Authenticates a service key separately from ordinary claims.
 * Configured under {@code rowguard.service_key_verifier}.
 */
public interface ServiceKeyVerifier extends ConfigBasedProvider {

    /**
     * @return the capability when the key is valid, empty otherwise
     */
    Optional<BypassCapability> verify(String serviceKey);
}
