package io.rowguard.sql.policy.claims;

import com.typesafe.config.Config;

import java.util.Optional;

/**
 * Accepts one fixed key. Tests only.
 */
public class StaticServiceKeyVerifier extends AbstractServiceKeyVerifier {

    private String key;

    public StaticServiceKeyVerifier() {
    }

    public StaticServiceKeyVerifier(String key) {
        this.key = key;
    }

    @Override
    public void setConfig(Config config) {
        this.key = config.getString("key");
    }

    @Override
    public Optional<BypassCapability> verify(String serviceKey) {
        return key != null && key.equals(serviceKey) ? Optional.of(grant("test-service")) : Optional.empty();
    }

    public static ClaimsContext bypass(ClaimsContext claims) {
        return claims.withBypass(new StaticServiceKeyVerifier("k").verify("k").orElseThrow());
    }
}
