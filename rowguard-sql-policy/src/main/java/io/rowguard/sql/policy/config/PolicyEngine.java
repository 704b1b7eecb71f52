package io.rowguard.sql.policy.config;

import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.claims.InvalidServiceKeyException;
import io.rowguard.sql.policy.claims.ServiceKeyVerifier;
import io.rowguard.sql.policy.enforce.EnforcementGate;
import io.rowguard.sql.policy.enforce.PolicyEnforcedExecutor;
import io.rowguard.sql.policy.eval.ExpressionEvaluator;
import io.rowguard.sql.policy.publication.PublicationFilter;
import io.rowguard.sql.policy.resolve.PolicyResolver;
import io.rowguard.sql.policy.storage.TableStore;
import io.rowguard.sql.policy.store.PolicyStore;

/**
 * Wired set of components sharing one policy store, see {@link PolicyEngineFactory}.
 */
public class PolicyEngine {

    private final PolicyStore policyStore;
    private final TableStore tableStore;
    private final ExpressionEvaluator evaluator;
    private final PolicyResolver resolver;
    private final EnforcementGate gate;
    private final PolicyEnforcedExecutor executor;
    private final PublicationFilter publicationFilter;
    private final ServiceKeyVerifier serviceKeyVerifier;

    PolicyEngine(PolicyStore policyStore, TableStore tableStore, ExpressionEvaluator evaluator,
                 PolicyResolver resolver, EnforcementGate gate, PublicationFilter publicationFilter,
                 ServiceKeyVerifier serviceKeyVerifier) {
        this.policyStore = policyStore;
        this.tableStore = tableStore;
        this.evaluator = evaluator;
        this.resolver = resolver;
        this.gate = gate;
        this.executor = new PolicyEnforcedExecutor(tableStore, gate);
        this.publicationFilter = publicationFilter;
        this.serviceKeyVerifier = serviceKeyVerifier;
    }

    public PolicyStore policyStore() {
        return policyStore;
    }

    public TableStore tableStore() {
        return tableStore;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public PolicyResolver resolver() {
        return resolver;
    }

    public EnforcementGate gate() {
        return gate;
    }

    public PolicyEnforcedExecutor executor() {
        return executor;
    }

    public PublicationFilter publicationFilter() {
        return publicationFilter;
    }

    public ServiceKeyVerifier serviceKeyVerifier() {
        return serviceKeyVerifier;
    }

    /**
     * Attaches the bypass capability of a verified service key to {@code claims}.
     *
     * @throws InvalidServiceKeyException if the key is not a valid service key
     */
    public ClaimsContext withServiceKey(ClaimsContext claims, String serviceKey) throws InvalidServiceKeyException {
        var capability = serviceKeyVerifier.verify(serviceKey);
        if (capability.isEmpty()) {
            throw new InvalidServiceKeyException();
        }
        return claims.withBypass(capability.get());
    }
}
