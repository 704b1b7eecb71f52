package io.rowguard.sql.policy.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.rowguard.sql.commons.ExpressionFactory;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.recorder.NOOPPolicyRecorder;
import io.rowguard.sql.policy.recorder.PolicyRecorder;
import io.rowguard.sql.policy.store.PolicyStore;
import io.rowguard.sql.policy.store.TableSecurityState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.ExecutionException;

/**
 * Turns the policies of a table into one {@link EffectivePredicate} per operation and role.
 *
 * <p>Results are cached by (table, operation, role, generation). Claim values are referenced
 * symbolically ({@code auth.uid()}) so the tree depends on nothing else. The store reports every change,
 * and the entries of the changed table are dropped before the change becomes visible; a lookup racing
 * the change carries the old generation and can never be served to later readers.
 */
public class PolicyResolver {

    private static final Logger logger = LoggerFactory.getLogger(PolicyResolver.class);

    record CacheKey(String table, Operation operation, String role, long generation) {}

    private final PolicyStore store;
    private final PolicyRecorder recorder;
    private final Cache<CacheKey, EffectivePredicate> cache;

    public PolicyResolver(PolicyStore store) {
        this(store, 10_000, Duration.ofMinutes(10), NOOPPolicyRecorder.INSTANCE);
    }

    public PolicyResolver(PolicyStore store, long maxSize, Duration expireAfterAccess, PolicyRecorder recorder) {
        this.store = store;
        this.recorder = recorder;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(expireAfterAccess)
                .build();
        store.addListener(this::invalidate);
    }

    /**
     * @param operation a concrete kind; ALL is only a policy kind
     */
    public EffectivePredicate resolve(String table, Operation operation, ClaimsContext claims) {
        if (operation == Operation.ALL) {
            throw new IllegalArgumentException("Cannot resolve for ALL, use a concrete operation");
        }
        var state = store.state(table);
        if (!state.rlsEnabled()) {
            return EffectivePredicate.unrestricted(table, operation);
        }
        var key = new CacheKey(table, operation, claims.role(), state.generation());
        var cached = cache.getIfPresent(key);
        if (cached != null) {
            recorder.recordResolution(table, operation, true);
            return cached;
        }
        recorder.recordResolution(table, operation, false);
        try {
            return cache.get(key, () -> combine(state, operation, claims.role()));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unable to resolve policies for " + table, e.getCause());
        }
    }

    public long cacheSize() {
        return cache.size();
    }

    static EffectivePredicate combine(TableSecurityState state, Operation operation, String role) {
        var usings = new ArrayList<JsonNode>();
        var checks = new ArrayList<JsonNode>();
        var names = new ArrayList<String>();
        for (Policy p : state.policiesFor(operation)) {
            if (!p.appliesTo(role)) {
                continue;
            }
            names.add(p.name());
            // INSERT policies may carry only a check
            usings.add(p.using() != null ? p.using() : p.withCheck());
            checks.add(p.effectiveCheck());
        }
        if (names.isEmpty()) {
            logger.atDebug().log("No {} policy on {} applies to role {}", operation, state.table(), role);
            return EffectivePredicate.denyAll(state.table(), operation);
        }
        return new EffectivePredicate(state.table(), operation,
                ExpressionFactory.orFilters(usings.toArray(new JsonNode[0])),
                ExpressionFactory.orFilters(checks.toArray(new JsonNode[0])),
                false, false, names);
    }

    private void invalidate(TableSecurityState state) {
        cache.asMap().keySet().removeIf(k -> k.table().equals(state.table()));
        logger.atDebug().log("Invalidated cached predicates of {} at generation {}", state.table(), state.generation());
    }
}
