package io.rowguard.sql.policy.recorder;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.claims.ClaimsContext;
import org.slf4j.MarkerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Counts policy decisions per table and audits bypasses, rejected writes and evaluation errors.
 * Counters are named {@code rowguard.policy.<event>.count} and tagged with {@code table}.
 */
public class MicroMeterPolicyRecorder implements PolicyRecorder {

    private static final Auditor auditor = new Auditor(MarkerFactory.getMarker("policy"));

    private final MeterRegistry registry;
    private final Clock clock;

    public MicroMeterPolicyRecorder(MeterRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public MicroMeterPolicyRecorder(MeterRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    private Counter counter(String name, String table) {
        return Counter.builder("rowguard.policy." + name + ".count")
                .tag("table", table)
                .register(registry);
    }

    @Override
    public void recordResolution(String table, Operation operation, boolean cacheHit) {
        counter(cacheHit ? "cache_hit" : "cache_miss", table).increment();
    }

    @Override
    public void recordRowsFiltered(String table, long count) {
        if (count > 0) {
            counter("rows_filtered", table).increment(count);
        }
    }

    @Override
    public void recordQueryRewrite(String table) {
        counter("query_rewrite", table).increment();
    }

    @Override
    public void recordWriteAllowed(String table, Operation operation) {
        counter("write_allowed", table).increment();
    }

    @Override
    public void recordWriteFiltered(String table, Operation operation) {
        counter("write_filtered", table).increment();
    }

    @Override
    public void recordWriteRejected(String table, Operation operation, ClaimsContext claims, String reason) {
        counter("write_rejected", table).increment();
        auditor.audit(buildAudit("REJECT", table, operation, claims, claims.id(), reason));
    }

    @Override
    public void recordBypass(String table, Operation operation, ClaimsContext claims) {
        counter("bypass", table).increment();
        var capability = claims.bypass();
        auditor.audit(buildAudit("BYPASS", table, operation, claims,
                capability == null ? claims.id() : capability.subject(),
                capability == null ? null : "verified by " + capability.verifier()));
    }

    @Override
    public void recordEvaluationError(String table, Operation operation, ClaimsContext claims, Throwable error) {
        counter("evaluation_error", table).increment();
        String errorMessage = error.getClass().getSimpleName() + ": " + error.getMessage();
        auditor.audit(buildAudit("ERROR", table, operation, claims, claims.id(), errorMessage));
    }

    @Override
    public void recordBroadcast(String table, boolean delivered) {
        counter(delivered ? "broadcast_delivered" : "broadcast_suppressed", table).increment();
    }

    private PolicyAudit buildAudit(String action, String table, Operation operation, ClaimsContext claims,
                                   String subject, String detail) {
        return new PolicyAudit(action, table, operation, claims.role(), subject, Instant.now(clock), detail);
    }
}
