package io.rowguard.sql.policy.recorder;

import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.claims.ClaimsContext;

public class NOOPPolicyRecorder implements PolicyRecorder {

    public static final NOOPPolicyRecorder INSTANCE = new NOOPPolicyRecorder();

    @Override
    public void recordResolution(String table, Operation operation, boolean cacheHit) {
    }

    @Override
    public void recordRowsFiltered(String table, long count) {
    }

    @Override
    public void recordQueryRewrite(String table) {
    }

    @Override
    public void recordWriteAllowed(String table, Operation operation) {
    }

    @Override
    public void recordWriteFiltered(String table, Operation operation) {
    }

    @Override
    public void recordWriteRejected(String table, Operation operation, ClaimsContext claims, String reason) {
    }

    @Override
    public void recordBypass(String table, Operation operation, ClaimsContext claims) {
    }

    @Override
    public void recordEvaluationError(String table, Operation operation, ClaimsContext claims, Throwable error) {
    }

    @Override
    public void recordBroadcast(String table, boolean delivered) {
    }
}
