package io.rowguard.sql.policy.recorder;

import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.claims.ClaimsContext;

public interface PolicyRecorder {

    void recordResolution(String table, Operation operation, boolean cacheHit);

    void recordRowsFiltered(String table, long count);

    void recordQueryRewrite(String table);

    void recordWriteAllowed(String table, Operation operation);

    void recordWriteFiltered(String table, Operation operation);

    void recordWriteRejected(String table, Operation operation, ClaimsContext claims, String reason);

    void recordBypass(String table, Operation operation, ClaimsContext claims);

    void recordEvaluationError(String table, Operation operation, ClaimsContext claims, Throwable error);

    void recordBroadcast(String table, boolean delivered);
}
