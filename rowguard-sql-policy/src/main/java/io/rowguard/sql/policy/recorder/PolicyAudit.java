package io.rowguard.sql.policy.recorder;

import io.rowguard.sql.policy.Operation;

import java.time.Instant;

public record PolicyAudit(
        String action,        // BYPASS, REJECT, ERROR
        String table,
        Operation operation,
        String role,
        String subject,       // principal id, or the service key subject for BYPASS
        Instant timestamp,
        String detail
) {}
