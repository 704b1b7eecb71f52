package io.rowguard.sql.policy.enforce;

/**
 * Progress of one operation through the gate.
 */
public enum OperationState {
    RECEIVED,
    RESOLVING_POLICY,
    FILTERING,
    CHECKING,
    COMPLETED,
    REJECTED
}
