package io.rowguard.sql.policy;

/**
 * Write rejected by row level security. The message never reveals whether a targeted row exists.
 */
public class PolicyCheckViolationException extends PolicyException {
    private final String table;
    private final Operation operation;

    public PolicyCheckViolationException(String table, Operation operation, String message) {
        super(message);
        this.table = table;
        this.operation = operation;
    }

    public String getTable() {
        return table;
    }

    public Operation getOperation() {
        return operation;
    }
}
