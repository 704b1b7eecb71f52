package io.rowguard.sql.policy;

public class DuplicatePolicyNameException extends PolicyException {
    private final String table;
    private final String policyName;

    public DuplicatePolicyNameException(String table, String policyName) {
        super("policy \"%s\" for table \"%s\" already exists".formatted(policyName, table));
        this.table = table;
        this.policyName = policyName;
    }

    public String getTable() {
        return table;
    }

    public String getPolicyName() {
        return policyName;
    }
}
