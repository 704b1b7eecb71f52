package io.rowguard.sql.policy;

public class PolicyNotFoundException extends PolicyException {
    private final String table;
    private final String policyName;

    public PolicyNotFoundException(String table, String policyName) {
        super("policy \"%s\" for table \"%s\" does not exist".formatted(policyName, table));
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
