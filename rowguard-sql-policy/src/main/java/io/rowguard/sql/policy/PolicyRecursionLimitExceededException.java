package io.rowguard.sql.policy;

public class PolicyRecursionLimitExceededException extends PolicyEvaluationException {
    private final String table;
    private final int maxDepth;

    public PolicyRecursionLimitExceededException(String table, int maxDepth) {
        super("policy sub-queries nested deeper than %d levels while reading \"%s\"".formatted(maxDepth, table));
        this.table = table;
        this.maxDepth = maxDepth;
    }

    public String getTable() {
        return table;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
