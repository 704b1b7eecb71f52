package io.rowguard.sql.policy.store;

import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.Policy;

import java.util.List;

/**
 * Immutable snapshot of a table's row level security configuration.
 *
 * @param policies in registration order
 * @param generation store wide counter value of the last change to this table
 */
public record TableSecurityState(String table, boolean rlsEnabled, List<Policy> policies, long generation) {

    public TableSecurityState {
        policies = List.copyOf(policies);
    }

    static TableSecurityState unregistered(String table) {
        return new TableSecurityState(table, false, List.of(), 0);
    }

    public List<Policy> policiesFor(Operation operation) {
        return policies.stream().filter(p -> p.operation().covers(operation)).toList();
    }

    public Policy policy(String name) {
        for (var p : policies) {
            if (p.name().equals(name)) {
                return p;
            }
        }
        return null;
    }
}
