package io.rowguard.sql.policy.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import io.rowguard.sql.commons.ExpressionFactory;
import io.rowguard.sql.policy.Operation;

import java.util.List;

/**
 * OR-combination of the policies that apply to one (table, operation, role).
 * The trees are shared with the cache and must not be mutated; copy before transforming.
 *
 * @param using filter on existing rows
 * @param check filter on proposed rows, each policy's {@code with_check} falling back to its {@code using}
 * @param unrestricted RLS is disabled on the table, both trees are constant true
 * @param defaultDeny RLS is enabled but no policy applies, both trees are constant false
 * @param policyNames names of the combined policies, in registration order
 */
public record EffectivePredicate(String table, Operation operation, JsonNode using, JsonNode check,
                                 boolean unrestricted, boolean defaultDeny, List<String> policyNames) {

    public EffectivePredicate {
        policyNames = List.copyOf(policyNames);
    }

    public static EffectivePredicate unrestricted(String table, Operation operation) {
        var t = ExpressionFactory.trueExpression();
        return new EffectivePredicate(table, operation, t, t, true, false, List.of());
    }

    public static EffectivePredicate denyAll(String table, Operation operation) {
        var f = ExpressionFactory.falseExpression();
        return new EffectivePredicate(table, operation, f, f, false, true, List.of());
    }
}
