package io.rowguard.sql.policy.eval;

import java.util.List;
import java.util.Set;

/**
 * Security definer helper callable from predicates. Runs with the privileges of its definer: scans
 * of the tables it declares skip row level security, scans of any other table fail.
 */
public interface DefinerFunction {

    /**
     * Name as called from SQL, optionally schema qualified, e.g. {@code private.user_teams}.
     */
    String name();

    Set<String> tables();

    /**
     * @param context already switched to definer mode for {@link #tables()}
     */
    Object invoke(List<Object> arguments, EvaluationContext context, ExpressionEvaluator evaluator);
}
