package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.Row;

import java.util.List;

/**
 * Reads the rows of a table a sub-query scans, as the principal of {@code context} may see them.
 */
@FunctionalInterface
public interface TableReader {
    List<Row> read(String table, EvaluationContext context);
}
