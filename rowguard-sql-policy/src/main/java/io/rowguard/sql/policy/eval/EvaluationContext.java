package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.PolicyRecursionLimitExceededException;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.Row;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.storage.RowSource;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Immutable state threaded through one evaluation: claims, the read snapshot, the nesting depth and
 * the column scope. Every derived context is a new instance, so concurrent evaluations share nothing.
 */
public final class EvaluationContext {

    private final ClaimsContext claims;
    private final RowSource source;
    private final TableReader reader;
    private final Instant now;
    private final int depth;
    private final int maxDepth;
    private final Scope scope;
    private final Set<String> definerTables;

    private EvaluationContext(ClaimsContext claims, RowSource source, TableReader reader, Instant now,
                              int depth, int maxDepth, Scope scope, Set<String> definerTables) {
        this.claims = claims;
        this.source = source;
        this.reader = reader;
        this.now = now;
        this.depth = depth;
        this.maxDepth = maxDepth;
        this.scope = scope;
        this.definerTables = definerTables;
    }

    /**
     * @param source snapshot sub-queries read; null when sub-queries are not available
     * @param reader applies row level security to sub-query scans; null when sub-queries are not available
     * @param now value of {@code now()} for the whole operation
     */
    public static EvaluationContext root(ClaimsContext claims, RowSource source, TableReader reader,
                                         Instant now, int maxDepth) {
        if (claims == null) {
            throw new IllegalArgumentException("Claims cannot be null");
        }
        return new EvaluationContext(claims, source, reader, now, 0, maxDepth, Scope.EMPTY, null);
    }

    public ClaimsContext claims() {
        return claims;
    }

    public RowSource source() {
        return source;
    }

    public Instant now() {
        return now;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Scope scope() {
        return scope;
    }

    public boolean isDefiner() {
        return definerTables != null;
    }

    /**
     * Context for evaluating a nested table's policies or a definer function body: one level deeper,
     * with a fresh scope.
     *
     * @throws PolicyRecursionLimitExceededException beyond the maximum depth
     */
    public EvaluationContext enter(String table) {
        if (depth + 1 > maxDepth) {
            throw new PolicyRecursionLimitExceededException(table, maxDepth);
        }
        return new EvaluationContext(claims, source, reader, now, depth + 1, maxDepth, Scope.EMPTY, null);
    }

    public EvaluationContext withRow(String qualifier, Row row) {
        return withFrame(List.of(new Scope.Binding(qualifier, row)));
    }

    public EvaluationContext withFrame(List<Scope.Binding> frame) {
        return new EvaluationContext(claims, source, reader, now, depth, maxDepth, scope.push(frame), definerTables);
    }

    /**
     * Context in which scans of {@code tables} skip row level security and scans of any other table fail.
     */
    public EvaluationContext asDefiner(Set<String> tables) {
        return new EvaluationContext(claims, source, reader, now, depth, maxDepth, scope, Set.copyOf(tables));
    }

    /**
     * Rows of {@code table} visible to this context.
     */
    public List<Row> read(String table) {
        if (source == null || reader == null) {
            throw new PredicateEvaluationException("sub-query on \"" + table + "\" needs a row source");
        }
        if (definerTables != null) {
            if (!definerTables.contains(table)) {
                throw new PredicateEvaluationException("definer function may not read \"" + table + "\"");
            }
            enter(table);
            return source.rows(table);
        }
        return reader.read(table, this);
    }

    public List<String> columns(String table) {
        if (source == null) {
            throw new PredicateEvaluationException("sub-query on \"" + table + "\" needs a row source");
        }
        return source.columns(table);
    }
}
