package io.rowguard.sql.policy.enforce;

import com.fasterxml.jackson.databind.JsonNode;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.PolicyCheckViolationException;
import io.rowguard.sql.policy.PolicyEvaluationException;
import io.rowguard.sql.policy.Row;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.eval.EvaluationContext;
import io.rowguard.sql.policy.resolve.EffectivePredicate;
import io.rowguard.sql.policy.storage.StoreTransaction;
import io.rowguard.sql.policy.storage.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs reads and writes against a {@link TableStore} under row level security.
 *
 * <p>Each write runs in one {@link StoreTransaction}: policy sub-queries read that transaction, and a
 * rejected row or an evaluation error discards every change the operation made.
 */
public class PolicyEnforcedExecutor {

    private static final Logger logger = LoggerFactory.getLogger(PolicyEnforcedExecutor.class);

    private final TableStore store;
    private final EnforcementGate gate;

    public PolicyEnforcedExecutor(TableStore store, EnforcementGate gate) {
        this.store = store;
        this.gate = gate;
    }

    /**
     * @param where caller's filter, null for all visible rows
     */
    public List<Row> select(String table, JsonNode where, ClaimsContext claims) {
        return gate.select(table, where, claims, store.snapshot());
    }

    public void insert(String table, Row row, ClaimsContext claims) throws PolicyCheckViolationException {
        insertAll(table, List.of(row), claims);
    }

    /**
     * Inserts all rows or none. Columns missing from a row are null.
     */
    public int insertAll(String table, List<Row> rows, ClaimsContext claims) throws PolicyCheckViolationException {
        try (var tx = store.begin()) {
            var predicate = gate.predicate(table, Operation.INSERT, claims);
            var context = gate.evaluator().rootContext(claims, tx, gate);
            for (var row : rows) {
                var proposed = Row.nulls(tx.columns(table)).with(row.asMap());
                var decision = gate.checkProposed(predicate, proposed, context);
                if (decision.isRejected()) {
                    throw violation(table, Operation.INSERT, decision);
                }
                tx.insert(table, proposed);
            }
            tx.commit();
            return rows.size();
        } catch (PolicyCheckViolationException | RuntimeException e) {
            rolledBack(table, Operation.INSERT, e);
            throw e;
        }
    }

    /**
     * Applies {@code changes} to every row the caller may update that matches {@code where}.
     *
     * @return number of rows updated
     * @throws PolicyCheckViolationException if an updated row fails the check; nothing is updated
     */
    public int update(String table, JsonNode where, Map<String, ?> changes, ClaimsContext claims)
            throws PolicyCheckViolationException {
        try (var tx = store.begin()) {
            var count = update(tx, table, where, changes, claims);
            tx.commit();
            return count;
        } catch (PolicyCheckViolationException | RuntimeException e) {
            rolledBack(table, Operation.UPDATE, e);
            throw e;
        }
    }

    /**
     * Update targeting exactly one row.
     *
     * @throws PolicyCheckViolationException if no row the caller may update matches, or the row fails the check
     * @throws IllegalArgumentException if more than one row matches
     */
    public void updateOne(String table, JsonNode where, Map<String, ?> changes, ClaimsContext claims)
            throws PolicyCheckViolationException {
        try (var tx = store.begin()) {
            var count = update(tx, table, where, changes, claims);
            expectOne(table, Operation.UPDATE, count);
            tx.commit();
        } catch (PolicyCheckViolationException | RuntimeException e) {
            rolledBack(table, Operation.UPDATE, e);
            throw e;
        }
    }

    /**
     * @return number of rows deleted
     */
    public int delete(String table, JsonNode where, ClaimsContext claims) throws PolicyCheckViolationException {
        try (var tx = store.begin()) {
            var count = delete(tx, table, where, claims);
            tx.commit();
            return count;
        } catch (PolicyCheckViolationException | RuntimeException e) {
            rolledBack(table, Operation.DELETE, e);
            throw e;
        }
    }

    /**
     * @throws PolicyCheckViolationException if no row the caller may delete matches
     * @throws IllegalArgumentException if more than one row matches
     */
    public void deleteOne(String table, JsonNode where, ClaimsContext claims) throws PolicyCheckViolationException {
        try (var tx = store.begin()) {
            var count = delete(tx, table, where, claims);
            expectOne(table, Operation.DELETE, count);
            tx.commit();
        } catch (PolicyCheckViolationException | RuntimeException e) {
            rolledBack(table, Operation.DELETE, e);
            throw e;
        }
    }

    private int update(StoreTransaction tx, String table, JsonNode where, Map<String, ?> changes, ClaimsContext claims)
            throws PolicyCheckViolationException {
        var predicate = writable(table, Operation.UPDATE, claims);
        var context = gate.evaluator().rootContext(claims, tx, gate);
        int count = 0;
        for (var row : List.copyOf(tx.rows(table))) {
            if (!matches(predicate, row, where, context)) {
                continue;
            }
            var proposed = row.with(changes);
            var decision = gate.checkProposed(predicate, proposed, context);
            if (decision.isRejected()) {
                throw violation(table, Operation.UPDATE, decision);
            }
            tx.replace(table, row, proposed);
            count++;
        }
        return count;
    }

    private int delete(StoreTransaction tx, String table, JsonNode where, ClaimsContext claims)
            throws PolicyCheckViolationException {
        var predicate = writable(table, Operation.DELETE, claims);
        var context = gate.evaluator().rootContext(claims, tx, gate);
        int count = 0;
        for (var row : List.copyOf(tx.rows(table))) {
            if (matches(predicate, row, where, context)) {
                tx.delete(table, row);
                count++;
            }
        }
        return count;
    }

    private EffectivePredicate writable(String table, Operation operation, ClaimsContext claims)
            throws PolicyCheckViolationException {
        var predicate = gate.predicate(table, operation, claims);
        if (predicate.defaultDeny()) {
            throw violation(table, operation, gate.denied(predicate, claims));
        }
        return predicate;
    }

    /**
     * The caller's filter only decides rows that passed {@code using}.
     */
    private boolean matches(EffectivePredicate predicate, Row row, JsonNode where, EvaluationContext context) {
        if (!gate.checkUsing(predicate, row, context).isAllowed()) {
            if (targets(predicate.table(), row, where, context)) {
                gate.writeFiltered(predicate);
            }
            return false;
        }
        return where == null || where.isNull()
                || gate.evaluator().test(where, context.withRow(predicate.table(), row));
    }

    /**
     * Whether the caller's filter selects a row hidden from it. Only feeds the write_filtered counter, so a
     * failure here never reaches the caller.
     */
    private boolean targets(String table, Row hidden, JsonNode where, EvaluationContext context) {
        if (where == null || where.isNull()) {
            return true;
        }
        try {
            return gate.evaluator().test(where, context.withRow(table, hidden));
        } catch (PolicyEvaluationException e) {
            logger.atDebug().setCause(e).log("Not counting a hidden row of {}: caller filter failed on it", table);
            return false;
        }
    }

    private static void expectOne(String table, Operation operation, int count) throws PolicyCheckViolationException {
        if (count == 0) {
            throw new PolicyCheckViolationException(table, operation,
                    "%s on table \"%s\" matched no row the caller may modify".formatted(operation, table));
        }
        if (count > 1) {
            throw new IllegalArgumentException("%s on table \"%s\" matched %d rows, expected one"
                    .formatted(operation, table, count));
        }
    }

    private static PolicyCheckViolationException violation(String table, Operation operation, WriteDecision decision) {
        return new PolicyCheckViolationException(table, operation, decision.reason());
    }

    private static void rolledBack(String table, Operation operation, Exception e) {
        logger.atDebug().log("Rolled back {} on {}: {}", operation, table, e.getMessage());
    }
}
