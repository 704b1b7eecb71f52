package io.rowguard.sql.policy.enforce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.PolicyEvaluationException;
import io.rowguard.sql.policy.Row;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.eval.EvaluationContext;
import io.rowguard.sql.policy.eval.ExpressionEvaluator;
import io.rowguard.sql.policy.eval.TableReader;
import io.rowguard.sql.policy.recorder.NOOPPolicyRecorder;
import io.rowguard.sql.policy.recorder.PolicyRecorder;
import io.rowguard.sql.policy.resolve.EffectivePredicate;
import io.rowguard.sql.policy.resolve.PolicyResolver;
import io.rowguard.sql.policy.storage.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.rowguard.sql.commons.ExpressionConstants.*;

/**
 * Single entry point through which every table operation obtains its row level security decision.
 *
 * <p>Reads are either rewritten for DuckDB ({@link #filterForRead}) or filtered row by row
 * ({@link #select}); writes are decided one row at a time ({@link #authorizeWrite}). A caller holding a
 * {@link io.rowguard.sql.policy.claims.BypassCapability} skips all of it, and every such skip is audited.
 *
 * <p>Sub-queries inside policies scan tables through {@link #read}, which applies the scanned table's own
 * SELECT policies for the same claims and the same {@link RowSource}.
 */
public class EnforcementGate implements TableReader {

    private static final Logger logger = LoggerFactory.getLogger(EnforcementGate.class);

    private final PolicyResolver resolver;
    private final ExpressionEvaluator evaluator;
    private final PolicyRecorder recorder;
    private final ClaimsBinder binder;

    public EnforcementGate(PolicyResolver resolver, ExpressionEvaluator evaluator) {
        this(resolver, evaluator, NOOPPolicyRecorder.INSTANCE);
    }

    public EnforcementGate(PolicyResolver resolver, ExpressionEvaluator evaluator, PolicyRecorder recorder) {
        this.resolver = resolver;
        this.evaluator = evaluator;
        this.recorder = recorder;
        this.binder = new ClaimsBinder(evaluator, resolver);
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    /**
     * Effective predicate after the bypass check. Bypass use is audited here.
     */
    public EffectivePredicate predicate(String table, Operation operation, ClaimsContext claims) {
        transition(OperationState.RESOLVING_POLICY, table, operation);
        if (claims.hasBypass()) {
            logger.atInfo().log("Bypassing row level security on {} for {} ({})", table, operation, claims.bypass());
            recorder.recordBypass(table, operation, claims);
            return EffectivePredicate.unrestricted(table, operation);
        }
        return resolver.resolve(table, operation, claims);
    }

    /**
     * Rewrites a query so DuckDB returns only the rows of {@code table} the caller may see.
     *
     * @param query parsed statement as returned by {@link Transformations#parseToTree(String)}
     * @return rewritten copy; claim functions are bound to the caller's values
     */
    public JsonNode filterForRead(String table, JsonNode query, ClaimsContext claims) {
        return filterForRead(table, query, claims, null);
    }

    /**
     * @param source rows that definer functions read while binding; may be null when policies use none
     */
    public JsonNode filterForRead(String table, JsonNode query, ClaimsContext claims, RowSource source) {
        transition(OperationState.RECEIVED, table, Operation.SELECT);
        var predicate = predicate(table, Operation.SELECT, claims);
        if (claims.hasBypass()) {
            transition(OperationState.COMPLETED, table, Operation.SELECT);
            return query.deepCopy();
        }
        var context = evaluator.rootContext(claims, source, this);
        transition(OperationState.FILTERING, table, Operation.SELECT);
        try {
            var result = query.deepCopy();
            var statement = (ObjectNode) Transformations.getFirstStatementNode(result);
            if (readsOnly(statement, table)) {
                binder.bindExpressions(statement, context);
                if (!predicate.unrestricted()) {
                    Transformations.addFilterToSelect(statement, binder.bind(predicate.using(), context));
                }
            } else {
                statement = binder.bindSelect(statement, context);
            }
            ((ObjectNode) ((ArrayNode) result.get(FIELD_STATEMENTS)).get(0)).set(FIELD_NODE, statement);
            recorder.recordQueryRewrite(table);
            transition(OperationState.COMPLETED, table, Operation.SELECT);
            return result;
        } catch (PolicyEvaluationException e) {
            recorder.recordEvaluationError(table, Operation.SELECT, claims, e);
            throw e;
        }
    }

    /**
     * SQL text form of {@link #filterForRead(String, JsonNode, ClaimsContext)}.
     *
     * @throws IllegalArgumentException if the SQL cannot be parsed
     */
    public String filterForRead(String table, String sql, ClaimsContext claims) {
        try {
            return Transformations.parseToSql(filterForRead(table, Transformations.parseToTree(sql), claims));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to parse sql: " + sql, e);
        }
    }

    /**
     * Rows of {@code table} visible to the caller that also satisfy {@code where}. Rows failing the
     * policy are dropped before {@code where} sees them.
     *
     * @param where caller's own filter, may be null
     */
    public List<Row> select(String table, JsonNode where, ClaimsContext claims, RowSource source) {
        transition(OperationState.RECEIVED, table, Operation.SELECT);
        var predicate = predicate(table, Operation.SELECT, claims);
        var context = evaluator.rootContext(claims, source, this);
        transition(OperationState.FILTERING, table, Operation.SELECT);
        try {
            var visible = filter(table, predicate, source.rows(table), context);
            if (where == null || where.isNull()) {
                transition(OperationState.COMPLETED, table, Operation.SELECT);
                return visible;
            }
            var result = new ArrayList<Row>();
            for (var row : visible) {
                if (evaluator.test(where, context.withRow(table, row))) {
                    result.add(row);
                }
            }
            transition(OperationState.COMPLETED, table, Operation.SELECT);
            return result;
        } catch (PolicyEvaluationException e) {
            recorder.recordEvaluationError(table, Operation.SELECT, claims, e);
            throw e;
        }
    }

    public boolean isVisible(String table, Row row, ClaimsContext claims, RowSource source) {
        var predicate = predicate(table, Operation.SELECT, claims);
        if (predicate.unrestricted()) {
            return true;
        }
        try {
            return !predicate.defaultDeny()
                    && evaluator.test(predicate.using(), evaluator.rootContext(claims, source, this).withRow(table, row));
        } catch (PolicyEvaluationException e) {
            recorder.recordEvaluationError(table, Operation.SELECT, claims, e);
            throw e;
        }
    }

    /**
     * Decides one row of a write.
     *
     * @param existing current row for UPDATE and DELETE, null for INSERT
     * @param proposed new row for INSERT and UPDATE, null for DELETE
     * @param source read view of the enclosing transaction, used by sub-queries
     */
    public WriteDecision authorizeWrite(String table, Operation operation, Row existing, Row proposed,
                                        ClaimsContext claims, RowSource source) {
        if (!operation.isWrite()) {
            throw new IllegalArgumentException("Not a write operation: " + operation);
        }
        if (operation != Operation.INSERT && existing == null) {
            throw new IllegalArgumentException(operation + " requires the existing row");
        }
        if (operation != Operation.DELETE && proposed == null) {
            throw new IllegalArgumentException(operation + " requires the proposed row");
        }
        transition(OperationState.RECEIVED, table, operation);
        var predicate = predicate(table, operation, claims);
        var context = evaluator.rootContext(claims, source, this);
        if (existing != null) {
            var decision = checkExisting(predicate, existing, context);
            if (!decision.isAllowed()) {
                return decision;
            }
        }
        if (proposed != null) {
            var decision = checkProposed(predicate, proposed, context);
            if (!decision.isAllowed()) {
                return decision;
            }
        }
        recorder.recordWriteAllowed(table, operation);
        transition(OperationState.COMPLETED, table, operation);
        return WriteDecision.ALLOW;
    }

    /**
     * {@code using} half of a write decision: FILTERED when the caller may not touch {@code existing}.
     */
    WriteDecision checkExisting(EffectivePredicate predicate, Row existing, EvaluationContext context) {
        var decision = checkUsing(predicate, existing, context);
        if (decision == WriteDecision.FILTERED) {
            writeFiltered(predicate);
        }
        return decision;
    }

    /**
     * {@link #checkExisting} without counting a FILTERED outcome. Scans count only the hidden rows the caller's
     * own filter selects, through {@link #writeFiltered}.
     */
    WriteDecision checkUsing(EffectivePredicate predicate, Row existing, EvaluationContext context) {
        if (predicate.unrestricted()) {
            return WriteDecision.ALLOW;
        }
        if (predicate.defaultDeny()) {
            return denied(predicate, context.claims());
        }
        transition(OperationState.CHECKING, predicate.table(), predicate.operation());
        if (!test(predicate, predicate.using(), existing, context)) {
            transition(OperationState.COMPLETED, predicate.table(), predicate.operation());
            return WriteDecision.FILTERED;
        }
        return WriteDecision.ALLOW;
    }

    void writeFiltered(EffectivePredicate predicate) {
        recorder.recordWriteFiltered(predicate.table(), predicate.operation());
    }

    /**
     * Check half of a write decision: REJECT when {@code proposed} violates the check.
     */
    WriteDecision checkProposed(EffectivePredicate predicate, Row proposed, EvaluationContext context) {
        if (predicate.unrestricted()) {
            return WriteDecision.ALLOW;
        }
        if (predicate.defaultDeny()) {
            return denied(predicate, context.claims());
        }
        transition(OperationState.CHECKING, predicate.table(), predicate.operation());
        if (!test(predicate, predicate.check(), proposed, context)) {
            return reject(predicate.table(), predicate.operation(), context.claims(),
                    "new row violates row-level security policy for table \"%s\"".formatted(predicate.table()));
        }
        return WriteDecision.ALLOW;
    }

    private boolean test(EffectivePredicate predicate, JsonNode expression, Row row, EvaluationContext context) {
        try {
            return evaluator.test(expression, context.withRow(predicate.table(), row));
        } catch (PolicyEvaluationException e) {
            recorder.recordEvaluationError(predicate.table(), predicate.operation(), context.claims(), e);
            throw e;
        }
    }

    WriteDecision denied(EffectivePredicate predicate, ClaimsContext claims) {
        return reject(predicate.table(), predicate.operation(), claims,
                "no %s policy on table \"%s\" applies to role %s".formatted(predicate.operation(), predicate.table(), claims.role()));
    }

    /**
     * Sub-query scan of {@code table}: one level deeper, filtered by the table's own SELECT policies.
     */
    @Override
    public List<Row> read(String table, EvaluationContext context) {
        var nested = context.enter(table);
        var claims = nested.claims();
        var predicate = claims.hasBypass()
                ? EffectivePredicate.unrestricted(table, Operation.SELECT)
                : resolver.resolve(table, Operation.SELECT, claims);
        return filter(table, predicate, nested.source().rows(table), nested);
    }

    private static boolean readsOnly(JsonNode statement, String table) {
        if (!Transformations.IS_SELECT.apply(statement)) {
            return false;
        }
        var from = statement.get(FIELD_FROM_TABLE);
        return from != null && NODE_TYPE_BASE_TABLE.equals(from.path(FIELD_TYPE).asText())
                && table.equals(Transformations.toCatalogSchemaTable(from).table());
    }

    private List<Row> filter(String table, EffectivePredicate predicate, List<Row> rows, EvaluationContext context) {
        if (predicate.unrestricted()) {
            return rows;
        }
        if (predicate.defaultDeny()) {
            recorder.recordRowsFiltered(table, rows.size());
            return List.of();
        }
        var result = new ArrayList<Row>();
        for (var row : rows) {
            if (evaluator.test(predicate.using(), context.withRow(table, row))) {
                result.add(row);
            }
        }
        recorder.recordRowsFiltered(table, rows.size() - result.size());
        return result;
    }

    private WriteDecision reject(String table, Operation operation, ClaimsContext claims, String reason) {
        recorder.recordWriteRejected(table, operation, claims, reason);
        transition(OperationState.REJECTED, table, operation);
        return WriteDecision.reject(reason);
    }

    private static void transition(OperationState state, String table, Operation operation) {
        logger.atDebug().log("{} on {}: {}", operation, table, state);
    }
}
