package io.rowguard.sql.policy.enforce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rowguard.sql.commons.ExpressionFactory;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.Operation;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.eval.EvaluationContext;
import io.rowguard.sql.policy.eval.ExpressionEvaluator;
import io.rowguard.sql.policy.eval.Interval;
import io.rowguard.sql.policy.eval.Values;
import io.rowguard.sql.policy.resolve.PolicyResolver;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static io.rowguard.sql.commons.ExpressionConstants.*;

/**
 * Prepares a predicate for execution inside DuckDB: claim functions and definer calls become literals,
 * and every base table a sub-query scans is replaced by {@code (SELECT * FROM t WHERE <t's SELECT predicate>)}.
 * {@code now()} is left for DuckDB to evaluate.
 */
final class ClaimsBinder {

    private static final String AUTH_SCHEMA = "auth";

    private final ExpressionEvaluator evaluator;
    private final PolicyResolver resolver;

    ClaimsBinder(ExpressionEvaluator evaluator, PolicyResolver resolver) {
        this.evaluator = evaluator;
        this.resolver = resolver;
    }

    /**
     * @return bound copy; the input is not modified
     */
    JsonNode bind(JsonNode expression, EvaluationContext context) {
        if (expression == null || expression.isNull()) {
            return expression;
        }
        JsonNode wrapped;
        try {
            wrapped = Transformations.wrapSubQueries(expression, t -> tableFilter(t.table(), context));
        } catch (IllegalArgumentException e) {
            throw new PredicateEvaluationException(e.getMessage(), e);
        }
        return bindCalls(wrapped, context);
    }

    /**
     * Wraps every base table {@code query} reads, at any depth, with its SELECT predicate and binds claim calls.
     *
     * @return bound copy
     * @throws PredicateEvaluationException when the query contains a shape that cannot be filtered
     */
    ObjectNode bindSelect(JsonNode query, EvaluationContext context) {
        JsonNode wrapped;
        try {
            wrapped = Transformations.wrapBaseTables(query, t -> tableFilter(t.table(), context));
        } catch (IllegalArgumentException e) {
            throw new PredicateEvaluationException(e.getMessage(), e);
        }
        return (ObjectNode) bindCalls(wrapped, context);
    }

    /**
     * Like {@link #bindSelect} but in place, and the FROM clause of {@code select} is left alone.
     */
    void bindExpressions(ObjectNode select, EvaluationContext context) {
        try {
            Transformations.wrapAllButFromClause(select, t -> tableFilter(t.table(), context));
        } catch (IllegalArgumentException e) {
            throw new PredicateEvaluationException(e.getMessage(), e);
        }
        bindCalls(select, context);
    }

    /**
     * Bound SELECT predicate of {@code table}, or null when reads of it are not restricted.
     */
    JsonNode tableFilter(String table, EvaluationContext context) {
        if (context.claims().hasBypass()) {
            return null;
        }
        var predicate = resolver.resolve(table, Operation.SELECT, context.claims());
        if (predicate.unrestricted()) {
            return null;
        }
        return bind(predicate.using(), context.enter(table));
    }

    private JsonNode bindCalls(JsonNode tree, EvaluationContext context) {
        return Transformations.transform(tree, this::isBindableCall, n -> bindCall(n, context));
    }

    private boolean isBindableCall(JsonNode node) {
        if (!Transformations.IS_FUNCTION.apply(node)) {
            return false;
        }
        var schema = node.path(FIELD_SCHEMA).asText("");
        var name = node.path(FIELD_FUNCTION_NAME).asText();
        if (AUTH_SCHEMA.equalsIgnoreCase(schema)) {
            return true;
        }
        if ((name.equals("->") || name.equals("->>")) && node.path(FIELD_CHILDREN).size() == 2) {
            var document = node.path(FIELD_CHILDREN).get(0);
            var key = node.path(FIELD_CHILDREN).get(1);
            return Transformations.isFunction(AUTH_SCHEMA, "jwt").apply(document) && Transformations.IS_CONSTANT.apply(key);
        }
        return evaluator.definer(schema.isEmpty() ? name : schema + "." + name).isPresent();
    }

    private JsonNode bindCall(JsonNode call, EvaluationContext context) {
        if (!Transformations.collectReferences(call).isEmpty()) {
            throw new PredicateEvaluationException("cannot push down " + call.path(FIELD_FUNCTION_NAME).asText()
                    + " with column arguments, evaluate the policy row by row instead");
        }
        return literal(evaluator.evaluateValue(call, context));
    }

    static JsonNode literal(Object value) {
        var v = Values.normalize(value);
        if (v == null || v instanceof String || v instanceof Long || v instanceof Double || v instanceof Boolean) {
            return ExpressionFactory.constant(v);
        }
        if (v instanceof BigDecimal b) {
            return ExpressionFactory.cast(ExpressionFactory.constant(b.toPlainString()), TYPE_DOUBLE);
        }
        if (v instanceof BigInteger b) {
            return ExpressionFactory.cast(ExpressionFactory.constant(b.toString()), TYPE_HUGEINT);
        }
        if (v instanceof Instant) {
            return ExpressionFactory.cast(ExpressionFactory.constant(Values.toText(v)), TYPE_TIMESTAMP_TZ);
        }
        if (v instanceof LocalDate d) {
            return ExpressionFactory.cast(ExpressionFactory.constant(d.toString()), TYPE_DATE);
        }
        if (v instanceof Interval i) {
            return ExpressionFactory.cast(ExpressionFactory.constant(i.toString()), TYPE_INTERVAL);
        }
        if (v instanceof Map<?, ?>) {
            return ExpressionFactory.constant(Values.toText(v));
        }
        if (v instanceof List<?> list) {
            var elements = new JsonNode[list.size()];
            for (int i = 0; i < elements.length; i++) {
                elements[i] = literal(list.get(i));
            }
            return ExpressionFactory.function("", "list_value", elements);
        }
        throw new PredicateEvaluationException("cannot bind a " + Values.typeName(v) + " value into a query");
    }
}
