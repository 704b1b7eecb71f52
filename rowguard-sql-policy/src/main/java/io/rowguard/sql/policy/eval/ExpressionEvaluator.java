package io.rowguard.sql.policy.eval;

import com.fasterxml.jackson.databind.JsonNode;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.Row;
import io.rowguard.sql.policy.claims.ClaimsContext;
import io.rowguard.sql.policy.storage.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static io.rowguard.sql.commons.ExpressionConstants.*;
import static io.rowguard.sql.policy.ConfigConstants.DEFAULT_MAX_RECURSION_DEPTH;

/**
 * Evaluates DuckDB JSON expression trees against rows with SQL three valued logic.
 * A predicate admits a row only when it evaluates to TRUE; FALSE and NULL both exclude it.
 *
 * <p>Sub-queries are run as nested loops over {@link EvaluationContext#read(String)}, so every table
 * they scan is itself filtered by row level security.
 */
public class ExpressionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final String AUTH_SCHEMA = "auth";
    private static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);

    private final Map<String, DefinerFunction> definers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxDepth;

    public ExpressionEvaluator() {
        this(Clock.systemUTC(), DEFAULT_MAX_RECURSION_DEPTH);
    }

    public ExpressionEvaluator(Clock clock, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    public void register(DefinerFunction function) {
        definers.put(function.name().toLowerCase(Locale.ROOT), function);
    }

    public Optional<DefinerFunction> definer(String qualifiedName) {
        return Optional.ofNullable(definers.get(qualifiedName.toLowerCase(Locale.ROOT)));
    }

    public Clock clock() {
        return clock;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public EvaluationContext rootContext(ClaimsContext claims, RowSource source, TableReader reader) {
        return EvaluationContext.root(claims, source, reader, Instant.now(clock), maxDepth);
    }

    /**
     * Evaluates a predicate with no access to other tables; any sub-query fails.
     */
    public boolean evaluate(JsonNode predicate, Row row, ClaimsContext claims) {
        return test(predicate, rootContext(claims, null, null).withRow(null, row));
    }

    /**
     * @return true only when the predicate is TRUE
     */
    public boolean test(JsonNode predicate, EvaluationContext context) {
        return Boolean.TRUE.equals(condition(predicate, context));
    }

    /**
     * @return TRUE, FALSE or null for UNKNOWN
     * @throws PredicateEvaluationException if the predicate does not produce a boolean
     */
    public Boolean condition(JsonNode predicate, EvaluationContext context) {
        return Values.toBoolean(evaluateValue(predicate, context));
    }

    public Object evaluateValue(JsonNode node, EvaluationContext context) {
        if (node == null || node.isNull()) {
            throw new PredicateEvaluationException("missing expression");
        }
        var clazz = node.path(FIELD_CLASS).asText();
        switch (clazz) {
            case CONSTANT_CLASS -> {
                return constant(node.get(FIELD_VALUE));
            }
            case COLUMN_REF_CLASS -> {
                return reference(node, context);
            }
            case COMPARISON_CLASS -> {
                var left = evaluateValue(node.get(FIELD_LEFT), context);
                var right = evaluateValue(node.get(FIELD_RIGHT), context);
                return Values.compare(node.get(FIELD_TYPE).asText(), left, right);
            }
            case CONJUNCTION_CLASS -> {
                return conjunction(node, context);
            }
            case OPERATOR_CLASS -> {
                return operator(node, context);
            }
            case BETWEEN_CLASS -> {
                var input = evaluateValue(node.get(FIELD_INPUT), context);
                var lower = Values.compare(COMPARE_TYPE_GREATERTHANOREQUALTO, input, evaluateValue(node.get(FIELD_LOWER), context));
                var upper = Values.compare(COMPARE_TYPE_LESSTHANOREQUALTO, input, evaluateValue(node.get(FIELD_UPPER), context));
                return and(lower, upper);
            }
            case CASE_CLASS -> {
                for (var check : node.path(FIELD_CASE_CHECKS)) {
                    if (test(check.get(FIELD_WHEN_EXPR), context)) {
                        return evaluateValue(check.get(FIELD_THEN_EXPR), context);
                    }
                }
                var elseExpr = node.get(FIELD_ELSE_EXPR);
                return elseExpr == null || elseExpr.isNull() ? null : evaluateValue(elseExpr, context);
            }
            case CAST_CLASS -> {
                return cast(node, context);
            }
            case FUNCTION_CLASS -> {
                return function(node, context);
            }
            case SUBQUERY_CLASS -> {
                return subquery(node, context);
            }
            default -> throw new PredicateEvaluationException("unsupported expression " + clazz + "/" + node.path(FIELD_TYPE).asText());
        }
    }

    /**
     * Runs a SELECT and returns its projected rows. Supports base tables, joins and derived tables in
     * FROM, a WHERE clause, DISTINCT and LIMIT. Grouping and aggregation are not supported.
     */
    public List<Row> query(JsonNode select, EvaluationContext context) {
        if (!Transformations.IS_SELECT.apply(select)) {
            throw new PredicateEvaluationException("only SELECT sub-queries are supported, got " + select.path(FIELD_TYPE).asText());
        }
        if (select.path("group_expressions").size() > 0 || !isNull(select.get("having"))) {
            throw new PredicateEvaluationException("grouping is not supported in policy sub-queries");
        }
        if (select.path(FIELD_CTE_MAP).path("map").size() > 0) {
            throw new PredicateEvaluationException("common table expressions are not supported in policy sub-queries");
        }
        boolean distinct = false;
        long limit = Long.MAX_VALUE;
        long offset = 0;
        for (var modifier : select.path("modifiers")) {
            switch (modifier.path(FIELD_TYPE).asText()) {
                case "DISTINCT_MODIFIER" -> distinct = true;
                case "LIMIT_MODIFIER" -> {
                    if (!isNull(modifier.get("limit"))) {
                        limit = toLong(evaluateValue(modifier.get("limit"), context), "LIMIT");
                    }
                    if (!isNull(modifier.get("offset"))) {
                        offset = toLong(evaluateValue(modifier.get("offset"), context), "OFFSET");
                    }
                }
                default -> {
                    // ORDER BY does not change which rows a predicate sees unless combined with LIMIT
                }
            }
        }
        var rows = new ArrayList<Row>();
        var seen = distinct ? new HashSet<Row>() : null;
        long skipped = 0;
        for (var frame : frames(select, context)) {
            var row = project(select.get(FIELD_SELECT_LIST), frame);
            if (seen != null && !seen.add(row)) {
                continue;
            }
            if (skipped < offset) {
                skipped++;
                continue;
            }
            if (rows.size() >= limit) {
                break;
            }
            rows.add(row);
        }
        return rows;
    }

    private List<EvaluationContext> frames(JsonNode select, EvaluationContext context) {
        var where = select.get(FIELD_WHERE_CLAUSE);
        var result = new ArrayList<EvaluationContext>();
        for (var frame : tableFrames(select.get(FIELD_FROM_TABLE), context)) {
            var frameContext = context.withFrame(frame);
            if (isNull(where) || test(where, frameContext)) {
                result.add(frameContext);
            }
        }
        return result;
    }

    private List<List<Scope.Binding>> tableFrames(JsonNode ref, EvaluationContext context) {
        if (isNull(ref)) {
            return List.of(List.of());
        }
        switch (ref.path(FIELD_TYPE).asText()) {
            case "EMPTY" -> {
                return List.of(List.of());
            }
            case NODE_TYPE_BASE_TABLE -> {
                var table = ref.get(FIELD_TABLE_NAME).asText();
                var qualifier = qualifier(ref, table);
                var result = new ArrayList<List<Scope.Binding>>();
                for (var row : context.read(table)) {
                    result.add(List.of(new Scope.Binding(qualifier, row)));
                }
                return result;
            }
            case NODE_TYPE_SUBQUERY -> {
                var qualifier = qualifier(ref, null);
                var result = new ArrayList<List<Scope.Binding>>();
                for (var row : query(ref.get(FIELD_SUBQUERY).get(FIELD_NODE), context)) {
                    result.add(List.of(new Scope.Binding(qualifier, row)));
                }
                return result;
            }
            case NODE_TYPE_JOIN -> {
                return join(ref, context);
            }
            default -> throw new PredicateEvaluationException("unsupported table reference " + ref.path(FIELD_TYPE).asText());
        }
    }

    private List<List<Scope.Binding>> join(JsonNode ref, EvaluationContext context) {
        var refType = ref.path("ref_type").asText("REGULAR");
        if (!refType.equals("REGULAR") && !refType.equals("CROSS")) {
            throw new PredicateEvaluationException(refType + " joins are not supported");
        }
        var joinType = ref.path(FIELD_JOIN_TYPE).asText(JOIN_TYPE_INNER);
        boolean keepLeft = joinType.equals(JOIN_TYPE_LEFT) || joinType.equals("OUTER");
        boolean keepRight = joinType.equals("RIGHT") || joinType.equals("OUTER");
        if (!keepLeft && !keepRight && !joinType.equals(JOIN_TYPE_INNER)) {
            throw new PredicateEvaluationException(joinType + " joins are not supported");
        }
        var left = tableFrames(ref.get(FIELD_LEFT), context);
        var right = tableFrames(ref.get(FIELD_RIGHT), context);
        var condition = ref.get(FIELD_CONDITION);
        var usingColumns = ref.path("using_columns");
        var rightMatched = new boolean[right.size()];
        var result = new ArrayList<List<Scope.Binding>>();
        for (var l : left) {
            boolean matched = false;
            for (int i = 0; i < right.size(); i++) {
                var combined = concat(l, right.get(i));
                if (joinMatches(combined, l, right.get(i), condition, usingColumns, context)) {
                    result.add(combined);
                    matched = true;
                    rightMatched[i] = true;
                }
            }
            if (!matched && keepLeft) {
                result.add(concat(l, nullFrame(ref.get(FIELD_RIGHT), context)));
            }
        }
        if (keepRight) {
            for (int i = 0; i < right.size(); i++) {
                if (!rightMatched[i]) {
                    result.add(concat(nullFrame(ref.get(FIELD_LEFT), context), right.get(i)));
                }
            }
        }
        return result;
    }

    private boolean joinMatches(List<Scope.Binding> combined, List<Scope.Binding> left, List<Scope.Binding> right,
                                JsonNode condition, JsonNode usingColumns, EvaluationContext context) {
        for (var column : usingColumns) {
            var name = new String[]{column.asText()};
            var l = Scope.EMPTY.push(left).resolve(name);
            var r = Scope.EMPTY.push(right).resolve(name);
            if (!Boolean.TRUE.equals(Values.equal(l, r))) {
                return false;
            }
        }
        return isNull(condition) || test(condition, context.withFrame(combined));
    }

    private List<Scope.Binding> nullFrame(JsonNode ref, EvaluationContext context) {
        switch (ref.path(FIELD_TYPE).asText()) {
            case NODE_TYPE_BASE_TABLE -> {
                var table = ref.get(FIELD_TABLE_NAME).asText();
                return List.of(new Scope.Binding(qualifier(ref, table), Row.nulls(context.columns(table))));
            }
            case NODE_TYPE_JOIN -> {
                return concat(nullFrame(ref.get(FIELD_LEFT), context), nullFrame(ref.get(FIELD_RIGHT), context));
            }
            case NODE_TYPE_SUBQUERY -> {
                var select = ref.get(FIELD_SUBQUERY).get(FIELD_NODE);
                var names = new ArrayList<String>();
                int i = 0;
                for (var expr : select.path(FIELD_SELECT_LIST)) {
                    if (STAR_CLASS.equals(expr.path(FIELD_CLASS).asText())) {
                        throw new PredicateEvaluationException("outer join on a derived table with * is not supported");
                    }
                    names.add(columnName(expr, i++));
                }
                return List.of(new Scope.Binding(qualifier(ref, null), Row.nulls(names)));
            }
            default -> throw new PredicateEvaluationException("unsupported table reference " + ref.path(FIELD_TYPE).asText());
        }
    }

    private Row project(JsonNode selectList, EvaluationContext frame) {
        var values = new LinkedHashMap<String, Object>();
        int i = 0;
        for (var expr : selectList) {
            if (STAR_CLASS.equals(expr.path(FIELD_CLASS).asText())) {
                for (var binding : frame.scope().bindings()) {
                    for (var column : binding.row().columns()) {
                        values.putIfAbsent(column, Values.normalize(binding.row().get(column)));
                    }
                }
            } else {
                values.put(columnName(expr, i), evaluateValue(expr, frame));
            }
            i++;
        }
        return Row.of(values);
    }

    private static String columnName(JsonNode expr, int position) {
        var alias = expr.path(FIELD_ALIAS).asText("");
        if (!alias.isEmpty()) {
            return alias;
        }
        if (Transformations.IS_REFERENCE.apply(expr)) {
            var names = Transformations.getReferenceName(expr);
            return names[names.length - 1];
        }
        return "col" + position;
    }

    private Object subquery(JsonNode node, EvaluationContext context) {
        var select = node.get(FIELD_SUBQUERY).get(FIELD_NODE);
        var type = node.path(FIELD_SUBQUERY_TYPE).asText();
        switch (type) {
            case SUBQUERY_TYPE_EXISTS -> {
                return !query(select, context).isEmpty();
            }
            case SUBQUERY_TYPE_NOT_EXISTS -> {
                return query(select, context).isEmpty();
            }
            case SUBQUERY_TYPE_SCALAR -> {
                var rows = query(select, context);
                if (rows.size() > 1) {
                    throw new PredicateEvaluationException("more than one row returned by a sub-query used as an expression");
                }
                return rows.isEmpty() ? null : single(rows.get(0));
            }
            case SUBQUERY_TYPE_ANY -> {
                var value = evaluateValue(node.get(FIELD_CHILD), context);
                var comparison = node.path(FIELD_COMPARISON_TYPE).asText(COMPARE_TYPE_EQUAL);
                Boolean result = false;
                for (var row : query(select, context)) {
                    var r = Values.compare(comparison, value, single(row));
                    if (Boolean.TRUE.equals(r)) {
                        return true;
                    }
                    if (r == null) {
                        result = null;
                    }
                }
                return result;
            }
            default -> throw new PredicateEvaluationException("unsupported sub-query type " + type);
        }
    }

    /**
     * Bare {@code current_date} and {@code current_timestamp} name the keyword functions unless a table in scope
     * has such a column.
     */
    private Object reference(JsonNode node, EvaluationContext context) {
        var names = Transformations.getReferenceName(node);
        if (names.length == 1 && BuiltinFunctions.isKeyword(names[0]) && !context.scope().binds(names[0])) {
            return BuiltinFunctions.call(names[0], List.of(), context);
        }
        return context.scope().resolve(names);
    }

    private static Object single(Row row) {
        if (row.size() != 1) {
            throw new PredicateEvaluationException("sub-query must return only one column");
        }
        return row.asMap().values().iterator().next();
    }

    /**
     * Every child is evaluated, so an invalid branch fails the predicate even when another branch decides it.
     */
    private Object conjunction(JsonNode node, EvaluationContext context) {
        boolean isAnd = CONJUNCTION_TYPE_AND.equals(node.path(FIELD_TYPE).asText());
        Boolean result = isAnd;
        boolean decided = false;
        for (var child : node.path(FIELD_CHILDREN)) {
            var value = condition(child, context);
            if (decided) {
                continue;
            }
            if (value == null) {
                result = null;
            } else if (value != isAnd) {
                result = value;
                decided = true;
            }
        }
        return result;
    }

    private Object operator(JsonNode node, EvaluationContext context) {
        var type = node.path(FIELD_TYPE).asText();
        var children = node.path(FIELD_CHILDREN);
        switch (type) {
            case OPERATOR_NOT_TYPE -> {
                var value = condition(children.get(0), context);
                return value == null ? null : !value;
            }
            case OPERATOR_IS_NULL_TYPE -> {
                return evaluateValue(children.get(0), context) == null;
            }
            case OPERATOR_IS_NOT_NULL_TYPE -> {
                return evaluateValue(children.get(0), context) != null;
            }
            case COMPARE_IN_TYPE, COMPARE_NOT_IN_TYPE -> {
                var value = evaluateValue(children.get(0), context);
                Boolean found = false;
                for (int i = 1; i < children.size(); i++) {
                    var r = Values.equal(value, evaluateValue(children.get(i), context));
                    if (Boolean.TRUE.equals(r)) {
                        found = true;
                        break;
                    }
                    if (r == null) {
                        found = null;
                    }
                }
                if (COMPARE_IN_TYPE.equals(type) || found == null) {
                    return found;
                }
                return !found;
            }
            case OPERATOR_COALESCE_TYPE -> {
                for (var child : children) {
                    var value = evaluateValue(child, context);
                    if (value != null) {
                        return value;
                    }
                }
                return null;
            }
            default -> throw new PredicateEvaluationException("unsupported operator " + type);
        }
    }

    private Object cast(JsonNode node, EvaluationContext context) {
        var value = evaluateValue(node.get(FIELD_CHILD), context);
        var castType = node.get(FIELD_CAST_TYPE);
        var target = castType.path(FIELD_ID).asText();
        var typeInfo = castType.get(FIELD_TYPE_INFO);
        if (node.path(FIELD_TRY_CAST).asBoolean(false)) {
            try {
                return Values.cast(value, target, typeInfo);
            } catch (PredicateEvaluationException e) {
                logger.debug("TRY_CAST of {} to {} gives NULL: {}", value, target, e.getMessage());
                return null;
            }
        }
        return Values.cast(value, target, typeInfo);
    }

    private Object function(JsonNode node, EvaluationContext context) {
        var name = node.path(FIELD_FUNCTION_NAME).asText();
        var schema = node.path(FIELD_SCHEMA).asText("");
        if (node.path(FIELD_DISTINCT).asBoolean(false) || !isNull(node.get(FIELD_FILTER))
                || node.path(FIELD_ORDER_BYS).path(FIELD_ORDERS).size() > 0) {
            throw new PredicateEvaluationException("aggregate function " + name + " is not supported in policies");
        }
        if (AUTH_SCHEMA.equalsIgnoreCase(schema)) {
            expectNoArguments(node, schema + "." + name);
            return auth(name, context.claims());
        }
        var qualified = schema.isEmpty() ? name : schema + "." + name;
        var definer = definer(qualified);
        if (definer.isPresent()) {
            var args = arguments(node, context);
            var fn = definer.get();
            return fn.invoke(args, context.enter(fn.name()).asDefiner(fn.tables()), this);
        }
        if (!schema.isEmpty() && !schema.equalsIgnoreCase("main") && !schema.equalsIgnoreCase("pg_catalog")) {
            throw new PredicateEvaluationException("function " + qualified + " does not exist or is not allowed in policies");
        }
        return BuiltinFunctions.call(name, arguments(node, context), context);
    }

    private List<Object> arguments(JsonNode node, EvaluationContext context) {
        var args = new ArrayList<>();
        for (var child : node.path(FIELD_CHILDREN)) {
            args.add(evaluateValue(child, context));
        }
        return args;
    }

    private static void expectNoArguments(JsonNode node, String name) {
        if (node.path(FIELD_CHILDREN).size() > 0) {
            throw new PredicateEvaluationException(name + "() takes no arguments");
        }
    }

    private static Object auth(String name, ClaimsContext claims) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "uid" -> {
                return claims.id();
            }
            case "role" -> {
                return claims.role();
            }
            case "email" -> {
                return claims.email();
            }
            case "jwt" -> {
                return claims.jwt();
            }
            default -> throw new PredicateEvaluationException("function auth." + name + " does not exist");
        }
    }

    /**
     * Decodes the {@code value} object of a CONSTANT node.
     */
    static Object constant(JsonNode value) {
        if (value == null || value.path(FIELD_IS_NULL).asBoolean(false)) {
            return null;
        }
        var type = value.path(FIELD_TYPE).path(FIELD_ID).asText();
        var v = value.get(FIELD_VALUE);
        if (v == null || v.isNull()) {
            return null;
        }
        switch (type) {
            case TYPE_NULL -> {
                return null;
            }
            case TYPE_VARCHAR -> {
                return v.asText();
            }
            case TYPE_BOOLEAN -> {
                return v.isBoolean() ? v.booleanValue() : Values.cast(v.asText(), TYPE_BOOLEAN, null);
            }
            case TYPE_TINYINT, TYPE_SMALLINT, TYPE_INTEGER, TYPE_BIGINT, "UTINYINT", "USMALLINT", "UINTEGER" -> {
                return v.asLong();
            }
            case "UBIGINT" -> {
                return Values.normalize(v.bigIntegerValue());
            }
            case TYPE_HUGEINT, "UHUGEINT" -> {
                if (v.isObject()) {
                    var upper = BigInteger.valueOf(v.path("upper").asLong());
                    var lower = new BigInteger(Long.toUnsignedString(v.path("lower").asLong()));
                    return Values.normalize(upper.multiply(TWO_TO_64).add(lower));
                }
                return Values.normalize(v.isNumber() ? v.bigIntegerValue() : new BigInteger(v.asText()));
            }
            case TYPE_DOUBLE, TYPE_FLOAT -> {
                return v.asDouble();
            }
            case TYPE_DECIMAL -> {
                if (v.isTextual()) {
                    return new BigDecimal(v.asText());
                }
                var scale = value.path(FIELD_TYPE).path(FIELD_TYPE_INFO).path(FIELD_SCALE).asInt(0);
                return new BigDecimal(v.bigIntegerValue(), scale);
            }
            case TYPE_DATE -> {
                var days = v.isObject() ? v.path(FIELD_DAYS).asLong() : v.asLong();
                return LocalDate.ofEpochDay(days);
            }
            case TYPE_TIMESTAMP, TYPE_TIMESTAMP_TZ, "TIMESTAMP_TZ" -> {
                var micros = v.isObject() ? v.path("value").asLong() : v.asLong();
                return Instant.EPOCH.plus(micros, java.time.temporal.ChronoUnit.MICROS);
            }
            case TYPE_INTERVAL -> {
                return new Interval(v.path(FIELD_MONTHS).asInt(), v.path(FIELD_DAYS).asInt(), v.path(FIELD_MICROS).asLong());
            }
            default -> throw new PredicateEvaluationException("unsupported constant type " + type);
        }
    }

    private static long toLong(Object value, String clause) {
        var v = Values.normalize(value);
        if (!(v instanceof Long l) || l < 0) {
            throw new PredicateEvaluationException(clause + " must be a non negative integer, got " + value);
        }
        return l;
    }

    private static List<Scope.Binding> concat(List<Scope.Binding> left, List<Scope.Binding> right) {
        var result = new ArrayList<Scope.Binding>(left.size() + right.size());
        result.addAll(left);
        result.addAll(right);
        return result;
    }

    private static String qualifier(JsonNode ref, String fallback) {
        var alias = ref.path(FIELD_ALIAS).asText("");
        return alias.isEmpty() ? fallback : alias;
    }

    private static Boolean and(Boolean left, Boolean right) {
        if (Boolean.FALSE.equals(left) || Boolean.FALSE.equals(right)) {
            return false;
        }
        if (left == null || right == null) {
            return null;
        }
        return true;
    }

    private static boolean isNull(JsonNode node) {
        return node == null || node.isNull();
    }
}
