package io.rowguard.sql.commons;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

import static io.rowguard.sql.commons.ExpressionConstants.*;

/**
 * Builds DuckDB JSON AST expression nodes, the same shape {@code json_serialize_sql}
 * produces and {@code json_deserialize_sql} accepts.
 *
 * <p>Every node carries {@code class} and {@code type}; the remaining fields depend on the
 * node kind ({@code left}/{@code right} for comparisons, {@code children} for conjunctions,
 * operators and functions, {@code subquery} for sub-query expressions).
 *
 * <pre>{@code
 * // owner_id = auth.uid() OR is_public
 * JsonNode owner = ExpressionFactory.equalExpr(
 *         ExpressionFactory.reference("owner_id"),
 *         ExpressionFactory.function("auth", "uid"));
 * JsonNode predicate = ExpressionFactory.orFilters(owner, ExpressionFactory.reference("is_public"));
 * }</pre>
 *
 * <p>All builders reject null operands with {@link IllegalArgumentException}.
 *
 * @see Transformations for parsing and rewriting trees
 */
public class ExpressionFactory {

    /**
     * Column reference. Multi-part names qualify the column, e.g. {@code ["members", "user_id"]}.
     */
    public static JsonNode reference(String... value) {
        if (value == null) {
            throw new IllegalArgumentException("Column names array cannot be null");
        }
        if (value.length == 0) {
            throw new IllegalArgumentException("Column names array cannot be empty");
        }
        ObjectNode result = withClassType(COLUMN_REF_CLASS, COLUMN_REF_TYPE);
        ArrayNode arrayNode = new ArrayNode(JsonNodeFactory.instance);
        for (String string : value) {
            arrayNode.add(string);
        }
        result.set(FIELD_COLUMN_NAMES, arrayNode);
        return result;
    }

    public static JsonNode equalExpr(JsonNode left, JsonNode right) {
        return comparing(COMPARE_TYPE_EQUAL, left, right);
    }

    public static JsonNode notEqualExpr(JsonNode left, JsonNode right) {
        return comparing(COMPARE_TYPE_NOTEQUAL, left, right);
    }

    public static JsonNode lessThanExpr(JsonNode left, JsonNode right) {
        return comparing(COMPARE_TYPE_LESSTHAN, left, right);
    }

    public static JsonNode lessThanOrEqualExpr(JsonNode left, JsonNode right) {
        return comparing(COMPARE_TYPE_LESSTHANOREQUALTO, left, right);
    }

    public static JsonNode greaterThanExpr(JsonNode left, JsonNode right) {
        return comparing(COMPARE_TYPE_GREATERTHAN, left, right);
    }

    public static JsonNode greaterThanOrEqualExpr(JsonNode left, JsonNode right) {
        return comparing(COMPARE_TYPE_GREATERTHANOREQUALTO, left, right);
    }

    /**
     * Type cast, e.g. {@code CAST('1 day' AS INTERVAL)}.
     *
     * @param castType DuckDB logical type id such as {@code BOOLEAN}, {@code VARCHAR} or {@code INTERVAL}
     */
    public static JsonNode cast(JsonNode child, String castType) {
        requireNonNull(child, "Child node");
        if (castType == null || castType.isEmpty()) {
            throw new IllegalArgumentException("Cast type cannot be null or empty");
        }
        ObjectNode result = withClassType(CAST_CLASS, CAST_TYPE_OPERATOR);
        result.set(FIELD_CHILD, child);
        ObjectNode ct = new ObjectNode(JsonNodeFactory.instance);
        ct.put(FIELD_ID, castType);
        ct.set(FIELD_TYPE_INFO, null);
        result.set(FIELD_CAST_TYPE, ct);
        result.put(FIELD_TRY_CAST, false);
        return result;
    }

    public static JsonNode caseCheck(JsonNode when, JsonNode then) {
        requireNonNull(when, "When expression");
        requireNonNull(then, "Then expression");
        ObjectNode result = new ObjectNode(JsonNodeFactory.instance);
        result.set(FIELD_WHEN_EXPR, when);
        result.set(FIELD_THEN_EXPR, then);
        return result;
    }

    /**
     * {@code CASE WHEN condition THEN then ELSE elseExpression END}
     */
    public static JsonNode ifExpr(JsonNode condition, JsonNode then, JsonNode elseExpression) {
        requireNonNull(condition, "Condition");
        requireNonNull(elseExpression, "Else expression");
        ObjectNode result = withClassType(CASE_CLASS, CASE_TYPE_EXPR);
        ArrayNode caseChecks = new ArrayNode(JsonNodeFactory.instance);
        caseChecks.add(caseCheck(condition, then));
        result.set(FIELD_CASE_CHECKS, caseChecks);
        result.set(FIELD_ELSE_EXPR, elseExpression);
        return result;
    }

    public static JsonNode trueExpression() {
        return cast(constant(CONSTANT_VALUE_TRUE), TYPE_BOOLEAN);
    }

    public static JsonNode falseExpression() {
        return cast(constant(CONSTANT_VALUE_FALSE), TYPE_BOOLEAN);
    }

    /**
     * Constant value node. Supported types: String, Integer, Long, Double, Float, Boolean and null.
     */
    public static JsonNode constant(Object value) {
        ObjectNode result = withClassType(CONSTANT_CLASS, CONSTANT_TYPE);
        result.set(FIELD_VALUE, constantValueNode(value));
        return result;
    }

    public static JsonNode andFilters(JsonNode leftFilter, JsonNode rightFilter) {
        requireNonNull(leftFilter, "Left filter");
        requireNonNull(rightFilter, "Right filter");
        return andFilters(new JsonNode[]{leftFilter, rightFilter});
    }

    public static JsonNode andFilters(JsonNode[] children) {
        return conjunction(CONJUNCTION_TYPE_AND, children);
    }

    public static JsonNode orFilters(JsonNode leftFilter, JsonNode rightFilter) {
        requireNonNull(leftFilter, "Left filter");
        requireNonNull(rightFilter, "Right filter");
        return orFilters(new JsonNode[]{leftFilter, rightFilter});
    }

    /**
     * OR of all children. A single child is returned as is.
     */
    public static JsonNode orFilters(JsonNode[] children) {
        if (children != null && children.length == 1) {
            requireNonNull(children[0], "Child filter");
            return children[0];
        }
        return conjunction(CONJUNCTION_TYPE_OR, children);
    }

    public static JsonNode notExpr(JsonNode child) {
        return operator(OPERATOR_NOT_TYPE, child);
    }

    public static JsonNode isNullExpr(JsonNode child) {
        return operator(OPERATOR_IS_NULL_TYPE, child);
    }

    public static JsonNode isNotNullExpr(JsonNode child) {
        return operator(OPERATOR_IS_NOT_NULL_TYPE, child);
    }

    /**
     * {@code reference IN (e1, e2, ...)}
     */
    public static <T> JsonNode inStaticList(JsonNode reference, List<T> elements) {
        requireNonNull(reference, "Reference");
        if (elements == null) {
            throw new IllegalArgumentException("Elements list cannot be null");
        }
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Elements list cannot be empty - IN clause requires at least one element");
        }
        ObjectNode result = withClassType(OPERATOR_CLASS, COMPARE_IN_TYPE);
        var children = new ArrayNode(JsonNodeFactory.instance);
        children.add(reference);
        for (var e : elements) {
            children.add(constant(e));
        }
        result.set(FIELD_CHILDREN, children);
        return result;
    }

    /**
     * Function call node.
     *
     * @param name function name, or the operator symbol when {@code isOperator} is set
     * @param schema schema qualifier, empty for none ({@code auth} in {@code auth.uid()})
     * @param catalog catalog qualifier, empty for none
     * @param children arguments
     */
    public static JsonNode createFunction(String name, String schema, String catalog, JsonNode children) {
        return createFunction(name, schema, catalog, children, false);
    }

    public static JsonNode createFunction(String name, String schema, String catalog, JsonNode children, boolean isOperator) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be null or empty");
        }
        if (schema == null) {
            throw new IllegalArgumentException("Schema cannot be null (use empty string for default)");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null (use empty string for default)");
        }
        requireNonNull(children, "Children");
        var orderBy = new ObjectNode(JsonNodeFactory.instance);
        orderBy.put(FIELD_TYPE, TYPE_ORDER_MODIFIER);
        orderBy.set(FIELD_ORDERS, new ArrayNode(JsonNodeFactory.instance));
        var input = withClassType(FUNCTION_CLASS, FUNCTION_TYPE);
        input.put(FIELD_FUNCTION_NAME, name);
        input.put(FIELD_SCHEMA, schema);
        input.put(FIELD_CATALOG, catalog);
        input.put(FIELD_DISTINCT, false);
        input.put(FIELD_IS_OPERATOR, isOperator);
        input.put(FIELD_EXPORT_STATE, false);
        input.set(FIELD_CHILDREN, children);
        input.set(FIELD_FILTER, null);
        input.set(FIELD_ORDER_BYS, orderBy);
        return input;
    }

    /**
     * Schema qualified function call such as {@code auth.uid()} or {@code lower(email)}.
     */
    public static JsonNode function(String schema, String name, JsonNode... arguments) {
        return createFunction(name, schema, "", arrayOf(arguments));
    }

    /**
     * Binary operator call such as {@code now() - to_days(1)} or {@code a || b}.
     */
    public static JsonNode binaryOperator(String symbol, JsonNode left, JsonNode right) {
        requireNonNull(left, "Left operand");
        requireNonNull(right, "Right operand");
        return createFunction(symbol, "", "", arrayOf(left, right), true);
    }

    /**
     * {@code SELECT <projection> FROM <table> WHERE <where>} select node, usable inside
     * {@link #subquery(String, JsonNode, JsonNode, String)}.
     *
     * @param where may be null for no filter
     */
    public static JsonNode selectNode(String table, JsonNode projection, JsonNode where) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Table cannot be null or empty");
        }
        requireNonNull(projection, "Projection");
        var from = new ObjectNode(JsonNodeFactory.instance);
        from.put(FIELD_TYPE, NODE_TYPE_BASE_TABLE);
        from.put(FIELD_ALIAS, "");
        from.put(FIELD_CATALOG_NAME, "");
        from.put(FIELD_SCHEMA_NAME, "");
        from.put(FIELD_TABLE_NAME, table);
        var select = new ObjectNode(JsonNodeFactory.instance);
        select.put(FIELD_TYPE, SELECT_NODE_TYPE);
        select.set(FIELD_SELECT_LIST, arrayOf(projection));
        select.set(FIELD_FROM_TABLE, from);
        select.set(FIELD_WHERE_CLAUSE, where == null ? NullNode.getInstance() : where);
        return select;
    }

    /**
     * Sub-query expression.
     *
     * @param subqueryType one of EXISTS, NOT_EXISTS, ANY, SCALAR
     * @param child left operand for ANY, null otherwise
     * @param comparisonType comparison used for ANY, null otherwise
     */
    public static JsonNode subquery(String subqueryType, JsonNode selectNode, JsonNode child, String comparisonType) {
        requireNonNull(selectNode, "Select node");
        ObjectNode result = withClassType(SUBQUERY_CLASS, SUBQUERY_TYPE);
        result.put(FIELD_SUBQUERY_TYPE, subqueryType);
        var statement = new ObjectNode(JsonNodeFactory.instance);
        statement.set(FIELD_NODE, selectNode);
        result.set(FIELD_SUBQUERY, statement);
        if (child != null) {
            result.set(FIELD_CHILD, child);
            result.put(FIELD_COMPARISON_TYPE, comparisonType == null ? COMPARE_TYPE_EQUAL : comparisonType);
        }
        return result;
    }

    /**
     * {@code child IN (SELECT ...)}
     */
    public static JsonNode inSubquery(JsonNode child, JsonNode selectNode) {
        requireNonNull(child, "Child");
        return subquery(SUBQUERY_TYPE_ANY, selectNode, child, COMPARE_TYPE_EQUAL);
    }

    public static JsonNode exists(JsonNode selectNode) {
        return subquery(SUBQUERY_TYPE_EXISTS, selectNode, null, null);
    }

    private static JsonNode conjunction(String type, JsonNode[] children) {
        if (children == null) {
            throw new IllegalArgumentException("Children array cannot be null");
        }
        if (children.length == 0) {
            throw new IllegalArgumentException("Children array cannot be empty - conjunction requires at least one child");
        }
        ObjectNode result = withClassType(CONJUNCTION_CLASS, type);
        ArrayNode arrayNode = new ArrayNode(JsonNodeFactory.instance);
        for (var c : children) {
            requireNonNull(c, "Child filter");
            arrayNode.add(c);
        }
        result.set(FIELD_CHILDREN, arrayNode);
        return result;
    }

    private static JsonNode operator(String type, JsonNode child) {
        requireNonNull(child, "Child");
        ObjectNode result = withClassType(OPERATOR_CLASS, type);
        result.set(FIELD_CHILDREN, arrayOf(child));
        return result;
    }

    private static ArrayNode arrayOf(JsonNode... nodes) {
        var array = new ArrayNode(JsonNodeFactory.instance);
        if (nodes != null) {
            for (var n : nodes) {
                requireNonNull(n, "Argument");
                array.add(n);
            }
        }
        return array;
    }

    private static JsonNode constantValueNode(Object value) {
        ObjectNode valueNode = new ObjectNode(JsonNodeFactory.instance);
        ObjectNode type = new ObjectNode(JsonNodeFactory.instance);
        valueNode.set(FIELD_TYPE, type);
        type.set(FIELD_TYPE_INFO, null);
        if (value == null) {
            valueNode.put(FIELD_IS_NULL, true);
            type.put(FIELD_ID, TYPE_NULL);
        } else {
            valueNode.put(FIELD_IS_NULL, false);
            if (value instanceof String string) {
                type.put(FIELD_ID, TYPE_VARCHAR);
                valueNode.put(FIELD_VALUE, string);
            } else if (value instanceof Integer i) {
                type.put(FIELD_ID, TYPE_INTEGER);
                valueNode.put(FIELD_VALUE, i);
            } else if (value instanceof Long l) {
                type.put(FIELD_ID, TYPE_BIGINT);
                valueNode.put(FIELD_VALUE, l);
            } else if (value instanceof Double d) {
                type.put(FIELD_ID, TYPE_DOUBLE);
                valueNode.put(FIELD_VALUE, d);
            } else if (value instanceof Float f) {
                type.put(FIELD_ID, TYPE_FLOAT);
                valueNode.put(FIELD_VALUE, f);
            } else if (value instanceof Boolean b) {
                type.put(FIELD_ID, TYPE_BOOLEAN);
                valueNode.put(FIELD_VALUE, b);
            } else {
                throw new IllegalArgumentException(
                    "Unsupported constant type: " + value.getClass().getName() +
                    ". Supported types: String, Integer, Long, Double, Float, Boolean, null");
            }
        }
        return valueNode;
    }

    private static ObjectNode withClassType(String clazz, String type) {
        ObjectNode result = new ObjectNode(JsonNodeFactory.instance);
        result.put(FIELD_CLASS, clazz);
        result.put(FIELD_TYPE, type);
        result.put(FIELD_ALIAS, "");
        result.put(FIELD_QUERY_LOCATION, 0);
        return result;
    }

    private static JsonNode comparing(String type, JsonNode left, JsonNode right) {
        requireNonNull(left, "Left operand");
        requireNonNull(right, "Right operand");
        ObjectNode node = withClassType(COMPARISON_CLASS, type);
        node.set(FIELD_LEFT, left);
        node.set(FIELD_RIGHT, right);
        return node;
    }

    private static void requireNonNull(Object value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
    }
}
