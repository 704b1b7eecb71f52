package io.rowguard.sql.commons;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.sql.Connection;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Function;

import static io.rowguard.sql.commons.ExpressionConstants.*;

/**
 * Utility class for SQL Abstract Syntax Tree (AST) transformations.
 *
 * <p>This class provides functions to:
 * <ul>
 *   <li>Parse SQL queries and filter expressions into JSON AST using DuckDB's json_serialize_sql</li>
 *   <li>Walk and rewrite AST nodes (filter injection, table wrapping, node replacement)</li>
 *   <li>Serialize AST back to SQL using json_deserialize_sql</li>
 * </ul>
 *
 * <p>Rewriting helpers never mutate their input; they return deep copies.
 *
 * @see ExpressionFactory for creating new AST nodes
 */
public class Transformations {

    public record CatalogSchemaTable(String catalog, String schema, String table, String alias) {
        /**
         * Name column references use to qualify this table: the alias when present, else the table name.
         */
        public String qualifier() {
            return alias == null || alias.isEmpty() ? table : alias;
        }
    }

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String JSON_SERIALIZE_SQL = "SELECT  cast(json_serialize_sql('%s') as string)";

    public static final String JSON_DESERIALIZE_SQL = "SELECT json_deserialize_sql( cast('%s' as json))";

    private static final String FILTER_TEMPLATE = "select * from t where %s";

    private static final String FILTERED_TABLE_TEMPLATE = "select * from (select * from t where true) as t";

    private static volatile JsonNode filteredTableTemplate;

    public static final Function<JsonNode, Boolean> IS_CONSTANT = isClassAndType(CONSTANT_CLASS,
            CONSTANT_TYPE);
    public static final Function<JsonNode, Boolean> IS_REFERENCE = isClassAndType(COLUMN_REF_CLASS,
            COLUMN_REF_TYPE);
    public static final Function<JsonNode, Boolean> IS_CONJUNCTION_AND = isClassAndType(CONJUNCTION_CLASS,
            CONJUNCTION_TYPE_AND);
    public static final Function<JsonNode, Boolean> IS_CONJUNCTION_OR = isClassAndType(CONJUNCTION_CLASS,
            CONJUNCTION_TYPE_OR);
    public static final Function<JsonNode, Boolean> IS_CAST = isClassAndType(CAST_CLASS, CAST_TYPE_OPERATOR);
    public static final Function<JsonNode, Boolean> IS_SELECT = isType(SELECT_NODE_TYPE);
    public static final Function<JsonNode, Boolean> IS_COMPARISON = isClass(COMPARISON_CLASS);
    public static final Function<JsonNode, Boolean> IS_SUBQUERY = isClassAndType(SUBQUERY_CLASS, SUBQUERY_TYPE);
    public static final Function<JsonNode, Boolean> IS_FUNCTION = isClassAndType(FUNCTION_CLASS, FUNCTION_TYPE);

    public static Function<JsonNode, Boolean> isFunction(String functionName) {
        return n -> {
            var name = n.get(FIELD_FUNCTION_NAME);
            if (name == null)
                return false;
            return IS_FUNCTION.apply(n) && functionName.equalsIgnoreCase(name.asText());
        };
    }

    /**
     * Matches {@code schema.functionName(...)}, e.g. {@code auth.uid()}.
     */
    public static Function<JsonNode, Boolean> isFunction(String schema, String functionName) {
        return n -> {
            if (!isFunction(functionName).apply(n)) {
                return false;
            }
            var s = n.get(FIELD_SCHEMA);
            return s != null && schema.equalsIgnoreCase(s.asText());
        };
    }

    public static Function<JsonNode, Boolean> isClassAndType(String clazz, String type) {
        return node -> {
            JsonNode classNode = node.get(FIELD_CLASS);
            JsonNode typeNode = node.get(FIELD_TYPE);
            return classNode != null && typeNode != null && classNode.asText().equals(clazz)
                    && typeNode.asText().equals(type);
        };
    }

    public static Function<JsonNode, Boolean> isClass(String clazz) {
        return node -> {
            JsonNode classNode = node.get(FIELD_CLASS);
            return classNode != null && classNode.asText().equals(clazz);
        };
    }

    public static Function<JsonNode, Boolean> isType(String type) {
        return node -> {
            JsonNode typeNode = node.get(FIELD_TYPE);
            return typeNode != null && typeNode.asText().equals(type);
        };
    }

    public static String[] getReferenceName(JsonNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Node cannot be null");
        }
        JsonNode columnNamesNode = node.get(FIELD_COLUMN_NAMES);
        if (columnNamesNode == null || !columnNamesNode.isArray()) {
            throw new IllegalStateException("Node has no 'column_names' array field. Node: " + node);
        }
        ArrayNode array = (ArrayNode) columnNamesNode;
        String[] res = new String[array.size()];
        for (int i = 0; i < res.length; i++) {
            res[i] = array.get(i).asText();
        }
        return res;
    }

    /**
     * Replaces every node matching {@code matchFn} with the result of {@code transformFn}.
     * Matching nodes are not descended into. Mutates {@code node} in place.
     */
    public static JsonNode transform(JsonNode node, Function<JsonNode, Boolean> matchFn,
                                     Function<JsonNode, JsonNode> transformFn) {
        if (node == null) {
            return null;
        }
        if (matchFn.apply(node)) {
            return transformFn.apply(node);
        }
        if (node instanceof ObjectNode objectNode) {
            for (Iterator<String> it = objectNode.fieldNames(); it.hasNext(); ) {
                String field = it.next();
                JsonNode current = objectNode.get(field);
                JsonNode newNode = transform(current, matchFn, transformFn);
                objectNode.set(field, newNode);
            }
            return objectNode;
        }
        if (node instanceof ArrayNode arrayNode) {
            for (int i = 0; i < arrayNode.size(); i++) {
                JsonNode current = arrayNode.get(i);
                JsonNode newNode = transform(current, matchFn, transformFn);
                arrayNode.set(i, newNode);
            }
            return arrayNode;
        }
        return node;
    }

    public static List<JsonNode> collectFunction(JsonNode tree, String functionName) {
        final List<JsonNode> list = new ArrayList<>();
        find(tree, isFunction(functionName), list::add);
        return list;
    }

    public static List<JsonNode> collectReferences(JsonNode tree) {
        final List<JsonNode> list = new ArrayList<>();
        find(tree, IS_REFERENCE, list::add);
        return list;
    }

    /**
     * Sub-query expressions directly reachable from {@code tree}; sub-queries nested inside them are not included.
     */
    public static List<JsonNode> collectSubQueries(JsonNode tree) {
        final List<JsonNode> list = new ArrayList<>();
        find(tree, IS_SUBQUERY, list::add);
        return list;
    }

    /**
     * Depth first search over every object field and array element. Matching nodes are
     * collected and not descended into.
     */
    public static void find(JsonNode node, Function<JsonNode, Boolean> matchFn,
                            Consumer<JsonNode> collectFn) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject() && matchFn.apply(node)) {
            collectFn.accept(node);
            return;
        }
        if (node.isContainerNode()) {
            for (JsonNode c : node) {
                find(c, matchFn, collectFn);
            }
        }
    }

    public static JsonNode parseToTree(Connection connection, String sql) throws JsonProcessingException {
        String escapeSql = escapeSpecialChar(sql);
        String jsonString = ConnectionPool.collectFirst(connection, String.format(JSON_SERIALIZE_SQL, escapeSql), String.class);
        return checkParsed(objectMapper.readTree(jsonString), sql);
    }

    public static JsonNode parseToTree(String sql) throws JsonProcessingException {
        String escapeSql = escapeSpecialChar(sql);
        String jsonString = ConnectionPool.collectFirst(String.format(JSON_SERIALIZE_SQL, escapeSql), String.class);
        return checkParsed(objectMapper.readTree(jsonString), sql);
    }

    public static String parseToSql(Connection connection, JsonNode node) {
        String sql = String.format(JSON_DESERIALIZE_SQL, escapeSpecialChar(node.toString()));
        return ConnectionPool.collectFirst(connection, sql, String.class);
    }

    public static String parseToSql(JsonNode node) {
        String sql = String.format(JSON_DESERIALIZE_SQL, escapeSpecialChar(node.toString()));
        return ConnectionPool.collectFirst(sql, String.class);
    }

    /**
     * Parses a boolean SQL expression such as {@code auth.uid() = owner_id} into an expression node.
     *
     * @throws IllegalArgumentException if the text is not a valid filter expression
     */
    public static JsonNode compileFilterString(String stringFilter) {
        if (stringFilter == null || stringFilter.isBlank()) {
            throw new IllegalArgumentException("Filter cannot be null or empty");
        }
        JsonNode tree;
        try {
            tree = parseToTree(FILTER_TEMPLATE.formatted(stringFilter));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to parse filter: " + stringFilter, e);
        }
        var where = getWhereClauseForBaseTable(getFirstStatementNode(tree));
        if (where == null || where.isNull()) {
            throw new IllegalArgumentException("Not a filter expression: " + stringFilter);
        }
        return where;
    }

    public static JsonNode getFirstStatementNode(JsonNode jsonNode) {
        if (jsonNode == null) {
            throw new IllegalArgumentException("JsonNode cannot be null");
        }
        JsonNode statementsNode = jsonNode.get(FIELD_STATEMENTS);
        if (statementsNode == null || !statementsNode.isArray()) {
            throw new IllegalStateException("JSON node has no 'statements' array field. Node: " + jsonNode);
        }
        ArrayNode statements = (ArrayNode) statementsNode;
        if (statements.isEmpty()) {
            throw new IllegalStateException("Statements array is empty. Node: " + jsonNode);
        }
        JsonNode statement = statements.get(0);
        JsonNode node = statement.get(FIELD_NODE);
        if (node == null) {
            throw new IllegalStateException("Statement has no 'node' field. Statement: " + statement);
        }
        return node;
    }

    public static JsonNode getSelectForBaseTable(JsonNode statementNode) {
        var fromTable = statementNode.get(FIELD_FROM_TABLE);
        if (fromTable == null) {
            return null;
        }
        switch (fromTable.get(FIELD_TYPE).asText()) {
            case NODE_TYPE_BASE_TABLE -> {
                return statementNode;
            }
            case NODE_TYPE_SUBQUERY -> {
                return getSelectForBaseTable(fromTable.get(FIELD_SUBQUERY).get(FIELD_NODE));
            }
            default -> {
                return null;
            }
        }
    }

    public static JsonNode getWhereClauseForBaseTable(JsonNode statementNode) {
        JsonNode selectNode = getSelectForBaseTable(statementNode);
        return selectNode != null ? selectNode.get(FIELD_WHERE_CLAUSE) : null;
    }

    /**
     * ANDs {@code toAdd} onto the WHERE clause of the select reading the base table.
     *
     * @return rewritten copy of {@code query}, or null if the query does not read a single base table
     */
    public static JsonNode addFilterToBaseTable(JsonNode query, JsonNode toAdd) {
        var res = query.deepCopy();
        var select = getSelectForBaseTable(getFirstStatementNode(res));
        if (select == null) {
            return null;
        }
        addFilterToSelect((ObjectNode) select, toAdd);
        return res;
    }

    /**
     * ANDs {@code toAdd} onto the WHERE clause of {@code select} in place.
     */
    public static void addFilterToSelect(ObjectNode select, JsonNode toAdd) {
        var where = select.get(FIELD_WHERE_CLAUSE);
        if (where == null || where instanceof NullNode) {
            select.set(FIELD_WHERE_CLAUSE, toAdd);
        } else {
            select.set(FIELD_WHERE_CLAUSE, ExpressionFactory.andFilters(where, toAdd));
        }
    }

    /**
     * Base tables read by the FROM clause of a select node, walking joins and derived tables.
     * Tables referenced only from sub-query expressions are not included.
     */
    public static List<CatalogSchemaTable> getAllTablesFromSelect(JsonNode selectNode) {
        var result = new ArrayList<CatalogSchemaTable>();
        collectTables(selectNode.get(FIELD_FROM_TABLE), result);
        return result;
    }

    public static CatalogSchemaTable toCatalogSchemaTable(JsonNode baseTableRef) {
        return new CatalogSchemaTable(text(baseTableRef, FIELD_CATALOG_NAME), text(baseTableRef, FIELD_SCHEMA_NAME),
                text(baseTableRef, FIELD_TABLE_NAME), text(baseTableRef, FIELD_ALIAS));
    }

    /**
     * Replaces every base table {@code queryNode} reads by {@code (SELECT * FROM table WHERE filter) AS qualifier}:
     * FROM clauses and joins, derived tables, set operations, common table expressions and sub-query
     * expressions in any clause. Tables for which {@code filterFor} returns null are left untouched. The
     * returned filters are inserted as they are.
     *
     * @return rewritten copy
     * @throws IllegalArgumentException for query shapes that cannot be filtered, such as table functions
     */
    public static JsonNode wrapBaseTables(JsonNode queryNode, Function<CatalogSchemaTable, JsonNode> filterFor) {
        return wrapQuery(queryNode.deepCopy(), filterFor);
    }

    /**
     * Wraps the base tables read by sub-query expressions inside {@code expression}.
     *
     * @return rewritten copy
     * @throws IllegalArgumentException for query shapes that cannot be filtered
     */
    public static JsonNode wrapSubQueries(JsonNode expression, Function<CatalogSchemaTable, JsonNode> filterFor) {
        return wrapExpression(expression.deepCopy(), filterFor);
    }

    /**
     * In place variant of {@link #wrapBaseTables} that leaves the FROM clause of {@code select} alone: common
     * table expressions and sub-queries in the select list, WHERE, GROUP BY, HAVING, QUALIFY and modifiers are wrapped.
     */
    public static void wrapAllButFromClause(ObjectNode select, Function<CatalogSchemaTable, JsonNode> filterFor) {
        if (!IS_SELECT.apply(select)) {
            throw new IllegalArgumentException("Not a select node: " + select.path(FIELD_TYPE).asText());
        }
        wrapCommonTableExpressions(select, filterFor);
        var fields = new ArrayList<String>();
        select.fieldNames().forEachRemaining(fields::add);
        for (var field : fields) {
            if (!field.equals(FIELD_FROM_TABLE) && !field.equals(FIELD_CTE_MAP)) {
                select.set(field, wrapExpression(select.get(field), filterFor));
            }
        }
    }

    private static JsonNode wrapQuery(JsonNode queryNode, Function<CatalogSchemaTable, JsonNode> filterFor) {
        if (queryNode == null || !queryNode.isObject()) {
            throw new IllegalArgumentException("Missing query node");
        }
        var query = (ObjectNode) queryNode;
        var type = query.path(FIELD_TYPE).asText();
        switch (type) {
            case NODE_TYPE_SELECT_NODE -> {
                query.set(FIELD_FROM_TABLE, wrapTableRef(query.get(FIELD_FROM_TABLE), filterFor));
                wrapAllButFromClause(query, filterFor);
            }
            case NODE_TYPE_SET_OPERATION_NODE, NODE_TYPE_RECURSIVE_CTE_NODE, NODE_TYPE_CTE_NODE -> {
                for (var field : List.of(FIELD_LEFT, FIELD_RIGHT, FIELD_QUERY, FIELD_CHILD)) {
                    if (query.hasNonNull(field)) {
                        query.set(field, wrapQuery(query.get(field), filterFor));
                    }
                }
                if (query.get(FIELD_CHILDREN) instanceof ArrayNode children) {
                    for (int i = 0; i < children.size(); i++) {
                        children.set(i, wrapQuery(children.get(i), filterFor));
                    }
                }
                wrapCommonTableExpressions(query, filterFor);
                if (query.has(FIELD_MODIFIERS)) {
                    query.set(FIELD_MODIFIERS, wrapExpression(query.get(FIELD_MODIFIERS), filterFor));
                }
            }
            default -> throw new IllegalArgumentException("Cannot apply row filters to a " + type + " query");
        }
        return query;
    }

    private static void wrapCommonTableExpressions(ObjectNode query, Function<CatalogSchemaTable, JsonNode> filterFor) {
        var cteMap = query.get(FIELD_CTE_MAP);
        if (cteMap == null || cteMap.isNull()) {
            return;
        }
        // each entry's value holds {"query": {"node": ...}}
        find(cteMap, n -> n.path(FIELD_QUERY).has(FIELD_NODE), cte -> {
            var statement = (ObjectNode) cte.get(FIELD_QUERY);
            statement.set(FIELD_NODE, wrapQuery(statement.get(FIELD_NODE), filterFor));
        });
    }

    private static JsonNode wrapExpression(JsonNode expression, Function<CatalogSchemaTable, JsonNode> filterFor) {
        return transform(expression, IS_SUBQUERY, s -> {
            var subquery = (ObjectNode) s;
            var statement = (ObjectNode) subquery.get(FIELD_SUBQUERY);
            statement.set(FIELD_NODE, wrapQuery(statement.get(FIELD_NODE), filterFor));
            if (subquery.has(FIELD_CHILD)) {
                subquery.set(FIELD_CHILD, wrapExpression(subquery.get(FIELD_CHILD), filterFor));
            }
            return subquery;
        });
    }

    private static JsonNode wrapTableRef(JsonNode tableRef, Function<CatalogSchemaTable, JsonNode> filterFor) {
        if (tableRef == null || tableRef.isNull()) {
            return tableRef;
        }
        var type = tableRef.path(FIELD_TYPE).asText();
        switch (type) {
            case NODE_TYPE_BASE_TABLE -> {
                var table = toCatalogSchemaTable(tableRef);
                var filter = filterFor.apply(table);
                if (filter == null) {
                    return tableRef;
                }
                return filteredTableRef(tableRef, table.qualifier(), filter);
            }
            case NODE_TYPE_JOIN -> {
                var join = (ObjectNode) tableRef;
                join.set(FIELD_LEFT, wrapTableRef(join.get(FIELD_LEFT), filterFor));
                join.set(FIELD_RIGHT, wrapTableRef(join.get(FIELD_RIGHT), filterFor));
                if (join.has(FIELD_CONDITION)) {
                    join.set(FIELD_CONDITION, wrapExpression(join.get(FIELD_CONDITION), filterFor));
                }
                return join;
            }
            case NODE_TYPE_SUBQUERY -> {
                var statement = (ObjectNode) tableRef.get(FIELD_SUBQUERY);
                statement.set(FIELD_NODE, wrapQuery(statement.get(FIELD_NODE), filterFor));
                return tableRef;
            }
            case NODE_TYPE_EMPTY -> {
                return tableRef;
            }
            case NODE_TYPE_EXPRESSION_LIST -> {
                return wrapExpression(tableRef, filterFor);
            }
            default -> throw new IllegalArgumentException("Cannot apply row filters to a " + type + " table reference");
        }
    }

    private static JsonNode filteredTableRef(JsonNode baseTableRef, String alias, JsonNode filter) {
        var ref = (ObjectNode) getFilteredTableTemplate().deepCopy();
        var inner = (ObjectNode) ref.get(FIELD_SUBQUERY).get(FIELD_NODE);
        var innerTable = (ObjectNode) baseTableRef.deepCopy();
        innerTable.put(FIELD_ALIAS, "");
        inner.set(FIELD_FROM_TABLE, innerTable);
        inner.set(FIELD_WHERE_CLAUSE, filter);
        ref.put(FIELD_ALIAS, alias);
        return ref;
    }

    private static JsonNode getFilteredTableTemplate() {
        var template = filteredTableTemplate;
        if (template == null) {
            try {
                template = getFirstStatementNode(parseToTree(FILTERED_TABLE_TEMPLATE)).get(FIELD_FROM_TABLE);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException(e);
            }
            filteredTableTemplate = template;
        }
        return template;
    }

    private static void collectTables(JsonNode tableRef, List<CatalogSchemaTable> collector) {
        if (tableRef == null || tableRef.isNull()) {
            return;
        }
        switch (tableRef.get(FIELD_TYPE).asText()) {
            case NODE_TYPE_BASE_TABLE -> collector.add(toCatalogSchemaTable(tableRef));
            case NODE_TYPE_JOIN -> {
                collectTables(tableRef.get(FIELD_LEFT), collector);
                collectTables(tableRef.get(FIELD_RIGHT), collector);
            }
            case NODE_TYPE_SUBQUERY -> {
                var node = tableRef.get(FIELD_SUBQUERY).get(FIELD_NODE);
                if (IS_SELECT.apply(node)) {
                    collectTables(node.get(FIELD_FROM_TABLE), collector);
                }
            }
            default -> {
            }
        }
    }

    private static JsonNode checkParsed(JsonNode tree, String sql) {
        var error = tree.get("error");
        if (error != null && error.asBoolean()) {
            throw new IllegalArgumentException("Unable to parse sql: " + sql + " : " + tree.path("error_message").asText());
        }
        return tree;
    }

    private static String text(JsonNode node, String field) {
        var f = node.get(field);
        return f == null || f.isNull() ? "" : f.asText();
    }

    private static String escapeSpecialChar(String sql) {
        return sql.replaceAll("'", "''");
    }
}
