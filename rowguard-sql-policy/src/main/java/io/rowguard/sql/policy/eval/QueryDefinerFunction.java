package io.rowguard.sql.policy.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.rowguard.sql.commons.Transformations;
import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.Row;

import java.util.*;

import static io.rowguard.sql.commons.ExpressionConstants.*;

/**
 * Definer function whose body is one SELECT. Parameters are visible to the body as columns of an
 * enclosing row, so give them names no scanned table uses.
 *
 * <pre>{@code
 * QueryDefinerFunction.fromSql("private.user_teams", List.of("p_user"),
 *         "select team_id from members where user_id = p_user", Result.LIST);
 * }</pre>
 */
public class QueryDefinerFunction implements DefinerFunction {

    public enum Result {
        /** first column of every row, as a list */
        LIST,
        /** first column of the single row, null for none */
        SCALAR,
        /** whether any row exists */
        EXISTS
    }

    private final String name;
    private final List<String> parameters;
    private final JsonNode select;
    private final Result result;
    private final Set<String> tables;

    public QueryDefinerFunction(String name, List<String> parameters, JsonNode select, Result result) {
        if (!Transformations.IS_SELECT.apply(select)) {
            throw new IllegalArgumentException("Definer function body must be a SELECT node");
        }
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.select = select;
        this.result = result;
        this.tables = collectTables(select);
    }

    public static QueryDefinerFunction fromSql(String name, List<String> parameters, String sql, Result result) {
        try {
            return new QueryDefinerFunction(name, parameters,
                    Transformations.getFirstStatementNode(Transformations.parseToTree(sql)), result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to parse body of " + name, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> tables() {
        return tables;
    }

    public Result result() {
        return result;
    }

    @Override
    public Object invoke(List<Object> arguments, EvaluationContext context, ExpressionEvaluator evaluator) {
        if (arguments.size() != parameters.size()) {
            throw new PredicateEvaluationException("%s expects %d arguments but got %d"
                    .formatted(name, parameters.size(), arguments.size()));
        }
        var args = new LinkedHashMap<String, Object>();
        for (int i = 0; i < parameters.size(); i++) {
            args.put(parameters.get(i), arguments.get(i));
        }
        var rows = evaluator.query(select, context.withRow(null, Row.of(args)));
        switch (result) {
            case EXISTS -> {
                return !rows.isEmpty();
            }
            case SCALAR -> {
                if (rows.size() > 1) {
                    throw new PredicateEvaluationException(name + " returned more than one row");
                }
                return rows.isEmpty() ? null : first(rows.get(0));
            }
            default -> {
                var values = new ArrayList<>(rows.size());
                for (var r : rows) {
                    values.add(first(r));
                }
                return values;
            }
        }
    }

    private static Object first(Row row) {
        return row.asMap().values().iterator().next();
    }

    private static Set<String> collectTables(JsonNode select) {
        var result = new HashSet<String>();
        for (var t : Transformations.getAllTablesFromSelect(select)) {
            result.add(t.table());
        }
        for (var sub : Transformations.collectSubQueries(select.get(FIELD_WHERE_CLAUSE))) {
            result.addAll(collectTables(sub.get(FIELD_SUBQUERY).get(FIELD_NODE)));
        }
        return Set.copyOf(result);
    }
}
