package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.PredicateEvaluationException;
import io.rowguard.sql.policy.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Column name resolution. A scope is a stack of frames; each frame binds rows to table qualifiers
 * (one per table in a FROM clause). Names resolve in the innermost frame first, so sub-queries can
 * reference the enclosing query's row.
 */
public final class Scope {

    /**
     * @param qualifier table name or alias; null matches any qualifier
     */
    public record Binding(String qualifier, Row row) {
    }

    public static final Scope EMPTY = new Scope(List.of(), null);

    private final List<Binding> bindings;
    private final Scope outer;

    private Scope(List<Binding> bindings, Scope outer) {
        this.bindings = bindings;
        this.outer = outer;
    }

    public Scope push(List<Binding> frame) {
        return new Scope(List.copyOf(frame), this);
    }

    public List<Binding> bindings() {
        return bindings;
    }

    /**
     * @param names column_names of a COLUMN_REF: {@code [column]}, {@code [table, column]} or longer
     * @throws PredicateEvaluationException if no frame binds the column, or a frame binds it twice
     */
    public Object resolve(String[] names) {
        var column = names[names.length - 1];
        var qualifier = names.length > 1 ? names[names.length - 2] : null;
        for (var scope = this; scope != null; scope = scope.outer) {
            var found = scope.find(qualifier, column);
            if (!found.isEmpty()) {
                if (found.size() > 1) {
                    throw new PredicateEvaluationException("column reference \"" + column + "\" is ambiguous");
                }
                return Values.normalize(found.get(0).row().get(column));
            }
            if (qualifier != null && scope.hasQualifier(qualifier)) {
                throw new PredicateEvaluationException("column " + qualifier + "." + column + " does not exist");
            }
        }
        throw new PredicateEvaluationException("column \"" + String.join(".", names) + "\" does not exist");
    }

    /**
     * Whether any frame binds an unqualified {@code column}.
     */
    public boolean binds(String column) {
        for (var scope = this; scope != null; scope = scope.outer) {
            if (!scope.find(null, column).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private List<Binding> find(String qualifier, String column) {
        var result = new ArrayList<Binding>(1);
        for (var b : bindings) {
            if (qualifier != null && b.qualifier() != null && !b.qualifier().equalsIgnoreCase(qualifier)) {
                continue;
            }
            if (b.row().hasColumn(column)) {
                result.add(b);
            }
        }
        return result;
    }

    private boolean hasQualifier(String qualifier) {
        for (var b : bindings) {
            if (b.qualifier() != null && b.qualifier().equalsIgnoreCase(qualifier)) {
                return true;
            }
        }
        return false;
    }
}
