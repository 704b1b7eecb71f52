package io.rowguard.sql.policy;

import java.util.*;

/**
 * Immutable, insertion ordered mapping of column name to value. Values may be null.
 */
public final class Row {

    private static final Row EMPTY = new Row(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private Row(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Row empty() {
        return EMPTY;
    }

    public static Row of(Map<String, ?> values) {
        return new Row(new LinkedHashMap<>(values));
    }

    /**
     * @param keyValues alternating column names and values
     */
    public static Row of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating column names and values");
        }
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Row(map);
    }

    /**
     * Row with every listed column set to null, used for the unmatched side of an outer join.
     */
    public static Row nulls(Collection<String> columns) {
        var map = new LinkedHashMap<String, Object>();
        for (var c : columns) {
            map.put(c, null);
        }
        return new Row(map);
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * @return the value, possibly null; use {@link #hasColumn(String)} to tell a null value from a missing column
     */
    public Object get(String column) {
        return values.get(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Row with(String column, Object value) {
        var map = new LinkedHashMap<>(values);
        map.put(column, value);
        return new Row(map);
    }

    /**
     * Copy with {@code changes} applied; columns not present in this row are added at the end.
     */
    public Row with(Map<String, ?> changes) {
        var map = new LinkedHashMap<>(values);
        map.putAll(changes);
        return new Row(map);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
