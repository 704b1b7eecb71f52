package io.rowguard.sql.policy.publication;

import io.rowguard.sql.policy.Row;

import java.util.Objects;

/**
 * One committed row change, as handed to the replication layer.
 *
 * @param oldRow pre-image, null for INSERT
 * @param newRow post-image, null for DELETE
 */
public record ChangeEvent(String table, Type type, Row oldRow, Row newRow) {

    public enum Type {
        INSERT, UPDATE, DELETE
    }

    public ChangeEvent {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(type, "type");
        if (type != Type.INSERT && oldRow == null) {
            throw new IllegalArgumentException(type + " event requires the old row");
        }
        if (type != Type.DELETE && newRow == null) {
            throw new IllegalArgumentException(type + " event requires the new row");
        }
    }

    public static ChangeEvent insert(String table, Row newRow) {
        return new ChangeEvent(table, Type.INSERT, null, newRow);
    }

    public static ChangeEvent update(String table, Row oldRow, Row newRow) {
        return new ChangeEvent(table, Type.UPDATE, oldRow, newRow);
    }

    public static ChangeEvent delete(String table, Row oldRow) {
        return new ChangeEvent(table, Type.DELETE, oldRow, null);
    }

    /**
     * Row a subscriber must be able to SELECT to receive the event.
     */
    public Row subject() {
        return type == Type.DELETE ? oldRow : newRow;
    }
}
