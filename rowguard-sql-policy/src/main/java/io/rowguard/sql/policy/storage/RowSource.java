package io.rowguard.sql.policy.storage;

import io.rowguard.sql.policy.Row;

import java.util.List;

/**
 * Consistent read view of table contents. Sub-queries of one operation all read the same source.
 */
public interface RowSource {

    /**
     * @throws IllegalArgumentException if the table does not exist
     */
    List<Row> rows(String table);

    /**
     * Declared columns in order.
     *
     * @throws IllegalArgumentException if the table does not exist
     */
    List<String> columns(String table);

    boolean hasTable(String table);
}
