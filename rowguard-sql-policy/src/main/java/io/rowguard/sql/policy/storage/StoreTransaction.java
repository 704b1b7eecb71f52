package io.rowguard.sql.policy.storage;

import io.rowguard.sql.policy.Row;

/**
 * Staged changes over a snapshot. Reads see the snapshot plus this transaction's own changes.
 * Closing without {@link #commit()} discards the changes.
 *
 * <p>Rows are identified by instance: {@link #replace} and {@link #delete} take a row obtained from
 * {@link #rows(String)} of the same transaction.
 */
public interface StoreTransaction extends RowSource, AutoCloseable {

    void insert(String table, Row row);

    void replace(String table, Row existing, Row replacement);

    void delete(String table, Row existing);

    /**
     * @throws java.util.ConcurrentModificationException if a table changed by this transaction
     *         was committed by another transaction since this one started
     */
    void commit();

    void rollback();

    @Override
    void close();
}
