package io.rowguard.sql.policy.storage;

import java.util.List;

/**
 * Storage engine the policy enforced executor runs against.
 */
public interface TableStore {

    void createTable(String table, List<String> columns);

    StoreTransaction begin();

    /**
     * Current committed contents.
     */
    RowSource snapshot();
}
