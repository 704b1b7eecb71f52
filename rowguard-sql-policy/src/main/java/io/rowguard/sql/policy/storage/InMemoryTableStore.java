package io.rowguard.sql.policy.storage;

import io.rowguard.sql.policy.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Copy on write table store. Each commit publishes a new immutable map of tables, so snapshots never
 * change under a reader. Commits are serialized and fail when another commit touched one of the
 * same tables after the transaction began.
 */
public class InMemoryTableStore implements TableStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTableStore.class);

    private record Table(List<String> columns, List<Row> rows, long version) {
    }

    private volatile Map<String, Table> tables = Map.of();

    @Override
    public synchronized void createTable(String table, List<String> columns) {
        if (tables.containsKey(table)) {
            throw new IllegalArgumentException("Table already exists: " + table);
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Table needs at least one column: " + table);
        }
        var next = new HashMap<>(tables);
        next.put(table, new Table(List.copyOf(columns), List.of(), 0));
        tables = Map.copyOf(next);
    }

    @Override
    public StoreTransaction begin() {
        return new Transaction(tables);
    }

    @Override
    public RowSource snapshot() {
        return new Snapshot(tables);
    }

    private synchronized void apply(Map<String, Table> base, Map<String, List<Row>> staged) {
        var current = tables;
        for (var table : staged.keySet()) {
            if (current.get(table).version() != base.get(table).version()) {
                throw new ConcurrentModificationException("Table " + table + " was modified by another transaction");
            }
        }
        var next = new HashMap<>(current);
        staged.forEach((table, rows) -> {
            var t = current.get(table);
            next.put(table, new Table(t.columns(), List.copyOf(rows), t.version() + 1));
        });
        tables = Map.copyOf(next);
        logger.atDebug().log("Committed changes to {}", staged.keySet());
    }

    private static class Snapshot implements RowSource {
        protected final Map<String, Table> base;

        Snapshot(Map<String, Table> base) {
            this.base = base;
        }

        protected Table table(String table) {
            var t = base.get(table);
            if (t == null) {
                throw new IllegalArgumentException("Table does not exist: " + table);
            }
            return t;
        }

        @Override
        public List<Row> rows(String table) {
            return table(table).rows();
        }

        @Override
        public List<String> columns(String table) {
            return table(table).columns();
        }

        @Override
        public boolean hasTable(String table) {
            return base.containsKey(table);
        }
    }

    private class Transaction extends Snapshot implements StoreTransaction {
        private final Map<String, List<Row>> staged = new HashMap<>();
        private boolean open = true;

        Transaction(Map<String, Table> base) {
            super(base);
        }

        @Override
        public List<Row> rows(String table) {
            var changed = staged.get(table);
            return changed != null ? Collections.unmodifiableList(changed) : super.rows(table);
        }

        @Override
        public void insert(String table, Row row) {
            checkColumns(table, row);
            stage(table).add(Row.nulls(columns(table)).with(row.asMap()));
        }

        @Override
        public void replace(String table, Row existing, Row replacement) {
            checkColumns(table, replacement);
            var rows = stage(table);
            rows.set(indexOf(rows, table, existing), replacement);
        }

        @Override
        public void delete(String table, Row existing) {
            var rows = stage(table);
            rows.remove(indexOf(rows, table, existing));
        }

        @Override
        public void commit() {
            checkOpen();
            open = false;
            if (!staged.isEmpty()) {
                apply(base, staged);
            }
        }

        @Override
        public void rollback() {
            staged.clear();
            open = false;
        }

        @Override
        public void close() {
            if (open) {
                rollback();
            }
        }

        private List<Row> stage(String table) {
            checkOpen();
            return staged.computeIfAbsent(table, t -> new ArrayList<>(super.rows(t)));
        }

        private int indexOf(List<Row> rows, String table, Row row) {
            for (int i = 0; i < rows.size(); i++) {
                if (rows.get(i) == row) {
                    return i;
                }
            }
            throw new IllegalArgumentException("Row is not part of " + table + " in this transaction");
        }

        private void checkColumns(String table, Row row) {
            var columns = columns(table);
            for (var c : row.columns()) {
                if (!columns.contains(c)) {
                    throw new IllegalArgumentException("Column " + c + " does not exist in " + table);
                }
            }
        }

        private void checkOpen() {
            if (!open) {
                throw new IllegalStateException("Transaction is already closed");
            }
        }
    }
}
