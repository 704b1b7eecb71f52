package io.rowguard.sql.policy.storage;

import io.rowguard.sql.policy.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryTableStoreTest {

    private InMemoryTableStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryTableStore();
        store.createTable("notes", List.of("id", "owner", "body"));
    }

    @Test
    void testInsertFillsMissingColumns() {
        try (var tx = store.begin()) {
            tx.insert("notes", Row.of("id", 1L, "owner", "u1"));
            tx.commit();
        }
        var rows = store.snapshot().rows("notes");
        assertEquals(1, rows.size());
        assertTrue(rows.get(0).hasColumn("body"));
        assertNull(rows.get(0).get("body"));
    }

    @Test
    void testCloseWithoutCommitDiscards() {
        try (var tx = store.begin()) {
            tx.insert("notes", Row.of("id", 1L));
            assertEquals(1, tx.rows("notes").size());
        }
        assertTrue(store.snapshot().rows("notes").isEmpty());
    }

    @Test
    void testSnapshotIsStable() {
        var before = store.snapshot();
        try (var tx = store.begin()) {
            tx.insert("notes", Row.of("id", 1L));
            tx.commit();
        }
        assertTrue(before.rows("notes").isEmpty());
        assertEquals(1, store.snapshot().rows("notes").size());
    }

    @Test
    void testReplaceAndDelete() {
        try (var tx = store.begin()) {
            tx.insert("notes", Row.of("id", 1L, "body", "a"));
            tx.insert("notes", Row.of("id", 2L, "body", "b"));
            tx.commit();
        }
        try (var tx = store.begin()) {
            var rows = tx.rows("notes");
            tx.replace("notes", rows.get(0), rows.get(0).with("body", "changed"));
            tx.delete("notes", tx.rows("notes").get(1));
            tx.commit();
        }
        var rows = store.snapshot().rows("notes");
        assertEquals(1, rows.size());
        assertEquals("changed", rows.get(0).get("body"));
    }

    @Test
    void testConflictingCommitFails() {
        var first = store.begin();
        var second = store.begin();
        first.insert("notes", Row.of("id", 1L));
        second.insert("notes", Row.of("id", 2L));
        first.commit();
        assertThrows(ConcurrentModificationException.class, second::commit);
        assertEquals(1, store.snapshot().rows("notes").size());
    }

    @Test
    void testUnknownTableAndColumn() {
        assertThrows(IllegalArgumentException.class, () -> store.snapshot().rows("missing"));
        assertThrows(IllegalArgumentException.class, () -> store.createTable("notes", List.of("id")));
        try (var tx = store.begin()) {
            assertThrows(IllegalArgumentException.class, () -> tx.insert("notes", Row.of("nope", 1L)));
        }
    }
}
