package io.rowguard.sql.commons;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

public class ConnectionPoolTest {

    @Test
    public void testCollectFirst() {
        Assertions.assertEquals(3, ConnectionPool.collectFirst("select 1 + 2", Integer.class));
    }

    @Test
    public void testCollectAll() throws SQLException {
        try (var connection = ConnectionPool.getConnection()) {
            var values = ConnectionPool.collectAll(connection, "select * from generate_series(3)",
                    rs -> rs.getLong(1));
            Assertions.assertEquals(List.of(0L, 1L, 2L, 3L), values);
        }
    }

    @Test
    public void testConnectionsShareDatabase() throws SQLException {
        try (var connection = ConnectionPool.getConnection(new String[]{
                "create or replace table cp_shared(x int)", "insert into cp_shared values (7)"})) {
            Assertions.assertEquals(7, ConnectionPool.collectFirst(connection, "select x from cp_shared", Integer.class));
        }
        Assertions.assertEquals(7, ConnectionPool.collectFirst("select x from cp_shared", Integer.class));
    }

    @Test
    public void testFailureIsWrapped() {
        Assertions.assertThrows(RuntimeSqlException.class, () -> ConnectionPool.execute("select * from no_such_table"));
    }
}
