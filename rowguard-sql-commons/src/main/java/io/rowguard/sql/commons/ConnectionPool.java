package io.rowguard.sql.commons;

import org.duckdb.DuckDBConnection;

import java.io.IOException;
import java.io.InputStream;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Process wide in-memory DuckDB database. Every caller gets its own duplicated connection
 * over the same database; callers close what they get.
 *
 * <p>Used for parsing SQL into JSON AST (and back) and for running rewritten queries.
 * Properties in a {@code duckdb.properties} classpath resource are passed to the driver.
 */
public enum ConnectionPool {
    INSTANCE;

    private static final String DUCKDB_PROPERTY_FILENAME = "duckdb.properties";
    private final DuckDBConnection connection;

    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException(e);
        }
    }

    ConnectionPool() {
        try {
            this.connection = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:", loadProperties());
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    /**
     * @return first column of the first row
     * @throws RuntimeSqlException if the query fails or returns no row
     */
    @SuppressWarnings("unchecked")
    public static <T> T collectFirst(Connection connection, String sql, Class<T> tClass) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            try (ResultSet resultSet = statement.getResultSet()) {
                if (!resultSet.next()) {
                    throw new SQLException("Query returned no results: " + sql);
                }
                if (tClass.isArray()) {
                    return (T) resultSet.getArray(1).getArray();
                } else {
                    return resultSet.getObject(1, tClass);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static <T> T collectFirst(String sql, Class<T> tClass) {
        try (DuckDBConnection connection = getConnection()) {
            return collectFirst(connection, sql, tClass);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    /**
     * Materializes every row of the result.
     */
    public static <T> List<T> collectAll(Connection connection, String sql, Extractor<T> extractor) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            var result = new ArrayList<T>();
            try (ResultSet resultSet = statement.getResultSet()) {
                while (resultSet.next()) {
                    result.add(extractor.extract(resultSet));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeSqlException("Error running sql: " + sql, e);
        }
    }

    public static <T> List<T> collectFirstColumn(Connection connection, String sql, Class<T> tClass) {
        return collectAll(connection, sql, rs -> rs.getObject(1, tClass));
    }

    public static boolean execute(Connection connection, String sql) {
        try (Statement statement = connection.createStatement()) {
            return statement.execute(sql);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static boolean execute(String sql) {
        try (Connection connection = ConnectionPool.getConnection();
             Statement statement = connection.createStatement()) {
            return statement.execute(sql);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static int[] executeBatch(Connection connection, String[] queries) {
        try (Statement statement = connection.createStatement()) {
            for (String sql : queries) {
                statement.addBatch(sql);
            }
            return statement.executeBatch();
        } catch (SQLException e) {
            throw new RuntimeSqlException("Error running sqls: ", e);
        }
    }

    public static DuckDBConnection getConnection() {
        return INSTANCE.getConnectionInternal();
    }

    /**
     * @param sqls executed on the connection before it is returned, generally settings or table setup
     */
    public static DuckDBConnection getConnection(String[] sqls) {
        DuckDBConnection connection = getConnection();
        executeBatch(connection, sqls);
        return connection;
    }

    private DuckDBConnection getConnectionInternal() {
        try {
            return (DuckDBConnection) connection.duplicate();
        } catch (SQLException e) {
            throw new RuntimeSqlException("Error creating connection", e);
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = ConnectionPool.class.getClassLoader().getResourceAsStream(DUCKDB_PROPERTY_FILENAME)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + DUCKDB_PROPERTY_FILENAME, e);
        }
        return properties;
    }
}
