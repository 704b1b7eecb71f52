package io.rowguard.sql.commons;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Reads one value out of the current row of a result set.
 */
@FunctionalInterface
public interface Extractor<T> {
    T extract(ResultSet resultSet) throws SQLException;
}
