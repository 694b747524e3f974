package com.baskettecase.dpmcp.backend;

import java.sql.Array;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Converts JDBC result sets into {@link QueryResult}s.
 *
 * JDBC temporal types become {@code java.time} values and SQL arrays become lists,
 * so results serialize the same way regardless of driver.
 */
public final class JdbcResultConverter {

    private JdbcResultConverter() {
    }

    public static QueryResult toQueryResult(ResultSet rs, int maxRows, long startNanos) throws SQLException {
        return toQueryResult(rs, maxRows, startNanos, UnaryOperator.identity());
    }

    /**
     * @param driverValues hook for driver-specific value types, applied after the standard conversions
     */
    public static QueryResult toQueryResult(ResultSet rs, int maxRows, long startNanos,
                                            UnaryOperator<Object> driverValues) throws SQLException {
        List<String> columns = columnNames(rs.getMetaData());
        List<List<Object>> rows = new ArrayList<>();
        boolean truncated = false;

        while (rs.next()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }
            List<Object> row = new ArrayList<>(columns.size());
            for (int i = 1; i <= columns.size(); i++) {
                row.add(driverValues.apply(normalize(rs.getObject(i))));
            }
            rows.add(row);
        }

        return QueryResult.of(columns, rows, (System.nanoTime() - startNanos) / 1_000_000, truncated);
    }

    public static List<String> columnNames(ResultSetMetaData metaData) throws SQLException {
        int count = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(metaData.getColumnLabel(i));
        }
        return columns;
    }

    static Object normalize(Object value) throws SQLException {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        }
        if (value instanceof Array) {
            Object elements = ((Array) value).getArray();
            if (elements instanceof Object[]) {
                return Arrays.asList((Object[]) elements);
            }
            return elements;
        }
        return value;
    }
}
