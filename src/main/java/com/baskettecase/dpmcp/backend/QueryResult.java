package com.baskettecase.dpmcp.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical tabular result every backend produces, whatever its native representation.
 *
 * <p>{@code rowCount == rows.size()} and every row holds exactly {@code columns.size()}
 * values; construction fails otherwise. Rows may contain SQL NULLs.
 */
public record QueryResult(
    List<String> columns,
    List<List<Object>> rows,
    int rowCount,
    long elapsedMs,
    boolean truncated
) {
    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                if (row == null || row.size() != columns.size()) {
                    throw new IllegalArgumentException(String.format(
                        "Row width %d does not match %d columns",
                        row == null ? 0 : row.size(), columns.size()));
                }
                copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        if (rowCount != copied.size()) {
            throw new IllegalArgumentException(
                "row_count " + rowCount + " does not match " + copied.size() + " rows");
        }
        rows = Collections.unmodifiableList(copied);
    }

    public static QueryResult of(List<String> columns, List<List<Object>> rows, long elapsedMs, boolean truncated) {
        return new QueryResult(columns, rows, rows == null ? 0 : rows.size(), elapsedMs, truncated);
    }

    public static QueryResult empty(List<String> columns, long elapsedMs) {
        return new QueryResult(columns, List.of(), 0, elapsedMs, false);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
