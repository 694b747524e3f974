package com.baskettecase.dpmcp.backend;

import java.util.Map;

/**
 * A file or table to expose to a file-ingesting engine.
 *
 * @param type      {@code csv} or {@code table}
 * @param path      file path for {@code csv}
 * @param schema    target schema, engine default when null
 * @param tableName target table, derived from the file name when null
 * @param options   engine-specific options such as {@code delimiter}
 */
public record DataSourceInfo(
    String type,
    String path,
    String schema,
    String tableName,
    Map<String, String> options
) {
    public DataSourceInfo {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static DataSourceInfo csv(String path, String schema, String tableName) {
        return new DataSourceInfo("csv", path, schema, tableName, Map.of());
    }

    public String option(String key) {
        return options.get(key);
    }
}
