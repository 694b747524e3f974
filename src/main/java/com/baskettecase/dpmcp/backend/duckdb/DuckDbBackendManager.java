package com.baskettecase.dpmcp.backend.duckdb;

import com.baskettecase.dpmcp.backend.AbstractBackendManager;
import com.baskettecase.dpmcp.backend.DataSourceInfo;
import com.baskettecase.dpmcp.backend.JdbcResultConverter;
import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.error.QueryExecutionException;
import com.baskettecase.dpmcp.sql.ReadOnlySqlRules;
import com.baskettecase.dpmcp.sql.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterUtils;
import org.springframework.jdbc.core.namedparam.ParsedSql;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * DuckDB Backend Manager
 *
 * Embedded analytic engine behind a single JDBC connection. The driver is
 * synchronous and the connection is not shared safely, so every operation
 * serializes on one lock; concurrent callers queue. This adapter's
 * {@link #validateSql} is the only read-only check on this engine.
 */
@Slf4j
public class DuckDbBackendManager extends AbstractBackendManager {

    public static final String TYPE = "duckdb";

    static final String IN_MEMORY = ":memory:";

    private static final String DEFAULT_SCHEMA = "main";

    private static final List<String> DENIED_KEYWORDS = List.of(
        "create", "drop", "alter", "truncate", "insert", "update", "delete", "merge",
        "grant", "revoke", "begin", "commit", "rollback", "call", "exec",
        "attach", "detach", "copy", "pragma", "install"
    );

    private final ReentrantLock connectionLock = new ReentrantLock();
    private final Map<String, Statement> inFlight = new ConcurrentHashMap<>();

    private Connection connection;
    private String databasePath = IN_MEMORY;

    public DuckDbBackendManager(Map<String, Object> config) {
        super(config);
    }

    @Override
    public String getBackendType() {
        return TYPE;
    }

    @Override
    public boolean connect(Map<String, Object> params) {
        connectionLock.lock();
        try {
            if (isConnected()) {
                log.debug("DuckDB already connected to {}", databasePath);
                return true;
            }
            Map<String, Object> merged = mergeParams(params);
            String path = stringParam(merged, "database-path", IN_MEMORY);
            String url = IN_MEMORY.equals(path) ? "jdbc:duckdb:" : "jdbc:duckdb:" + path;

            connection = DriverManager.getConnection(url);
            databasePath = path;
            markConnected(true);
            log.info("🔗 Connected to DuckDB database: {}", path);
            return true;
        } catch (SQLException e) {
            log.error("❌ Failed to connect to DuckDB: {}", e.getMessage());
            return false;
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public boolean disconnect() {
        connectionLock.lock();
        try {
            if (connection == null) {
                return true;
            }
            connection.close();
            log.info("🔌 Disconnected from DuckDB database: {}", databasePath);
            return true;
        } catch (SQLException e) {
            log.warn("⚠️ Error closing DuckDB connection: {}", e.getMessage());
            return false;
        } finally {
            connection = null;
            markConnected(false);
            connectionLock.unlock();
        }
    }

    @Override
    public QueryResult executeQuery(String sql, Map<String, Object> parameters, String transactionId, int maxRows) {
        requireConnected("executeQuery");
        long start = System.nanoTime();

        String jdbcSql = sql;
        List<Object> args = new ArrayList<>();
        if (parameters != null && !parameters.isEmpty()) {
            MapSqlParameterSource source = new MapSqlParameterSource(parameters);
            ParsedSql parsed = NamedParameterUtils.parseSqlStatement(sql);
            jdbcSql = NamedParameterUtils.substituteNamedParameters(parsed, source);
            for (Object value : NamedParameterUtils.buildValueArray(parsed, source, null)) {
                // Collections were expanded to "?, ?, ..." by substituteNamedParameters
                if (value instanceof Collection) {
                    args.addAll((Collection<?>) value);
                } else {
                    args.add(value);
                }
            }
        }

        log.info("[TXN:{}] 📊 DuckDB executing: {}", transactionId, sql);
        acquire(transactionId);
        try (PreparedStatement statement = connection.prepareStatement(jdbcSql)) {
            track(transactionId, statement);
            for (int i = 0; i < args.size(); i++) {
                statement.setObject(i + 1, args.get(i));
            }
            if (!statement.execute()) {
                return QueryResult.empty(List.of(), elapsedMs(start));
            }
            try (ResultSet rs = statement.getResultSet()) {
                QueryResult result = JdbcResultConverter.toQueryResult(rs, maxRows, start);
                log.info("[TXN:{}] ✅ DuckDB returned {} rows in {} ms{}", transactionId,
                        result.rowCount(), result.elapsedMs(), result.truncated() ? " (truncated)" : "");
                return result;
            }
        } catch (SQLException e) {
            log.error("[TXN:{}] ❌ DuckDB query failed: {}", transactionId, e.getMessage());
            throw new QueryExecutionException(e.getMessage(), e);
        } finally {
            untrack(transactionId);
            connectionLock.unlock();
        }
    }

    /**
     * Drops case variants of the view before creating it, so DuckDB never keeps a stale
     * definition under a differently-cased name.
     */
    @Override
    public boolean createView(String name, String sql, boolean replace, String transactionId) {
        requireConnected("createView");
        if (name == null || name.isBlank() || sql == null || sql.isBlank()) {
            log.warn("[TXN:{}] ⚠️ View name and SQL are required", transactionId);
            return false;
        }

        acquire(transactionId);
        try {
            if (replace) {
                String lower = name.toLowerCase(Locale.ROOT);
                dropViewQuietly(lower, transactionId);
                if (!lower.equals(name)) {
                    dropViewQuietly(name, transactionId);
                }
            }
            String ddl = (replace ? "CREATE OR REPLACE VIEW " : "CREATE VIEW ") + quoteIdentifier(name) + " AS " + sql;
            try (Statement statement = connection.createStatement()) {
                statement.execute(ddl);
            }
            log.info("[TXN:{}] ✅ Created view {}", transactionId, name);
            return true;
        } catch (SQLException e) {
            log.error("[TXN:{}] ❌ Failed to create view {}: {}", transactionId, name, e.getMessage());
            return false;
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public List<String> listViews(String transactionId) {
        requireConnected("listViews");
        acquire(transactionId);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                 "SELECT view_name FROM duckdb_views() WHERE NOT internal ORDER BY view_name")) {
            List<String> views = new ArrayList<>();
            while (rs.next()) {
                views.add(rs.getString(1));
            }
            log.debug("[TXN:{}] Found {} views", transactionId, views.size());
            return views;
        } catch (SQLException e) {
            log.error("[TXN:{}] ❌ Failed to list views: {}", transactionId, e.getMessage());
            return List.of();
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public boolean checkViewExists(String name) {
        requireConnected("checkViewExists");
        acquire(null);
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM duckdb_views() WHERE NOT internal AND lower(view_name) = lower(?)")) {
            statement.setString(1, name);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            log.error("❌ Failed to check view {}: {}", name, e.getMessage());
            return false;
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public boolean registerDataSource(DataSourceInfo sourceInfo, String transactionId) {
        requireConnected("registerDataSource");
        if (sourceInfo == null || sourceInfo.type() == null) {
            log.warn("[TXN:{}] ⚠️ Data source type is required", transactionId);
            return false;
        }
        String type = sourceInfo.type().toLowerCase(Locale.ROOT);
        if ("csv".equals(type)) {
            return registerCsv(sourceInfo, transactionId);
        }
        if ("table".equals(type)) {
            return tableExists(
                sourceInfo.schema() == null ? DEFAULT_SCHEMA : sourceInfo.schema(), sourceInfo.tableName());
        }
        log.warn("[TXN:{}] ⚠️ Unsupported data source type for DuckDB: {}", transactionId, sourceInfo.type());
        return false;
    }

    @Override
    public ValidationResult validateSql(String sql) {
        requireConnected("validateSql");
        if (sql == null || sql.isBlank()) {
            return ValidationResult.invalid("SQL statement is empty");
        }
        if (ReadOnlySqlRules.hasMultipleStatements(sql)) {
            return ValidationResult.invalid("Multi-statement queries are not allowed");
        }
        if (!ReadOnlySqlRules.startsWithReadKeyword(sql)) {
            String keyword = ReadOnlySqlRules.leadingKeyword(sql);
            return ValidationResult.invalid("Invalid SQL statement: only SELECT statements are allowed (found "
                    + (keyword.isEmpty() ? "UNKNOWN" : keyword) + ")");
        }
        Optional<String> denied = ReadOnlySqlRules.findDeniedKeyword(sql, DENIED_KEYWORDS);
        if (denied.isPresent()) {
            return ValidationResult.invalid("Invalid SQL statement: disallowed keyword " + denied.get());
        }
        return ValidationResult.valid();
    }

    @Override
    public Map<String, Object> getMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("database_type", TYPE);
        metadata.put("database_path", databasePath);
        if (!isConnected()) {
            metadata.put("status", "disconnected");
            return metadata;
        }
        metadata.put("status", "connected");
        connectionLock.lock();
        try (Statement statement = connection.createStatement()) {
            metadata.put("version", scalar(statement, "SELECT version()"));
            metadata.put("view_count", scalar(statement, "SELECT COUNT(*) FROM duckdb_views() WHERE NOT internal"));
            metadata.put("table_count", scalar(statement, "SELECT COUNT(*) FROM duckdb_tables() WHERE NOT internal"));
        } catch (SQLException e) {
            log.warn("⚠️ Could not read DuckDB metadata: {}", e.getMessage());
            metadata.put("error", e.getMessage());
        } finally {
            connectionLock.unlock();
        }
        return metadata;
    }

    @Override
    public Map<String, Boolean> createFallbackViews(List<String> viewNames, String transactionId) {
        requireConnected("createFallbackViews");
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String name : viewNames) {
            Optional<String> template = FallbackViewTemplates.sqlFor(name);
            if (template.isEmpty()) {
                log.warn("[TXN:{}] ⚠️ No fallback template for view {}", transactionId, name);
                results.put(name, false);
                continue;
            }
            boolean created = createView(name, template.get(), true, transactionId);
            if (created) {
                log.info("[TXN:{}] 🧪 Created fallback view {} with {} synthetic rows",
                        transactionId, name, FallbackViewTemplates.ROW_COUNT);
            }
            results.put(name, created);
        }
        return results;
    }

    /**
     * DuckDB maps {@code Statement.cancel()} to an engine interrupt of the running query.
     */
    @Override
    public boolean cancelQuery(String transactionId) {
        if (transactionId == null) {
            return false;
        }
        Statement statement = inFlight.get(transactionId);
        if (statement == null) {
            return false;
        }
        try {
            statement.cancel();
            log.warn("[TXN:{}] ⚠️ Interrupt sent to running DuckDB statement", transactionId);
            return true;
        } catch (SQLException e) {
            log.warn("[TXN:{}] ⚠️ DuckDB statement could not be cancelled, it may finish detached: {}",
                    transactionId, e.getMessage());
            return false;
        }
    }

    private boolean registerCsv(DataSourceInfo sourceInfo, String transactionId) {
        if (sourceInfo.path() == null || !Files.isRegularFile(Paths.get(sourceInfo.path()))) {
            log.warn("[TXN:{}] ⚠️ CSV file not found: {}", transactionId, sourceInfo.path());
            return false;
        }
        Path path = Paths.get(sourceInfo.path());
        String schema = sourceInfo.schema() == null ? DEFAULT_SCHEMA : sourceInfo.schema();
        String table = sourceInfo.tableName() != null ? sourceInfo.tableName() : baseName(path);
        String delimiter = sourceInfo.option("delimiter") != null ? sourceInfo.option("delimiter") : detectDelimiter(path);

        String loadSql = String.format(
            "CREATE OR REPLACE TABLE %s.%s AS SELECT * FROM read_csv_auto('%s', delim = '%s', header = true)",
            quoteIdentifier(schema), quoteIdentifier(table),
            path.toAbsolutePath().toString().replace("'", "''"), delimiter.replace("'", "''"));

        acquire(transactionId);
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE SCHEMA IF NOT EXISTS " + quoteIdentifier(schema));
            statement.execute(loadSql);
            log.info("[TXN:{}] ✅ Registered CSV {} as {}.{}", transactionId, path.getFileName(), schema, table);
            return true;
        } catch (SQLException e) {
            log.error("[TXN:{}] ❌ Failed to register CSV {}: {}", transactionId, path, e.getMessage());
            return false;
        } finally {
            connectionLock.unlock();
        }
    }

    private boolean tableExists(String schema, String table) {
        if (table == null) {
            return false;
        }
        acquire(null);
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM information_schema.tables WHERE lower(table_schema) = lower(?) AND lower(table_name) = lower(?)")) {
            statement.setString(1, schema);
            statement.setString(2, table);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            log.error("❌ Failed to look up table {}.{}: {}", schema, table, e.getMessage());
            return false;
        } finally {
            connectionLock.unlock();
        }
    }

    static String detectDelimiter(Path csvFile) {
        try (BufferedReader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header != null && header.chars().filter(c -> c == ';').count() > header.chars().filter(c -> c == ',').count()) {
                return ";";
            }
        } catch (IOException e) {
            log.warn("⚠️ Could not read header of {}, assuming comma delimiter: {}", csvFile, e.getMessage());
        }
        return ",";
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private void dropViewQuietly(String name, String transactionId) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("DROP VIEW IF EXISTS " + quoteIdentifier(name));
        } catch (SQLException e) {
            log.debug("[TXN:{}] Ignoring drop failure for {}: {}", transactionId, name, e.getMessage());
        }
    }

    private static Object scalar(Statement statement, String sql) throws SQLException {
        try (ResultSet rs = statement.executeQuery(sql)) {
            return rs.next() ? rs.getObject(1) : null;
        }
    }

    /**
     * Wait for the connection; a caller interrupted while queued gives up instead of waiting on.
     */
    private void acquire(String transactionId) {
        try {
            connectionLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException(
                "Interrupted while waiting for the DuckDB connection (transaction " + transactionId + ")", e);
        }
        if (connection == null) {
            connectionLock.unlock();
            throw new IllegalStateException("DuckDB connection was closed");
        }
    }

    private void track(String transactionId, Statement statement) {
        if (transactionId != null) {
            inFlight.put(transactionId, statement);
        }
    }

    private void untrack(String transactionId) {
        if (transactionId != null) {
            inFlight.remove(transactionId);
        }
    }
}
