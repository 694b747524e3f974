package com.baskettecase.dpmcp.backend.postgres;

import com.baskettecase.dpmcp.backend.AbstractBackendManager;
import com.baskettecase.dpmcp.backend.DataSourceInfo;
import com.baskettecase.dpmcp.backend.JdbcResultConverter;
import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.backend.RecordStore;
import com.baskettecase.dpmcp.error.QueryExecutionException;
import com.baskettecase.dpmcp.sql.ReadOnlySqlRules;
import com.baskettecase.dpmcp.sql.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.util.PGobject;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * PostgreSQL Backend Manager
 *
 * Pooled relational backend (PostgreSQL, Supabase) on HikariCP. Queries run
 * concurrently up to the pool size. Besides analytic reads it serves as the
 * metadata/config store through {@link RecordStore}, which is why its SQL check
 * is a plain denylist.
 */
@Slf4j
public class PostgresBackendManager extends AbstractBackendManager implements RecordStore {

    public static final String TYPE = "postgres";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final List<String> DENIED_PHRASES = List.of(
        "DROP TABLE", "DROP DATABASE", "DROP SCHEMA", "TRUNCATE", "DELETE FROM",
        "UPDATE", "ALTER TABLE", "GRANT", "REVOKE"
    );

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Function<HikariConfig, DataSource> dataSourceFactory;

    private volatile DataSource dataSource;
    private volatile NamedParameterJdbcTemplate jdbcTemplate;
    private String schema = "public";
    private String poolDescription;

    public PostgresBackendManager(Map<String, Object> config) {
        this(config, HikariDataSource::new);
    }

    public PostgresBackendManager(Map<String, Object> config, Function<HikariConfig, DataSource> dataSourceFactory) {
        super(config);
        this.dataSourceFactory = dataSourceFactory;
    }

    @Override
    public String getBackendType() {
        return TYPE;
    }

    @Override
    public synchronized boolean connect(Map<String, Object> params) {
        if (isConnected()) {
            return true;
        }
        Map<String, Object> merged = mergeParams(params);
        try {
            HikariConfig hikariConfig = buildPoolConfig(merged);
            schema = stringParam(merged, "schema", "public");
            dataSource = dataSourceFactory.apply(hikariConfig);

            JdbcTemplate template = new JdbcTemplate(dataSource);
            template.setFetchSize(1000);
            int statementTimeoutMs = intParam(merged, "statement-timeout-ms", 0);
            if (statementTimeoutMs > 0) {
                template.setQueryTimeout(Math.max(1, (statementTimeoutMs + 999) / 1000));
            }
            jdbcTemplate = new NamedParameterJdbcTemplate(template);

            poolDescription = String.format("%s (min=%d, max=%d)",
                    hikariConfig.getJdbcUrl(), hikariConfig.getMinimumIdle(), hikariConfig.getMaximumPoolSize());
            markConnected(true);
            log.info("🔗 Connected to PostgreSQL pool {}", poolDescription);
            return true;
        } catch (RuntimeException e) {
            log.error("❌ Failed to create PostgreSQL pool: {}", e.getMessage());
            closeDataSource();
            return false;
        }
    }

    @Override
    public synchronized boolean disconnect() {
        if (dataSource != null) {
            log.info("🔌 Closing PostgreSQL pool {}", poolDescription);
        }
        boolean closed = closeDataSource();
        jdbcTemplate = null;
        markConnected(false);
        return closed;
    }

    @Override
    public QueryResult executeQuery(String sql, Map<String, Object> parameters, String transactionId, int maxRows) {
        requireConnected("executeQuery");
        long start = System.nanoTime();
        log.info("[TXN:{}] 📊 PostgreSQL executing: {}", transactionId, sql);
        try {
            QueryResult result = jdbcTemplate.query(sql, new MapSqlParameterSource(parameters == null ? Map.of() : parameters),
                    (ResultSetExtractor<QueryResult>) rs ->
                            JdbcResultConverter.toQueryResult(rs, maxRows, start, PostgresBackendManager::unwrapPgObject));
            log.info("[TXN:{}] ✅ PostgreSQL returned {} rows in {} ms", transactionId,
                    result == null ? 0 : result.rowCount(), elapsedMs(start));
            return result == null ? QueryResult.empty(List.of(), elapsedMs(start)) : result;
        } catch (DataAccessException e) {
            String message = e.getMostSpecificCause().getMessage();
            log.error("[TXN:{}] ❌ PostgreSQL query failed: {}", transactionId, message);
            throw new QueryExecutionException(message, e);
        }
    }

    @Override
    public boolean createView(String name, String sql, boolean replace, String transactionId) {
        requireConnected("createView");
        String ddl = (replace ? "CREATE OR REPLACE VIEW " : "CREATE VIEW ") + quoteIdentifier(name) + " AS " + sql;
        try {
            jdbcTemplate.getJdbcTemplate().execute(ddl);
            log.info("[TXN:{}] ✅ Created view {}", transactionId, name);
            return true;
        } catch (DataAccessException e) {
            log.error("[TXN:{}] ❌ Failed to create view {}: {}", transactionId, name, e.getMostSpecificCause().getMessage());
            return false;
        }
    }

    @Override
    public List<String> listViews(String transactionId) {
        requireConnected("listViews");
        try {
            return jdbcTemplate.queryForList(
                "SELECT table_name FROM information_schema.views WHERE table_schema = :schema ORDER BY table_name",
                Map.of("schema", schema), String.class);
        } catch (DataAccessException e) {
            log.error("[TXN:{}] ❌ Failed to list views: {}", transactionId, e.getMostSpecificCause().getMessage());
            return List.of();
        }
    }

    @Override
    public boolean checkViewExists(String name) {
        requireConnected("checkViewExists");
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.views WHERE table_schema = :schema AND lower(table_name) = lower(:name)",
                Map.of("schema", schema, "name", name), Integer.class);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            log.error("❌ Failed to check view {}: {}", name, e.getMostSpecificCause().getMessage());
            return false;
        }
    }

    @Override
    public boolean registerDataSource(DataSourceInfo sourceInfo, String transactionId) {
        requireConnected("registerDataSource");
        log.debug("[TXN:{}] Data source registration is not needed for PostgreSQL", transactionId);
        return false;
    }

    @Override
    public ValidationResult validateSql(String sql) {
        requireConnected("validateSql");
        if (sql == null || sql.isBlank()) {
            return ValidationResult.invalid("Empty SQL query");
        }
        if (ReadOnlySqlRules.hasMultipleStatements(sql)) {
            return ValidationResult.invalid("Multi-statement queries are not allowed");
        }
        Optional<String> denied = ReadOnlySqlRules.findDeniedKeyword(sql, DENIED_PHRASES);
        return denied
            .map(phrase -> ValidationResult.invalid("Dangerous SQL operation detected: " + phrase))
            .orElseGet(ValidationResult::valid);
    }

    @Override
    public Map<String, Object> getMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("database_type", TYPE);
        metadata.put("schema", schema);
        if (!isConnected()) {
            metadata.put("status", "disconnected");
            return metadata;
        }
        metadata.put("status", "connected");
        metadata.put("pool", poolDescription);
        try {
            metadata.put("version", jdbcTemplate.getJdbcTemplate().queryForObject("SELECT version()", String.class));
        } catch (DataAccessException e) {
            metadata.put("error", e.getMostSpecificCause().getMessage());
        }
        if (dataSource instanceof HikariDataSource) {
            HikariPoolMXBean pool = ((HikariDataSource) dataSource).getHikariPoolMXBean();
            if (pool != null) {
                metadata.put("active_connections", pool.getActiveConnections());
                metadata.put("idle_connections", pool.getIdleConnections());
                metadata.put("total_connections", pool.getTotalConnections());
            }
        }
        return metadata;
    }

    @Override
    public Map<String, Boolean> createFallbackViews(List<String> viewNames, String transactionId) {
        requireConnected("createFallbackViews");
        log.debug("[TXN:{}] Fallback views are not created on PostgreSQL", transactionId);
        return allFalse(viewNames);
    }

    @Override
    public boolean upsertRecord(String table, Map<String, Object> record, List<String> keyFields, String transactionId) {
        requireConnected("upsertRecord");
        if (record == null || record.isEmpty() || keyFields == null || keyFields.isEmpty()) {
            log.warn("[TXN:{}] ⚠️ Upsert into {} needs a record and key fields", transactionId, table);
            return false;
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = buildUpsertSql(table, record, keyFields, params);
        try {
            int affected = jdbcTemplate.update(sql, params);
            log.info("[TXN:{}] ✅ Upserted record into {} ({} row(s) affected)", transactionId, table, affected);
            return true;
        } catch (DataAccessException e) {
            log.error("[TXN:{}] ❌ Upsert into {} failed: {}", transactionId, table, e.getMostSpecificCause().getMessage());
            return false;
        }
    }

    @Override
    public Optional<Map<String, Object>> getRecord(String table, String keyField, Object keyValue) {
        List<Map<String, Object>> rows = fetchRecords(table, Map.of(keyField, keyValue), 1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Map<String, Object>> fetchRecords(String table, Map<String, Object> filters, int limit) {
        requireConnected("fetchRecords");
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(identifier(table));
        if (filters != null && !filters.isEmpty()) {
            List<String> conditions = new ArrayList<>();
            int i = 0;
            for (Map.Entry<String, Object> filter : filters.entrySet()) {
                String param = "f" + i++;
                conditions.add(identifier(filter.getKey()) + " = :" + param);
                params.addValue(param, filter.getValue());
            }
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (limit > 0) {
            sql.append(" LIMIT ").append(limit);
        }
        try {
            return jdbcTemplate.queryForList(sql.toString(), params);
        } catch (DataAccessException e) {
            throw new QueryExecutionException(e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * {@code INSERT ... ON CONFLICT (keys) DO UPDATE SET c = EXCLUDED.c}, or {@code DO NOTHING}
     * when every column is a key. Map and collection values go to a jsonb column.
     */
    static String buildUpsertSql(String table, Map<String, Object> record, List<String> keyFields,
                                 MapSqlParameterSource params) {
        for (String key : keyFields) {
            if (!record.containsKey(key)) {
                throw new IllegalArgumentException("Key field '" + key + "' is missing from the record");
            }
        }
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        int i = 0;
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            String param = "p" + i++;
            columns.add(identifier(entry.getKey()));
            Object value = entry.getValue();
            if (value instanceof Map || value instanceof Collection) {
                params.addValue(param, toJson(value));
                placeholders.add("CAST(:" + param + " AS jsonb)");
            } else {
                params.addValue(param, value);
                placeholders.add(":" + param);
            }
        }

        String conflictTarget = keyFields.stream().map(PostgresBackendManager::identifier).collect(Collectors.joining(", "));
        List<String> updates = record.keySet().stream()
                .filter(column -> !keyFields.contains(column))
                .map(column -> identifier(column) + " = EXCLUDED." + identifier(column))
                .collect(Collectors.toList());

        return "INSERT INTO " + identifier(table)
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + String.join(", ", placeholders) + ")"
                + " ON CONFLICT (" + conflictTarget + ")"
                + (updates.isEmpty() ? " DO NOTHING" : " DO UPDATE SET " + String.join(", ", updates));
    }

    static HikariConfig buildPoolConfig(Map<String, Object> params) {
        HikariConfig hikariConfig = new HikariConfig();
        String jdbcUrl = stringParam(params, "jdbc-url", null);
        if (jdbcUrl == null) {
            jdbcUrl = String.format("jdbc:postgresql://%s:%d/%s",
                    stringParam(params, "host", "localhost"),
                    intParam(params, "port", 5432),
                    stringParam(params, "database", "postgres"));
        }
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setUsername(stringParam(params, "user", null));
        hikariConfig.setPassword(stringParam(params, "password", null));
        hikariConfig.setPoolName("dp-postgres");
        hikariConfig.setMinimumIdle(intParam(params, "min-pool-size", 1));
        hikariConfig.setMaximumPoolSize(intParam(params, "max-pool-size", 10));
        hikariConfig.setConnectionTimeout(30000);
        hikariConfig.setIdleTimeout(600000);
        hikariConfig.setMaxLifetime(1800000);

        StringBuilder initSql = new StringBuilder();
        int statementTimeoutMs = intParam(params, "statement-timeout-ms", 0);
        if (statementTimeoutMs > 0) {
            initSql.append("SET statement_timeout = ").append(statementTimeoutMs).append("; ");
        }
        initSql.append("SET application_name = 'data-product-mcp-server';");
        hikariConfig.setConnectionInitSql(initSql.toString());

        String sslMode = stringParam(params, "ssl-mode", null);
        if (sslMode != null) {
            hikariConfig.addDataSourceProperty("sslmode", sslMode);
        }
        hikariConfig.addDataSourceProperty("defaultRowFetchSize", "1000");
        return hikariConfig;
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        return name;
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be stored as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Object unwrapPgObject(Object value) {
        return value instanceof PGobject ? ((PGobject) value).getValue() : value;
    }

    private boolean closeDataSource() {
        DataSource current = dataSource;
        dataSource = null;
        if (current instanceof Closeable) {
            try {
                ((Closeable) current).close();
            } catch (IOException e) {
                log.warn("⚠️ Error closing PostgreSQL pool: {}", e.getMessage());
                return false;
            }
        }
        return true;
    }
}
