package com.baskettecase.dpmcp.backend;

import com.baskettecase.dpmcp.sql.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Contract every storage engine adapter satisfies.
 *
 * <p>An adapter owns exactly one backend connection (native handle, pool or client)
 * and moves between two states: disconnected and connected. Apart from
 * {@link #connect}, {@link #disconnect}, {@link #isConnected}, {@link #getBackendType}
 * and {@link #getMetadata}, every operation requires a connected adapter and throws
 * {@link IllegalStateException} otherwise.
 *
 * <p>{@link #executeQuery} raises {@link com.baskettecase.dpmcp.error.QueryExecutionException}
 * for native failures; the gateway is the only place these are turned into responses.
 */
public interface BackendManager {

    /**
     * Open the backend connection. Recoverable failures are logged and reported as {@code false}.
     */
    boolean connect(Map<String, Object> params);

    /**
     * Release the backend connection. Idempotent.
     */
    boolean disconnect();

    boolean isConnected();

    /**
     * Registered type name, e.g. {@code duckdb}.
     */
    String getBackendType();

    /**
     * Run a single read statement.
     *
     * @param sql           statement text
     * @param parameters    named parameters, may be null or empty
     * @param transactionId correlation id for logging and cancellation, may be null
     * @param maxRows       row cap, {@code <= 0} for unlimited; a capped result is marked truncated
     */
    QueryResult executeQuery(String sql, Map<String, Object> parameters, String transactionId, int maxRows);

    default QueryResult executeQuery(String sql, Map<String, Object> parameters, String transactionId) {
        return executeQuery(sql, parameters, transactionId, 0);
    }

    default QueryResult executeQuery(String sql) {
        return executeQuery(sql, Map.of(), null, 0);
    }

    /**
     * Create or replace a named view. Engines without view support return {@code false}.
     */
    boolean createView(String name, String sql, boolean replace, String transactionId);

    List<String> listViews(String transactionId);

    boolean checkViewExists(String name);

    /**
     * Expose a file or table to the engine. Only meaningful for file-ingesting engines.
     */
    boolean registerDataSource(DataSourceInfo sourceInfo, String transactionId);

    /**
     * Engine-local enforcement of the read-only policy.
     */
    ValidationResult validateSql(String sql);

    Map<String, Object> getMetadata();

    /**
     * Materialize synthetic data for known required views.
     *
     * @return per-name success; unknown names and unsupporting engines map to {@code false}
     */
    Map<String, Boolean> createFallbackViews(List<String> viewNames, String transactionId);

    /**
     * Interrupt the in-flight query started under {@code transactionId}, where the driver allows it.
     *
     * @return true if an interrupt was issued
     */
    default boolean cancelQuery(String transactionId) {
        return false;
    }
}
