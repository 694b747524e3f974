package com.baskettecase.dpmcp.backend.bigquery;

import com.baskettecase.dpmcp.backend.AbstractBackendManager;
import com.baskettecase.dpmcp.backend.DataSourceInfo;
import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.error.QueryExecutionException;
import com.baskettecase.dpmcp.sql.ReadOnlySqlRules;
import com.baskettecase.dpmcp.sql.ValidationResult;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.TableResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * BigQuery Backend Manager
 *
 * Stateless client bound to a default project and dataset. The client API blocks,
 * so each query runs on a worker thread of this adapter and the calling thread waits
 * on it; interrupting the caller cancels the BigQuery job. Curated views live in
 * BigQuery itself, so view creation, source registration and fallback views are not
 * supported here.
 */
@Slf4j
public class BigQueryBackendManager extends AbstractBackendManager {

    public static final String TYPE = "bigquery";

    private static final List<String> DENIED_KEYWORDS = List.of(
        "insert", "update", "delete", "merge", "create", "alter", "drop", "truncate"
    );

    private final BigQueryClientFactory clientFactory;
    private final Map<String, JobId> runningJobs = new ConcurrentHashMap<>();

    private volatile BigQuery client;
    private volatile ExecutorService worker;
    private String projectId;
    private String datasetId;
    private Long jobTimeoutMs;

    public BigQueryBackendManager(Map<String, Object> config) {
        this(config, BigQueryClientFactory.standard());
    }

    public BigQueryBackendManager(Map<String, Object> config, BigQueryClientFactory clientFactory) {
        super(config);
        this.clientFactory = clientFactory;
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
        String project = stringParam(merged, "project", null);
        String dataset = stringParam(merged, "dataset", null);
        if (project == null || dataset == null) {
            log.error("❌ BigQuery requires 'project' and 'dataset' connection parameters");
            return false;
        }
        try {
            client = clientFactory.create(
                project,
                stringParam(merged, "service-account-json-path", null),
                stringParam(merged, "location", null));
            projectId = project;
            datasetId = dataset;
            int timeout = intParam(merged, "query-timeout-ms", 0);
            jobTimeoutMs = timeout > 0 ? (long) timeout : null;
            worker = Executors.newCachedThreadPool(new CustomizableThreadFactory("bigquery-worker-"));
            markConnected(true);
            log.info("🔗 Connected to BigQuery dataset {}.{}", projectId, datasetId);
            return true;
        } catch (Exception e) {
            log.error("❌ Failed to create BigQuery client for project {}: {}", project, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized boolean disconnect() {
        if (worker != null) {
            worker.shutdownNow();
            worker = null;
        }
        if (client != null) {
            log.info("🔌 Released BigQuery client for {}.{}", projectId, datasetId);
        }
        client = null;
        runningJobs.clear();
        markConnected(false);
        return true;
    }

    @Override
    public QueryResult executeQuery(String sql, Map<String, Object> parameters, String transactionId, int maxRows) {
        requireConnected("executeQuery");
        long start = System.nanoTime();
        BigQuery bigQuery = client;

        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(sql)
                .setDefaultDataset(DatasetId.of(projectId, datasetId))
                .setUseLegacySql(false);
        if (jobTimeoutMs != null) {
            builder.setJobTimeoutMs(jobTimeoutMs);
        }
        if (parameters != null) {
            parameters.forEach((name, value) -> builder.addNamedParameter(name, toParameterValue(value)));
        }
        QueryJobConfiguration jobConfig = builder.build();
        JobId jobId = JobId.of("dp_" + UUID.randomUUID().toString().replace("-", ""));

        log.info("[TXN:{}] 📊 BigQuery executing (job {}): {}", transactionId, jobId.getJob(), sql);
        if (transactionId != null) {
            runningJobs.put(transactionId, jobId);
        }
        Future<TableResult> future = worker.submit(() -> bigQuery.query(jobConfig, jobId));
        try {
            TableResult tableResult = future.get();
            QueryResult result = convert(tableResult, maxRows, start);
            log.info("[TXN:{}] ✅ BigQuery returned {} rows in {} ms", transactionId, result.rowCount(), result.elapsedMs());
            return result;
        } catch (InterruptedException e) {
            future.cancel(true);
            cancelJob(bigQuery, jobId, transactionId);
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("BigQuery query interrupted (job " + jobId.getJob() + ")", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[TXN:{}] ❌ BigQuery query failed: {}", transactionId, cause.getMessage());
            throw new QueryExecutionException(cause.getMessage(), cause);
        } finally {
            if (transactionId != null) {
                runningJobs.remove(transactionId);
            }
        }
    }

    @Override
    public boolean createView(String name, String sql, boolean replace, String transactionId) {
        requireConnected("createView");
        log.warn("[TXN:{}] ⚠️ View creation is not supported for BigQuery; view {} must be managed in BigQuery",
                transactionId, name);
        return false;
    }

    @Override
    public List<String> listViews(String transactionId) {
        requireConnected("listViews");
        try {
            QueryResult result = executeQuery(
                "SELECT table_name FROM `" + viewsTable() + "` ORDER BY table_name",
                Map.of(), transactionId, 0);
            List<String> views = new ArrayList<>();
            result.rows().forEach(row -> views.add(String.valueOf(row.get(0))));
            return views;
        } catch (QueryExecutionException e) {
            log.error("[TXN:{}] ❌ Failed to list BigQuery views: {}", transactionId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean checkViewExists(String name) {
        requireConnected("checkViewExists");
        try {
            QueryResult result = executeQuery(
                "SELECT COUNT(*) AS cnt FROM `" + viewsTable() + "` WHERE table_name = @view_name",
                Map.of("view_name", name), null, 0);
            return !result.isEmpty() && ((Number) result.rows().get(0).get(0)).longValue() > 0;
        } catch (QueryExecutionException e) {
            log.error("❌ Failed to check BigQuery view {}: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean registerDataSource(DataSourceInfo sourceInfo, String transactionId) {
        requireConnected("registerDataSource");
        log.warn("[TXN:{}] ⚠️ Data source registration is not supported for BigQuery", transactionId);
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
            return ValidationResult.invalid("Only SELECT/WITH statements are permitted for BigQuery execution (found "
                    + ReadOnlySqlRules.leadingKeyword(sql) + ")");
        }
        Optional<String> denied = ReadOnlySqlRules.findDeniedKeyword(sql, DENIED_KEYWORDS);
        if (denied.isPresent()) {
            return ValidationResult.invalid("Mutation statements are not allowed: " + denied.get());
        }
        return ValidationResult.valid();
    }

    @Override
    public Map<String, Object> getMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", isConnected() ? "connected" : "disconnected");
        metadata.put("database_type", TYPE);
        metadata.put("project", projectId);
        metadata.put("dataset", datasetId);
        return metadata;
    }

    @Override
    public Map<String, Boolean> createFallbackViews(List<String> viewNames, String transactionId) {
        requireConnected("createFallbackViews");
        log.warn("[TXN:{}] ⚠️ Fallback views are not supported for BigQuery", transactionId);
        return allFalse(viewNames);
    }

    @Override
    public boolean cancelQuery(String transactionId) {
        JobId jobId = transactionId == null ? null : runningJobs.get(transactionId);
        BigQuery bigQuery = client;
        if (jobId == null || bigQuery == null) {
            return false;
        }
        return cancelJob(bigQuery, jobId, transactionId);
    }

    static QueryResult convert(TableResult tableResult, int maxRows, long startNanos) {
        FieldList fields = tableResult.getSchema() == null ? null : tableResult.getSchema().getFields();
        List<String> columns = new ArrayList<>();
        if (fields != null) {
            fields.forEach(field -> columns.add(field.getName()));
        }
        List<List<Object>> rows = new ArrayList<>();
        boolean truncated = false;
        for (FieldValueList values : tableResult.iterateAll()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }
            List<Object> row = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                row.add(toJavaValue(fields.get(i), values.get(i)));
            }
            rows.add(row);
        }
        return QueryResult.of(columns, rows, elapsedMs(startNanos), truncated);
    }

    static Object toJavaValue(Field field, FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() != FieldValue.Attribute.PRIMITIVE) {
            return String.valueOf(value.getValue());
        }
        StandardSQLTypeName type = field.getType().getStandardType();
        switch (type) {
            case INT64:
                return value.getLongValue();
            case FLOAT64:
                return value.getDoubleValue();
            case NUMERIC:
            case BIGNUMERIC:
                return value.getNumericValue();
            case BOOL:
                return value.getBooleanValue();
            default:
                return value.getStringValue();
        }
    }

    static QueryParameterValue toParameterValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return QueryParameterValue.int64(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return QueryParameterValue.float64(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal) {
            return QueryParameterValue.numeric((BigDecimal) value);
        }
        if (value instanceof Boolean) {
            return QueryParameterValue.bool((Boolean) value);
        }
        return QueryParameterValue.string(value == null ? null : String.valueOf(value));
    }

    private boolean cancelJob(BigQuery bigQuery, JobId jobId, String transactionId) {
        try {
            boolean cancelled = bigQuery.cancel(jobId);
            log.warn("[TXN:{}] ⚠️ Cancellation requested for BigQuery job {}: {}", transactionId, jobId.getJob(), cancelled);
            return cancelled;
        } catch (RuntimeException e) {
            log.warn("[TXN:{}] ⚠️ Could not cancel BigQuery job {}: {}", transactionId, jobId.getJob(), e.getMessage());
            return false;
        }
    }

    private String viewsTable() {
        return projectId + "." + datasetId + ".INFORMATION_SCHEMA.VIEWS";
    }
}
