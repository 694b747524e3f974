package com.baskettecase.dpmcp.gateway;

import com.baskettecase.dpmcp.backend.BackendManager;
import com.baskettecase.dpmcp.backend.BackendManagerFactory;
import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.catalog.BootstrapReport;
import com.baskettecase.dpmcp.catalog.CatalogSnapshot;
import com.baskettecase.dpmcp.catalog.DataProductDefinition;
import com.baskettecase.dpmcp.catalog.ViewBootstrapper;
import com.baskettecase.dpmcp.config.GatewayProperties;
import com.baskettecase.dpmcp.error.BackendConnectionException;
import com.baskettecase.dpmcp.error.ErrorCode;
import com.baskettecase.dpmcp.error.GatewayException;
import com.baskettecase.dpmcp.error.QueryTimeoutException;
import com.baskettecase.dpmcp.sql.SqlNormalizer;
import com.baskettecase.dpmcp.sql.SqlValidator;
import com.baskettecase.dpmcp.sql.ValidationResult;
import com.baskettecase.dpmcp.util.NameSuggester;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Query Gateway
 *
 * Single entry point for read-only SQL against the configured backend. Every request,
 * successful or not, comes back as a {@link ResponseEnvelope}; the only exceptions that
 * escape are usage errors (calling before initialization or after close).
 *
 * Pipeline per request: normalize (data product requests only), validate at the gateway,
 * reconnect if needed, validate at the backend, execute on the worker pool under a timeout,
 * then classify failures and annotate the envelope.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryGateway {

    public enum State { UNINITIALIZED, INITIALIZING, READY, CLOSED }

    static final String METRIC_EXECUTIONS = "dp_gateway.query.executions";
    static final String METRIC_FAILURES = "dp_gateway.query.failures";
    static final String METRIC_DURATION = "dp_gateway.query.duration";

    private final GatewayProperties properties;
    private final BackendManagerFactory backendFactory;
    private final ViewBootstrapper viewBootstrapper;
    private final SqlValidator sqlValidator;
    private final SqlNormalizer sqlNormalizer;
    private final HumanActionClassifier humanActionClassifier;
    private final PrincipalContextProvider principalContextProvider;
    private final MeterRegistry meterRegistry;

    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final Object reconnectMonitor = new Object();

    private volatile State state = State.UNINITIALIZED;
    private volatile BackendManager backend;
    private volatile CatalogSnapshot catalog = CatalogSnapshot.empty("none");
    private volatile BootstrapReport lastBootstrap;
    private ExecutorService queryExecutor;
    private Counter executionCounter;
    private Timer durationTimer;

    @PostConstruct
    public void initialize() {
        lifecycleLock.writeLock().lock();
        try {
            if (state != State.UNINITIALIZED) {
                throw new IllegalStateException("Query gateway cannot initialize from state " + state);
            }
            state = State.INITIALIZING;
            String txId = newTransactionId();
            log.info("[TXN:{}] 🚀 Initializing query gateway with {} backend", txId, properties.getBackendType());

            executionCounter = Counter.builder(METRIC_EXECUTIONS)
                    .description("Queries submitted to the gateway")
                    .register(meterRegistry);
            durationTimer = Timer.builder(METRIC_DURATION)
                    .description("End-to-end gateway query time")
                    .register(meterRegistry);

            if (!properties.getSecurity().isValidateSql()) {
                log.warn("⚠️ Gateway SQL validation is DISABLED; relying on backend and database permissions");
            }

            try {
                Map<String, Object> connectionParams = connectionParams();
                BackendManager manager = backendFactory.createManager(properties.getBackendType(), connectionParams);
                if (!manager.connect(connectionParams)) {
                    throw new BackendConnectionException(
                            "Could not connect to " + properties.getBackendType() + " backend");
                }
                backend = manager;
                queryExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentQueries()),
                        new CustomizableThreadFactory("dp-query-"));
                bootstrapViews(txId);
            } catch (RuntimeException e) {
                log.error("[TXN:{}] ❌ Query gateway initialization failed: {}", txId, e.getMessage());
                releaseResources();
                state = State.UNINITIALIZED;
                throw e;
            }

            state = State.READY;
            log.info("[TXN:{}] ✅ Query gateway ready: backend={}, catalog={}, {} data products",
                    txId, backend.getBackendType(), catalog.source(), catalog.dataProducts().size());
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * Re-resolve definitions and re-create views. In-flight queries finish first.
     */
    public BootstrapReport reload() {
        lifecycleLock.writeLock().lock();
        try {
            requireReady("reload");
            String txId = newTransactionId();
            log.info("[TXN:{}] 🔄 Reloading view definitions", txId);
            state = State.INITIALIZING;
            try {
                return bootstrapViews(txId);
            } finally {
                state = State.READY;
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @PreDestroy
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (state == State.CLOSED) {
                return;
            }
            releaseResources();
            state = State.CLOSED;
            log.info("🔌 Query gateway closed");
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * Execute ad-hoc SQL.
     */
    public ResponseEnvelope execute(QueryRequest request) {
        lifecycleLock.readLock().lock();
        try {
            requireReady("execute");
            String txId = request != null && hasText(request.transactionId()) ? request.transactionId() : newTransactionId();
            String requestId = request != null && hasText(request.requestId()) ? request.requestId() : txId;

            if (request == null || !hasText(request.sql())) {
                return reject(requestId, txId, ErrorCode.INVALID_REQUEST, "Invalid or empty SQL request");
            }
            if (!properties.getSecurity().isAllowCustomSql()) {
                return reject(requestId, txId, ErrorCode.CUSTOM_SQL_DISABLED, "Custom SQL execution is disabled");
            }

            Invocation invocation = new Invocation(requestId, txId, null, null, request.sql().trim(),
                    request.parameters(), request.principalId(), request.principalContext(),
                    request.timeoutMs(), request.maxRows());
            return run(invocation);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Execute generated SQL against a data product. The SQL is normalized first since it
     * usually arrives wrapped in JSON, code fences or quotes.
     */
    public ResponseEnvelope getDataProduct(DataProductRequest request) {
        lifecycleLock.readLock().lock();
        try {
            requireReady("getDataProduct");
            String txId = request != null && hasText(request.transactionId()) ? request.transactionId() : newTransactionId();
            String requestId = request != null && hasText(request.requestId()) ? request.requestId() : txId;

            if (request == null || !hasText(request.productId())) {
                return reject(requestId, txId, ErrorCode.INVALID_REQUEST, "Invalid data product request: missing product ID");
            }
            if (!hasText(request.sqlQuery())) {
                ResponseEnvelope envelope = reject(requestId, txId, ErrorCode.INVALID_REQUEST, "Missing SQL query in request");
                envelope.setProductId(request.productId());
                return envelope;
            }

            String sql;
            try {
                sql = sqlNormalizer.normalize(request.sqlQuery());
            } catch (RuntimeException e) {
                log.warn("[TXN:{}] ⚠️ SQL normalization failed, using raw text: {}", txId, e.getMessage());
                sql = request.sqlQuery().trim();
            }
            if (!hasText(sql)) {
                ResponseEnvelope envelope = reject(requestId, txId, ErrorCode.INVALID_REQUEST, "SQL query is empty after normalization");
                envelope.setProductId(request.productId());
                return envelope;
            }

            DataProductDefinition product = catalog.findDataProduct(request.productId()).orElse(null);
            if (product == null) {
                log.info("[TXN:{}] 📦 Data product {} is not in catalog {}, executing anyway",
                        txId, request.productId(), catalog.source());
            }

            Invocation invocation = new Invocation(requestId, txId, request.productId(), product, sql,
                    request.parameters(), request.principalId(), request.principalContext(),
                    request.timeoutMs(), request.maxRows());
            return run(invocation);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    public List<String> listViews() {
        lifecycleLock.readLock().lock();
        try {
            requireReady("listViews");
            return backend.listViews(newTransactionId());
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    public CatalogSnapshot getCatalog() {
        return catalog;
    }

    public Optional<BootstrapReport> getLastBootstrapReport() {
        return Optional.ofNullable(lastBootstrap);
    }

    public State getState() {
        return state;
    }

    /**
     * Backend metadata plus gateway state. Safe to call in any state.
     */
    public Map<String, Object> getBackendMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("gateway_state", state.name());
        metadata.put("backend_type", properties.getBackendType());
        metadata.put("catalog_source", catalog.source());
        BackendManager current = backend;
        if (current != null) {
            try {
                metadata.putAll(current.getMetadata());
            } catch (RuntimeException e) {
                log.warn("⚠️ Could not read backend metadata: {}", e.getMessage());
                metadata.put("status", "error");
                metadata.put("error", e.getMessage());
            }
        }
        return metadata;
    }

    // ---------------------------------------------------------------------------------------

    private BootstrapReport bootstrapViews(String txId) {
        if (hasText(properties.getDataDirectory())) {
            viewBootstrapper.registerDataDirectory(backend, Paths.get(properties.getDataDirectory()),
                    properties.getDataSchema(), txId);
        }
        CatalogSnapshot snapshot = viewBootstrapper.resolve();
        BootstrapReport report = viewBootstrapper.materialize(backend, snapshot, properties.getRequiredViews(), txId);
        catalog = snapshot;
        lastBootstrap = report;
        return report;
    }

    private ResponseEnvelope run(Invocation invocation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        executionCounter.increment();
        try {
            Outcome outcome = validateAndExecute(invocation);
            return toEnvelope(invocation, outcome);
        } catch (RuntimeException e) {
            log.error("[TXN:{}] ❌ Unexpected gateway failure", invocation.transactionId(), e);
            return toEnvelope(invocation, Outcome.failed(ErrorCode.INTERNAL_ERROR,
                    "Internal gateway error: " + e.getMessage(), e));
        } finally {
            sample.stop(durationTimer);
        }
    }

    private Outcome validateAndExecute(Invocation invocation) {
        String txId = invocation.transactionId();
        log.info("[TXN:{}] 🔧 Executing SQL{}: {}", txId,
                invocation.productId() != null ? " for data product " + invocation.productId() : "", invocation.sql());

        boolean validate = properties.getSecurity().isValidateSql();
        if (validate) {
            ValidationResult gatewayCheck = sqlValidator.validate(invocation.sql());
            if (!gatewayCheck.isValid()) {
                log.warn("[TXN:{}] ❌ SQL validation failed: {}", txId, gatewayCheck.getErrorMessage());
                return Outcome.failed(ErrorCode.SQL_VALIDATION_ERROR, gatewayCheck.getErrorMessage(), null);
            }
            if (!gatewayCheck.warnings().isEmpty()) {
                log.warn("[TXN:{}] ⚠️ SQL warnings: {}", txId, gatewayCheck.getWarningMessage());
            }
        }
        String executable = sqlValidator.prepareForExecution(invocation.sql());

        Optional<Outcome> connectionProblem = ensureConnected(txId);
        if (connectionProblem.isPresent()) {
            return connectionProblem.get();
        }

        BackendManager target = backend;
        if (validate) {
            ValidationResult backendCheck = target.validateSql(executable);
            if (!backendCheck.isValid()) {
                log.warn("[TXN:{}] ❌ {} rejected SQL: {}", txId, target.getBackendType(), backendCheck.getErrorMessage());
                return Outcome.failed(ErrorCode.SQL_VALIDATION_ERROR, backendCheck.getErrorMessage(), null);
            }
        }

        int maxRows = effectiveMaxRows(invocation.maxRows());
        long timeoutMs = invocation.timeoutMs() != null && invocation.timeoutMs() > 0
                ? invocation.timeoutMs() : properties.getQueryTimeoutMs();
        Map<String, Object> parameters = invocation.parameters() == null ? Map.of() : invocation.parameters();

        Future<QueryResult> future;
        try {
            future = queryExecutor.submit(() -> target.executeQuery(executable, parameters, txId, maxRows));
        } catch (RejectedExecutionException e) {
            return Outcome.failed(ErrorCode.CONNECTION_ERROR, "Query executor is not accepting work", e);
        }

        try {
            return Outcome.of(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            if (!target.cancelQuery(txId)) {
                log.warn("[TXN:{}] ⚠️ {} backend could not interrupt the query; it may finish detached",
                        txId, target.getBackendType());
            }
            QueryTimeoutException timeout = new QueryTimeoutException(timeoutMs);
            log.error("[TXN:{}] ⏱️ {}", txId, timeout.getMessage());
            return Outcome.failed(timeout.getErrorCode(), timeout.getMessage(), timeout);
        } catch (ExecutionException e) {
            return executionFailure(invocation, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            target.cancelQuery(txId);
            Thread.currentThread().interrupt();
            return Outcome.failed(ErrorCode.INTERNAL_ERROR, "Query interrupted", e);
        }
    }

    private Outcome executionFailure(Invocation invocation, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        ErrorCode code;
        if (cause instanceof GatewayException) {
            code = ((GatewayException) cause).getErrorCode();
        } else if (cause instanceof IllegalStateException) {
            code = ErrorCode.CONNECTION_ERROR;
        } else {
            code = ErrorCode.SQL_EXECUTION_ERROR;
        }
        log.error("[TXN:{}] ❌ SQL execution failed: {}\nSQL: {}", invocation.transactionId(), message, invocation.sql(), cause);
        return Outcome.failed(code, message, cause);
    }

    private Optional<Outcome> ensureConnected(String txId) {
        if (backend.isConnected()) {
            return Optional.empty();
        }
        synchronized (reconnectMonitor) {
            if (backend.isConnected()) {
                return Optional.empty();
            }
            log.warn("[TXN:{}] 🔗 {} backend disconnected, attempting reconnect", txId, backend.getBackendType());
            boolean reconnected;
            try {
                reconnected = backend.connect(connectionParams());
            } catch (RuntimeException e) {
                log.error("[TXN:{}] ❌ Reconnect failed: {}", txId, e.getMessage());
                reconnected = false;
            }
            if (!reconnected) {
                return Optional.of(Outcome.failed(ErrorCode.CONNECTION_ERROR,
                        "Backend " + backend.getBackendType() + " is not connected and reconnect failed", null));
            }
            log.info("[TXN:{}] ✅ Reconnected to {} backend", txId, backend.getBackendType());
            try {
                BootstrapReport report = bootstrapViews(txId);
                log.info("[TXN:{}] 🏗️ Restored {} views after reconnect", txId, report.createdCount());
            } catch (RuntimeException e) {
                log.warn("[TXN:{}] ⚠️ Views could not be restored after reconnect: {}", txId, e.getMessage());
            }
            return Optional.empty();
        }
    }

    private ResponseEnvelope toEnvelope(Invocation invocation, Outcome outcome) {
        String txId = invocation.transactionId();
        ResponseEnvelope envelope;
        switch (outcome.kind()) {
            case OK:
            case EMPTY: {
                QueryResult result = outcome.result();
                envelope = ResponseEnvelope.success(invocation.requestId(), txId, successMessage(invocation, result), result);
                if (outcome.kind() == Outcome.Kind.EMPTY) {
                    log.info("[TXN:{}] 📭 Query returned no rows in {} ms", txId, result.elapsedMs());
                } else {
                    log.info("[TXN:{}] ✅ Query returned {} rows{} in {} ms", txId, result.rowCount(),
                            result.truncated() ? " (truncated)" : "", result.elapsedMs());
                }
                break;
            }
            default: {
                envelope = ResponseEnvelope.error(invocation.requestId(), txId, outcome.errorCode(), outcome.errorMessage());
                meterRegistry.counter(METRIC_FAILURES, "error_code", outcome.errorCode().name()).increment();
                if (outcome.errorCode() == ErrorCode.SQL_EXECUTION_ERROR) {
                    flagHumanAction(envelope, invocation.sql(), outcome.errorMessage(), txId);
                }
                break;
            }
        }
        envelope.setProductId(invocation.productId());
        envelope.setMetadata(annotate(invocation));
        return envelope;
    }

    private void flagHumanAction(ResponseEnvelope envelope, String sql, String errorMessage, String txId) {
        humanActionClassifier.classify(errorMessage).ifPresent(category -> {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("category", category.name());
            context.put("sql", sql);
            context.put("message", errorMessage);
            context.put("transaction_id", txId);
            if (category == HumanActionClassifier.Category.MISSING_RELATION) {
                humanActionClassifier.extractMissingRelation(errorMessage).ifPresent(missing -> {
                    context.put("missing_relation", missing);
                    List<String> suggestions = NameSuggester.suggest(missing, knownRelations(txId));
                    if (!suggestions.isEmpty()) {
                        context.put("suggestions", suggestions);
                    }
                });
            }
            envelope.setHumanActionRequired(true);
            envelope.setHumanActionType(category.getActionType());
            envelope.setHumanActionContext(context);
            log.info("[TXN:{}] 🙋 Error flagged for human action: {}", txId, category);
        });
    }

    private List<String> knownRelations(String txId) {
        List<String> names = new ArrayList<>();
        try {
            names.addAll(backend.listViews(txId));
        } catch (RuntimeException e) {
            log.debug("[TXN:{}] Could not list views for suggestions: {}", txId, e.getMessage());
        }
        catalog.dataProducts().forEach(product -> names.add(product.primaryTableOrView()));
        return names;
    }

    private Map<String, Object> annotate(Invocation invocation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", properties.getBackendType());

        Map<String, Object> principalContext = invocation.principalContext();
        if (principalContext == null && invocation.principalId() != null) {
            try {
                principalContext = principalContextProvider.findPrincipalContext(invocation.principalId()).orElse(null);
            } catch (RuntimeException e) {
                log.warn("[TXN:{}] ⚠️ Principal context lookup failed for {}: {}",
                        invocation.transactionId(), invocation.principalId(), e.getMessage());
            }
        }
        if (invocation.principalId() != null) {
            metadata.put("principal_id", invocation.principalId());
        }
        if (principalContext != null) {
            metadata.put("principal_context", principalContext);
        }

        DataProductDefinition product = invocation.product();
        String governance = DataProductDefinition.DEFAULT_GOVERNANCE_LEVEL;
        if (product != null) {
            governance = product.governanceLevel();
            metadata.put("product_type", product.isView() ? "view" : "table");
            metadata.put("primary_table", product.primaryTableOrView());
        } else if (principalContext != null && principalContext.get("governance_level") != null) {
            governance = String.valueOf(principalContext.get("governance_level"));
        }
        metadata.put("governance_level", governance);
        return metadata;
    }

    private ResponseEnvelope reject(String requestId, String txId, ErrorCode code, String message) {
        log.warn("[TXN:{}] ❌ Rejected request: {}", txId, message);
        executionCounter.increment();
        meterRegistry.counter(METRIC_FAILURES, "error_code", code.name()).increment();
        return ResponseEnvelope.error(requestId, txId, code, message);
    }

    private String successMessage(Invocation invocation, QueryResult result) {
        if (invocation.productId() != null) {
            return "Successfully retrieved " + result.rowCount() + " rows for data product: " + invocation.productId();
        }
        return "SQL execution successful";
    }

    private int effectiveMaxRows(Integer requested) {
        int configured = properties.getMaxRows();
        if (requested == null || requested <= 0) {
            return configured;
        }
        return configured > 0 ? Math.min(requested, configured) : requested;
    }

    private Map<String, Object> connectionParams() {
        Map<String, Object> params = new HashMap<>(properties.getConnection());
        params.putIfAbsent("query-timeout-ms", properties.getQueryTimeoutMs());
        params.putIfAbsent("statement-timeout-ms", properties.getQueryTimeoutMs());
        return params;
    }

    private void releaseResources() {
        if (queryExecutor != null) {
            queryExecutor.shutdownNow();
            queryExecutor = null;
        }
        if (backend != null) {
            try {
                backend.disconnect();
            } catch (RuntimeException e) {
                log.warn("⚠️ Backend disconnect failed: {}", e.getMessage());
            }
        }
    }

    private void requireReady(String operation) {
        State current = state;
        if (current != State.READY) {
            throw new IllegalStateException("Query gateway is " + current + "; " + operation + " requires READY");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String newTransactionId() {
        return UUID.randomUUID().toString();
    }

    private record Invocation(
        String requestId,
        String transactionId,
        String productId,
        DataProductDefinition product,
        String sql,
        Map<String, Object> parameters,
        String principalId,
        Map<String, Object> principalContext,
        Long timeoutMs,
        Integer maxRows
    ) {
    }

    /**
     * Result of one execution attempt: rows, no rows, or a classified error.
     */
    private record Outcome(Kind kind, QueryResult result, ErrorCode errorCode, String errorMessage, Throwable cause) {

        enum Kind { OK, EMPTY, ERROR }

        static Outcome of(QueryResult result) {
            return new Outcome(result.isEmpty() ? Kind.EMPTY : Kind.OK, result, null, null, null);
        }

        static Outcome failed(ErrorCode errorCode, String errorMessage, Throwable cause) {
            return new Outcome(Kind.ERROR, null, errorCode, errorMessage, cause);
        }
    }
}
