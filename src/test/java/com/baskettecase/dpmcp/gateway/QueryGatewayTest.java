package com.baskettecase.dpmcp.gateway;

import com.baskettecase.dpmcp.backend.BackendManager;
import com.baskettecase.dpmcp.backend.BackendManagerFactory;
import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.catalog.CatalogSnapshot;
import com.baskettecase.dpmcp.catalog.DataProductDefinition;
import com.baskettecase.dpmcp.catalog.DefinitionSource;
import com.baskettecase.dpmcp.catalog.ViewBootstrapper;
import com.baskettecase.dpmcp.catalog.ViewDefinition;
import com.baskettecase.dpmcp.config.GatewayProperties;
import com.baskettecase.dpmcp.error.BackendConnectionException;
import com.baskettecase.dpmcp.error.ErrorCode;
import com.baskettecase.dpmcp.error.QueryExecutionException;
import com.baskettecase.dpmcp.sql.SqlNormalizer;
import com.baskettecase.dpmcp.sql.SqlValidator;
import com.baskettecase.dpmcp.sql.ValidationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Gateway pipeline against a mocked backend.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class QueryGatewayTest {

    private static final QueryResult ONE_ROW = QueryResult.of(List.of("total_value"), List.of(List.of(500)), 3, false);

    @Mock
    private BackendManager backend;

    private GatewayProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private PrincipalContextProvider principalContextProvider = PrincipalContextProvider.NONE;
    private QueryGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setBackendType("mock");
        properties.setRequiredViews(List.of("fi_star_view"));
        meterRegistry = new SimpleMeterRegistry();

        when(backend.getBackendType()).thenReturn("mock");
        when(backend.connect(any())).thenReturn(true);
        when(backend.isConnected()).thenReturn(true);
        when(backend.createView(anyString(), anyString(), anyBoolean(), anyString())).thenReturn(true);
        when(backend.checkViewExists(anyString())).thenReturn(true);
        when(backend.validateSql(anyString())).thenReturn(ValidationResult.valid());
        when(backend.listViews(anyString())).thenReturn(List.of("fi_star_view", "fi_customer_transactions_view"));
        when(backend.getMetadata()).thenReturn(Map.of("status", "connected"));
        when(backend.executeQuery(anyString(), any(), anyString(), anyInt())).thenReturn(ONE_ROW);
    }

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.close();
        }
    }

    private QueryGateway newGateway() {
        BackendManagerFactory factory = new BackendManagerFactory();
        factory.registerBackend("mock", config -> backend);
        CatalogSnapshot catalog = new CatalogSnapshot("test",
            List.of(new DataProductDefinition("sales_data", "sales_view", "Sales", "enterprise", null)),
            List.of(new ViewDefinition("sales_view", "SELECT region, amount FROM sales", "sales_data")));
        DefinitionSource source = new DefinitionSource() {
            @Override
            public String name() {
                return "test";
            }

            @Override
            public Optional<CatalogSnapshot> load() {
                return Optional.of(catalog);
            }
        };
        gateway = new QueryGateway(properties, factory, new ViewBootstrapper(List.of(source)),
            new SqlValidator(), new SqlNormalizer(new ObjectMapper()), new HumanActionClassifier(),
            principalContextProvider, meterRegistry);
        return gateway;
    }

    private QueryGateway readyGateway() {
        QueryGateway ready = newGateway();
        ready.initialize();
        return ready;
    }

    @Test
    void testInitializeConnectsAndBootstrapsViews() {
        QueryGateway ready = readyGateway();

        assertEquals(QueryGateway.State.READY, ready.getState());
        assertEquals("test", ready.getCatalog().source());
        verify(backend).createView(eq("sales_view"), eq("SELECT region, amount FROM sales"), eq(true), anyString());
        assertEquals(1, ready.getLastBootstrapReport().orElseThrow().createdCount());
    }

    @Test
    void testInitializeFailsWhenBackendCannotConnect() {
        when(backend.connect(any())).thenReturn(false);
        QueryGateway failing = newGateway();

        assertThrows(BackendConnectionException.class, failing::initialize);
        assertEquals(QueryGateway.State.UNINITIALIZED, failing.getState());
    }

    @Test
    void testUnknownBackendTypeFailsInitialization() {
        properties.setBackendType("oracle");
        QueryGateway failing = newGateway();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, failing::initialize);
        assertTrue(e.getMessage().startsWith("Unsupported backend type: oracle"));
    }

    @Test
    void testCallsBeforeInitializeAreUsageErrors() {
        QueryGateway notReady = newGateway();

        assertThrows(IllegalStateException.class, () -> notReady.execute(QueryRequest.of("SELECT 1")));
        assertThrows(IllegalStateException.class, notReady::listViews);
    }

    @Test
    void testCallsAfterCloseAreUsageErrors() {
        QueryGateway closed = readyGateway();
        closed.close();
        closed.close();

        assertEquals(QueryGateway.State.CLOSED, closed.getState());
        assertThrows(IllegalStateException.class, () -> closed.execute(QueryRequest.of("SELECT 1")));
        assertThrows(IllegalStateException.class, closed::initialize);
        verify(backend).disconnect();
    }

    @Test
    void testExecuteSuccess() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.builder()
            .requestId("req-1")
            .sql("SELECT SUM(amount) AS total_value FROM fi_star_view;")
            .build());

        assertTrue(envelope.isSuccess());
        assertEquals("req-1", envelope.getRequestId());
        assertNotNull(envelope.getTransactionId());
        assertEquals("SQL execution successful", envelope.getMessage());
        assertEquals(List.of("total_value"), envelope.getColumns());
        assertEquals(1, envelope.getRowCount());
        assertEquals("mock", envelope.getMetadata().get("source"));
        assertNull(envelope.getErrorCode());
        verify(backend).executeQuery(eq("SELECT SUM(amount) AS total_value FROM fi_star_view"), any(),
            eq(envelope.getTransactionId()), eq(10000));
        assertEquals(1.0, meterRegistry.get("dp_gateway.query.executions").counter().count());
        assertEquals(1, meterRegistry.get("dp_gateway.query.duration").timer().count());
    }

    @Test
    void testTransactionIdIsPropagated() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.builder().transactionId("tx-42").sql("SELECT 1").build());

        assertEquals("tx-42", envelope.getTransactionId());
        assertEquals("tx-42", envelope.getRequestId());
        verify(backend).executeQuery(anyString(), any(), eq("tx-42"), anyInt());
    }

    @Test
    void testDeleteIsRejectedBeforeReachingBackend() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("DELETE FROM \"FI_Star_View\""));

        assertEquals(ResponseEnvelope.ERROR, envelope.getStatus());
        assertEquals(ErrorCode.SQL_VALIDATION_ERROR, envelope.getErrorCode());
        assertTrue(envelope.getErrorMessage().toLowerCase().contains("only select statements"));
        assertTrue(envelope.getColumns().isEmpty());
        assertTrue(envelope.getRows().isEmpty());
        assertEquals(0, envelope.getRowCount());
        verify(backend, never()).executeQuery(anyString(), any(), anyString(), anyInt());
        assertEquals(1.0, meterRegistry.get("dp_gateway.query.failures")
            .tag("error_code", "SQL_VALIDATION_ERROR").counter().count());
    }

    @Test
    void testDropAndInsertRejectedWithStatementType() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope drop = ready.execute(QueryRequest.of("DROP TABLE t"));
        ResponseEnvelope insert = ready.execute(QueryRequest.of("INSERT INTO t VALUES (1)"));

        assertEquals(ErrorCode.SQL_VALIDATION_ERROR, drop.getErrorCode());
        assertTrue(drop.getErrorMessage().contains("(found DROP)"));
        assertEquals(ErrorCode.SQL_VALIDATION_ERROR, insert.getErrorCode());
        assertTrue(insert.getErrorMessage().contains("(found INSERT)"));
        verify(backend, never()).executeQuery(anyString(), any(), anyString(), anyInt());
    }

    @Test
    void testBackendValidationRejection() {
        when(backend.validateSql(anyString())).thenReturn(ValidationResult.invalid("Invalid SQL statement: disallowed keyword PRAGMA"));
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT 1"));

        assertEquals(ErrorCode.SQL_VALIDATION_ERROR, envelope.getErrorCode());
        assertEquals("Invalid SQL statement: disallowed keyword PRAGMA", envelope.getErrorMessage());
        verify(backend, never()).executeQuery(anyString(), any(), anyString(), anyInt());
    }

    @Test
    void testValidationCanBeDisabled() {
        properties.getSecurity().setValidateSql(false);
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("EXPLAIN SELECT 1"));

        assertTrue(envelope.isSuccess());
        verify(backend, never()).validateSql(anyString());
    }

    @Test
    void testEmptySqlIsInvalidRequest() {
        QueryGateway ready = readyGateway();

        assertEquals(ErrorCode.INVALID_REQUEST, ready.execute(QueryRequest.of("  ")).getErrorCode());
        assertEquals(ErrorCode.INVALID_REQUEST, ready.execute(null).getErrorCode());
    }

    @Test
    void testCustomSqlDisabledOnlyAffectsExecute() {
        properties.getSecurity().setAllowCustomSql(false);
        QueryGateway ready = readyGateway();

        ResponseEnvelope custom = ready.execute(QueryRequest.of("SELECT 1"));
        ResponseEnvelope product = ready.getDataProduct(DataProductRequest.builder()
            .productId("sales_data").sqlQuery("SELECT * FROM sales_view").build());

        assertEquals(ErrorCode.CUSTOM_SQL_DISABLED, custom.getErrorCode());
        assertTrue(product.isSuccess());
    }

    @Test
    void testExecutionErrorIsClassifiedWithSuggestions() {
        when(backend.executeQuery(anyString(), any(), anyString(), anyInt())).thenThrow(new QueryExecutionException(
            "Catalog Error: Table with name fi_star_vew does not exist! Did you mean \"fi_star_view\"?"));
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT * FROM fi_star_vew"));

        assertEquals(ErrorCode.SQL_EXECUTION_ERROR, envelope.getErrorCode());
        assertTrue(envelope.getErrorMessage().contains("fi_star_vew"));
        assertTrue(envelope.isHumanActionRequired());
        assertEquals("data_correction", envelope.getHumanActionType());
        assertEquals("MISSING_RELATION", envelope.getHumanActionContext().get("category"));
        assertEquals("fi_star_vew", envelope.getHumanActionContext().get("missing_relation"));
        assertEquals("SELECT * FROM fi_star_vew", envelope.getHumanActionContext().get("sql"));
        assertEquals(envelope.getErrorMessage(), envelope.getHumanActionContext().get("message"));
        assertEquals("fi_star_view", ((List<?>) envelope.getHumanActionContext().get("suggestions")).get(0));
    }

    @Test
    void testPermissionErrorNeedsAccessReview() {
        when(backend.executeQuery(anyString(), any(), anyString(), anyInt()))
            .thenThrow(new QueryExecutionException("ERROR: permission denied for table salaries"));
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT * FROM salaries"));

        assertEquals("access_review", envelope.getHumanActionType());
    }

    @Test
    void testUnclassifiedExecutionErrorNeedsNoHuman() {
        when(backend.executeQuery(anyString(), any(), anyString(), anyInt()))
            .thenThrow(new QueryExecutionException("IO Error: Connection reset while reading block"));
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT amount FROM t"));

        assertEquals(ErrorCode.SQL_EXECUTION_ERROR, envelope.getErrorCode());
        assertFalse(envelope.isHumanActionRequired());
        assertNull(envelope.getHumanActionType());
    }

    @Test
    void testUnexpectedBackendExceptionBecomesExecutionError() {
        when(backend.executeQuery(anyString(), any(), anyString(), anyInt()))
            .thenThrow(new IllegalArgumentException("Unsupported parameter type"));
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT 1"));

        assertEquals(ErrorCode.SQL_EXECUTION_ERROR, envelope.getErrorCode());
        assertEquals("Unsupported parameter type", envelope.getErrorMessage());
    }

    @Test
    void testTimeoutCancelsQuery() {
        when(backend.executeQuery(anyString(), any(), anyString(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return ONE_ROW;
        });
        QueryGateway ready = readyGateway();

        long start = System.currentTimeMillis();
        ResponseEnvelope envelope = ready.execute(QueryRequest.builder()
            .transactionId("tx-slow").sql("SELECT * FROM huge_view").timeoutMs(200L).build());

        assertEquals(ErrorCode.QUERY_TIMEOUT, envelope.getErrorCode());
        assertEquals("Query exceeded timeout of 200 ms", envelope.getErrorMessage());
        assertTrue(System.currentTimeMillis() - start < 5_000);
        verify(backend).cancelQuery("tx-slow");
    }

    @Test
    void testReconnectsOnceWhenDisconnected() {
        QueryGateway ready = readyGateway();
        when(backend.isConnected()).thenReturn(false);

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT 1"));

        assertTrue(envelope.isSuccess());
        verify(backend, times(2)).connect(any());
        verify(backend, times(2)).createView(eq("sales_view"), eq("SELECT region, amount FROM sales"), eq(true), anyString());
    }

    @Test
    void testFailedReconnectIsConnectionError() {
        QueryGateway ready = readyGateway();
        when(backend.isConnected()).thenReturn(false);
        when(backend.connect(any())).thenReturn(false);

        ResponseEnvelope envelope = ready.execute(QueryRequest.of("SELECT 1"));

        assertEquals(ErrorCode.CONNECTION_ERROR, envelope.getErrorCode());
        verify(backend, never()).executeQuery(anyString(), any(), anyString(), anyInt());
    }

    @Test
    void testMaxRowsIsCappedByConfiguration() {
        properties.setMaxRows(100);
        QueryGateway ready = readyGateway();

        ready.execute(QueryRequest.builder().sql("SELECT 1").maxRows(5).build());
        ready.execute(QueryRequest.builder().sql("SELECT 2").maxRows(5000).build());

        verify(backend).executeQuery(eq("SELECT 1"), any(), anyString(), eq(5));
        verify(backend).executeQuery(eq("SELECT 2"), any(), anyString(), eq(100));
    }

    @Test
    void testGetDataProductNormalizesSqlAndAnnotates() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.getDataProduct(DataProductRequest.builder()
            .productId("SALES_DATA")
            .sqlQuery("```json\n{\"sql\": \"SELECT region, SUM(amount) FROM sales_view GROUP BY region;\"}\n```")
            .principalId("analyst-7")
            .build());

        assertTrue(envelope.isSuccess(), envelope.getErrorMessage());
        assertEquals("SALES_DATA", envelope.getProductId());
        assertEquals("Successfully retrieved 1 rows for data product: SALES_DATA", envelope.getMessage());
        assertEquals("enterprise", envelope.getMetadata().get("governance_level"));
        assertEquals("view", envelope.getMetadata().get("product_type"));
        assertEquals("analyst-7", envelope.getMetadata().get("principal_id"));
        verify(backend).executeQuery(eq("SELECT region, SUM(amount) FROM sales_view GROUP BY region"), any(), anyString(), anyInt());
    }

    @Test
    void testGetDataProductForUnknownProductStillExecutes() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.getDataProduct(DataProductRequest.builder()
            .productId("ad_hoc").sqlQuery("SELECT 1").build());

        assertTrue(envelope.isSuccess());
        assertEquals("department", envelope.getMetadata().get("governance_level"));
    }

    @Test
    void testGetDataProductRequestValidation() {
        QueryGateway ready = readyGateway();

        ResponseEnvelope noProduct = ready.getDataProduct(DataProductRequest.builder().sqlQuery("SELECT 1").build());
        ResponseEnvelope noSql = ready.getDataProduct(DataProductRequest.builder().productId("sales_data").build());
        ResponseEnvelope onlyPackaging = ready.getDataProduct(DataProductRequest.builder()
            .productId("sales_data").sqlQuery("``````").build());

        assertEquals(ErrorCode.INVALID_REQUEST, noProduct.getErrorCode());
        assertEquals(ErrorCode.INVALID_REQUEST, noSql.getErrorCode());
        assertEquals("sales_data", noSql.getProductId());
        assertEquals(ErrorCode.INVALID_REQUEST, onlyPackaging.getErrorCode());
    }

    @Test
    void testPrincipalContextFromProvider() {
        principalContextProvider = principalId -> Optional.of(Map.of("department", "finance", "governance_level", "restricted"));
        QueryGateway ready = readyGateway();

        ResponseEnvelope envelope = ready.execute(QueryRequest.builder().sql("SELECT 1").principalId("analyst-7").build());

        assertEquals(Map.of("department", "finance", "governance_level", "restricted"),
            envelope.getMetadata().get("principal_context"));
        assertEquals("restricted", envelope.getMetadata().get("governance_level"));
    }

    @Test
    void testReloadRebootstrapsViews() {
        QueryGateway ready = readyGateway();

        ready.reload();

        verify(backend, times(2)).createView(eq("sales_view"), anyString(), eq(true), anyString());
        assertEquals(QueryGateway.State.READY, ready.getState());
    }

    @Test
    void testBackendMetadataIncludesGatewayState() {
        QueryGateway ready = readyGateway();

        Map<String, Object> metadata = ready.getBackendMetadata();

        assertEquals("READY", metadata.get("gateway_state"));
        assertEquals("connected", metadata.get("status"));
        assertEquals("test", metadata.get("catalog_source"));
    }

    @Test
    void testListViewsDelegatesToBackend() {
        assertEquals(List.of("fi_star_view", "fi_customer_transactions_view"), readyGateway().listViews());
    }
}
