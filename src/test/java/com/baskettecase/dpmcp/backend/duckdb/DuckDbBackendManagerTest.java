package com.baskettecase.dpmcp.backend.duckdb;

import com.baskettecase.dpmcp.backend.DataSourceInfo;
import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.error.QueryExecutionException;
import com.baskettecase.dpmcp.sql.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a real in-memory DuckDB database.
 */
class DuckDbBackendManagerTest {

    private DuckDbBackendManager backend;

    @BeforeEach
    void setUp() {
        backend = new DuckDbBackendManager(Map.of("database-path", ":memory:"));
        assertTrue(backend.connect(Map.of()));
    }

    @AfterEach
    void tearDown() {
        backend.disconnect();
    }

    @Test
    void testSumOverViewWithSpacedColumnName() {
        backend.executeQuery("CREATE TABLE FinancialTransactions AS SELECT * FROM (VALUES (100.00), (250.50), (149.50)) t(\"Transaction Value Amount\")");
        assertTrue(backend.createView("FI_Star_View", "SELECT * FROM FinancialTransactions", true, "tx-1"));

        QueryResult result = backend.executeQuery(
            "SELECT SUM(\"Transaction Value Amount\") AS total_value FROM \"FI_Star_View\"", Map.of(), "tx-1");

        assertEquals(List.of("total_value"), result.columns());
        assertEquals(1, result.rowCount());
        assertEquals(0, new BigDecimal("500.00").compareTo(new BigDecimal(result.rows().get(0).get(0).toString())));
    }

    @Test
    void testCreateViewThenQueryReturnsSameRows() {
        backend.executeQuery("CREATE TABLE accounts AS SELECT i AS id, 'acct' || i AS name FROM range(0, 3) t(i)");
        assertTrue(backend.createView("accounts_view", "SELECT id, name FROM accounts", true, "tx-2"));

        QueryResult direct = backend.executeQuery("SELECT id, name FROM accounts ORDER BY id");
        QueryResult viaView = backend.executeQuery("SELECT * FROM accounts_view ORDER BY id");

        assertEquals(direct.rows(), viaView.rows());
        assertTrue(backend.listViews("tx-2").contains("accounts_view"));
    }

    @Test
    void testCreateViewReplacesCaseVariant() {
        assertTrue(backend.createView("fi_star_view", "SELECT 1 AS old_column", true, "tx-3"));
        assertTrue(backend.createView("FI_Star_View", "SELECT 2 AS new_column", true, "tx-3"));

        QueryResult result = backend.executeQuery("SELECT * FROM fi_star_view");

        assertEquals(List.of("new_column"), result.columns());
        assertEquals(1, backend.listViews("tx-3").size());
        assertTrue(backend.checkViewExists("FI_STAR_VIEW"));
    }

    @Test
    void testCreateViewWithBadSqlReturnsFalse() {
        assertFalse(backend.createView("broken_view", "SELECT * FROM no_such_table", true, "tx-4"));
        assertFalse(backend.checkViewExists("broken_view"));
    }

    @Test
    void testNamedParametersAndCollections() {
        QueryResult result = backend.executeQuery(
            "SELECT i FROM range(0, 10) t(i) WHERE i >= :low AND i IN (:picked) ORDER BY i",
            Map.of("low", 3, "picked", List.of(1, 4, 7)), "tx-5");

        assertEquals(2, result.rowCount());
        assertEquals(4L, ((Number) result.rows().get(0).get(0)).longValue());
    }

    @Test
    void testMaxRowsTruncates() {
        QueryResult result = backend.executeQuery("SELECT i FROM range(0, 50) t(i)", Map.of(), "tx-6", 10);

        assertEquals(10, result.rowCount());
        assertTrue(result.truncated());
    }

    @Test
    void testEmptyResultKeepsColumns() {
        QueryResult result = backend.executeQuery("SELECT 1 AS a, 2 AS b WHERE 1 = 0");

        assertTrue(result.isEmpty());
        assertEquals(List.of("a", "b"), result.columns());
    }

    @Test
    void testMissingTableRaisesQueryExecutionException() {
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
            () -> backend.executeQuery("SELECT * FROM missing_table"));

        assertTrue(e.getMessage().toLowerCase().contains("missing_table"));
    }

    @Test
    void testFallbackViewsHaveStableSchema() {
        Map<String, Boolean> results = backend.createFallbackViews(
            List.of("fi_star_view", "fi_sales_by_customer_type_view", "unknown_view"), "tx-7");

        assertTrue(results.get("fi_star_view"));
        assertTrue(results.get("fi_sales_by_customer_type_view"));
        assertFalse(results.get("unknown_view"));

        QueryResult star = backend.executeQuery("SELECT * FROM fi_star_view");
        assertEquals(List.of("transactionid", "fiscal_year", "fiscal_quarter", "fiscal_month", "customer_id",
            "customer_type", "account_id", "amount", "description"), star.columns());
        assertEquals(FallbackViewTemplates.ROW_COUNT, star.rowCount());

        QueryResult sales = backend.executeQuery("SELECT * FROM fi_sales_by_customer_type_view");
        assertEquals(List.of("customertypeid", "value", "date"), sales.columns());
    }

    @Test
    void testFallbackDataIsDeterministic() {
        backend.createFallbackViews(List.of("fi_customer_transactions_view"), "tx-8");
        QueryResult first = backend.executeQuery("SELECT * FROM fi_customer_transactions_view ORDER BY transaction_id");

        backend.createFallbackViews(List.of("fi_customer_transactions_view"), "tx-8");
        QueryResult second = backend.executeQuery("SELECT * FROM fi_customer_transactions_view ORDER BY transaction_id");

        assertEquals(first.rows(), second.rows());
    }

    @Test
    void testRegisterCsvDataSource(@TempDir Path dataDir) throws IOException {
        Path csv = dataDir.resolve("sales.csv");
        Files.writeString(csv, "region;amount\nnorth;10\nsouth;20\n");

        assertTrue(backend.registerDataSource(DataSourceInfo.csv(csv.toString(), "staging", null), "tx-9"));

        QueryResult result = backend.executeQuery("SELECT SUM(amount) AS total FROM staging.sales");
        assertEquals(30L, ((Number) result.rows().get(0).get(0)).longValue());
        assertTrue(backend.registerDataSource(new DataSourceInfo("table", null, "staging", "sales", null), "tx-9"));
    }

    @Test
    void testRegisterMissingCsvReturnsFalse() {
        assertFalse(backend.registerDataSource(DataSourceInfo.csv("/no/such/file.csv", null, null), "tx-10"));
    }

    @Test
    void testDetectDelimiter(@TempDir Path dataDir) throws IOException {
        Path semicolon = dataDir.resolve("a.csv");
        Files.writeString(semicolon, "a;b;c\n1;2;3\n");
        Path comma = dataDir.resolve("b.csv");
        Files.writeString(comma, "a,b\n1,2\n");

        assertEquals(";", DuckDbBackendManager.detectDelimiter(semicolon));
        assertEquals(",", DuckDbBackendManager.detectDelimiter(comma));
    }

    @Test
    void testValidateSql() {
        assertTrue(backend.validateSql("SELECT * FROM fi_star_view").isValid());
        assertTrue(backend.validateSql("WITH a AS (SELECT 1) SELECT * FROM a").isValid());

        ValidationResult delete = backend.validateSql("DELETE FROM fi_star_view");
        assertFalse(delete.isValid());
        assertTrue(delete.getErrorMessage().toLowerCase().contains("only select statements"));

        ValidationResult attach = backend.validateSql("SELECT * FROM (ATTACH 'other.db')");
        assertFalse(attach.isValid());
        assertTrue(attach.getErrorMessage().contains("ATTACH"));

        ValidationResult hidden = backend.validateSql("SELECT '/*'; DROP TABLE FinancialTransactions; SELECT '*/'");
        assertFalse(hidden.isValid());
        assertEquals("Multi-statement queries are not allowed", hidden.getErrorMessage());
    }

    @Test
    void testConnectAndDisconnectAreIdempotent() {
        assertTrue(backend.connect(Map.of()));
        assertTrue(backend.isConnected());

        assertTrue(backend.disconnect());
        assertTrue(backend.disconnect());
        assertFalse(backend.isConnected());
    }

    @Test
    void testUsageBeforeConnectIsRejected() {
        DuckDbBackendManager fresh = new DuckDbBackendManager(Map.of());

        assertThrows(IllegalStateException.class, () -> fresh.executeQuery("SELECT 1"));
        assertThrows(IllegalStateException.class, () -> fresh.validateSql("SELECT 1"));
        assertEquals("disconnected", fresh.getMetadata().get("status"));
    }

    @Test
    void testMetadata() {
        backend.createView("v1", "SELECT 1 AS x", true, "tx-11");

        Map<String, Object> metadata = backend.getMetadata();

        assertEquals("connected", metadata.get("status"));
        assertEquals("duckdb", metadata.get("database_type"));
        assertEquals(1L, ((Number) metadata.get("view_count")).longValue());
        assertNotNull(metadata.get("version"));
    }

    @Test
    void testCancelWithoutRunningQuery() {
        assertFalse(backend.cancelQuery("nothing-running"));
        assertFalse(backend.cancelQuery(null));
    }
}
