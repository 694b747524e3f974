package com.baskettecase.dpmcp.catalog;

import com.baskettecase.dpmcp.backend.BackendManager;
import com.baskettecase.dpmcp.backend.DataSourceInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ViewBootstrapperTest {

    @Mock
    private BackendManager backend;

    @Test
    void testFirstNonEmptySourceWins() {
        CatalogSnapshot registry = new CatalogSnapshot("registry",
            List.of(DataProductDefinition.of("sales_data", "sales_view", "Sales")), List.of());
        ViewBootstrapper bootstrapper = new ViewBootstrapper(List.of(
            source("contract", Optional.empty()),
            source("registry", Optional.of(registry)),
            new DefaultDefinitionSource()));

        assertEquals("registry", bootstrapper.resolve().source());
    }

    @Test
    void testFailingSourceIsSkipped() {
        DefinitionSource failing = new DefinitionSource() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Optional<CatalogSnapshot> load() throws IOException {
                throw new IOException("malformed YAML");
            }
        };

        CatalogSnapshot snapshot = new ViewBootstrapper(List.of(failing)).resolve();

        assertEquals(DefaultDefinitionSource.NAME, snapshot.source());
        assertTrue(snapshot.findDataProduct("financial_transactions_data").isPresent());
    }

    @Test
    void testMaterializeCreatesViewsAndFallsBackForMissingRequired() {
        CatalogSnapshot snapshot = new CatalogSnapshot("contract", List.of(), List.of(
            new ViewDefinition("FI_Star_View", "SELECT * FROM FinancialTransactions", "dp"),
            new ViewDefinition("broken_view", "SELECT * FROM nowhere", "dp")));
        when(backend.createView(eq("FI_Star_View"), anyString(), eq(true), eq("tx"))).thenReturn(true);
        when(backend.createView(eq("broken_view"), anyString(), eq(true), eq("tx"))).thenReturn(false);
        when(backend.checkViewExists("fi_star_view")).thenReturn(true);
        when(backend.checkViewExists("fi_customer_transactions_view")).thenReturn(false);
        when(backend.createFallbackViews(List.of("fi_customer_transactions_view"), "tx"))
            .thenReturn(Map.of("fi_customer_transactions_view", true));

        BootstrapReport report = new ViewBootstrapper(List.of()).materialize(backend, snapshot,
            List.of("fi_star_view", "fi_customer_transactions_view"), "tx");

        assertEquals(1, report.createdCount());
        assertEquals(List.of("broken_view"), report.failedViews());
        assertEquals(List.of("fi_customer_transactions_view"), report.missingRequiredViews());
        assertEquals(Map.of("fi_customer_transactions_view", true), report.fallbackResults());
    }

    @Test
    void testExistingRequiredViewIsNotReplacedByFallback() {
        when(backend.checkViewExists("fi_star_view")).thenReturn(true);

        BootstrapReport report = new ViewBootstrapper(List.of())
            .materialize(backend, CatalogSnapshot.empty("none"), List.of("fi_star_view"), "tx");

        assertTrue(report.missingRequiredViews().isEmpty());
        verify(backend, never()).createFallbackViews(any(), any());
    }

    @Test
    void testLastDeclarationOfAViewWins() {
        CatalogSnapshot snapshot = new CatalogSnapshot("contract", List.of(), List.of(
            new ViewDefinition("sales_view", "SELECT 1 AS first", "dp"),
            new ViewDefinition("SALES_VIEW", "SELECT 2 AS second", "dp")));
        when(backend.createView(anyString(), anyString(), eq(true), eq("tx"))).thenReturn(true);

        new ViewBootstrapper(List.of()).materialize(backend, snapshot, List.of(), "tx");

        verify(backend, times(1)).createView("SALES_VIEW", "SELECT 2 AS second", true, "tx");
        verify(backend, never()).createView(eq("sales_view"), anyString(), anyBoolean(), anyString());
    }

    @Test
    void testViewCreationExceptionDoesNotStopBootstrap() {
        CatalogSnapshot snapshot = new CatalogSnapshot("contract", List.of(), List.of(
            new ViewDefinition("a_view", "SELECT 1", "dp"),
            new ViewDefinition("b_view", "SELECT 2", "dp")));
        when(backend.createView(eq("a_view"), anyString(), eq(true), eq("tx"))).thenThrow(new IllegalStateException("boom"));
        when(backend.createView(eq("b_view"), anyString(), eq(true), eq("tx"))).thenReturn(true);

        BootstrapReport report = new ViewBootstrapper(List.of()).materialize(backend, snapshot, List.of(), "tx");

        assertEquals(Map.of("a_view", false, "b_view", true), report.viewResults());
    }

    @Test
    void testRegisterDataDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("orders.csv"), "id\n1\n");
        Files.writeString(dir.resolve("customers.CSV"), "id\n1\n");
        Files.writeString(dir.resolve("notes.txt"), "ignored");
        when(backend.registerDataSource(any(DataSourceInfo.class), eq("tx"))).thenReturn(true);

        int registered = new ViewBootstrapper(List.of()).registerDataDirectory(backend, dir, "raw", "tx");

        assertEquals(2, registered);
        ArgumentCaptor<DataSourceInfo> captor = ArgumentCaptor.forClass(DataSourceInfo.class);
        verify(backend, times(2)).registerDataSource(captor.capture(), eq("tx"));
        assertTrue(captor.getAllValues().stream().allMatch(info -> "csv".equals(info.type()) && "raw".equals(info.schema())));
    }

    @Test
    void testMissingDataDirectoryRegistersNothing(@TempDir Path dir) {
        assertEquals(0, new ViewBootstrapper(List.of()).registerDataDirectory(backend, dir.resolve("absent"), "raw", "tx"));
        verifyNoInteractions(backend);
    }

    private static DefinitionSource source(String name, Optional<CatalogSnapshot> snapshot) {
        return new DefinitionSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<CatalogSnapshot> load() {
                return snapshot;
            }
        };
    }
}
