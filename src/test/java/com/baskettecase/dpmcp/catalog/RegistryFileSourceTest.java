package com.baskettecase.dpmcp.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RegistryFileSourceTest {

    @Test
    void testYamlRegistry() throws IOException {
        RegistryFileSource source = new RegistryFileSource(new ClassPathResource("registry/data_products.yaml"));

        CatalogSnapshot snapshot = source.load().orElseThrow();

        // missing_primary has no primary table and is skipped
        assertEquals(2, snapshot.dataProducts().size());
        DataProductDefinition sales = snapshot.findDataProduct("sales_data").orElseThrow();
        assertEquals("sales_view", sales.primaryTableOrView());
        assertEquals("enterprise", sales.governanceLevel());
        assertEquals("SUM(amount)", sales.kpiDefinition().get("total_sales"));
        assertEquals("department", snapshot.findDataProduct("inventory_data").orElseThrow().governanceLevel());

        assertEquals(1, snapshot.views().size());
        assertEquals("sales_data", snapshot.views().get(0).sourceDataProductId());
    }

    @Test
    void testCsvRegistry() throws IOException {
        RegistryFileSource source = new RegistryFileSource(new ClassPathResource("registry/data_products.csv"));

        CatalogSnapshot snapshot = source.load().orElseThrow();

        assertEquals(2, snapshot.dataProducts().size());
        assertEquals("Stock levels", snapshot.findDataProduct("inventory_data").orElseThrow().description());
        assertTrue(snapshot.views().isEmpty());
    }

    @Test
    void testTopLevelYamlList(@TempDir Path dir) throws IOException {
        Path registry = dir.resolve("products.yml");
        Files.writeString(registry, "- product_id: only_one\n  primary_table: t1\n");

        CatalogSnapshot snapshot = new RegistryFileSource(new FileSystemResource(registry)).load().orElseThrow();

        assertEquals(1, snapshot.dataProducts().size());
        assertEquals("only_one", snapshot.dataProducts().get(0).id());
    }

    @Test
    void testMissingRegistryIsEmpty() throws IOException {
        assertEquals(Optional.empty(),
            new RegistryFileSource(new ClassPathResource("registry/none.yaml")).load());
    }
}
