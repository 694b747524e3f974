package com.baskettecase.dpmcp.catalog;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContractFileSourceTest {

    @Test
    void testLoadsProductsViewsAndKpis() throws IOException {
        ContractFileSource source = new ContractFileSource(new ClassPathResource("contracts/test_contract.yaml"));

        CatalogSnapshot snapshot = source.load().orElseThrow();

        // broken_view has no SQL and is skipped
        assertEquals(2, snapshot.views().size());
        assertEquals("Test_Star_View", snapshot.views().get(0).name());
        assertEquals("dp_test_001", snapshot.views().get(0).sourceDataProductId());

        DataProductDefinition contractProduct = snapshot.findDataProduct("DP_TEST_001").orElseThrow();
        assertEquals("Test_Star_View", contractProduct.primaryTableOrView());
        assertEquals("restricted", contractProduct.governanceLevel());
        assertTrue(contractProduct.kpiDefinition().containsKey("Revenue"));
        assertTrue(contractProduct.isView());

        DataProductDefinition table = snapshot.findDataProduct("Customers").orElseThrow();
        assertEquals("Customers", table.primaryTableOrView());
        assertEquals("restricted", table.governanceLevel());
        assertNull(table.kpiDefinition());
    }

    @Test
    void testBlankTableNameIsSkipped() throws IOException {
        ContractFileSource source = new ContractFileSource(new ClassPathResource("contracts/blank_table_contract.yaml"));

        CatalogSnapshot snapshot = source.load().orElseThrow();

        assertEquals(1, snapshot.views().size());
        assertTrue(snapshot.findDataProduct("dp_blank_001").isPresent());
        assertTrue(snapshot.findDataProduct("Accounts").isPresent());
        assertEquals(2, snapshot.dataProducts().size());
    }

    @Test
    void testMissingFileIsEmpty() throws IOException {
        ContractFileSource source = new ContractFileSource(new ClassPathResource("contracts/does_not_exist.yaml"));

        assertEquals(Optional.empty(), source.load());
    }

    @Test
    void testNonMappingFails() {
        ContractFileSource source = new ContractFileSource(new ClassPathResource("contracts/not_a_mapping.yaml"));

        assertThrows(IOException.class, source::load);
    }

    @Test
    void testShippedContractLoads() throws IOException {
        ContractFileSource source = new ContractFileSource(new ClassPathResource("contracts/fi_star_schema.yaml"));

        CatalogSnapshot snapshot = source.load().orElseThrow();

        assertEquals(3, snapshot.views().size());
        assertTrue(snapshot.findDataProduct("dp_fi_20250516_001").isPresent());
        assertTrue(snapshot.findDataProduct("FinancialTransactions").isPresent());
    }
}
