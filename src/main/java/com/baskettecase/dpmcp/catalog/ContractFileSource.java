package com.baskettecase.dpmcp.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a domain contract: the contract's data product, its tables and KPIs, and the
 * views built over them.
 *
 * <pre>
 * data_product: dp_fi_20250516_001
 * description: Finance star schema
 * governance_level: department
 * tables:
 *   - name: FinancialTransactions
 * kpis:
 *   - name: Revenue
 *     description: Total revenue
 * views:
 *   - name: FI_Star_View
 *     sql: SELECT * FROM FinancialTransactions
 * </pre>
 */
@Slf4j
public class ContractFileSource implements DefinitionSource {

    private static final ObjectMapper YAML = new YAMLMapper();

    private final Resource contract;

    public ContractFileSource(Resource contract) {
        this.contract = contract;
    }

    @Override
    public String name() {
        return "contract:" + contract.getDescription();
    }

    @Override
    public Optional<CatalogSnapshot> load() throws IOException {
        if (!contract.exists()) {
            log.info("📄 Contract file not found: {}", contract.getDescription());
            return Optional.empty();
        }
        JsonNode root;
        try (InputStream in = contract.getInputStream()) {
            root = YAML.readTree(in);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("Contract " + contract.getDescription() + " is not a YAML mapping");
        }

        String productId = text(root, "data_product");
        String governance = text(root, "governance_level");
        List<DataProductDefinition> products = new ArrayList<>();
        List<ViewDefinition> views = new ArrayList<>();

        for (JsonNode viewNode : root.path("views")) {
            try {
                views.add(new ViewDefinition(text(viewNode, "name"), text(viewNode, "sql"), productId));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping view in {}: {}", contract.getDescription(), e.getMessage());
            }
        }

        if (productId != null) {
            String primary = views.isEmpty() ? firstTable(root) : views.get(0).name();
            if (primary != null) {
                products.add(new DataProductDefinition(productId, primary, text(root, "description"),
                        governance, kpis(root)));
            }
        }

        for (JsonNode tableNode : root.path("tables")) {
            String table = text(tableNode, "name");
            if (table == null) {
                continue;
            }
            String tableGovernance = text(tableNode, "governance_level");
            try {
                products.add(new DataProductDefinition(table, table, text(tableNode, "description"),
                        tableGovernance != null ? tableGovernance : governance, null));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping table in {}: {}", contract.getDescription(), e.getMessage());
            }
        }

        log.info("📄 Loaded contract {}: {} data products, {} views",
                contract.getDescription(), products.size(), views.size());
        return Optional.of(new CatalogSnapshot(name(), products, views));
    }

    private static Map<String, Object> kpis(JsonNode root) {
        JsonNode kpiNodes = root.path("kpis");
        if (!kpiNodes.isArray() || kpiNodes.isEmpty()) {
            return null;
        }
        Map<String, Object> kpis = new LinkedHashMap<>();
        for (JsonNode kpi : kpiNodes) {
            String name = text(kpi, "name");
            if (name != null) {
                kpis.put(name, YAML.convertValue(kpi, new TypeReference<Map<String, Object>>() { }));
            }
        }
        return kpis;
    }

    private static String firstTable(JsonNode root) {
        JsonNode tables = root.path("tables");
        return tables.isArray() && !tables.isEmpty() ? text(tables.get(0), "name") : null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
