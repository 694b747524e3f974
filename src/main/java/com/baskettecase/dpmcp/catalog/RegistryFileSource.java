package com.baskettecase.dpmcp.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.baskettecase.dpmcp.catalog.ContractFileSource.text;

/**
 * Loads the data product registry, as YAML ({@code data_products} and {@code views} lists)
 * or as CSV with a {@code product_id,primary_table,description,governance_level} header.
 */
@Slf4j
public class RegistryFileSource implements DefinitionSource {

    private static final ObjectMapper YAML = new YAMLMapper();
    private static final CsvMapper CSV = new CsvMapper();

    private final Resource registry;

    public RegistryFileSource(Resource registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "registry:" + registry.getDescription();
    }

    @Override
    public Optional<CatalogSnapshot> load() throws IOException {
        if (!registry.exists()) {
            log.info("📄 Registry file not found: {}", registry.getDescription());
            return Optional.empty();
        }
        String filename = registry.getFilename() == null ? "" : registry.getFilename().toLowerCase(Locale.ROOT);
        CatalogSnapshot snapshot = filename.endsWith(".csv") ? loadCsv() : loadYaml();
        log.info("📄 Loaded registry {}: {} data products, {} views",
                registry.getDescription(), snapshot.dataProducts().size(), snapshot.views().size());
        return Optional.of(snapshot);
    }

    private CatalogSnapshot loadYaml() throws IOException {
        JsonNode root;
        try (InputStream in = registry.getInputStream()) {
            root = YAML.readTree(in);
        }
        if (root == null) {
            return CatalogSnapshot.empty(name());
        }
        JsonNode productNodes = root.isArray() ? root : root.path("data_products");

        List<DataProductDefinition> products = new ArrayList<>();
        for (JsonNode node : productNodes) {
            Map<String, Object> kpi = node.hasNonNull("kpi_definition")
                    ? YAML.convertValue(node.get("kpi_definition"), new TypeReference<Map<String, Object>>() { })
                    : null;
            addProduct(products, text(node, "product_id"), text(node, "primary_table"),
                    text(node, "description"), text(node, "governance_level"), kpi);
        }

        List<ViewDefinition> views = new ArrayList<>();
        for (JsonNode node : root.path("views")) {
            try {
                views.add(new ViewDefinition(text(node, "name"), text(node, "sql"), text(node, "data_product_id")));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping view in {}: {}", registry.getDescription(), e.getMessage());
            }
        }
        return new CatalogSnapshot(name(), products, views);
    }

    private CatalogSnapshot loadCsv() throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<DataProductDefinition> products = new ArrayList<>();
        try (InputStream in = registry.getInputStream();
             MappingIterator<Map<String, String>> rows = CSV.readerFor(new TypeReference<Map<String, String>>() { })
                     .with(schema)
                     .readValues(in)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                addProduct(products, row.get("product_id"), row.get("primary_table"),
                        row.get("description"), row.get("governance_level"), null);
            }
        }
        return new CatalogSnapshot(name(), products, List.of());
    }

    private void addProduct(List<DataProductDefinition> products, String id, String primary,
                            String description, String governance, Map<String, Object> kpi) {
        try {
            products.add(new DataProductDefinition(id, primary, description, governance, kpi));
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Skipping registry entry in {}: {}", registry.getDescription(), e.getMessage());
        }
    }
}
