package com.baskettecase.dpmcp.tools;

import com.baskettecase.dpmcp.catalog.BootstrapReport;
import com.baskettecase.dpmcp.catalog.CatalogSnapshot;
import com.baskettecase.dpmcp.catalog.DataProductDefinition;
import com.baskettecase.dpmcp.gateway.DataProductRequest;
import com.baskettecase.dpmcp.gateway.QueryGateway;
import com.baskettecase.dpmcp.gateway.QueryRequest;
import com.baskettecase.dpmcp.gateway.ResponseEnvelope;
import com.baskettecase.dpmcp.util.JsonResponseFormatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Data Product Tools for MCP Server
 *
 * Exposes the query gateway to MCP clients. Query tools always answer with the JSON
 * response envelope, so callers branch on {@code status} and {@code error_code}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataProductTools {

    private final QueryGateway queryGateway;

    @McpTool(
        name = "dp.executeSql",
        description = "Execute a read-only SELECT or WITH query against the data product backend. Returns a JSON envelope with columns, rows and error details."
    )
    public String executeSql(
        @McpToolParam(
            description = "SQL SELECT statement; named parameters use :name syntax",
            required = true
        ) String sql,
        @McpToolParam(
            description = "Named parameters for the query",
            required = false
        ) Map<String, Object> params,
        @McpToolParam(
            description = "Maximum rows to return (capped by server configuration)",
            required = false
        ) Integer maxRows,
        @McpToolParam(
            description = "Principal the query runs on behalf of, used for response annotation",
            required = false
        ) String principalId
    ) {
        log.info("🔧 TOOL CALLED: dp.executeSql");
        log.info("   📊 Parameters: maxRows={}, principalId={}, params={}", maxRows, principalId, params);

        ResponseEnvelope envelope = queryGateway.execute(QueryRequest.builder()
                .sql(sql)
                .parameters(params)
                .maxRows(maxRows)
                .principalId(principalId)
                .build());
        return JsonResponseFormatter.formatEnvelope(envelope);
    }

    @McpTool(
        name = "dp.getDataProduct",
        description = "Query a registered data product with generated SQL. The SQL may be wrapped in JSON or markdown and is cleaned before validation."
    )
    public String getDataProduct(
        @McpToolParam(
            description = "Data product identifier, see dp.listDataProducts",
            required = true
        ) String productId,
        @McpToolParam(
            description = "SQL query for the data product",
            required = true
        ) String sqlQuery,
        @McpToolParam(
            description = "Principal the query runs on behalf of, used for response annotation",
            required = false
        ) String principalId
    ) {
        log.info("🔧 TOOL CALLED: dp.getDataProduct");
        log.info("   📊 Parameters: productId={}, principalId={}", productId, principalId);

        ResponseEnvelope envelope = queryGateway.getDataProduct(DataProductRequest.builder()
                .productId(productId)
                .sqlQuery(sqlQuery)
                .principalId(principalId)
                .build());
        return JsonResponseFormatter.formatEnvelope(envelope);
    }

    @McpTool(
        name = "dp.listViews",
        description = "List the views available on the backend."
    )
    public String listViews() {
        log.info("🔧 TOOL CALLED: dp.listViews");
        return toJson(Map.of("views", queryGateway.listViews()));
    }

    @McpTool(
        name = "dp.listDataProducts",
        description = "List registered data products with their primary table or view and governance level."
    )
    public String listDataProducts() {
        log.info("🔧 TOOL CALLED: dp.listDataProducts");
        CatalogSnapshot catalog = queryGateway.getCatalog();
        List<Map<String, Object>> products = catalog.dataProducts().stream()
                .map(DataProductTools::describe)
                .collect(Collectors.toList());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("source", catalog.source());
        response.put("data_products", products);
        return toJson(response);
    }

    @McpTool(
        name = "dp.backendStatus",
        description = "Show gateway state and backend metadata (type, version, object counts)."
    )
    public String backendStatus() {
        log.info("🔧 TOOL CALLED: dp.backendStatus");
        return toJson(queryGateway.getBackendMetadata());
    }

    @McpTool(
        name = "dp.reloadViews",
        description = "Reload data product and view definitions and re-create views on the backend."
    )
    public String reloadViews() {
        log.info("🔧 TOOL CALLED: dp.reloadViews");
        BootstrapReport report = queryGateway.reload();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("source", report.source());
        response.put("views_created", report.createdCount());
        response.put("failed_views", report.failedViews());
        response.put("missing_required_views", report.missingRequiredViews());
        response.put("fallback_views", report.fallbackResults());
        return toJson(response);
    }

    static Map<String, Object> describe(DataProductDefinition product) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("product_id", product.id());
        entry.put("primary_table", product.primaryTableOrView());
        entry.put("description", product.description());
        entry.put("governance_level", product.governanceLevel());
        if (product.kpiDefinition() != null) {
            entry.put("kpi_definition", product.kpiDefinition());
        }
        return entry;
    }

    private String toJson(Object value) {
        try {
            return JsonResponseFormatter.toJson(value);
        } catch (JsonProcessingException e) {
            log.error("❌ Failed to serialize tool response", e);
            throw new IllegalStateException("Failed to serialize tool response: " + e.getOriginalMessage(), e);
        }
    }
}
