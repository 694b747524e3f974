package com.baskettecase.dpmcp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration bound from {@code dp.gateway.*}.
 */
@Data
@ConfigurationProperties(prefix = "dp.gateway")
public class GatewayProperties {

    /**
     * Backend type understood by the backend factory (duckdb, bigquery, postgres, ...).
     */
    private String backendType = "duckdb";

    /**
     * Backend connection parameters, kebab-case keys (database-path, project, dataset, host, ...).
     */
    private Map<String, Object> connection = new HashMap<>();

    /**
     * Domain contract YAML; {@code classpath:} and file locations are accepted.
     */
    private String contractPath;

    /**
     * Data product registry, YAML or CSV.
     */
    private String registryPath;

    /**
     * Directory of CSV files to register as tables on file-ingesting backends.
     */
    private String dataDirectory;

    private String dataSchema = "main";

    private long queryTimeoutMs = 30000;

    private int maxRows = 10000;

    private int maxConcurrentQueries = 8;

    private List<String> requiredViews = new ArrayList<>(List.of(
        "fi_star_view",
        "fi_financial_transactions_view",
        "fi_sales_by_customer_type_view",
        "fi_customer_transactions_view"
    ));

    private Security security = new Security();

    @Data
    public static class Security {
        private boolean validateSql = true;
        private boolean allowCustomSql = true;
    }
}
