package com.baskettecase.dpmcp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Data Product MCP Server Application
 *
 * Read-only SQL gateway over DuckDB, BigQuery or PostgreSQL, exposed as MCP tools
 * over Streamable-HTTP and as a small REST API.
 */
@Slf4j
@SpringBootApplication
public class DataProductMcpServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataProductMcpServerApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Data Product MCP Server is ready!");
        log.info("📡 MCP Server running on Streamable-HTTP transport");
        log.info("🔧 Available tools: dp.executeSql, dp.getDataProduct, dp.listViews, dp.listDataProducts, dp.backendStatus, dp.reloadViews");
        log.info("📊 Metrics available at: /actuator/prometheus");
        log.info("🏥 Health check at: /actuator/health");
    }
}
