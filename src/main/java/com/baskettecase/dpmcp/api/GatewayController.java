package com.baskettecase.dpmcp.api;

import com.baskettecase.dpmcp.catalog.BootstrapReport;
import com.baskettecase.dpmcp.catalog.CatalogSnapshot;
import com.baskettecase.dpmcp.gateway.QueryGateway;
import com.baskettecase.dpmcp.gateway.QueryRequest;
import com.baskettecase.dpmcp.gateway.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Gateway Controller
 *
 * Plain HTTP endpoints for dashboards and operators. These are NOT MCP tools.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GatewayController {

    private final QueryGateway queryGateway;

    @GetMapping("/backend")
    public ResponseEntity<Map<String, Object>> getBackend() {
        return ResponseEntity.ok(queryGateway.getBackendMetadata());
    }

    @GetMapping("/views")
    public ResponseEntity<ViewListResponse> getViews() {
        try {
            return ResponseEntity.ok(new ViewListResponse(queryGateway.listViews(), null));
        } catch (Exception e) {
            log.error("Failed to list views", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ViewListResponse(null, "Failed to list views: " + e.getMessage()));
        }
    }

    @GetMapping("/data-products")
    public ResponseEntity<DataProductListResponse> getDataProducts() {
        CatalogSnapshot catalog = queryGateway.getCatalog();
        List<DataProductSummary> products = catalog.dataProducts().stream()
            .map(product -> new DataProductSummary(product.id(), product.primaryTableOrView(),
                product.description(), product.governanceLevel()))
            .toList();
        return ResponseEntity.ok(new DataProductListResponse(catalog.source(), products));
    }

    /**
     * Query results always come back as an envelope; failures are reported in the body.
     */
    @PostMapping("/query")
    public ResponseEntity<ResponseEnvelope> query(@RequestBody QueryRequest request) {
        return ResponseEntity.ok(queryGateway.execute(request));
    }

    @PostMapping("/reload")
    public ResponseEntity<ReloadResponse> reload() {
        try {
            BootstrapReport report = queryGateway.reload();
            return ResponseEntity.ok(new ReloadResponse(report.source(), report.createdCount(),
                report.failedViews(), report.missingRequiredViews(), null));
        } catch (Exception e) {
            log.error("Failed to reload views", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ReloadResponse(null, 0, null, null, "Reload failed: " + e.getMessage()));
        }
    }

    // Response records

    public record ViewListResponse(List<String> views, String error) {}

    public record DataProductSummary(String productId, String primaryTable, String description, String governanceLevel) {}

    public record DataProductListResponse(String source, List<DataProductSummary> dataProducts) {}

    public record ReloadResponse(String source, long viewsCreated, List<String> failedViews,
                                 List<String> missingRequiredViews, String error) {}
}
