package com.baskettecase.dpmcp.gateway;

import lombok.Builder;

import java.util.Map;

/**
 * A query against a registered data product. {@code sqlQuery} usually comes from an
 * upstream SQL generator and is normalized before validation.
 */
@Builder
public record DataProductRequest(
    String requestId,
    String transactionId,
    String productId,
    String sqlQuery,
    Map<String, Object> parameters,
    String principalId,
    Map<String, Object> principalContext,
    Long timeoutMs,
    Integer maxRows
) {
}
