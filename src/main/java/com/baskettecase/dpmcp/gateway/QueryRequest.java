package com.baskettecase.dpmcp.gateway;

import lombok.Builder;

import java.util.Map;

/**
 * An ad-hoc SQL request. Principal fields only annotate the response.
 *
 * @param transactionId assigned by the gateway when absent
 * @param timeoutMs     overrides the configured query timeout when positive
 * @param maxRows       lowers the configured row cap when positive
 */
@Builder
public record QueryRequest(
    String requestId,
    String transactionId,
    String sql,
    Map<String, Object> parameters,
    String principalId,
    Map<String, Object> principalContext,
    Long timeoutMs,
    Integer maxRows
) {
    public static QueryRequest of(String sql) {
        return QueryRequest.builder().sql(sql).build();
    }
}
