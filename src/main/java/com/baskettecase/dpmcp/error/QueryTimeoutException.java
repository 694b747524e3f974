package com.baskettecase.dpmcp.error;

import lombok.Getter;

@Getter
public class QueryTimeoutException extends GatewayException {

    private final long timeoutMs;

    public QueryTimeoutException(long timeoutMs) {
        super(ErrorCode.QUERY_TIMEOUT, "Query exceeded timeout of " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }
}
