package com.baskettecase.dpmcp.error;

/**
 * Backend-native failure on permitted SQL (missing relation, bad column, type mismatch...).
 */
public class QueryExecutionException extends GatewayException {

    public QueryExecutionException(String message) {
        super(ErrorCode.SQL_EXECUTION_ERROR, message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(ErrorCode.SQL_EXECUTION_ERROR, message, cause);
    }
}
