package com.baskettecase.dpmcp.error;

/**
 * Stable error codes carried by error envelopes.
 *
 * Callers branch on these codes, never on backend-specific error text.
 */
public enum ErrorCode {
    INVALID_REQUEST,
    CUSTOM_SQL_DISABLED,
    SQL_VALIDATION_ERROR,
    SQL_EXECUTION_ERROR,
    QUERY_TIMEOUT,
    CONNECTION_ERROR,
    INTERNAL_ERROR
}
