package com.baskettecase.dpmcp.error;

/**
 * Backend unreachable or not initialized. Fatal at startup, reported as an envelope at query time.
 */
public class BackendConnectionException extends GatewayException {

    public BackendConnectionException(String message) {
        super(ErrorCode.CONNECTION_ERROR, message);
    }

    public BackendConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION_ERROR, message, cause);
    }
}
