package com.baskettecase.dpmcp.error;

import lombok.Getter;

/**
 * Base type for failures the gateway knows how to classify.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    protected GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
