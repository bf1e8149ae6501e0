package com.portfolio.mirror.common.exception;

import lombok.Getter;

/**
 * Base exception for credential, gateway and market-data failures.
 * Carries an error code that {@link Http} maps onto an HTTP status.
 */
@Getter
public abstract class BaseBrokerException extends RuntimeException {

    private final String errorCode;

    protected BaseBrokerException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseBrokerException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseBrokerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
