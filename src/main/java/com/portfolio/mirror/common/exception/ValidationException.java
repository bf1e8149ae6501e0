package com.portfolio.mirror.common.exception;

/**
 * Exception for invalid caller input.
 */
public class ValidationException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
