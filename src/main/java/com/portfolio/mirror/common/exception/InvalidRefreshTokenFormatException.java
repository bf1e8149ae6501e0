package com.portfolio.mirror.common.exception;

/**
 * The refresh token is missing or too short to be a real token. Caller error, never retried.
 */
public class InvalidRefreshTokenFormatException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-010";

    public InvalidRefreshTokenFormatException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
