package com.portfolio.mirror.common.exception;

/**
 * No active refresh token exists for the person. Fatal until an operator enrolls the person again.
 */
public class NoRefreshTokenException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-010";

    public NoRefreshTokenException(String personName) {
        super("No active refresh token found for " + personName);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
