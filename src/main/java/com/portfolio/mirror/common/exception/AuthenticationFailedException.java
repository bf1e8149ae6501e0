package com.portfolio.mirror.common.exception;

/**
 * Upstream answered 401 again after one refresh and one retry. Fatal for that request.
 */
public class AuthenticationFailedException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-012";

    public AuthenticationFailedException(String personName, String endpoint, Throwable cause) {
        super("Authentication failed for " + personName + " on " + endpoint
                + " after token refresh. Reconnect the brokerage account", cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
