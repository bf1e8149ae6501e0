package com.portfolio.mirror.common.exception;

import lombok.Getter;

/**
 * The brokerage OAuth endpoint rejected a refresh. A 400 or 401 means the refresh token itself is dead
 * and the person has to reconnect the brokerage account; other statuses are reported as-is.
 */
@Getter
public class UpstreamAuthException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-011";
    public static final String RECONNECT_ERROR_CODE = "ERR-AUTH-RECONNECT";

    private final int status;

    public UpstreamAuthException(String personName, int status, Throwable cause) {
        super(codeFor(status), messageFor(personName, status), cause);
        this.status = status;
    }

    public UpstreamAuthException(String personName, int status, String detail) {
        super(codeFor(status), messageFor(personName, status) + ": " + detail, null);
        this.status = status;
    }

    /**
     * True when upstream declared the refresh token invalid (HTTP 400/401).
     */
    public boolean isRefreshTokenInvalid() {
        return isRefreshTokenInvalid(status);
    }

    static boolean isRefreshTokenInvalid(int status) {
        return status == 400 || status == 401;
    }

    private static String codeFor(int status) {
        return isRefreshTokenInvalid(status) ? RECONNECT_ERROR_CODE : DEFAULT_ERROR_CODE;
    }

    private static String messageFor(String personName, int status) {
        if (isRefreshTokenInvalid(status)) {
            return "Refresh token for " + personName + " is invalid or expired (HTTP " + status
                    + "). Reconnect the brokerage account";
        }
        return "Brokerage token endpoint rejected refresh for " + personName + " (HTTP " + status + ")";
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
