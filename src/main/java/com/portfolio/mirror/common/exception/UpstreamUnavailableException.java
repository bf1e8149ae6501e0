package com.portfolio.mirror.common.exception;

import lombok.Getter;

/**
 * Network failure, timeout or 5xx from the brokerage. Retrying is the caller's decision.
 * {@code status} is 0 when no HTTP response was received.
 */
@Getter
public class UpstreamUnavailableException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-UPSTREAM-001";

    private final int status;

    public UpstreamUnavailableException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
