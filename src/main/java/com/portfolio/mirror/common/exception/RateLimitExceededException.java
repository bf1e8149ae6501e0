package com.portfolio.mirror.common.exception;

/**
 * A queued brokerage call did not get a start slot within the allowed wait.
 */
public class RateLimitExceededException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-RATE-001";

    public RateLimitExceededException(String limiterName, long waitedMs) {
        super("Limiter '" + limiterName + "' had no start slot free within " + waitedMs + " ms");
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
