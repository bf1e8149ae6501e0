package com.portfolio.mirror.common.exception;

/**
 * Exception thrown when a stored entity (person, credential, symbol row) does not exist.
 */
public class EntityNotFoundException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-001";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String entityType, String identifier) {
        super(String.format("%s with identifier %s not found", entityType, identifier));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
