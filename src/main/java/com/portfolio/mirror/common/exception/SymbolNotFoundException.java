package com.portfolio.mirror.common.exception;

/**
 * The brokerage has no instrument with this symbol.
 */
public class SymbolNotFoundException extends BaseBrokerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-MKT-404";

    public SymbolNotFoundException(String symbol) {
        super("Symbol " + symbol + " not found");
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
