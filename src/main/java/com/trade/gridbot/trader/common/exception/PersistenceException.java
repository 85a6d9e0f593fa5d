package com.trade.gridbot.trader.common.exception;

public class PersistenceException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-PST-001";

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
