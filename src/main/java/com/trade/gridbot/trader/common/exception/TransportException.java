package com.trade.gridbot.trader.common.exception;

/**
 * Network level failure talking to the exchange (REST or stream).
 */
public class TransportException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-NET-001";

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransportException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
