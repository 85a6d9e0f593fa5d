package com.trade.gridbot.trader.common.exception;

/**
 * The initial market order went through but the exchange never showed the expected position.
 */
public class PositionNotEstablishedException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-POS-001";

    public PositionNotEstablishedException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
