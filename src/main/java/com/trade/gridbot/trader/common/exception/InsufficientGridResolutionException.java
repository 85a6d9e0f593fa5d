package com.trade.gridbot.trader.common.exception;

/**
 * Quantity per grid level falls below the exchange minimum order size.
 */
public class InsufficientGridResolutionException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-GRID-001";

    public InsufficientGridResolutionException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
