package com.trade.gridbot.trader.common.exception;

/**
 * The exchange refused an order. Scoped to a single grid level.
 */
public class OrderRejectedException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-ORD-001";

    public OrderRejectedException(String message) {
        super(message);
    }

    public OrderRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
