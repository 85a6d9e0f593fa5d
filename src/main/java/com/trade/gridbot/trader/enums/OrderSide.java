package com.trade.gridbot.trader.enums;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * +1 for BUY, -1 for SELL.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
