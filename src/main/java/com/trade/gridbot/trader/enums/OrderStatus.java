package com.trade.gridbot.trader.enums;

public enum OrderStatus {
    PENDING,    // submitted or awaiting retry
    OPEN,       // acknowledged by the exchange
    UNKNOWN,    // missing from the open-order list, no fill or cancel seen yet
    FILLED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED;
    }
}
