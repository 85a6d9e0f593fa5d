package com.trade.gridbot.trader.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
