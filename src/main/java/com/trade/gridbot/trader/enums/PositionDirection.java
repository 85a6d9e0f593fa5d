package com.trade.gridbot.trader.enums;

public enum PositionDirection {
    LONG,
    SHORT,
    NEUTRAL
}
