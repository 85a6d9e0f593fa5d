package com.trade.gridbot.trader.enums;

public enum StopReason {
    MANUAL,
    STOP_LOSS,
    TAKE_PROFIT,
    MAX_DRAWDOWN,
    SHUTDOWN
}
