package com.trade.gridbot.trader.enums;

public enum BotState {
    INITIALIZING,
    RUNNING,
    PAUSED,
    STOPPED,
    ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }
}
