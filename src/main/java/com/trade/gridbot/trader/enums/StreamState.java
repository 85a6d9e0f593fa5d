package com.trade.gridbot.trader.enums;

public enum StreamState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    AUTHENTICATED,
    RECONNECTING;

    public boolean isOpen() {
        return this == CONNECTED || this == AUTHENTICATED;
    }
}
