package com.trade.gridbot.trader.enums;

public enum TimeInForce {
    GTC,
    IOC,
    FOK
}
