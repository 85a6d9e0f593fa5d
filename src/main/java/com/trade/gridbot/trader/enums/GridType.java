package com.trade.gridbot.trader.enums;

public enum GridType {
    ARITHMETIC, // constant price step
    GEOMETRIC   // constant price ratio
}
