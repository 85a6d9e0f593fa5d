package com.trade.gridbot.trader.model.exchange;

import java.math.BigDecimal;

public record Ticker(String symbol, BigDecimal last, BigDecimal bid, BigDecimal ask) {
}
