package com.trade.gridbot.trader.model.stream;

import java.math.BigDecimal;
import java.time.Instant;

public record TickerEvent(String symbol, BigDecimal last, BigDecimal bid, BigDecimal ask, Instant timestamp)
        implements StreamEvent {

    public static final String CHANNEL = "ticker";

    @Override
    public String channel() {
        return CHANNEL;
    }
}
