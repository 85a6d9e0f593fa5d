package com.trade.gridbot.trader.model.stream;

import java.math.BigDecimal;
import java.time.Instant;

public record PositionEvent(String symbol,
                            BigDecimal signedSize,
                            BigDecimal entryPrice,
                            BigDecimal markPrice,
                            BigDecimal unrealizedPnl,
                            Instant timestamp) implements StreamEvent {

    public static final String CHANNEL = "position";

    @Override
    public String channel() {
        return CHANNEL;
    }
}
