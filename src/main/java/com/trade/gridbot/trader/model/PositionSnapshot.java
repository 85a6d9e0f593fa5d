package com.trade.gridbot.trader.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PositionSnapshot(String symbol,
                               BigDecimal signedSize,
                               BigDecimal entryPrice,
                               BigDecimal markPrice,
                               BigDecimal unrealizedPnl,
                               Instant updatedAt) {

    public static PositionSnapshot flat(String symbol) {
        return new PositionSnapshot(symbol, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, Instant.now());
    }

    public PositionSnapshot withMark(BigDecimal mark) {
        BigDecimal pnl = entryPrice.signum() == 0 ? BigDecimal.ZERO
                : mark.subtract(entryPrice).multiply(signedSize);
        return new PositionSnapshot(symbol, signedSize, entryPrice, mark, pnl, Instant.now());
    }
}
