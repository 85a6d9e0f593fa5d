package com.trade.gridbot.trader.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An opening fill matched with its closing fill on the adjacent level.
 */
public record CompletedCycle(int openLevel,
                             int closeLevel,
                             BigDecimal buyPrice,
                             BigDecimal sellPrice,
                             BigDecimal quantity,
                             BigDecimal fees,
                             BigDecimal profit,
                             Instant completedAt) {
}
