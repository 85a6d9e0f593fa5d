package com.trade.gridbot.trader.model.exchange;

import java.math.BigDecimal;

/**
 * Net position; positive size is long, negative is short.
 */
public record ExchangePosition(String symbol,
                               BigDecimal signedSize,
                               BigDecimal entryPrice,
                               BigDecimal markPrice,
                               BigDecimal unrealizedPnl) {
}
