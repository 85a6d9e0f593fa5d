package com.trade.gridbot.trader.model;

import com.trade.gridbot.trader.enums.OrderSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A confirmed fill of a grid order.
 */
public record GridTrade(int levelIndex,
                        OrderSide side,
                        BigDecimal price,
                        BigDecimal quantity,
                        BigDecimal fillPrice,
                        String exchangeOrderId,
                        String clientOrderId,
                        Instant filledAt) {
}
