package com.trade.gridbot.trader.model.events;

import com.trade.gridbot.trader.enums.OrderSide;

import java.math.BigDecimal;

public record DuplicateOrderDetected(String symbol, String orderId, OrderSide side, BigDecimal price, boolean cancelled) {
}
