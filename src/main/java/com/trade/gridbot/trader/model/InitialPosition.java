package com.trade.gridbot.trader.model;

import com.trade.gridbot.trader.enums.OrderSide;

import java.math.BigDecimal;

/**
 * Market position to open before the ladder goes live, with a human readable explanation.
 */
public record InitialPosition(OrderSide side, BigDecimal quantity, String explanation) {

    public boolean isNeeded() {
        return quantity != null && quantity.signum() > 0;
    }
}
