package com.trade.gridbot.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.trade.gridbot.trader.enums.OrderSide;

import java.math.BigDecimal;

/**
 * One price point of the grid. {@code side} is null when the level sits inside the
 * buffer around the reference price and is skipped for this pass.
 */
public record GridLevel(int index, BigDecimal price, OrderSide side, BigDecimal quantity) {

    @JsonIgnore
    public boolean hasSide() {
        return side != null;
    }

    public GridLevel withSide(OrderSide newSide) {
        return new GridLevel(index, price, newSide, quantity);
    }

    public GridLevel withQuantity(BigDecimal newQuantity) {
        return new GridLevel(index, price, side, newQuantity);
    }
}
