package com.trade.gridbot.trader.model;

import java.math.BigDecimal;

public record PriceRange(BigDecimal lower, BigDecimal upper) {

    public BigDecimal width() {
        return upper.subtract(lower);
    }

    public boolean contains(BigDecimal price) {
        return price.compareTo(lower) >= 0 && price.compareTo(upper) <= 0;
    }
}
