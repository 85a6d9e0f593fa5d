package com.trade.gridbot.trader.model.exchange;

import com.trade.gridbot.trader.common.constants.GridConstants;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Symbol trading rules: minimum order size, quantity step, price tick and the
 * maintenance margin rate used for liquidation estimates.
 */
@Builder
public record ExchangeLimits(String symbol,
                             BigDecimal minQuantity,
                             BigDecimal quantityStep,
                             BigDecimal tickSize,
                             BigDecimal maintenanceMarginRate) {

    public BigDecimal floorQuantity(BigDecimal qty) {
        if (quantityStep == null || quantityStep.signum() <= 0) return qty;
        return qty.divide(quantityStep, 0, RoundingMode.DOWN).multiply(quantityStep);
    }

    public BigDecimal roundPrice(BigDecimal price) {
        if (tickSize == null || tickSize.signum() <= 0) return price;
        return price.divide(tickSize, 0, RoundingMode.HALF_UP).multiply(tickSize);
    }

    public BigDecimal minQuantityOrZero() {
        return minQuantity == null ? BigDecimal.ZERO : minQuantity;
    }

    public BigDecimal maintenanceMarginRateOrDefault() {
        return maintenanceMarginRate == null ? GridConstants.DEFAULT_MAINTENANCE_MARGIN_RATE : maintenanceMarginRate;
    }
}
