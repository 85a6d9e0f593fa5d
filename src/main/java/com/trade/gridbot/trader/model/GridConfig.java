package com.trade.gridbot.trader.model;

import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.common.exception.ConfigInvalidException;
import com.trade.gridbot.trader.enums.GridType;
import com.trade.gridbot.trader.enums.OrderType;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.enums.TimeInForce;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable per-run configuration of one grid bot.
 * Optional limits (stop-loss, take-profit, max position, max drawdown) are null when unset.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GridConfig {

    String symbol;
    @Builder.Default
    PositionDirection direction = PositionDirection.LONG;
    @Builder.Default
    GridType gridType = GridType.ARITHMETIC;

    BigDecimal lowerPrice;
    BigDecimal upperPrice;
    int gridCount;
    BigDecimal totalInvestment;
    @Builder.Default
    int leverage = 1;

    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal maxPositionSize;
    BigDecimal maxDrawdownPct;

    @Builder.Default
    OrderType orderType = OrderType.LIMIT;
    @Builder.Default
    TimeInForce timeInForce = TimeInForce.GTC;
    boolean postOnly;
    boolean trailingUp;
    boolean trailingDown;
    @Builder.Default
    boolean cancelOrdersOnStop = true;
    boolean closePositionOnStop;

    boolean acceptHighRisk;
    boolean acceptOutOfRangeEntry;
    /** Levels between a fill and its replenishment; 0 re-uses the filled level. */
    @Builder.Default
    int replenishStep = 1;
    @Builder.Default
    BigDecimal feeRate = GridConstants.DEFAULT_FEE_RATE;

    /**
     * Checks every rule and throws once with the full list of violations.
     */
    public GridConfig validate() {
        List<String> v = new ArrayList<>();
        if (symbol == null || symbol.isBlank()) v.add("symbol is required");
        if (direction == null) v.add("direction is required");
        if (lowerPrice == null || upperPrice == null) {
            v.add("lowerPrice and upperPrice are required");
        } else {
            if (lowerPrice.signum() <= 0) v.add("lowerPrice must be > 0");
            if (lowerPrice.compareTo(upperPrice) >= 0) v.add("lowerPrice must be < upperPrice");
        }
        if (gridCount < 2) v.add("gridCount must be >= 2");
        if (totalInvestment == null || totalInvestment.signum() <= 0) v.add("totalInvestment must be > 0");
        if (leverage < 1 || leverage > GridConstants.MAX_LEVERAGE)
            v.add("leverage must be between 1 and " + GridConstants.MAX_LEVERAGE);
        if (replenishStep < 0) v.add("replenishStep must be >= 0");
        if (feeRate == null || feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) >= 0)
            v.add("feeRate must be in [0, 1)");
        if (maxDrawdownPct != null
                && (maxDrawdownPct.signum() <= 0 || maxDrawdownPct.compareTo(GridConstants.HUNDRED) > 0))
            v.add("maxDrawdownPct must be in (0, 100]");
        if (maxPositionSize != null && maxPositionSize.signum() <= 0) v.add("maxPositionSize must be > 0");

        if (lowerPrice != null && upperPrice != null) {
            if (stopLoss != null) {
                if (direction == PositionDirection.LONG && stopLoss.compareTo(lowerPrice) >= 0)
                    v.add("LONG stopLoss must be below lowerPrice");
                if (direction == PositionDirection.SHORT && stopLoss.compareTo(upperPrice) <= 0)
                    v.add("SHORT stopLoss must be above upperPrice");
            }
            if (takeProfit != null) {
                if (direction == PositionDirection.LONG && takeProfit.compareTo(upperPrice) <= 0)
                    v.add("LONG takeProfit must be above upperPrice");
                if (direction == PositionDirection.SHORT && takeProfit.compareTo(lowerPrice) >= 0)
                    v.add("SHORT takeProfit must be below lowerPrice");
            }
        }
        if (!v.isEmpty()) throw new ConfigInvalidException(v);
        return this;
    }

    /**
     * Capital committed to each level, leverage included.
     */
    public BigDecimal notionalPerLevel() {
        return totalInvestment.multiply(BigDecimal.valueOf(leverage))
                .divide(BigDecimal.valueOf(gridCount), GridConstants.MC);
    }

    public GridConfig withRange(PriceRange range) {
        return toBuilder().lowerPrice(range.lower()).upperPrice(range.upper()).build();
    }
}
