package com.trade.gridbot.trader.service.calculator;

import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.common.exception.InsufficientGridResolutionException;
import com.trade.gridbot.trader.enums.GridType;
import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.model.GridLevel;
import com.trade.gridbot.trader.model.InitialPosition;
import com.trade.gridbot.trader.model.PriceRange;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static com.trade.gridbot.trader.common.constants.GridConstants.MC;

/**
 * Pure grid geometry: level prices, side assignment around a reference price, per-level
 * quantity and the market position needed before the ladder goes live. No I/O, no state.
 */
@Component
public class GridCalculator {

    private final BigDecimal sideBufferPct;

    public GridCalculator() {
        this(GridConstants.DEFAULT_SIDE_BUFFER_PCT);
    }

    @Autowired
    public GridCalculator(@Value("${grid.calculator.side-buffer-pct:0.001}") BigDecimal sideBufferPct) {
        this.sideBufferPct = Objects.requireNonNull(sideBufferPct, "sideBufferPct");
    }

    /**
     * Computes all {@code gridCount} levels. Levels within the buffer around the reference
     * price carry no side. Below the buffer is BUY, above is SELL, for every direction.
     *
     * @throws InsufficientGridResolutionException when the per-level quantity is below the
     *                                             exchange minimum or two levels collapse onto one tick
     */
    public List<GridLevel> levels(GridConfig config, BigDecimal referencePrice, ExchangeLimits limits) {
        requirePositive(referencePrice);
        BigDecimal quantity = quantityPerLevel(config, referencePrice, limits);
        List<BigDecimal> prices = prices(config, limits);

        BigDecimal buffer = referencePrice.multiply(sideBufferPct, MC);
        BigDecimal buyBelow = referencePrice.subtract(buffer);
        BigDecimal sellAbove = referencePrice.add(buffer);

        List<GridLevel> out = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            BigDecimal p = prices.get(i);
            OrderSide side = null;
            if (p.compareTo(buyBelow) < 0) side = OrderSide.BUY;
            else if (p.compareTo(sellAbove) > 0) side = OrderSide.SELL;
            out.add(new GridLevel(i, p, side, quantity));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Levels to place at start: those with a side that sits on the correct side of the price.
     */
    public List<GridLevel> initialOrders(List<GridLevel> levels, BigDecimal referencePrice) {
        List<GridLevel> out = new ArrayList<>();
        for (GridLevel l : levels) {
            if (!l.hasSide()) continue;
            int cmp = l.price().compareTo(referencePrice);
            if ((l.side() == OrderSide.BUY && cmp < 0) || (l.side() == OrderSide.SELL && cmp > 0)) out.add(l);
        }
        return out;
    }

    /**
     * Market position needed so that every closing order of the ladder has inventory behind it.
     * LONG needs the SELL quantity above the price minus the BUY quantity below it, bought up front.
     * SHORT mirrors that with a SELL. NEUTRAL takes whichever side the difference points to.
     */
    public InitialPosition initialPositionNeeded(List<GridLevel> levels,
                                                 BigDecimal referencePrice,
                                                 PositionDirection direction,
                                                 ExchangeLimits limits) {
        BigDecimal sellAbove = BigDecimal.ZERO;
        BigDecimal buyBelow = BigDecimal.ZERO;
        int sells = 0;
        int buys = 0;
        for (GridLevel l : initialOrders(levels, referencePrice)) {
            if (l.side() == OrderSide.SELL) {
                sellAbove = sellAbove.add(l.quantity());
                sells++;
            } else {
                buyBelow = buyBelow.add(l.quantity());
                buys++;
            }
        }

        BigDecimal diff = sellAbove.subtract(buyBelow);
        OrderSide side;
        BigDecimal qty;
        switch (direction) {
            case LONG:
                side = OrderSide.BUY;
                qty = diff.max(BigDecimal.ZERO);
                break;
            case SHORT:
                side = OrderSide.SELL;
                qty = diff.negate().max(BigDecimal.ZERO);
                break;
            default:
                side = diff.signum() >= 0 ? OrderSide.BUY : OrderSide.SELL;
                qty = diff.abs();
        }
        qty = limits == null ? qty : limits.floorQuantity(qty);

        String explanation = String.format(Locale.ROOT,
                "%s grid at %s: %d SELL levels above (qty %s) vs %d BUY levels below (qty %s) -> %s",
                direction, referencePrice.toPlainString(), sells, sellAbove.toPlainString(), buys,
                buyBelow.toPlainString(),
                qty.signum() > 0 ? "open " + side + " " + qty.toPlainString() + " at market" : "no initial position");
        return new InitialPosition(side, qty, explanation);
    }

    /**
     * Per-level quantity: (investment x leverage / gridCount) / price, floored to the quantity step.
     */
    public BigDecimal quantityPerLevel(GridConfig config, BigDecimal referencePrice, ExchangeLimits limits) {
        BigDecimal raw = config.notionalPerLevel().divide(referencePrice, MC);
        BigDecimal qty = limits == null ? raw : limits.floorQuantity(raw);
        BigDecimal min = limits == null ? BigDecimal.ZERO : limits.minQuantityOrZero();
        if (qty.signum() <= 0 || qty.compareTo(min) < 0) {
            throw new InsufficientGridResolutionException(String.format(Locale.ROOT,
                    "Quantity per grid %s is below exchange minimum %s for %s (%d grids, investment %s, leverage %dx)",
                    qty.toPlainString(), min.toPlainString(), config.getSymbol(), config.getGridCount(),
                    config.getTotalInvestment().toPlainString(), config.getLeverage()));
        }
        return qty;
    }

    /**
     * Range the grid should move to when trailing is enabled and the price has left the
     * current range by more than 5%. Empty when no shift is due.
     */
    public Optional<PriceRange> trailingRange(GridConfig config, BigDecimal price) {
        PriceRange current = new PriceRange(config.getLowerPrice(), config.getUpperPrice());
        BigDecimal width = current.width();
        BigDecimal upTrigger = current.upper().multiply(BigDecimal.ONE.add(GridConstants.TRAIL_TRIGGER_PCT));
        BigDecimal downTrigger = current.lower().multiply(BigDecimal.ONE.subtract(GridConstants.TRAIL_TRIGGER_PCT));

        if (config.isTrailingUp() && price.compareTo(upTrigger) > 0) {
            return Optional.of(new PriceRange(
                    price.subtract(width.multiply(GridConstants.TRAIL_NEAR_SHARE)),
                    price.add(width.multiply(GridConstants.TRAIL_FAR_SHARE))));
        }
        if (config.isTrailingDown() && price.compareTo(downTrigger) < 0) {
            BigDecimal lower = price.subtract(width.multiply(GridConstants.TRAIL_FAR_SHARE));
            if (lower.signum() <= 0) return Optional.empty();
            return Optional.of(new PriceRange(lower, price.add(width.multiply(GridConstants.TRAIL_NEAR_SHARE))));
        }
        return Optional.empty();
    }

    /**
     * Net profit of one buy/sell round trip after paying {@code feeRate} on both legs.
     */
    public static BigDecimal gridProfit(BigDecimal buyPrice, BigDecimal sellPrice, BigDecimal quantity, BigDecimal feeRate) {
        BigDecimal buyCost = buyPrice.multiply(quantity);
        BigDecimal sellRevenue = sellPrice.multiply(quantity);
        BigDecimal fees = buyCost.add(sellRevenue).multiply(feeRate);
        return sellRevenue.subtract(buyCost).subtract(fees);
    }

    // ---------------- helpers ----------------

    private List<BigDecimal> prices(GridConfig config, ExchangeLimits limits) {
        int n = config.getGridCount();
        BigDecimal lower = config.getLowerPrice();
        BigDecimal upper = config.getUpperPrice();
        List<BigDecimal> prices = new ArrayList<>(n);

        if (config.getGridType() == GridType.GEOMETRIC) {
            double ratio = Math.pow(upper.doubleValue() / lower.doubleValue(), 1.0 / (n - 1));
            BigDecimal r = new BigDecimal(ratio, MC);
            for (int i = 0; i < n; i++) {
                prices.add(i == n - 1 ? upper : lower.multiply(r.pow(i, MC), MC));
            }
        } else {
            BigDecimal spacing = upper.subtract(lower).divide(BigDecimal.valueOf(n - 1L), MC);
            for (int i = 0; i < n; i++) {
                prices.add(i == n - 1 ? upper : lower.add(spacing.multiply(BigDecimal.valueOf(i))));
            }
        }

        if (limits != null) {
            prices.replaceAll(limits::roundPrice);
        }
        for (int i = 1; i < n; i++) {
            if (prices.get(i).compareTo(prices.get(i - 1)) <= 0) {
                throw new InsufficientGridResolutionException(String.format(Locale.ROOT,
                        "Grid spacing for %s collapses levels %d and %d onto price %s",
                        config.getSymbol(), i - 1, i, prices.get(i).toPlainString()));
            }
        }
        return prices;
    }

    private static void requirePositive(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("referencePrice must be > 0");
        }
    }
}
