package com.trade.gridbot.trader.service.risk;

import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.enums.StopReason;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.model.GridStats;
import com.trade.gridbot.trader.model.PositionSnapshot;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.trade.gridbot.trader.common.constants.GridConstants.HUNDRED;
import static com.trade.gridbot.trader.common.constants.GridConstants.MC;

/**
 * Safety checks for one bot: a pre-start gate, continuous stop conditions and a
 * consecutive-loss circuit breaker that pauses new placements.
 */
@Slf4j
public class RiskGate {

    private final RiskSettings settings;
    private final Clock clock;

    // -------------------- circuit breaker --------------------
    private int consecutiveLosses;
    private Instant circuitOpenUntil;

    public RiskGate() {
        this(RiskSettings.builder().build(), Clock.systemUTC());
    }

    public RiskGate(RiskSettings settings, Clock clock) {
        this.settings = settings == null ? RiskSettings.builder().build() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    // =====================================================================
    // Pre-start
    // =====================================================================

    /**
     * Runs every check and reports all failures, not just the first.
     */
    public RiskReport preStartCheck(GridConfig config, BigDecimal referencePrice, ExchangeLimits limits) {
        List<String> reasons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int leverage = config.getLeverage();

        // (a) per-level size vs exchange minimum
        BigDecimal rawQty = config.notionalPerLevel().divide(referencePrice, MC);
        BigDecimal qty = limits == null ? rawQty : limits.floorQuantity(rawQty);
        BigDecimal minQty = limits == null ? BigDecimal.ZERO : limits.minQuantityOrZero();
        if (qty.signum() <= 0 || qty.compareTo(minQty) < 0) {
            reasons.add(fmt("quantity per grid %s is below exchange minimum %s", qty.toPlainString(), minQty.toPlainString()));
        }

        // (b) liquidation distance vs stop-loss move
        BigDecimal mm = settings.getMaintenanceMarginRate() != null ? settings.getMaintenanceMarginRate()
                : limits != null ? limits.maintenanceMarginRateOrDefault() : GridConstants.DEFAULT_MAINTENANCE_MARGIN_RATE;
        BigDecimal liqDistancePct = HUNDRED.subtract(mm.multiply(HUNDRED))
                .divide(BigDecimal.valueOf(leverage), 4, RoundingMode.HALF_UP);
        BigDecimal liqPrice = liquidationPrice(config.getDirection(), referencePrice, liqDistancePct);

        if (config.getStopLoss() != null) {
            BigDecimal slMovePct = referencePrice.subtract(config.getStopLoss()).abs()
                    .multiply(HUNDRED).divide(referencePrice, 4, RoundingMode.HALF_UP);
            if (slMovePct.compareTo(liqDistancePct) >= 0) {
                reasons.add(fmt("liquidation risk: stop-loss %s is a %s%% move but liquidation is %s%% away at %dx",
                        config.getStopLoss().toPlainString(), slMovePct.toPlainString(),
                        liqDistancePct.toPlainString(), leverage));
            }
        } else {
            warnings.add("no stop-loss configured");
        }

        // (c) per-level notional cap
        if (config.getMaxPositionSize() != null && config.notionalPerLevel().compareTo(config.getMaxPositionSize()) > 0) {
            reasons.add(fmt("per-level notional %s exceeds maxPositionSize %s",
                    config.notionalPerLevel().setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    config.getMaxPositionSize().toPlainString()));
        }

        // (d) entry inside range
        boolean inRange = referencePrice.compareTo(config.getLowerPrice()) >= 0
                && referencePrice.compareTo(config.getUpperPrice()) <= 0;
        if (!inRange) {
            String msg = fmt("reference price %s is outside range [%s, %s]", referencePrice.toPlainString(),
                    config.getLowerPrice().toPlainString(), config.getUpperPrice().toPlainString());
            if (config.isAcceptOutOfRangeEntry()) warnings.add(msg);
            else reasons.add(msg);
        }

        // -------------------- warnings --------------------
        if (leverage > settings.getMaxSafeLeverage()) {
            warnings.add(fmt("leverage %dx is above the safe threshold %dx", leverage, settings.getMaxSafeLeverage()));
        }
        BigDecimal spacingPct = config.getUpperPrice().subtract(config.getLowerPrice())
                .divide(BigDecimal.valueOf(config.getGridCount() - 1L), MC)
                .multiply(HUNDRED).divide(referencePrice, 4, RoundingMode.HALF_UP);
        if (spacingPct.compareTo(settings.getMinGridSpacingPct()) < 0) {
            warnings.add(fmt("grid spacing %s%% is below %s%%", spacingPct.toPlainString(),
                    settings.getMinGridSpacingPct().toPlainString()));
        }
        BigDecimal roundTripFeePct = config.getFeeRate().multiply(new BigDecimal("2")).multiply(HUNDRED);
        if (spacingPct.compareTo(roundTripFeePct) <= 0) {
            warnings.add(fmt("grid spacing %s%% does not cover round-trip fees of %s%%", spacingPct.toPlainString(),
                    roundTripFeePct.stripTrailingZeros().toPlainString()));
        }
        if (liqDistancePct.compareTo(settings.getMinLiquidationDistancePct()) < 0) {
            warnings.add(fmt("liquidation is only %s%% away", liqDistancePct.toPlainString()));
        }
        if (liqPrice != null && liqPrice.compareTo(config.getLowerPrice()) > 0
                && liqPrice.compareTo(config.getUpperPrice()) < 0) {
            warnings.add(fmt("estimated liquidation price %s lies inside the grid range",
                    liqPrice.setScale(4, RoundingMode.HALF_UP).toPlainString()));
        }

        RiskReport report = new RiskReport(reasons.isEmpty(), List.copyOf(reasons), List.copyOf(warnings),
                liqPrice, liqDistancePct, qty);
        if (!report.ok()) log.warn("[{}] {}", config.getSymbol(), report.describe());
        else if (!warnings.isEmpty()) log.info("[{}] {}", config.getSymbol(), report.describe());
        return report;
    }

    // =====================================================================
    // Continuous
    // =====================================================================

    /**
     * Stop condition for the current mark price and performance, if any.
     */
    public Optional<StopReason> evaluate(GridConfig config, BigDecimal markPrice, GridStats stats) {
        if (markPrice != null && markPrice.signum() > 0) {
            BigDecimal sl = config.getStopLoss();
            if (sl != null && breached(config, sl, markPrice, true)) return Optional.of(StopReason.STOP_LOSS);
            BigDecimal tp = config.getTakeProfit();
            if (tp != null && breached(config, tp, markPrice, false)) return Optional.of(StopReason.TAKE_PROFIT);
        }
        if (config.getMaxDrawdownPct() != null && stats != null && stats.getCurrentDrawdown() != null) {
            BigDecimal ddPct = stats.getCurrentDrawdown().multiply(HUNDRED)
                    .divide(config.getTotalInvestment(), 4, RoundingMode.HALF_UP);
            if (ddPct.compareTo(config.getMaxDrawdownPct()) >= 0) return Optional.of(StopReason.MAX_DRAWDOWN);
        }
        return Optional.empty();
    }

    /**
     * Open position notional above {@code maxPositionSize}. Only reported; the grid keeps running.
     */
    public Optional<String> positionLimitBreached(GridConfig config, PositionSnapshot position) {
        BigDecimal cap = config.getMaxPositionSize();
        if (cap == null || position == null || position.signedSize() == null) return Optional.empty();
        BigDecimal mark = position.markPrice() != null && position.markPrice().signum() > 0
                ? position.markPrice() : position.entryPrice();
        if (mark == null || mark.signum() <= 0) return Optional.empty();
        BigDecimal value = position.signedSize().abs().multiply(mark, MC);
        if (value.compareTo(cap) <= 0) return Optional.empty();
        return Optional.of(fmt("position value %s exceeds maxPositionSize %s",
                value.setScale(2, RoundingMode.HALF_UP).toPlainString(), cap.toPlainString()));
    }

    // =====================================================================
    // Circuit breaker
    // =====================================================================

    /**
     * @return true when this cycle opened the circuit
     */
    public synchronized boolean recordCycle(BigDecimal profit) {
        if (profit == null || profit.signum() >= 0) {
            consecutiveLosses = 0;
            return false;
        }
        consecutiveLosses++;
        if (consecutiveLosses < settings.getMaxConsecutiveLosses()) return false;
        circuitOpenUntil = clock.instant().plus(settings.getLossCooldown());
        log.warn("{} consecutive losing cycles; pausing new placements until {}", consecutiveLosses, circuitOpenUntil);
        consecutiveLosses = 0;
        return true;
    }

    public synchronized Instant getCircuitOpenUntil() {
        return circuitOpenUntil;
    }

    public synchronized boolean allowPlacement() {
        if (circuitOpenUntil == null) return true;
        if (!clock.instant().isBefore(circuitOpenUntil)) {
            log.info("loss circuit breaker closed");
            circuitOpenUntil = null;
            return true;
        }
        return false;
    }

    public synchronized int getConsecutiveLosses() {
        return consecutiveLosses;
    }

    public int getMaxConsecutiveLosses() {
        return settings.getMaxConsecutiveLosses();
    }

    // -------------------- helpers --------------------

    private static boolean breached(GridConfig config, BigDecimal trigger, BigDecimal mark, boolean stopLoss) {
        PositionDirection d = config.getDirection();
        boolean belowTrigger;
        if (d == PositionDirection.LONG) belowTrigger = stopLoss;
        else if (d == PositionDirection.SHORT) belowTrigger = !stopLoss;
        else belowTrigger = trigger.compareTo(config.getLowerPrice()) < 0;
        return belowTrigger ? mark.compareTo(trigger) <= 0 : mark.compareTo(trigger) >= 0;
    }

    private static BigDecimal liquidationPrice(PositionDirection d, BigDecimal ref, BigDecimal distancePct) {
        BigDecimal move = ref.multiply(distancePct).divide(HUNDRED, MC);
        if (d == PositionDirection.LONG) return ref.subtract(move);
        if (d == PositionDirection.SHORT) return ref.add(move);
        return null;
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
