package com.trade.gridbot.trader.service.position;

import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.model.GridLevel;
import com.trade.gridbot.trader.model.GridTrade;
import com.trade.gridbot.trader.model.InitialPosition;
import com.trade.gridbot.trader.model.PositionSnapshot;
import com.trade.gridbot.trader.model.events.ImbalanceDetected;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import com.trade.gridbot.trader.service.calculator.GridCalculator;
import com.trade.gridbot.trader.service.events.GridEventPublisher;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.trade.gridbot.trader.common.constants.GridConstants.MC;

/**
 * Sole writer of the bot's {@link PositionSnapshot}. Compares what the exchange reports with
 * what the confirmed fills imply and reports drift; it never trades to correct it.
 * Not thread-safe: driven from the engine's dispatch thread.
 */
@Slf4j
public class PositionReconciler {

    private final String symbol;
    private final GridCalculator calculator;
    private final GridEventPublisher events;
    private final BigDecimal tolerance;
    private final Duration confirmAfter;
    private final Clock clock;

    private volatile PositionSnapshot snapshot;
    private BigDecimal baseline = BigDecimal.ZERO;
    private BigDecimal filledNet = BigDecimal.ZERO;

    private Instant mismatchSince;
    private boolean mismatchReported;

    public PositionReconciler(String symbol, GridCalculator calculator, GridEventPublisher events, BigDecimal tolerance) {
        this(symbol, calculator, events, tolerance, Duration.ZERO, Clock.systemUTC());
    }

    /**
     * @param confirmAfter how long a mismatch must persist, across at least two position
     *                     updates, before it is reported
     */
    public PositionReconciler(String symbol, GridCalculator calculator, GridEventPublisher events,
                              BigDecimal tolerance, Duration confirmAfter, Clock clock) {
        this.symbol = symbol;
        this.calculator = calculator;
        this.events = events;
        this.tolerance = tolerance == null ? new BigDecimal("0.00000001") : tolerance.abs();
        this.confirmAfter = confirmAfter == null ? Duration.ZERO : confirmAfter;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.snapshot = PositionSnapshot.flat(symbol);
    }

    /** Signed sum over levels: BUY quantities minus SELL quantities. */
    public static BigDecimal expectedNet(Collection<GridLevel> levels) {
        BigDecimal net = BigDecimal.ZERO;
        for (GridLevel l : levels) {
            if (!l.hasSide()) continue;
            net = l.side() == OrderSide.BUY ? net.add(l.quantity()) : net.subtract(l.quantity());
        }
        return net;
    }

    /**
     * Starting point for the implied position, normally the exchange position right after
     * the initial market order.
     */
    public void setBaseline(PositionSnapshot start) {
        this.snapshot = start;
        this.baseline = start.signedSize();
        this.filledNet = BigDecimal.ZERO;
        this.mismatchSince = null;
        this.mismatchReported = false;
    }

    public BigDecimal impliedSize() {
        return baseline.add(filledNet);
    }

    /**
     * Overwrites the snapshot with the exchange's view.
     * <p>
     * A position frame often arrives before the fill that explains it, so a mismatch is only
     * reported once a later update still shows it after {@code confirmAfter}. It is published
     * once per episode; a matching update ends the episode.
     *
     * @param remainingPlanned planned levels still to fill, for the expected final position
     * @return the imbalance when actual and implied have differed by more than the tolerance
     * for long enough
     */
    public Optional<ImbalanceDetected> onPositionUpdate(PositionSnapshot update, Collection<GridLevel> remainingPlanned) {
        this.snapshot = update;
        BigDecimal implied = impliedSize();
        BigDecimal diff = update.signedSize().subtract(implied).abs();
        if (diff.compareTo(tolerance) <= 0) {
            if (mismatchReported) log.info("[{}] position back in line with fills at {}", symbol, implied.toPlainString());
            mismatchSince = null;
            mismatchReported = false;
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (mismatchSince == null) {
            mismatchSince = now;
            log.debug("[{}] position {} differs from implied {}; waiting for confirmation", symbol,
                    update.signedSize().toPlainString(), implied.toPlainString());
            return Optional.empty();
        }
        if (Duration.between(mismatchSince, now).compareTo(confirmAfter) < 0) return Optional.empty();

        ImbalanceDetected imbalance = new ImbalanceDetected(symbol, update.signedSize(), implied,
                implied.add(expectedNet(remainingPlanned)), tolerance);
        if (!mismatchReported && events != null) events.publishImbalance(imbalance);
        mismatchReported = true;
        return Optional.of(imbalance);
    }

    /**
     * Applies a confirmed fill to the implied size and to the local snapshot, so the snapshot
     * stays current between position messages.
     */
    public void onFill(GridTrade trade) {
        BigDecimal signedQty = trade.side() == OrderSide.BUY ? trade.quantity() : trade.quantity().negate();
        filledNet = filledNet.add(signedQty);

        BigDecimal size = snapshot.signedSize();
        BigDecimal newSize = size.add(signedQty);
        BigDecimal entry = snapshot.entryPrice();
        if (newSize.signum() == 0) {
            entry = BigDecimal.ZERO;
        } else if (size.signum() == 0 || size.signum() != newSize.signum()) {
            entry = trade.fillPrice();
        } else if (size.signum() == signedQty.signum()) {
            entry = entry.multiply(size.abs()).add(trade.fillPrice().multiply(signedQty.abs()))
                    .divide(newSize.abs(), MC);
        }
        BigDecimal mark = snapshot.markPrice().signum() > 0 ? snapshot.markPrice() : trade.fillPrice();
        snapshot = new PositionSnapshot(symbol, newSize, entry, mark, BigDecimal.ZERO, Instant.now()).withMark(mark);
    }

    /** Refreshes mark price and unrealized P&L from a ticker. */
    public void onMark(BigDecimal price) {
        if (price == null || price.signum() <= 0) return;
        snapshot = snapshot.withMark(price);
    }

    public InitialPosition initialPositionNeeded(List<GridLevel> levels,
                                                 BigDecimal referencePrice,
                                                 PositionDirection direction,
                                                 ExchangeLimits limits) {
        InitialPosition ip = calculator.initialPositionNeeded(levels, referencePrice, direction, limits);
        log.info("[{}] {}", symbol, ip.explanation());
        return ip;
    }

    public PositionSnapshot getSnapshot() {
        return snapshot;
    }

    /** Restores persisted state without treating it as a fresh baseline. */
    public void restore(PositionSnapshot persisted) {
        if (persisted == null) return;
        this.snapshot = persisted;
        this.baseline = persisted.signedSize();
        this.filledNet = BigDecimal.ZERO;
    }
}
