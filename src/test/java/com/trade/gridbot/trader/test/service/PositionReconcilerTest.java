package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.model.GridLevel;
import com.trade.gridbot.trader.model.GridTrade;
import com.trade.gridbot.trader.model.InitialPosition;
import com.trade.gridbot.trader.model.PositionSnapshot;
import com.trade.gridbot.trader.model.events.ImbalanceDetected;
import com.trade.gridbot.trader.service.calculator.GridCalculator;
import com.trade.gridbot.trader.service.events.GridEventPublisher;
import com.trade.gridbot.trader.service.position.PositionReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PositionReconcilerTest {

    @Mock
    GridEventPublisher events;

    PositionReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new PositionReconciler("BTCUSDT", new GridCalculator(), events, new BigDecimal("0.001"));
    }

    private static PositionSnapshot position(String size) {
        return new PositionSnapshot("BTCUSDT", new BigDecimal(size), new BigDecimal("100"),
                new BigDecimal("100"), BigDecimal.ZERO, Instant.now());
    }

    private static GridTrade fill(OrderSide side, String qty, String price) {
        return new GridTrade(3, side, new BigDecimal(price), new BigDecimal(qty), new BigDecimal(price),
                "ex-1", "grid_BTCUSDT_3_B_1", Instant.now());
    }

    @Test
    void expectedNetIsBuysMinusSells() {
        List<GridLevel> levels = List.of(
                new GridLevel(0, new BigDecimal("100"), OrderSide.BUY, new BigDecimal("1")),
                new GridLevel(1, new BigDecimal("101"), OrderSide.BUY, new BigDecimal("1")),
                new GridLevel(2, new BigDecimal("102"), null, new BigDecimal("1")),
                new GridLevel(3, new BigDecimal("103"), OrderSide.SELL, new BigDecimal("0.5")));

        assertThat(PositionReconciler.expectedNet(levels)).isEqualByComparingTo("1.5");
    }

    @Test
    void matchingPositionRaisesNothing() {
        reconciler.setBaseline(position("1"));
        reconciler.onFill(fill(OrderSide.BUY, "0.5", "99"));

        Optional<ImbalanceDetected> r = reconciler.onPositionUpdate(position("1.5"), List.of());

        assertThat(r).isEmpty();
        verify(events, never()).publishImbalance(any());
    }

    @Test
    void driftBeyondToleranceIsReportedNotCorrected() {
        reconciler.setBaseline(position("1"));
        List<GridLevel> remaining = List.of(new GridLevel(6, new BigDecimal("106"), OrderSide.SELL, new BigDecimal("0.4")));

        assertThat(reconciler.onPositionUpdate(position("0.8"), remaining)).isEmpty();
        Optional<ImbalanceDetected> r = reconciler.onPositionUpdate(position("0.8"), remaining);

        assertThat(r).isPresent();
        assertThat(r.get().actualSize()).isEqualByComparingTo("0.8");
        assertThat(r.get().impliedSize()).isEqualByComparingTo("1");
        assertThat(r.get().expectedFinalSize()).isEqualByComparingTo("0.6");
        assertThat(r.get().difference()).isEqualByComparingTo("-0.2");
        verify(events).publishImbalance(r.get());
        assertThat(reconciler.getSnapshot().signedSize()).isEqualByComparingTo("0.8");

        assertThat(reconciler.onPositionUpdate(position("0.8"), remaining)).isPresent();
        verify(events, times(1)).publishImbalance(any());
    }

    @Test
    void positionFrameAheadOfItsFillRaisesNothing() {
        reconciler.setBaseline(position("1"));

        assertThat(reconciler.onPositionUpdate(position("1.5"), List.of())).isEmpty();
        reconciler.onFill(fill(OrderSide.BUY, "0.5", "99"));
        assertThat(reconciler.onPositionUpdate(position("1.5"), List.of())).isEmpty();

        verify(events, never()).publishImbalance(any());
    }

    @Test
    void mismatchMustOutlastConfirmationWindow() {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
        Clock clock = new Clock() {
            @Override
            public ZoneOffset getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now.get();
            }
        };
        PositionReconciler slow = new PositionReconciler("BTCUSDT", new GridCalculator(), events,
                new BigDecimal("0.001"), Duration.ofSeconds(60), clock);
        slow.setBaseline(position("1"));

        assertThat(slow.onPositionUpdate(position("2"), List.of())).isEmpty();
        now.set(now.get().plusSeconds(30));
        assertThat(slow.onPositionUpdate(position("2"), List.of())).isEmpty();
        now.set(now.get().plusSeconds(30));
        assertThat(slow.onPositionUpdate(position("2"), List.of())).isPresent();
        verify(events).publishImbalance(any());

        assertThat(slow.onPositionUpdate(position("1"), List.of())).isEmpty();
        now.set(now.get().plusSeconds(120));
        assertThat(slow.onPositionUpdate(position("2"), List.of())).isEmpty();
    }

    @Test
    void fillsMoveEntryPriceByWeightedAverage() {
        reconciler.setBaseline(position("1"));

        reconciler.onFill(fill(OrderSide.BUY, "1", "90"));

        PositionSnapshot s = reconciler.getSnapshot();
        assertThat(s.signedSize()).isEqualByComparingTo("2");
        assertThat(s.entryPrice()).isEqualByComparingTo("95");

        reconciler.onMark(new BigDecimal("100"));
        assertThat(reconciler.getSnapshot().unrealizedPnl()).isEqualByComparingTo("10");

        reconciler.onFill(fill(OrderSide.SELL, "2", "101"));
        assertThat(reconciler.getSnapshot().signedSize()).isEqualByComparingTo("0");
        assertThat(reconciler.getSnapshot().entryPrice()).isEqualByComparingTo("0");
        assertThat(reconciler.impliedSize()).isEqualByComparingTo("0");
    }

    @Test
    void crossingZeroResetsEntryToFillPrice() {
        reconciler.setBaseline(position("1"));

        reconciler.onFill(fill(OrderSide.SELL, "3", "104"));

        assertThat(reconciler.getSnapshot().signedSize()).isEqualByComparingTo("-2");
        assertThat(reconciler.getSnapshot().entryPrice()).isEqualByComparingTo("104");
    }

    @Test
    void initialPositionDelegatesToCalculator() {
        List<GridLevel> levels = List.of(
                new GridLevel(0, new BigDecimal("100"), OrderSide.BUY, new BigDecimal("1")),
                new GridLevel(1, new BigDecimal("110"), OrderSide.SELL, new BigDecimal("1")),
                new GridLevel(2, new BigDecimal("120"), OrderSide.SELL, new BigDecimal("1")));

        InitialPosition ip = reconciler.initialPositionNeeded(levels, new BigDecimal("105"), PositionDirection.LONG, null);

        assertThat(ip.side()).isEqualTo(OrderSide.BUY);
        assertThat(ip.quantity()).isEqualByComparingTo("1");
    }
}
