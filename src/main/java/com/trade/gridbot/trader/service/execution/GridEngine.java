package com.trade.gridbot.trader.service.execution;

import com.trade.gridbot.trader.common.Result;
import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.common.exception.GridTradeException;
import com.trade.gridbot.trader.common.exception.OrderRejectedException;
import com.trade.gridbot.trader.common.exception.PersistenceException;
import com.trade.gridbot.trader.common.exception.PositionNotEstablishedException;
import com.trade.gridbot.trader.common.exception.RiskCheckFailedException;
import com.trade.gridbot.trader.common.exception.TransportException;
import com.trade.gridbot.trader.enums.BotState;
import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.OrderType;
import com.trade.gridbot.trader.enums.StopReason;
import com.trade.gridbot.trader.enums.StreamState;
import com.trade.gridbot.trader.enums.TimeInForce;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.model.GridLevel;
import com.trade.gridbot.trader.model.GridStats;
import com.trade.gridbot.trader.model.GridTrade;
import com.trade.gridbot.trader.model.InitialPosition;
import com.trade.gridbot.trader.model.PersistedSnapshot;
import com.trade.gridbot.trader.model.PositionSnapshot;
import com.trade.gridbot.trader.model.PriceRange;
import com.trade.gridbot.trader.model.events.DuplicateOrderDetected;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import com.trade.gridbot.trader.model.exchange.ExchangeOrder;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderRequest;
import com.trade.gridbot.trader.model.exchange.ExchangePosition;
import com.trade.gridbot.trader.model.exchange.Ticker;
import com.trade.gridbot.trader.model.stream.ChannelSubscription;
import com.trade.gridbot.trader.model.stream.OrderUpdateEvent;
import com.trade.gridbot.trader.model.stream.PositionEvent;
import com.trade.gridbot.trader.model.stream.StreamEvent;
import com.trade.gridbot.trader.model.stream.TickerEvent;
import com.trade.gridbot.trader.service.calculator.GridCalculator;
import com.trade.gridbot.trader.service.events.GridEventPublisher;
import com.trade.gridbot.trader.service.exchange.ExchangeClient;
import com.trade.gridbot.trader.service.orders.OrderLedger;
import com.trade.gridbot.trader.service.persistence.SnapshotStore;
import com.trade.gridbot.trader.service.position.PositionReconciler;
import com.trade.gridbot.trader.service.risk.RiskGate;
import com.trade.gridbot.trader.service.risk.RiskReport;
import com.trade.gridbot.trader.service.streaming.StreamListener;
import com.trade.gridbot.trader.service.streaming.StreamProtocol;
import com.trade.gridbot.trader.service.streaming.StreamTransport;
import com.trade.gridbot.trader.service.streaming.StreamingClient;
import com.trade.gridbot.trader.service.trades.GridStatsTracker;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State machine of one grid bot.
 * <p>
 * Threads: the stream's dispatch thread is the only writer of ledger, position and stats
 * state, and also runs start-up reconciliation, periodic reconciliation and REST fallback
 * results. A scheduler thread triggers periodic work, a small pool runs fallback REST reads,
 * and a control thread runs risk-triggered stops so the dispatch thread never waits on itself.
 */
@Slf4j
public class GridEngine implements StreamListener {

    private final String instance;
    private final ExchangeClient exchange;
    private final GridCalculator calculator;
    private final RiskGate riskGate;
    private final SnapshotStore store;
    private final GridEventPublisher events;
    private final StreamTransport transport;
    private final StreamProtocol protocol;
    private final GridEngineSettings settings;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService fallbackPool;
    private final ExecutorService control;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final Object stateLock = new Object();
    private final Object persistLock = new Object();

    private volatile GridConfig config;
    private volatile BotState state = BotState.INITIALIZING;
    private volatile List<GridLevel> levels = List.of();
    private volatile ExchangeLimits limits;
    private volatile StreamingClient stream;
    private volatile OrderLedger ledger;
    private volatile PositionReconciler position;
    private volatile GridStatsTracker stats;
    private volatile CountDownLatch streamOpen = new CountDownLatch(1);

    private volatile Instant startedAt;
    private volatile BigDecimal lastPrice;
    private volatile String lastError;
    private volatile Instant lastFillSync;
    private boolean overPositionLimit;

    @Builder
    public GridEngine(String instance,
                      GridConfig config,
                      ExchangeClient exchange,
                      GridCalculator calculator,
                      RiskGate riskGate,
                      SnapshotStore store,
                      GridEventPublisher events,
                      StreamTransport transport,
                      StreamProtocol protocol,
                      GridEngineSettings settings) {
        this.config = Objects.requireNonNull(config, "config");
        this.instance = instance == null ? "default" : instance;
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.calculator = calculator == null ? new GridCalculator() : calculator;
        this.riskGate = riskGate == null ? new RiskGate() : riskGate;
        this.store = store;
        this.events = events == null ? new GridEventPublisher() : events;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.settings = settings == null ? GridEngineSettings.builder().build() : settings;

        String tag = config.getSymbol() + "-" + this.instance;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "grid-timer-" + tag));
        AtomicInteger n = new AtomicInteger();
        this.fallbackPool = Executors.newFixedThreadPool(Math.max(1, this.settings.getFallbackThreads()),
                r -> daemon(r, "grid-fallback-" + tag + "-" + n.incrementAndGet()));
        this.control = Executors.newSingleThreadExecutor(r -> daemon(r, "grid-control-" + tag));
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Fresh start: checks risk, lays out the ladder, connects the stream, opens the initial
     * position when needed and places the ladder. Blocks until RUNNING or ERROR.
     */
    public Result<BotState> start() {
        return begin(null);
    }

    /**
     * Restart from the persisted snapshot. Live exchange orders decide what is actually open;
     * the snapshot only supplies ids, epoch, the planned ladder and stats.
     */
    public Result<BotState> resume() {
        if (store == null) return start();
        Optional<PersistedSnapshot> loaded;
        try {
            loaded = store.load();
        } catch (PersistenceException e) {
            started.set(true);
            lastError = e.getMessage();
            log.error("[{}] cannot resume from {}: {}", symbol(), store.location(), e.getMessage());
            transition(BotState.ERROR, e.getMessage());
            teardown();
            return Result.fail(e);
        }
        if (loaded.isEmpty()) {
            log.info("[{}] no snapshot at {}; starting fresh", symbol(), store.location());
            return start();
        }
        PersistedSnapshot snapshot = loaded.get();
        config = snapshot.getConfig();
        log.info("[{}] resuming from snapshot saved {} (state {}, epoch {}, {} entries)", symbol(),
                snapshot.getSavedAt(), snapshot.getState(), snapshot.getPlacementEpoch(), snapshot.getEntries().size());
        return begin(snapshot);
    }

    private Result<BotState> begin(PersistedSnapshot resumed) {
        if (!started.compareAndSet(false, true)) {
            return Result.fail(GridConstants.BAD_STATE, "engine " + symbol() + " already started (" + state + ")");
        }
        startedAt = Instant.now();
        state = BotState.INITIALIZING;
        events.publishState(symbol(), null, BotState.INITIALIZING, resumed == null ? "start" : "resume");
        try {
            config.validate();
            limits = exchange.fetchLimits(symbol());
            BigDecimal ref = referencePrice();
            lastPrice = ref;

            RiskReport report = riskGate.preStartCheck(config, ref, limits);
            if (!report.ok()) {
                if (!config.isAcceptHighRisk()) throw new RiskCheckFailedException(report.reasons());
                report.reasons().forEach(r -> log.warn("[{}] risk override accepted: {}", symbol(), r));
            }
            report.warnings().forEach(w -> log.warn("[{}] {}", symbol(), w));

            levels = calculator.levels(config, ref, limits);
            buildComponents(resumed, ref);
            connectStream();

            awaitDispatch(() -> {
                initialize(ref, resumed != null);
                return null;
            });

            if (stopping.get()) return Result.ok(state);
            transition(BotState.RUNNING, "ladder live");
            schedulePeriodicWork();
            return Result.ok(BotState.RUNNING);
        } catch (PositionNotEstablishedException e) {
            return failStart(BotState.STOPPED, e.getMessage(), Result.fail(e));
        } catch (GridTradeException e) {
            return failStart(BotState.ERROR, e.getMessage(), Result.fail(e));
        } catch (RuntimeException e) {
            log.error("[{}] unexpected start failure", symbol(), e);
            return failStart(BotState.ERROR, e.toString(), Result.fail(GridConstants.BAD_STATE, e));
        }
    }

    private void buildComponents(PersistedSnapshot resumed, BigDecimal ref) {
        BigDecimal tolerance = limits != null && limits.quantityStep() != null ? limits.quantityStep() : null;
        ledger = new OrderLedger(config, exchange, limits, settings.getPriceTolerance(), settings.getPlacementPacing(),
                settings.getUnknownOrderGrace());
        position = new PositionReconciler(symbol(), calculator, events, tolerance, settings.getReconcileInterval(),
                Clock.systemUTC());
        stats = new GridStatsTracker(config.getReplenishStep(), config.getFeeRate());

        if (resumed != null) {
            ledger.restore(resumed.getEntries(), resumed.getPlannedLevels(), resumed.getPlacementEpoch());
            stats.restore(resumed.getStats());
            position.restore(resumed.getPosition());
        }
        if (ledger.plannedLevels().isEmpty()) {
            for (GridLevel l : calculator.initialOrders(levels, ref)) ledger.plan(l);
        }
        lastFillSync = resumed != null && resumed.getSavedAt() != null ? resumed.getSavedAt() : startedAt;
    }

    private void connectStream() {
        streamOpen = new CountDownLatch(1);
        stream = new StreamingClient("grid-" + symbol() + "-" + instance, transport, protocol,
                settings.getStreaming(), this);
        stream.subscribe(List.of(
                ChannelSubscription.of(TickerEvent.CHANNEL, symbol()),
                ChannelSubscription.of(OrderUpdateEvent.CHANNEL, symbol()),
                ChannelSubscription.of(PositionEvent.CHANNEL, symbol())));
        Result<Void> r = stream.connect(settings.getStreamUrl());
        if (r.isFailure()) throw new TransportException(r.getErrorCode(), r.getError(), null);
        boolean open;
        try {
            open = streamOpen.await(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while connecting stream", e);
        }
        if (!open) {
            throw new TransportException("stream not connected within " + settings.getConnectTimeout().toSeconds() + "s");
        }
    }

    /** Runs on the dispatch thread. */
    private void initialize(BigDecimal ref, boolean resumed) {
        PositionSnapshot current = toSnapshot(exchange.fetchPosition(symbol()), ref);
        if (!resumed && current.signedSize().signum() == 0) {
            InitialPosition ip = position.initialPositionNeeded(levels, ref, config.getDirection(), limits);
            if (ip.isNeeded()) {
                openInitialPosition(ip);
                current = verifyPosition(ip, ref);
            }
        } else if (!resumed) {
            log.warn("[{}] exchange already holds {}; skipping initial position", symbol(),
                    current.signedSize().toPlainString());
        }
        position.setBaseline(current);
        reconcilePass();
    }

    private void openInitialPosition(InitialPosition ip) {
        ExchangeOrderRequest req = ExchangeOrderRequest.builder()
                .symbol(symbol())
                .side(ip.side())
                .type(OrderType.MARKET)
                .quantity(ip.quantity())
                .clientOrderId(GridConstants.CLIENT_ID_PREFIX + "_" + symbol() + "_init_" + System.currentTimeMillis())
                .timeInForce(TimeInForce.IOC)
                .build();
        try {
            exchange.placeOrder(req);
            log.info("[{}] initial {} {} at market", symbol(), ip.side(), ip.quantity().toPlainString());
        } catch (OrderRejectedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OrderRejectedException("initial position order failed: " + e.getMessage(), e);
        }
    }

    /**
     * Polls the exchange until the initial position shows up on the expected side. A size off
     * by more than the tolerance is only logged.
     */
    private PositionSnapshot verifyPosition(InitialPosition ip, BigDecimal ref) {
        int attempts = Math.max(1, settings.getPositionVerifyAttempts());
        int expectedSign = ip.side() == OrderSide.BUY ? 1 : -1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) sleep(settings.getPositionVerifyDelay());
            PositionSnapshot p;
            try {
                p = toSnapshot(exchange.fetchPosition(symbol()), ref);
            } catch (RuntimeException e) {
                log.warn("[{}] position check {}/{} failed: {}", symbol(), attempt, attempts, e.getMessage());
                continue;
            }
            BigDecimal size = p.signedSize();
            if (size.signum() == 0) {
                log.warn("[{}] no position on exchange yet ({}/{})", symbol(), attempt, attempts);
                continue;
            }
            if (size.signum() != expectedSign) {
                log.warn("[{}] position side mismatch: expected {} but exchange holds {} ({}/{})", symbol(),
                        ip.side(), size.toPlainString(), attempt, attempts);
                continue;
            }
            BigDecimal deviation = size.abs().subtract(ip.quantity()).abs().divide(ip.quantity(), GridConstants.MC);
            if (deviation.compareTo(GridConstants.POSITION_SIZE_TOLERANCE) > 0) {
                log.warn("[{}] position size {} differs from expected {} by more than {}%", symbol(),
                        size.abs().toPlainString(), ip.quantity().toPlainString(),
                        GridConstants.POSITION_SIZE_TOLERANCE.multiply(GridConstants.HUNDRED).stripTrailingZeros().toPlainString());
            }
            log.info("[{}] initial position confirmed at {} @ {}", symbol(), size.toPlainString(),
                    p.entryPrice().toPlainString());
            return p;
        }
        throw new PositionNotEstablishedException(String.format("initial %s %s not confirmed after %d checks",
                ip.side(), ip.quantity().toPlainString(), attempts));
    }

    private void schedulePeriodicWork() {
        long reconcileMs = settings.getReconcileInterval().toMillis();
        if (reconcileMs > 0) {
            scheduler.scheduleWithFixedDelay(() -> stream.runOnDispatch(this::safeReconcile),
                    reconcileMs, reconcileMs, TimeUnit.MILLISECONDS);
        }
        long pollMs = settings.getFallbackPollInterval().toMillis();
        if (pollMs > 0) {
            scheduler.scheduleWithFixedDelay(this::fallbackTick, pollMs, pollMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stops the bot: no new placements, bounded wait for in-flight calls, then cancel and
     * close per configuration, disconnect and persist.
     */
    public Result<BotState> stop(StopReason reason) {
        if (!stopped.compareAndSet(false, true)) {
            return Result.ok(state);
        }
        stopping.set(true);
        log.info("[{}] stopping: {}", symbol(), reason);
        scheduler.shutdownNow();
        OrderLedger l = ledger;
        if (l != null) {
            l.close();
            l.awaitInFlight(settings.getStopTimeout());
            if (config.isCancelOrdersOnStop()) l.cancelAllOpen();
            if (config.isClosePositionOnStop()) closePosition();
        }
        if (stream != null) stream.shutdown();
        if (!state.isTerminal()) transition(BotState.STOPPED, reason.name());
        else persist();
        fallbackPool.shutdownNow();
        control.shutdown();
        return Result.ok(state);
    }

    public Result<BotState> pause() {
        synchronized (stateLock) {
            if (state != BotState.RUNNING) {
                return Result.fail(GridConstants.BAD_STATE, "cannot pause from " + state);
            }
            transition(BotState.PAUSED, "paused");
            return Result.ok(BotState.PAUSED);
        }
    }

    public Result<BotState> unpause() {
        synchronized (stateLock) {
            if (state != BotState.PAUSED) {
                return Result.fail(GridConstants.BAD_STATE, "cannot unpause from " + state);
            }
            transition(BotState.RUNNING, "unpaused");
        }
        stream.runOnDispatch(this::safeReconcile);
        return Result.ok(BotState.RUNNING);
    }

    public EngineStatus getStatus() {
        StreamingClient s = stream;
        OrderLedger l = ledger;
        PositionReconciler p = position;
        GridStatsTracker t = stats;
        return new EngineStatus(symbol(), instance, state,
                s == null ? StreamState.DISCONNECTED : s.getState(),
                startedAt, lastPrice,
                l == null ? null : l.summary(),
                p == null ? null : p.getSnapshot(),
                t == null ? null : t.snapshot(),
                lastError, Instant.now());
    }

    public BotState getState() {
        return state;
    }

    public GridConfig getConfig() {
        return config;
    }

    public List<GridLevel> getLevels() {
        return levels;
    }

    // =====================================================================
    // Stream callbacks (dispatch thread)
    // =====================================================================

    @Override
    public void onMessage(StreamEvent event) {
        if (stopping.get() || ledger == null) return;
        if (event instanceof TickerEvent t) {
            if (matches(t.symbol())) onPrice(t.last());
        } else if (event instanceof OrderUpdateEvent o) {
            if (!matches(o.symbol())) return;
            if (o.isFilled()) {
                handleFill(o.orderId(), o.clientOrderId(), o.filledQuantity(), o.averagePrice());
            } else if (o.isClosedWithoutFill()) {
                if (o.filledQuantity() != null && o.filledQuantity().signum() > 0) {
                    ledger.onPartialClose(o.orderId(), o.clientOrderId(), o.filledQuantity(), o.averagePrice())
                            .ifPresent(this::bookTrade);
                    persist();
                } else if (ledger.onCancelled(o.orderId(), o.clientOrderId())) {
                    persist();
                }
            } else {
                log.debug("[{}] order {} {}", symbol(), o.orderId(), o.status());
            }
        } else if (event instanceof PositionEvent p) {
            if (!matches(p.symbol())) return;
            onPosition(new PositionSnapshot(symbol(), p.signedSize(), p.entryPrice(), p.markPrice(),
                    p.unrealizedPnl(), p.timestamp()));
        }
    }

    @Override
    public void onStateChange(StreamState previous, StreamState current) {
        events.publishStreamState(symbol(), previous, current);
        if (current.isOpen()) {
            streamOpen.countDown();
            if (isLive() && previous != StreamState.CONNECTED) {
                log.info("[{}] stream back; reconciling missed updates", symbol());
                safeReconcile();
            }
        }
    }

    @Override
    public void onError(Throwable error) {
        lastError = error.getMessage();
        log.warn("[{}] stream error: {}", symbol(), error.getMessage());
    }

    // =====================================================================
    // Trading logic (dispatch thread)
    // =====================================================================

    private void onPrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) return;
        lastPrice = price;
        position.onMark(price);
        stats.onUnrealizedPnl(position.getSnapshot().unrealizedPnl());
        if (!isLive()) return;

        Optional<StopReason> stop = riskGate.evaluate(config, price, stats.snapshot());
        if (stop.isPresent()) {
            requestStop(stop.get(), "mark " + price.toPlainString());
            return;
        }
        calculator.trailingRange(config, price).ifPresent(range -> retrail(range, price));
    }

    private void onPosition(PositionSnapshot update) {
        position.onPositionUpdate(update, ledger.plannedLevels());
        stats.onUnrealizedPnl(update.unrealizedPnl());
        checkPositionLimit(position.getSnapshot());
        persist();
    }

    /** Reported once each time the position crosses above the cap. */
    private void checkPositionLimit(PositionSnapshot snapshot) {
        Optional<String> breach = riskGate.positionLimitBreached(config, snapshot);
        if (breach.isPresent() && !overPositionLimit) {
            log.warn("[{}] {}", symbol(), breach.get());
            events.publishPositionLimit(symbol(), breach.get());
        }
        overPositionLimit = breach.isPresent();
    }

    private void handleFill(String orderId, String clientOrderId, BigDecimal qty, BigDecimal price) {
        Optional<GridTrade> filled = ledger.onFill(orderId, clientOrderId, qty, price);
        if (filled.isEmpty()) return;
        GridTrade trade = filled.get();
        bookTrade(trade);
        if (ledger.isDetached(trade.clientOrderId())) {
            log.info("[{}] fill of {} from the previous ladder; not replenished", symbol(), trade.clientOrderId());
        } else {
            replenish(trade);
        }
        persist();
    }

    private void bookTrade(GridTrade trade) {
        position.onFill(trade);
        events.publishTrade(symbol(), trade);
        stats.onTrade(trade).ifPresent(cycle -> {
            if (riskGate.recordCycle(cycle.profit())) {
                events.publishCircuitOpen(symbol(), riskGate.getMaxConsecutiveLosses(), riskGate.getCircuitOpenUntil());
            }
            events.publishCycle(symbol(), cycle);
        });
        checkPositionLimit(position.getSnapshot());
    }

    /**
     * A BUY fill at i is answered by a SELL at i + step, a SELL fill at i by a BUY at i - step.
     */
    private void replenish(GridTrade trade) {
        int step = config.getReplenishStep();
        int target = trade.side() == OrderSide.BUY ? trade.levelIndex() + step : trade.levelIndex() - step;
        List<GridLevel> ladder = levels;
        if (target < 0 || target >= ladder.size()) {
            log.info("[{}] replenish target {} outside the grid; skipped", symbol(), target);
            return;
        }
        if (ledger.isActive(target)) {
            log.info("[{}] level {} already active; replenishment skipped", symbol(), target);
            return;
        }
        GridLevel base = ladder.get(target);
        GridLevel next = new GridLevel(target, base.price(), trade.side().opposite(), base.quantity());
        if (!canPlace()) {
            ledger.plan(next);
            log.info("[{}] placement held; level {} {} planned", symbol(), target, next.side());
            return;
        }
        ledger.place(next);
    }

    private void retrail(PriceRange range, BigDecimal price) {
        log.info("[{}] price {} left the range; trailing to [{}, {}]", symbol(), price.toPlainString(),
                range.lower().toPlainString(), range.upper().toPlainString());
        ledger.cancelAllOpen();
        ledger.detachLadder();
        GridConfig moved = config.withRange(range);
        try {
            List<GridLevel> relaid = calculator.levels(moved, price, limits);
            config = moved;
            levels = relaid;
            for (GridLevel l : calculator.initialOrders(relaid, price)) ledger.plan(l);
        } catch (GridTradeException e) {
            lastError = e.getMessage();
            log.error("[{}] cannot re-lay grid after trailing: {}", symbol(), e.getMessage());
            control.execute(() -> {
                transition(BotState.ERROR, e.getMessage());
                stop(StopReason.SHUTDOWN);
            });
            return;
        }
        reconcilePass();
    }

    private void safeReconcile() {
        try {
            reconcilePass();
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.warn("[{}] reconciliation pass failed: {}", symbol(), e.getMessage());
        }
    }

    /**
     * Pulls recent fills, matches open orders, cancels duplicates and places missing levels.
     */
    private void reconcilePass() {
        if (stopping.get()) return;
        applyFills(exchange.fetchRecentFills(symbol(), lastFillSync));

        OrderLedger.ReconcileResult r = ledger.reconcile(exchange.fetchOpenOrders(symbol()));
        if (!r.duplicatesToCancel().isEmpty()) {
            List<ExchangeOrder> cancelled = ledger.cancelDuplicates(r.duplicatesToCancel());
            for (ExchangeOrder d : r.duplicatesToCancel()) {
                events.publishDuplicate(new DuplicateOrderDetected(symbol(), d.orderId(), d.side(), d.price(),
                        cancelled.contains(d)));
            }
        }
        List<GridLevel> owed = ledger.scheduledLevels();
        if (!owed.isEmpty()) {
            if (canPlace()) {
                OrderLedger.PlacementReport placed = ledger.placeAll(owed);
                log.info("[{}] reconcile placed {} of {} missing levels ({} skipped, failed {})", symbol(),
                        placed.placed(), owed.size(), placed.skipped(), placed.failedLevels());
            } else if (!r.missingLevels().isEmpty()) {
                log.info("[{}] {} missing levels held (state {})", symbol(), owed.size(), state);
            }
        }
        persist();
    }

    private void applyFills(List<ExchangeOrder> fills) {
        if (fills == null || fills.isEmpty()) return;
        List<ExchangeOrder> sorted = new ArrayList<>(fills);
        sorted.sort(Comparator.comparing(ExchangeOrder::updatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        for (ExchangeOrder f : sorted) {
            handleFill(f.orderId(), f.clientOrderId(), f.filledQuantity(), f.averagePrice());
            if (f.updatedAt() != null && (lastFillSync == null || f.updatedAt().isAfter(lastFillSync))) {
                lastFillSync = f.updatedAt();
            }
        }
    }

    // =====================================================================
    // REST fallback
    // =====================================================================

    private void fallbackTick() {
        StreamingClient s = stream;
        if (stopping.get() || s == null || s.getState().isOpen() || !isLive()) return;
        if (!polling.compareAndSet(false, true)) return;
        String sym = symbol();
        Instant since = lastFillSync;
        CompletableFuture<Map<String, Ticker>> tickers = CompletableFuture.supplyAsync(exchange::fetchTickers, fallbackPool);
        CompletableFuture<ExchangePosition> pos = CompletableFuture.supplyAsync(() -> exchange.fetchPosition(sym), fallbackPool);
        CompletableFuture<List<ExchangeOrder>> fills =
                CompletableFuture.supplyAsync(() -> exchange.fetchRecentFills(sym, since), fallbackPool);
        CompletableFuture.allOf(tickers, pos, fills).whenComplete((v, err) -> {
            polling.set(false);
            if (err != null) {
                log.warn("[{}] REST fallback poll failed: {}", sym, err.getMessage());
                return;
            }
            s.runOnDispatch(() -> applyFallback(tickers.join().get(sym), pos.join(), fills.join()));
        });
    }

    private void applyFallback(Ticker ticker, ExchangePosition pos, List<ExchangeOrder> fills) {
        if (stopping.get()) return;
        applyFills(fills);
        if (pos != null) {
            onPosition(toSnapshot(pos, lastPrice));
        }
        if (ticker != null) onPrice(ticker.last());
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private void requestStop(StopReason reason, String detail) {
        log.warn("[{}] risk stop {}: {}", symbol(), reason, detail);
        events.publishRiskStop(symbol(), reason, detail);
        stopping.set(true);
        control.execute(() -> stop(reason));
    }

    private void closePosition() {
        BigDecimal size;
        try {
            ExchangePosition p = exchange.fetchPosition(symbol());
            size = p == null ? BigDecimal.ZERO : p.signedSize();
        } catch (RuntimeException e) {
            log.warn("[{}] position fetch failed on stop, using last snapshot: {}", symbol(), e.getMessage());
            size = position.getSnapshot().signedSize();
        }
        if (size == null || size.signum() == 0) return;
        ExchangeOrderRequest req = ExchangeOrderRequest.builder()
                .symbol(symbol())
                .side(size.signum() > 0 ? OrderSide.SELL : OrderSide.BUY)
                .type(OrderType.MARKET)
                .quantity(size.abs())
                .clientOrderId(GridConstants.CLIENT_ID_PREFIX + "_" + symbol() + "_close_" + System.currentTimeMillis())
                .timeInForce(TimeInForce.IOC)
                .reduceOnly(true)
                .build();
        try {
            exchange.placeOrder(req);
            log.info("[{}] closed position {} at market", symbol(), size.toPlainString());
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("[{}] failed to close position {}: {}", symbol(), size.toPlainString(), e.getMessage());
        }
    }

    private void transition(BotState to, String reason) {
        BotState from;
        synchronized (stateLock) {
            from = state;
            if (from == to) return;
            state = to;
        }
        log.info("[{}] {} -> {} ({})", symbol(), from, to, reason);
        events.publishState(symbol(), from, to, reason);
        persist();
    }

    private Result<BotState> failStart(BotState outcome, String reason, Result<BotState> failure) {
        lastError = reason;
        log.error("[{}] start failed: {}", symbol(), reason);
        transition(outcome, reason);
        teardown();
        return failure;
    }

    private void teardown() {
        stopping.set(true);
        if (ledger != null) ledger.close();
        if (stream != null) stream.shutdown();
        scheduler.shutdownNow();
        fallbackPool.shutdownNow();
        control.shutdown();
    }

    private void persist() {
        if (store == null || ledger == null) return;
        synchronized (persistLock) {
            PersistedSnapshot snapshot = PersistedSnapshot.builder()
                    .config(config)
                    .state(state)
                    .placementEpoch(ledger.getPlacementEpoch())
                    .entries(ledger.entries())
                    .plannedLevels(new ArrayList<>(ledger.plannedLevels()))
                    .position(position == null ? null : position.getSnapshot())
                    .stats(stats == null ? null : stats.snapshot())
                    .savedAt(Instant.now())
                    .build();
            long t0 = System.nanoTime();
            try {
                store.save(snapshot);
            } catch (PersistenceException e) {
                log.warn("[{}] snapshot not saved: {}", symbol(), e.getMessage());
                return;
            }
            Duration took = Duration.ofNanos(System.nanoTime() - t0);
            if (took.compareTo(settings.getIoBudget()) > 0) {
                log.warn("[{}] slow snapshot write: {} ms to {}", symbol(), took.toMillis(), store.location());
            }
        }
    }

    private void sleep(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while verifying position", e);
        }
    }

    private <T> T awaitDispatch(Callable<T> work) {
        try {
            return stream.callOnDispatch(work).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted during start-up", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException(cause);
        }
    }

    private BigDecimal referencePrice() {
        Ticker t = exchange.fetchTickers().get(symbol());
        if (t == null || t.last() == null || t.last().signum() <= 0) {
            throw new TransportException("no ticker for " + symbol());
        }
        return t.last();
    }

    private PositionSnapshot toSnapshot(ExchangePosition p, BigDecimal mark) {
        if (p == null || p.signedSize() == null) return PositionSnapshot.flat(symbol());
        BigDecimal m = p.markPrice() != null && p.markPrice().signum() > 0 ? p.markPrice() : mark;
        return new PositionSnapshot(symbol(), p.signedSize(),
                p.entryPrice() == null ? BigDecimal.ZERO : p.entryPrice(),
                m == null ? BigDecimal.ZERO : m,
                p.unrealizedPnl() == null ? BigDecimal.ZERO : p.unrealizedPnl(),
                Instant.now());
    }

    private boolean canPlace() {
        return (state == BotState.RUNNING || state == BotState.INITIALIZING)
                && !stopping.get() && riskGate.allowPlacement();
    }

    private boolean isLive() {
        return !stopping.get() && (state == BotState.RUNNING || state == BotState.PAUSED);
    }

    private boolean matches(String eventSymbol) {
        return eventSymbol == null || eventSymbol.equalsIgnoreCase(symbol());
    }

    private String symbol() {
        return config.getSymbol();
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    /**
     * Point-in-time view for status endpoints and the periodic state publisher.
     */
    public record EngineStatus(String symbol,
                               String instance,
                               BotState state,
                               StreamState streamState,
                               Instant startedAt,
                               BigDecimal lastPrice,
                               OrderLedger.LedgerSummary ledger,
                               PositionSnapshot position,
                               GridStats stats,
                               String lastError,
                               Instant asOf) {
    }
}
