package com.trade.gridbot.trader.service.orders;

import com.trade.gridbot.trader.common.Result;
import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.common.exception.GridTradeException;
import com.trade.gridbot.trader.common.exception.OrderRejectedException;
import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.OrderStatus;
import com.trade.gridbot.trader.enums.OrderType;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.model.GridLevel;
import com.trade.gridbot.trader.model.GridTrade;
import com.trade.gridbot.trader.model.LedgerEntry;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import com.trade.gridbot.trader.model.exchange.ExchangeOrder;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderRequest;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderResponse;
import com.trade.gridbot.trader.service.exchange.ExchangeClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Order book of one grid bot: level index, client order id and exchange order id, plus the
 * planned ladder the bot wants live.
 * <p>
 * At most one non-terminal entry exists per level. Collections are guarded by {@code lock};
 * exchange calls are always made with the lock released.
 * <p>
 * An order missing from the exchange's open list is not assumed cancelled: it turns
 * {@link OrderStatus#UNKNOWN}, keeps its level occupied and is only retired once it has stayed
 * missing for {@code unknownOrderGrace} without a fill or cancel arriving.
 */
@Slf4j
public class OrderLedger {

    /** Terminal entries no longer current for their level, kept for fill de-duplication. */
    private static final int MAX_RETIRED = 1000;

    private final GridConfig config;
    private final ExchangeClient exchange;
    private final ExchangeLimits limits;
    private final BigDecimal priceTolerance;
    private final Duration pacing;
    private final Duration unknownOrderGrace;

    private final Object lock = new Object();
    private final Map<Integer, LedgerEntry> byLevel = new TreeMap<>();
    private final Map<String, LedgerEntry> byClientId = new LinkedHashMap<>();
    private final Map<String, LedgerEntry> byExchangeId = new HashMap<>();
    private final Map<Integer, GridLevel> planned = new TreeMap<>();
    private final Set<Integer> scheduled = new TreeSet<>();        // missing levels already handed out
    private final Set<String> flaggedDuplicates = new HashSet<>(); // duplicates already handed out

    private long placementEpoch;
    private int inFlight;
    private boolean closed;

    public OrderLedger(GridConfig config, ExchangeClient exchange, ExchangeLimits limits) {
        this(config, exchange, limits, GridConstants.DEFAULT_PRICE_TOLERANCE, Duration.ofMillis(100));
    }

    public OrderLedger(GridConfig config,
                       ExchangeClient exchange,
                       ExchangeLimits limits,
                       BigDecimal priceTolerance,
                       Duration pacing) {
        this(config, exchange, limits, priceTolerance, pacing, GridConstants.DEFAULT_UNKNOWN_ORDER_GRACE);
    }

    public OrderLedger(GridConfig config,
                       ExchangeClient exchange,
                       ExchangeLimits limits,
                       BigDecimal priceTolerance,
                       Duration pacing,
                       Duration unknownOrderGrace) {
        this.config = Objects.requireNonNull(config, "config");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.limits = limits;
        this.priceTolerance = priceTolerance == null ? GridConstants.DEFAULT_PRICE_TOLERANCE : priceTolerance;
        this.pacing = pacing == null ? Duration.ZERO : pacing;
        this.unknownOrderGrace = unknownOrderGrace == null ? Duration.ZERO : unknownOrderGrace;
    }

    // ---------------- reconciliation ----------------

    /**
     * Matches the exchange's open orders against the ledger and the planned ladder.
     * <p>
     * Duplicates and missing levels are handed out once: a level reported missing stays
     * scheduled until {@link #place} picks it up, and a duplicate stays flagged while it is live
     * or until its cancel fails. A second call with unchanged inputs therefore returns empty
     * lists.
     */
    public ReconcileResult reconcile(Collection<ExchangeOrder> exchangeOpenOrders) {
        synchronized (lock) {
            Map<String, List<ExchangeOrder>> groups = new LinkedHashMap<>();
            Set<String> liveIds = new HashSet<>();
            Set<String> liveKeys = new HashSet<>();
            for (ExchangeOrder o : exchangeOpenOrders) {
                if (o.symbol() != null && !o.symbol().equalsIgnoreCase(config.getSymbol())) continue;
                if (o.orderId() != null) liveIds.add(o.orderId());
                if (o.side() == null || o.price() == null) {
                    log.warn("[{}] skipping exchange order {} without side/price", config.getSymbol(), o.orderId());
                    continue;
                }
                liveKeys.add(duplicateKey(o));
                groups.computeIfAbsent(groupKey(o), k -> new ArrayList<>()).add(o);
            }
            flaggedDuplicates.retainAll(liveKeys);

            List<ExchangeOrder> duplicates = new ArrayList<>();
            List<ExchangeOrder> keepers = new ArrayList<>();
            for (List<ExchangeOrder> group : groups.values()) {
                ExchangeOrder keeper = keeperOf(group);
                keepers.add(keeper);
                for (ExchangeOrder o : group) {
                    if (o != keeper && flaggedDuplicates.add(duplicateKey(o))) duplicates.add(o);
                }
            }
            if (!duplicates.isEmpty()) {
                log.warn("[{}] {} duplicate order(s) on exchange: {}", config.getSymbol(), duplicates.size(),
                        duplicates.stream().map(o -> o.side() + "@" + o.price().toPlainString() + "#" + o.orderId()).toList());
            }

            List<ExchangeOrder> unmatched = new ArrayList<>();
            for (ExchangeOrder keeper : keepers) {
                if (!adoptLocked(keeper)) unmatched.add(keeper);
            }
            if (!unmatched.isEmpty()) {
                log.warn("[{}] {} open order(s) match no planned level and are left alone: {}", config.getSymbol(),
                        unmatched.size(), unmatched.stream().map(ExchangeOrder::orderId).toList());
            }

            Instant now = Instant.now();
            for (LedgerEntry e : byClientId.values()) {
                if (e.getStatus().isTerminal() || e.getExchangeOrderId() == null) continue;
                if (liveIds.contains(e.getExchangeOrderId())) continue;
                if (e.getStatus() != OrderStatus.UNKNOWN) {
                    log.info("[{}] level {} order {} not in open orders; holding it as UNKNOWN", config.getSymbol(),
                            e.getLevelIndex(), e.getExchangeOrderId());
                    e.setStatus(OrderStatus.UNKNOWN);
                    e.setUpdatedAt(now);
                } else if (e.getUpdatedAt() == null
                        || Duration.between(e.getUpdatedAt(), now).compareTo(unknownOrderGrace) >= 0) {
                    log.info("[{}] level {} order {} still missing after {}s; retiring", config.getSymbol(),
                            e.getLevelIndex(), e.getExchangeOrderId(), unknownOrderGrace.toSeconds());
                    e.setStatus(OrderStatus.CANCELLED);
                    e.setLastError("not open on exchange");
                    e.setUpdatedAt(now);
                }
            }

            scheduled.removeIf(idx -> !planned.containsKey(idx) || !needsPlacementLocked(idx));
            List<GridLevel> missing = new ArrayList<>();
            for (GridLevel level : planned.values()) {
                if (needsPlacementLocked(level.index()) && scheduled.add(level.index())) missing.add(level);
            }
            return new ReconcileResult(List.copyOf(duplicates), List.copyOf(missing), List.copyOf(unmatched));
        }
    }

    /**
     * Planned levels that reconciliation found missing and no placement has picked up yet,
     * including levels held back while placement was not allowed.
     */
    public List<GridLevel> scheduledLevels() {
        synchronized (lock) {
            List<GridLevel> out = new ArrayList<>();
            for (Integer idx : scheduled) {
                GridLevel level = planned.get(idx);
                if (level != null && needsPlacementLocked(idx)) out.add(level);
            }
            return out;
        }
    }

    /**
     * Cancels the given exchange orders one by one.
     *
     * @return the orders the exchange confirmed as cancelled
     */
    public List<ExchangeOrder> cancelDuplicates(List<ExchangeOrder> duplicates) {
        List<ExchangeOrder> cancelled = new ArrayList<>();
        for (ExchangeOrder o : duplicates) {
            if (cancelOne(o.orderId(), o.clientOrderId())) {
                cancelled.add(o);
            } else {
                synchronized (lock) {
                    flaggedDuplicates.remove(duplicateKey(o));
                }
            }
        }
        return cancelled;
    }

    // ---------------- placement ----------------

    /**
     * Places one level. Rejected with {@code LEVEL_ACTIVE} when the level already holds a live
     * entry, unless that entry is PENDING after a failed attempt, which is retried under the
     * same client order id.
     */
    public Result<LedgerEntry> place(GridLevel level) {
        if (level == null || !level.hasSide()) {
            return Result.fail(GridConstants.BAD_STATE, "level has no side");
        }
        LedgerEntry entry;
        synchronized (lock) {
            if (closed) {
                return Result.fail(GridConstants.LEDGER_CLOSED, "ledger is closed for " + config.getSymbol());
            }
            scheduled.remove(level.index());
            LedgerEntry current = byLevel.get(level.index());
            Instant now = Instant.now();
            if (current != null && !current.getStatus().isTerminal()) {
                boolean retry = current.getStatus() == OrderStatus.PENDING
                        && current.getLastError() != null
                        && current.getSide() == level.side();
                if (!retry) {
                    return Result.fail(GridConstants.LEVEL_ACTIVE, String.format("level %d already has %s %s",
                            level.index(), current.getStatus(), current.getClientOrderId()));
                }
                entry = current;
                entry.setLastError(null);
                entry.setUpdatedAt(now);
                log.info("[{}] retrying level {} as {}", config.getSymbol(), level.index(), entry.getClientOrderId());
            } else {
                long epoch = ++placementEpoch;
                entry = LedgerEntry.builder()
                        .levelIndex(level.index())
                        .side(level.side())
                        .price(level.price())
                        .quantity(level.quantity())
                        .clientOrderId(clientOrderId(level.index(), level.side(), epoch))
                        .status(OrderStatus.PENDING)
                        .placementEpoch(epoch)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                indexLocked(entry);
            }
            planned.put(level.index(), level);
            inFlight++;
        }

        try {
            ExchangeOrderResponse resp = exchange.placeOrder(request(entry));
            synchronized (lock) {
                if (resp != null && resp.orderId() != null) {
                    entry.setExchangeOrderId(resp.orderId());
                    byExchangeId.put(resp.orderId(), entry);
                }
                if (entry.getStatus() == OrderStatus.PENDING) entry.setStatus(OrderStatus.OPEN);
                entry.setUpdatedAt(Instant.now());
                log.info("[{}] placed {} level {} {} @ {} -> {}", config.getSymbol(), entry.getSide(),
                        entry.getLevelIndex(), entry.getQuantity().toPlainString(), entry.getPrice().toPlainString(),
                        entry.getExchangeOrderId());
                return Result.ok(entry.copy());
            }
        } catch (RuntimeException e) {
            synchronized (lock) {
                entry.setLastError(e.getMessage() == null ? e.toString() : e.getMessage());
                entry.setUpdatedAt(Instant.now());
            }
            log.warn("[{}] placement of level {} failed, will retry on next pass: {}", config.getSymbol(),
                    entry.getLevelIndex(), e.getMessage());
            if (e instanceof GridTradeException) return Result.fail((GridTradeException) e);
            return Result.fail(new OrderRejectedException("placement failed: " + e.getMessage(), e));
        } finally {
            synchronized (lock) {
                inFlight--;
                lock.notifyAll();
            }
        }
    }

    /**
     * Places levels in order, pausing {@code pacing} between calls. Levels that are already
     * active are skipped.
     */
    public PlacementReport placeAll(List<GridLevel> levels) {
        int placed = 0;
        int skipped = 0;
        List<Integer> failed = new ArrayList<>();
        for (int i = 0; i < levels.size(); i++) {
            if (i > 0 && !pacing.isZero()) {
                try {
                    Thread.sleep(pacing.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[{}] placement interrupted after {} orders", config.getSymbol(), placed);
                    break;
                }
            }
            GridLevel level = levels.get(i);
            Result<LedgerEntry> r = place(level);
            if (r.isOk()) {
                placed++;
            } else if (GridConstants.LEVEL_ACTIVE.equals(r.getErrorCode())) {
                skipped++;
            } else if (GridConstants.LEDGER_CLOSED.equals(r.getErrorCode())) {
                break;
            } else {
                failed.add(level.index());
            }
        }
        return new PlacementReport(placed, skipped, List.copyOf(failed));
    }

    /**
     * Keeps {@code level} in the target ladder without placing it. The next reconciliation
     * pass reports it as missing.
     */
    public void plan(GridLevel level) {
        synchronized (lock) {
            planned.put(level.index(), level);
        }
    }

    /**
     * Releases the current ladder before it is re-laid around a new range. Orders that are
     * still live stay known by id so their fills and cancels are still booked, but they are
     * no longer bound to a level and are never adopted into the new ladder.
     *
     * @return the number of entries left detached
     */
    public int detachLadder() {
        synchronized (lock) {
            Instant now = Instant.now();
            int detached = 0;
            for (LedgerEntry e : byClientId.values()) {
                if (e.getStatus().isTerminal() || e.isDetached()) continue;
                if (e.getExchangeOrderId() == null && e.getLastError() != null) {
                    e.setStatus(OrderStatus.CANCELLED);
                    e.setUpdatedAt(now);
                    continue;
                }
                e.setDetached(true);
                e.setUpdatedAt(now);
                detached++;
            }
            byLevel.clear();
            planned.clear();
            scheduled.clear();
            if (detached > 0) {
                log.warn("[{}] {} order(s) from the previous ladder left detached", config.getSymbol(), detached);
            }
            return detached;
        }
    }

    public boolean isDetached(String clientOrderId) {
        synchronized (lock) {
            LedgerEntry e = clientOrderId == null ? null : byClientId.get(clientOrderId);
            return e != null && e.isDetached();
        }
    }

    // ---------------- exchange events ----------------

    public Optional<GridTrade> onFill(String exchangeOrderId, BigDecimal filledQty, BigDecimal filledPrice) {
        return onFill(exchangeOrderId, null, filledQty, filledPrice);
    }

    /**
     * Marks the entry FILLED and consumes its level from the planned ladder. Unknown ids and
     * repeated fills are ignored. A late fill of an entry that was already retired is still
     * booked; it only consumes the level when the level has not been taken over since.
     */
    public Optional<GridTrade> onFill(String exchangeOrderId, String clientOrderId,
                                      BigDecimal filledQty, BigDecimal filledPrice) {
        synchronized (lock) {
            LedgerEntry e = lookup(exchangeOrderId, clientOrderId);
            if (e == null) {
                log.warn("[{}] fill for unknown order {} / {} ignored", config.getSymbol(), exchangeOrderId, clientOrderId);
                return Optional.empty();
            }
            if (e.getStatus() == OrderStatus.FILLED) {
                log.debug("[{}] repeated fill for {} ignored", config.getSymbol(), e.getClientOrderId());
                return Optional.empty();
            }
            if (e.getExchangeOrderId() == null && exchangeOrderId != null) {
                e.setExchangeOrderId(exchangeOrderId);
                byExchangeId.put(exchangeOrderId, e);
            }
            Instant now = Instant.now();
            BigDecimal total = filledQty != null && filledQty.signum() > 0 ? filledQty : e.getQuantity();
            BigDecimal booked = e.getFilledQuantity() == null ? BigDecimal.ZERO : e.getFilledQuantity();
            BigDecimal qty = total.subtract(booked);
            BigDecimal price = filledPrice != null && filledPrice.signum() > 0 ? filledPrice : e.getPrice();
            OrderStatus before = e.getStatus();
            e.setStatus(OrderStatus.FILLED);
            e.setFilledQuantity(total);
            e.setFillPrice(price);
            e.setFilledAt(now);
            e.setUpdatedAt(now);
            if (qty.signum() <= 0) {
                log.debug("[{}] fill for {} already booked", config.getSymbol(), e.getClientOrderId());
                return Optional.empty();
            }
            if (!e.isDetached()) consumeLevelLocked(e, before);
            log.info("[{}] FILLED {} level {} {} @ {}", config.getSymbol(), e.getSide(), e.getLevelIndex(),
                    qty.toPlainString(), price.toPlainString());
            return Optional.of(new GridTrade(e.getLevelIndex(), e.getSide(), e.getPrice(), qty, price,
                    e.getExchangeOrderId(), e.getClientOrderId(), now));
        }
    }

    /**
     * The exchange closed the order without a fill. The level stays planned and is re-placed
     * on the next reconciliation pass.
     */
    public boolean onCancelled(String exchangeOrderId, String clientOrderId) {
        synchronized (lock) {
            LedgerEntry e = lookup(exchangeOrderId, clientOrderId);
            if (e == null || e.getStatus().isTerminal()) return false;
            e.setStatus(OrderStatus.CANCELLED);
            e.setUpdatedAt(Instant.now());
            log.info("[{}] level {} order {} cancelled by exchange", config.getSymbol(), e.getLevelIndex(),
                    e.getClientOrderId());
            return true;
        }
    }

    /**
     * The exchange closed a partially filled order. The filled part not booked yet is returned
     * as a trade; the entry is retired and its level stays planned for a fresh order.
     */
    public Optional<GridTrade> onPartialClose(String exchangeOrderId, String clientOrderId,
                                              BigDecimal cumulativeQty, BigDecimal averagePrice) {
        synchronized (lock) {
            LedgerEntry e = lookup(exchangeOrderId, clientOrderId);
            if (e == null || e.getStatus() == OrderStatus.FILLED) return Optional.empty();
            Instant now = Instant.now();
            if (!e.getStatus().isTerminal()) {
                e.setStatus(OrderStatus.CANCELLED);
                e.setUpdatedAt(now);
            }
            BigDecimal booked = e.getFilledQuantity() == null ? BigDecimal.ZERO : e.getFilledQuantity();
            if (cumulativeQty == null || cumulativeQty.compareTo(booked) <= 0) return Optional.empty();
            BigDecimal qty = cumulativeQty.subtract(booked);
            BigDecimal price = averagePrice != null && averagePrice.signum() > 0 ? averagePrice : e.getPrice();
            e.setFilledQuantity(cumulativeQty);
            e.setFillPrice(price);
            e.setFilledAt(now);
            log.info("[{}] level {} order {} closed after partial fill of {} @ {}", config.getSymbol(),
                    e.getLevelIndex(), e.getClientOrderId(), qty.toPlainString(), price.toPlainString());
            return Optional.of(new GridTrade(e.getLevelIndex(), e.getSide(), e.getPrice(), qty, price,
                    e.getExchangeOrderId(), e.getClientOrderId(), now));
        }
    }

    /**
     * Cancels every acknowledged live order, detached ones included. Unacknowledged entries
     * that failed to place are retired locally; placements still in flight are left to finish.
     */
    public CancelReport cancelAllOpen() {
        List<LedgerEntry> targets = new ArrayList<>();
        synchronized (lock) {
            Instant now = Instant.now();
            scheduled.clear();
            for (LedgerEntry e : byClientId.values()) {
                if (e.getStatus().isTerminal()) continue;
                if (e.getExchangeOrderId() != null) {
                    targets.add(e);
                } else if (e.getLastError() != null) {
                    e.setStatus(OrderStatus.CANCELLED);
                    e.setUpdatedAt(now);
                }
            }
        }
        int cancelled = 0;
        List<String> failed = new ArrayList<>();
        for (LedgerEntry e : targets) {
            if (cancelOne(e.getExchangeOrderId(), e.getClientOrderId())) cancelled++;
            else failed.add(e.getExchangeOrderId());
        }
        log.info("[{}] cancel all: {} requested, {} cancelled, {} failed", config.getSymbol(), targets.size(),
                cancelled, failed.size());
        return new CancelReport(targets.size(), cancelled, List.copyOf(failed));
    }

    private boolean cancelOne(String orderId, String clientOrderId) {
        try {
            exchange.cancelOrder(orderId, clientOrderId, config.getSymbol());
        } catch (RuntimeException e) {
            log.warn("[{}] cancel {} failed: {}", config.getSymbol(), orderId, e.getMessage());
            return false;
        }
        synchronized (lock) {
            LedgerEntry e = lookup(orderId, clientOrderId);
            if (e != null && !e.getStatus().isTerminal()) {
                e.setStatus(OrderStatus.CANCELLED);
                e.setUpdatedAt(Instant.now());
            }
        }
        return true;
    }

    // ---------------- shutdown ----------------

    /** Rejects every later {@link #place} call with {@code LEDGER_CLOSED}. */
    public void close() {
        synchronized (lock) {
            closed = true;
        }
    }

    /**
     * Waits for in-flight placements to settle.
     *
     * @return the number still in flight when the timeout expired
     */
    public int awaitInFlight(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (inFlight > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) break;
                try {
                    lock.wait(Math.max(1L, remaining / 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            if (inFlight > 0) {
                log.warn("[{}] {} placement(s) orphaned at shutdown; next resume reconciles them",
                        config.getSymbol(), inFlight);
            }
            return inFlight;
        }
    }

    // ---------------- views ----------------

    public boolean isActive(int levelIndex) {
        synchronized (lock) {
            LedgerEntry e = byLevel.get(levelIndex);
            return e != null && !e.getStatus().isTerminal();
        }
    }

    public Optional<LedgerEntry> current(int levelIndex) {
        synchronized (lock) {
            return Optional.ofNullable(byLevel.get(levelIndex)).map(LedgerEntry::copy);
        }
    }

    public List<LedgerEntry> entries() {
        synchronized (lock) {
            List<LedgerEntry> out = new ArrayList<>(byClientId.size());
            for (LedgerEntry e : byClientId.values()) out.add(e.copy());
            return out;
        }
    }

    public List<GridLevel> plannedLevels() {
        synchronized (lock) {
            return List.copyOf(planned.values());
        }
    }

    public long getPlacementEpoch() {
        synchronized (lock) {
            return placementEpoch;
        }
    }

    public LedgerSummary summary() {
        synchronized (lock) {
            int pending = 0;
            int open = 0;
            int filled = 0;
            int cancelled = 0;
            for (LedgerEntry e : byClientId.values()) {
                switch (e.getStatus()) {
                    case PENDING -> pending++;
                    case OPEN, UNKNOWN -> open++;
                    case FILLED -> filled++;
                    case CANCELLED -> cancelled++;
                }
            }
            return new LedgerSummary(pending, open, filled, cancelled, planned.size(), placementEpoch);
        }
    }

    /**
     * Replaces the ledger with persisted state. The entry with the highest epoch becomes
     * current for its level.
     */
    public void restore(List<LedgerEntry> entries, List<GridLevel> plannedLevels, long epoch) {
        synchronized (lock) {
            byLevel.clear();
            byClientId.clear();
            byExchangeId.clear();
            planned.clear();
            scheduled.clear();
            flaggedDuplicates.clear();
            long maxEpoch = epoch;
            for (LedgerEntry src : entries) {
                LedgerEntry e = src.copy();
                if (e.getClientOrderId() == null || e.getStatus() == null) continue;
                indexLocked(e);
                maxEpoch = Math.max(maxEpoch, e.getPlacementEpoch());
            }
            for (GridLevel l : plannedLevels) planned.put(l.index(), l);
            placementEpoch = maxEpoch;
            log.info("[{}] restored {} ledger entries, {} planned levels, epoch {}", config.getSymbol(),
                    byClientId.size(), planned.size(), placementEpoch);
        }
    }

    // ---------------- helpers ----------------

    private boolean adoptLocked(ExchangeOrder order) {
        LedgerEntry known = lookup(order.orderId(), order.clientOrderId());
        Instant now = Instant.now();
        if (known != null) {
            if (known.isDetached()) return false;
            if (known.getStatus() == OrderStatus.FILLED) {
                log.debug("[{}] filled order {} still listed as open; ignored", config.getSymbol(), order.orderId());
                return true;
            }
            LedgerEntry current = byLevel.get(known.getLevelIndex());
            if (current != known && current != null && !isFreeLocked(current)) {
                return false;
            }
            if (current != known && current != null && !current.getStatus().isTerminal()) {
                current.setStatus(OrderStatus.CANCELLED);
                current.setLastError("superseded by exchange order " + order.orderId());
                current.setUpdatedAt(now);
            }
            if (known.getExchangeOrderId() == null && order.orderId() != null) {
                known.setExchangeOrderId(order.orderId());
                byExchangeId.put(order.orderId(), known);
            }
            if (known.getStatus() != OrderStatus.OPEN) {
                known.setStatus(OrderStatus.OPEN);
                known.setLastError(null);
                known.setUpdatedAt(now);
            }
            byLevel.put(known.getLevelIndex(), known);
            return true;
        }

        GridLevel best = null;
        BigDecimal bestDistance = null;
        for (GridLevel level : planned.values()) {
            if (level.side() != order.side()) continue;
            LedgerEntry current = byLevel.get(level.index());
            if (current != null && !isFreeLocked(current)) continue;
            BigDecimal distance = level.price().subtract(order.price()).abs();
            if (distance.compareTo(priceTolerance) > 0) continue;
            if (bestDistance == null || distance.compareTo(bestDistance) < 0) {
                best = level;
                bestDistance = distance;
            }
        }
        if (best == null) return false;

        LedgerEntry previous = byLevel.get(best.index());
        if (previous != null && !previous.getStatus().isTerminal()) {
            previous.setStatus(OrderStatus.CANCELLED);
            previous.setLastError("superseded by exchange order " + order.orderId());
            previous.setUpdatedAt(now);
        }
        long epoch = ++placementEpoch;
        LedgerEntry adopted = LedgerEntry.builder()
                .levelIndex(best.index())
                .side(order.side())
                .price(order.price())
                .quantity(order.quantity() == null ? best.quantity() : order.quantity())
                .clientOrderId(order.clientOrderId() != null ? order.clientOrderId()
                        : clientOrderId(best.index(), order.side(), epoch))
                .exchangeOrderId(order.orderId())
                .status(OrderStatus.OPEN)
                .placementEpoch(epoch)
                .createdAt(now)
                .updatedAt(now)
                .build();
        indexLocked(adopted);
        scheduled.remove(best.index());
        log.info("[{}] adopted exchange order {} as level {}", config.getSymbol(), order.orderId(), best.index());
        return true;
    }

    /** Terminal, or a failed placement that never reached the exchange. */
    private static boolean isFreeLocked(LedgerEntry e) {
        return e.getStatus().isTerminal()
                || (e.getStatus() == OrderStatus.PENDING && e.getLastError() != null && e.getExchangeOrderId() == null);
    }

    /**
     * Consumes the level of a filled entry. A fill that arrives after the entry was retired
     * only consumes the level while no other order holds it.
     */
    private void consumeLevelLocked(LedgerEntry e, OrderStatus before) {
        int idx = e.getLevelIndex();
        LedgerEntry current = byLevel.get(idx);
        if (current == e) {
            planned.remove(idx);
            scheduled.remove(idx);
            return;
        }
        if (before == OrderStatus.CANCELLED && (current == null || isFreeLocked(current))) {
            if (current != null && !current.getStatus().isTerminal()) {
                current.setStatus(OrderStatus.CANCELLED);
                current.setUpdatedAt(Instant.now());
            }
            byLevel.put(idx, e);
            planned.remove(idx);
            scheduled.remove(idx);
            return;
        }
        if (current != null && !current.getStatus().isTerminal()) {
            log.warn("[{}] late fill of {} while level {} is held by {}", config.getSymbol(),
                    e.getClientOrderId(), idx, current.getClientOrderId());
        }
    }

    private ExchangeOrder keeperOf(List<ExchangeOrder> group) {
        ExchangeOrder known = null;
        for (ExchangeOrder o : group) {
            LedgerEntry e = lookup(o.orderId(), o.clientOrderId());
            if (e == null) continue;
            if (!e.isDetached()) return o;
            if (known == null) known = o;
        }
        return known != null ? known : group.get(0);
    }

    private boolean needsPlacementLocked(int levelIndex) {
        LedgerEntry e = byLevel.get(levelIndex);
        if (e == null || e.getStatus().isTerminal()) return true;
        return e.getStatus() == OrderStatus.PENDING && e.getLastError() != null;
    }

    private void indexLocked(LedgerEntry e) {
        byClientId.put(e.getClientOrderId(), e);
        if (e.getExchangeOrderId() != null) byExchangeId.put(e.getExchangeOrderId(), e);
        if (e.isDetached()) return;
        LedgerEntry current = byLevel.get(e.getLevelIndex());
        if (current == null || current.getPlacementEpoch() <= e.getPlacementEpoch()) {
            byLevel.put(e.getLevelIndex(), e);
        }
        pruneLocked();
    }

    private void pruneLocked() {
        int excess = byClientId.size() - byLevel.size() - MAX_RETIRED;
        if (excess <= 0) return;
        Iterator<LedgerEntry> it = byClientId.values().iterator();
        while (excess > 0 && it.hasNext()) {
            LedgerEntry e = it.next();
            if (!e.getStatus().isTerminal() || (!e.isDetached() && byLevel.get(e.getLevelIndex()) == e)) continue;
            it.remove();
            if (e.getExchangeOrderId() != null) byExchangeId.remove(e.getExchangeOrderId());
            excess--;
        }
    }

    private LedgerEntry lookup(String exchangeOrderId, String clientOrderId) {
        LedgerEntry e = exchangeOrderId == null ? null : byExchangeId.get(exchangeOrderId);
        if (e == null && clientOrderId != null) e = byClientId.get(clientOrderId);
        return e;
    }

    private static String duplicateKey(ExchangeOrder o) {
        return o.orderId() != null ? o.orderId() : "c:" + o.clientOrderId();
    }

    private String groupKey(ExchangeOrder o) {
        BigDecimal price = limits == null ? o.price() : limits.roundPrice(o.price());
        return o.side() + "@" + price.stripTrailingZeros().toPlainString();
    }

    private String clientOrderId(int levelIndex, OrderSide side, long epoch) {
        return GridConstants.CLIENT_ID_PREFIX + "_" + config.getSymbol() + "_" + levelIndex + "_"
                + (side == OrderSide.BUY ? "B" : "S") + "_" + epoch;
    }

    private ExchangeOrderRequest request(LedgerEntry e) {
        boolean market = config.getOrderType() == OrderType.MARKET;
        return ExchangeOrderRequest.builder()
                .symbol(config.getSymbol())
                .side(e.getSide())
                .type(config.getOrderType())
                .quantity(e.getQuantity())
                .price(market ? null : e.getPrice())
                .clientOrderId(e.getClientOrderId())
                .timeInForce(config.getTimeInForce())
                .postOnly(!market && config.isPostOnly())
                .reduceOnly(false)
                .build();
    }

    // ---------------- result types ----------------

    /**
     * @param duplicatesToCancel extra orders sharing a (side, price) slot with a keeper
     * @param missingLevels      planned levels newly found without a live order
     * @param unmatchedOrders    live orders that fit no planned level; never cancelled automatically
     */
    public record ReconcileResult(List<ExchangeOrder> duplicatesToCancel,
                                  List<GridLevel> missingLevels,
                                  List<ExchangeOrder> unmatchedOrders) {

        public boolean isClean() {
            return duplicatesToCancel.isEmpty() && missingLevels.isEmpty();
        }
    }

    public record PlacementReport(int placed, int skipped, List<Integer> failedLevels) {
    }

    public record CancelReport(int requested, int cancelled, List<String> failedOrderIds) {
    }

    public record LedgerSummary(int pending, int open, int filled, int cancelled, int planned, long placementEpoch) {
    }
}
