package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.common.exception.OrderRejectedException;
import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.OrderType;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import com.trade.gridbot.trader.model.exchange.ExchangeOrder;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderRequest;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderResponse;
import com.trade.gridbot.trader.model.exchange.ExchangePosition;
import com.trade.gridbot.trader.model.exchange.Ticker;
import com.trade.gridbot.trader.service.exchange.ExchangeClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-symbol exchange kept in memory. Limit orders rest until {@link #fill}; market orders
 * move the position immediately.
 */
class FakeExchange implements ExchangeClient {

    final String symbol;
    final ExchangeLimits limits;
    final Map<String, ExchangeOrder> open = new LinkedHashMap<>();
    final List<ExchangeOrderRequest> placed = new ArrayList<>();
    final List<String> cancelled = new ArrayList<>();
    final List<ExchangeOrder> recentFills = new ArrayList<>();
    /** Orders whose cancel requests fail. */
    final Set<String> failCancel = new HashSet<>();
    /** Market orders are accepted but never move the position. */
    volatile boolean ignoreMarketOrders;

    private BigDecimal last;
    private BigDecimal position = BigDecimal.ZERO;
    private int nextId;

    FakeExchange(String symbol, BigDecimal last, ExchangeLimits limits) {
        this.symbol = symbol;
        this.last = last;
        this.limits = limits;
    }

    synchronized void setLast(BigDecimal price) {
        this.last = price;
    }

    synchronized int placedCount() {
        return placed.size();
    }

    synchronized ExchangeOrderRequest lastPlaced() {
        return placed.get(placed.size() - 1);
    }

    synchronized BigDecimal position() {
        return position;
    }

    synchronized void setPosition(BigDecimal size) {
        this.position = size;
    }

    /** Fills a resting order and returns it in FILLED state. */
    synchronized ExchangeOrder fill(String orderId) {
        return fill(orderId, true);
    }

    /**
     * @param listed whether the fill shows up in {@link #fetchRecentFills}
     */
    synchronized ExchangeOrder fill(String orderId, boolean listed) {
        ExchangeOrder o = open.remove(orderId);
        if (o == null) throw new IllegalArgumentException("no open order " + orderId);
        BigDecimal done = o.filledQuantity() == null ? BigDecimal.ZERO : o.filledQuantity();
        move(o.side(), o.quantity().subtract(done));
        ExchangeOrder filled = o.toBuilder()
                .status("FILLED")
                .filledQuantity(o.quantity())
                .averagePrice(o.price())
                .updatedAt(Instant.now())
                .build();
        if (listed) recentFills.add(filled);
        return filled;
    }

    /** Fills part of a resting order, which stays open. */
    synchronized ExchangeOrder partialFill(String orderId, BigDecimal qty) {
        ExchangeOrder o = open.get(orderId);
        if (o == null) throw new IllegalArgumentException("no open order " + orderId);
        move(o.side(), qty);
        ExchangeOrder partial = o.toBuilder()
                .status("PARTIALLY_FILLED")
                .filledQuantity(qty)
                .averagePrice(o.price())
                .updatedAt(Instant.now())
                .build();
        open.put(orderId, partial);
        return partial;
    }

    /** The exchange cancels a resting order on its own, e.g. on expiry. */
    synchronized ExchangeOrder expire(String orderId) {
        ExchangeOrder o = open.remove(orderId);
        if (o == null) throw new IllegalArgumentException("no open order " + orderId);
        return o.toBuilder().status("CANCELLED").updatedAt(Instant.now()).build();
    }

    private void move(OrderSide side, BigDecimal qty) {
        position = side == OrderSide.BUY ? position.add(qty) : position.subtract(qty);
    }

    @Override
    public synchronized Map<String, Ticker> fetchTickers() {
        return Map.of(symbol, new Ticker(symbol, last, last, last));
    }

    @Override
    public synchronized List<ExchangeOrder> fetchOpenOrders(String symbol) {
        return new ArrayList<>(open.values());
    }

    @Override
    public synchronized ExchangeOrderResponse placeOrder(ExchangeOrderRequest request) {
        if (request.quantity() == null || request.quantity().signum() <= 0) {
            throw new OrderRejectedException("bad quantity");
        }
        placed.add(request);
        String id = "ex-" + (++nextId);
        if (request.type() == OrderType.MARKET) {
            if (!ignoreMarketOrders) move(request.side(), request.quantity());
            return new ExchangeOrderResponse(id, request.clientOrderId(), "FILLED");
        }
        open.put(id, ExchangeOrder.builder()
                .orderId(id)
                .clientOrderId(request.clientOrderId())
                .symbol(request.symbol())
                .side(request.side())
                .price(request.price())
                .quantity(request.quantity())
                .status("NEW")
                .build());
        return new ExchangeOrderResponse(id, request.clientOrderId(), "NEW");
    }

    @Override
    public synchronized void cancelOrder(String orderId, String clientOrderId, String symbol) {
        if (failCancel.contains(orderId)) throw new OrderRejectedException("cancel rejected for " + orderId);
        open.remove(orderId);
        cancelled.add(orderId);
    }

    @Override
    public synchronized ExchangePosition fetchPosition(String symbol) {
        return new ExchangePosition(symbol, position, position.signum() == 0 ? BigDecimal.ZERO : last, last, BigDecimal.ZERO);
    }

    @Override
    public ExchangeLimits fetchLimits(String symbol) {
        return limits;
    }

    @Override
    public synchronized List<ExchangeOrder> fetchRecentFills(String symbol, Instant since) {
        return new ArrayList<>(recentFills);
    }
}
