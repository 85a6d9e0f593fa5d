package com.trade.gridbot.trader.service.exchange;

import com.trade.gridbot.trader.common.exception.OrderRejectedException;
import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import com.trade.gridbot.trader.model.exchange.ExchangeOrder;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderRequest;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderResponse;
import com.trade.gridbot.trader.model.exchange.ExchangePosition;
import com.trade.gridbot.trader.model.exchange.Ticker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Retries the read-only calls of a delegate. Order placement and cancellation pass
 * straight through: a retried placement could open the same order twice.
 */
@Slf4j
public class ResilientExchangeClient implements ExchangeClient {

    private final ExchangeClient delegate;
    private final Retry retry;

    public ResilientExchangeClient(ExchangeClient delegate, String name, int maxAttempts, Duration wait) {
        this(delegate, Retry.of(name, RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .waitDuration(wait)
                .ignoreExceptions(OrderRejectedException.class, IllegalArgumentException.class)
                .build()));
    }

    public ResilientExchangeClient(ExchangeClient delegate, Retry retry) {
        this.delegate = delegate;
        this.retry = retry;
        this.retry.getEventPublisher().onRetry(e ->
                log.warn("exchange read retry #{} ({}): {}", e.getNumberOfRetryAttempts(), retry.getName(),
                        e.getLastThrowable() == null ? "-" : e.getLastThrowable().getMessage()));
    }

    @Override
    public Map<String, Ticker> fetchTickers() {
        return withRetry(delegate::fetchTickers);
    }

    @Override
    public List<ExchangeOrder> fetchOpenOrders(String symbol) {
        return withRetry(() -> delegate.fetchOpenOrders(symbol));
    }

    @Override
    public ExchangeOrderResponse placeOrder(ExchangeOrderRequest request) {
        return delegate.placeOrder(request);
    }

    @Override
    public void cancelOrder(String orderId, String clientOrderId, String symbol) {
        delegate.cancelOrder(orderId, clientOrderId, symbol);
    }

    @Override
    public ExchangePosition fetchPosition(String symbol) {
        return withRetry(() -> delegate.fetchPosition(symbol));
    }

    @Override
    public ExchangeLimits fetchLimits(String symbol) {
        return withRetry(() -> delegate.fetchLimits(symbol));
    }

    @Override
    public List<ExchangeOrder> fetchRecentFills(String symbol, Instant since) {
        return withRetry(() -> delegate.fetchRecentFills(symbol, since));
    }

    private <T> T withRetry(Supplier<T> call) {
        return Retry.decorateSupplier(retry, call).get();
    }
}
