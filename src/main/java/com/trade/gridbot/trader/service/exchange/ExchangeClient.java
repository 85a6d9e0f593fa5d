package com.trade.gridbot.trader.service.exchange;

import com.trade.gridbot.trader.model.exchange.ExchangeLimits;
import com.trade.gridbot.trader.model.exchange.ExchangeOrder;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderRequest;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderResponse;
import com.trade.gridbot.trader.model.exchange.ExchangePosition;
import com.trade.gridbot.trader.model.exchange.Ticker;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST capability of one exchange account. Signing and payload formatting live in the
 * implementation.
 * <p>
 * Every method may throw {@link com.trade.gridbot.trader.common.exception.TransportException}
 * for network failures; {@link #placeOrder} and {@link #cancelOrder} throw
 * {@link com.trade.gridbot.trader.common.exception.OrderRejectedException} when the exchange
 * refuses the request.
 */
public interface ExchangeClient {

    /** Latest tickers keyed by symbol. */
    Map<String, Ticker> fetchTickers();

    List<ExchangeOrder> fetchOpenOrders(String symbol);

    ExchangeOrderResponse placeOrder(ExchangeOrderRequest request);

    /** Either id may be null; implementations use whichever the exchange accepts. */
    void cancelOrder(String orderId, String clientOrderId, String symbol);

    ExchangePosition fetchPosition(String symbol);

    ExchangeLimits fetchLimits(String symbol);

    /** Orders filled at or after {@code since}, in any order. */
    List<ExchangeOrder> fetchRecentFills(String symbol, Instant since);
}
