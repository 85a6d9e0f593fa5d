package com.trade.gridbot.trader.model.exchange;

import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.OrderType;
import com.trade.gridbot.trader.enums.TimeInForce;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record ExchangeOrderRequest(String symbol,
                                   OrderSide side,
                                   OrderType type,
                                   BigDecimal quantity,
                                   BigDecimal price,          // null for MARKET
                                   String clientOrderId,
                                   TimeInForce timeInForce,
                                   boolean postOnly,
                                   boolean reduceOnly) {
}
