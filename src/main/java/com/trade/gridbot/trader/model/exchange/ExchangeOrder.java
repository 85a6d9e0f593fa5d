package com.trade.gridbot.trader.model.exchange;

import com.trade.gridbot.trader.enums.OrderSide;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An order as reported by the exchange. {@code status} is the exchange's own vocabulary,
 * normalised to upper case by the adapter (NEW, PARTIALLY_FILLED, FILLED, CANCELLED...).
 */
@Builder(toBuilder = true)
public record ExchangeOrder(String orderId,
                            String clientOrderId,
                            String symbol,
                            OrderSide side,
                            BigDecimal price,
                            BigDecimal quantity,
                            String status,
                            BigDecimal filledQuantity,
                            BigDecimal averagePrice,
                            Instant updatedAt) {
}
