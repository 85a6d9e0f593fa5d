package com.trade.gridbot.trader.model.exchange;

public record ExchangeOrderResponse(String orderId, String clientOrderId, String status) {
}
