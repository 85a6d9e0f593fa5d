package com.trade.gridbot.trader.model.stream;

/**
 * One channel on the stream, optionally scoped to a symbol. Private channels
 * (orders, positions) usually carry no symbol.
 */
public record ChannelSubscription(String channel, String symbol) {

    public static ChannelSubscription of(String channel) {
        return new ChannelSubscription(channel, null);
    }

    public static ChannelSubscription of(String channel, String symbol) {
        return new ChannelSubscription(channel, symbol);
    }

    /** De-duplication key. */
    public String key() {
        return symbol == null ? channel : channel + ":" + symbol;
    }
}
