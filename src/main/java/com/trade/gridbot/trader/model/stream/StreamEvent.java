package com.trade.gridbot.trader.model.stream;

/**
 * A decoded stream message. Each channel has its own type so the dispatch loop switches
 * on the class rather than on string keys.
 */
public interface StreamEvent {

    String channel();
}
