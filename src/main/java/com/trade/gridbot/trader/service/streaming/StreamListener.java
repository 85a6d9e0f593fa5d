package com.trade.gridbot.trader.service.streaming;

import com.trade.gridbot.trader.enums.StreamState;
import com.trade.gridbot.trader.model.stream.StreamEvent;

/**
 * Caller supplied handlers. All three run on the client's single dispatch thread,
 * one at a time and in arrival order.
 */
public interface StreamListener {

    void onMessage(StreamEvent event);

    default void onStateChange(StreamState previous, StreamState current) {
    }

    default void onError(Throwable error) {
    }
}
