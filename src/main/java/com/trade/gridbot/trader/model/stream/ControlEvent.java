package com.trade.gridbot.trader.model.stream;

/**
 * Protocol-level frames: pong, auth acknowledgement, subscription ack, server error.
 */
public record ControlEvent(Kind kind, String detail) implements StreamEvent {

    public enum Kind {
        PONG,
        AUTH_OK,
        SUBSCRIBED,
        ERROR
    }

    @Override
    public String channel() {
        return "control";
    }
}
