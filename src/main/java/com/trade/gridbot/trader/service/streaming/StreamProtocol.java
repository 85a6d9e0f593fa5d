package com.trade.gridbot.trader.service.streaming;

import com.trade.gridbot.trader.model.stream.ChannelSubscription;
import com.trade.gridbot.trader.model.stream.StreamEvent;

import java.util.List;
import java.util.Optional;

/**
 * Exchange specific wire format: builds outbound frames and decodes inbound ones into
 * typed events. Implementations must be thread-safe.
 */
public interface StreamProtocol {

    String subscriptionFrame(List<ChannelSubscription> channels, boolean subscribe);

    String pingFrame();

    /** Login frame for private endpoints; empty for public ones. */
    default Optional<String> authFrame() {
        return Optional.empty();
    }

    /**
     * Decodes one text frame. A frame may carry several events or none.
     *
     * @throws com.trade.gridbot.trader.common.exception.TransportException on malformed input
     */
    List<StreamEvent> decode(String text);
}
