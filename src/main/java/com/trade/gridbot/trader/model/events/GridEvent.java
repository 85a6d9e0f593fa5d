package com.trade.gridbot.trader.model.events;

import java.time.Instant;

/**
 * Observability event published for every notable engine change.
 * Topics: engine.state, grid.trade, grid.cycle, grid.imbalance, grid.duplicate, risk.stop,
 * risk.circuit, risk.warning, stream.state, engine.status.
 *
 * @param code machine-readable condition for alerting topics, {@code null} otherwise
 */
public record GridEvent(String topic, String symbol, String code, Object payload, Instant at) {
}
