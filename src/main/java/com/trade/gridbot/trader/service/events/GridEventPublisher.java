package com.trade.gridbot.trader.service.events;

import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.enums.BotState;
import com.trade.gridbot.trader.enums.StopReason;
import com.trade.gridbot.trader.enums.StreamState;
import com.trade.gridbot.trader.model.CompletedCycle;
import com.trade.gridbot.trader.model.GridTrade;
import com.trade.gridbot.trader.model.events.DuplicateOrderDetected;
import com.trade.gridbot.trader.model.events.GridEvent;
import com.trade.gridbot.trader.model.events.ImbalanceDetected;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Publishes {@link GridEvent}s on the Spring event bus. Listener failures never reach the engine.
 */
@Slf4j
@Service
public class GridEventPublisher {

    public static final String TOPIC_STATE = "engine.state";
    public static final String TOPIC_TRADE = "grid.trade";
    public static final String TOPIC_CYCLE = "grid.cycle";
    public static final String TOPIC_IMBALANCE = "grid.imbalance";
    public static final String TOPIC_DUPLICATE = "grid.duplicate";
    public static final String TOPIC_RISK_STOP = "risk.stop";
    public static final String TOPIC_CIRCUIT = "risk.circuit";
    public static final String TOPIC_RISK_WARNING = "risk.warning";
    public static final String TOPIC_STREAM = "stream.state";
    public static final String TOPIC_STATUS = "engine.status";

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    public GridEventPublisher() {
    }

    public GridEventPublisher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public void publishState(String symbol, BotState from, BotState to, String reason) {
        publish(TOPIC_STATE, symbol, Map.of("from", String.valueOf(from), "to", String.valueOf(to),
                "reason", reason == null ? "" : reason));
    }

    public void publishTrade(String symbol, GridTrade trade) {
        publish(TOPIC_TRADE, symbol, trade);
    }

    public void publishCycle(String symbol, CompletedCycle cycle) {
        publish(TOPIC_CYCLE, symbol, cycle);
    }

    public void publishImbalance(ImbalanceDetected imbalance) {
        log.warn("[{}] position imbalance: actual {} vs implied {} (tolerance {})", imbalance.symbol(),
                imbalance.actualSize().toPlainString(), imbalance.impliedSize().toPlainString(),
                imbalance.tolerance().toPlainString());
        publish(TOPIC_IMBALANCE, imbalance.symbol(), GridConstants.IMBALANCE, imbalance);
    }

    public void publishDuplicate(DuplicateOrderDetected duplicate) {
        publish(TOPIC_DUPLICATE, duplicate.symbol(), GridConstants.DUPLICATE_ORDER, duplicate);
    }

    public void publishRiskStop(String symbol, StopReason reason, String detail) {
        publish(TOPIC_RISK_STOP, symbol, Map.of("reason", reason.name(), "detail", detail == null ? "" : detail));
    }

    public void publishCircuitOpen(String symbol, int consecutiveLosses, Instant until) {
        publish(TOPIC_CIRCUIT, symbol, GridConstants.CIRCUIT_OPEN,
                Map.of("consecutiveLosses", consecutiveLosses, "until", String.valueOf(until)));
    }

    public void publishPositionLimit(String symbol, String detail) {
        publish(TOPIC_RISK_WARNING, symbol, GridConstants.POSITION_LIMIT, Map.of("detail", detail));
    }

    public void publishStreamState(String symbol, StreamState from, StreamState to) {
        publish(TOPIC_STREAM, symbol, Map.of("from", from.name(), "to", to.name()));
    }

    public void publishStatus(String symbol, Object status) {
        publish(TOPIC_STATUS, symbol, status);
    }

    private void publish(String topic, String symbol, Object payload) {
        publish(topic, symbol, null, payload);
    }

    private void publish(String topic, String symbol, String code, Object payload) {
        if (eventPublisher == null) return;
        try {
            eventPublisher.publishEvent(new GridEvent(topic, symbol, code, payload, Instant.now()));
        } catch (Exception e) {
            log.error("Failed to publish {} event for {}", topic, symbol, e);
        }
    }
}
