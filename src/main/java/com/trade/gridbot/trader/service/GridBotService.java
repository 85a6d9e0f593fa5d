package com.trade.gridbot.trader.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gridbot.trader.common.Result;
import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.config.GridBotProperties;
import com.trade.gridbot.trader.enums.BotState;
import com.trade.gridbot.trader.enums.StopReason;
import com.trade.gridbot.trader.service.calculator.GridCalculator;
import com.trade.gridbot.trader.service.events.GridEventPublisher;
import com.trade.gridbot.trader.service.exchange.ExchangeClient;
import com.trade.gridbot.trader.service.exchange.ResilientExchangeClient;
import com.trade.gridbot.trader.service.execution.GridEngine;
import com.trade.gridbot.trader.service.persistence.JsonSnapshotStore;
import com.trade.gridbot.trader.service.risk.RiskGate;
import com.trade.gridbot.trader.service.streaming.JsonStreamProtocol;
import com.trade.gridbot.trader.service.streaming.OkHttpStreamTransport;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the configured grid bots. Each bot gets its own engine, stream connection,
 * risk gate and snapshot file; the exchange client and calculator are shared.
 */
@Service
@Slf4j
public class GridBotService {

    private final Map<String, GridEngine> engines = new ConcurrentHashMap<>();

    @Autowired
    private GridBotProperties properties;
    @Autowired
    private ObjectMapper mapper;
    @Autowired
    private OkHttpClient okHttpClient;
    @Autowired
    private GridCalculator calculator;
    @Autowired
    private GridEventPublisher events;
    @Autowired
    private ObjectProvider<ExchangeClient> exchangeProvider;

    @EventListener(ApplicationReadyEvent.class)
    public void startConfigured() {
        if (!properties.isAutoStart() || properties.getBots().isEmpty()) {
            log.info("Grid bots: auto-start off or none configured");
            return;
        }
        if (exchangeProvider.getIfAvailable() == null) {
            log.warn("Grid bots: no ExchangeClient bean available; {} bot(s) not started",
                    properties.getBots().size());
            return;
        }
        for (GridBotProperties.Bot bot : properties.getBots()) {
            Result<GridEngine> registered = register(bot);
            if (registered.isFailure()) {
                log.error("Grid bot {} not registered: {}", bot.getSymbol(), registered.getError());
                continue;
            }
            GridEngine engine = registered.get();
            Result<BotState> r = properties.isResume() ? engine.resume() : engine.start();
            if (r.isOk()) log.info("Grid bot {} is {}", key(bot), r.get());
            else log.error("Grid bot {} failed to start: {}", key(bot), r.getError());
        }
    }

    /**
     * Builds an engine for the bot without starting it.
     */
    public Result<GridEngine> register(GridBotProperties.Bot bot) {
        String key = key(bot);
        if (engines.containsKey(key)) {
            return Result.fail(GridConstants.BAD_STATE, "bot " + key + " already registered");
        }
        ExchangeClient exchange = exchangeProvider.getIfAvailable();
        if (exchange == null) {
            return Result.fail(GridConstants.BAD_STATE, "no ExchangeClient configured");
        }
        GridBotProperties.Retry retry = properties.getRetry();
        GridEngine engine = GridEngine.builder()
                .instance(bot.getInstance())
                .config(bot.toGridConfig())
                .exchange(new ResilientExchangeClient(exchange, "exchange-" + key, retry.getMaxAttempts(), retry.getWait()))
                .calculator(calculator)
                .riskGate(new RiskGate(properties.getRisk().toSettings(), Clock.systemUTC()))
                .store(properties.getPersistence().isEnabled()
                        ? new JsonSnapshotStore(mapper, properties.getPersistence().getDir(), bot.getSymbol(), bot.getInstance())
                        : null)
                .events(events)
                .transport(new OkHttpStreamTransport(okHttpClient))
                .protocol(new JsonStreamProtocol(mapper))
                .settings(properties.engineSettings(bot))
                .build();
        engines.put(key, engine);
        return Result.ok(engine);
    }

    public Optional<GridEngine> find(String symbol, String instance) {
        return Optional.ofNullable(engines.get(key(symbol, instance)));
    }

    public Result<BotState> stop(String symbol, String instance) {
        return find(symbol, instance)
                .map(e -> e.stop(StopReason.MANUAL))
                .orElseGet(() -> Result.fail(GridConstants.BAD_STATE, "unknown bot " + key(symbol, instance)));
    }

    public Result<BotState> pause(String symbol, String instance) {
        return find(symbol, instance)
                .map(GridEngine::pause)
                .orElseGet(() -> Result.fail(GridConstants.BAD_STATE, "unknown bot " + key(symbol, instance)));
    }

    public Result<BotState> unpause(String symbol, String instance) {
        return find(symbol, instance)
                .map(GridEngine::unpause)
                .orElseGet(() -> Result.fail(GridConstants.BAD_STATE, "unknown bot " + key(symbol, instance)));
    }

    public List<GridEngine.EngineStatus> statuses() {
        List<GridEngine.EngineStatus> out = new ArrayList<>();
        engines.values().forEach(e -> out.add(e.getStatus()));
        return out;
    }

    @Scheduled(fixedDelayString = "${grid.engine.status-interval-ms:30000}")
    public void publishStatus() {
        for (GridEngine.EngineStatus s : statuses()) {
            log.debug("[{}:{}] {} stream={} price={}", s.symbol(), s.instance(), s.state(), s.streamState(), s.lastPrice());
            events.publishStatus(s.symbol(), s);
        }
    }

    @PreDestroy
    public void stopAll() {
        engines.forEach((key, engine) -> {
            if (engine.getState().isTerminal()) return;
            Result<BotState> r = engine.stop(StopReason.SHUTDOWN);
            log.info("Grid bot {} stopped on shutdown: {}", key, r.isOk() ? r.get() : r.getError());
        });
    }

    private static String key(GridBotProperties.Bot bot) {
        return key(bot.getSymbol(), bot.getInstance());
    }

    private static String key(String symbol, String instance) {
        return symbol + ":" + (instance == null ? "default" : instance);
    }
}
