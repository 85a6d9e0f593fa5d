package com.trade.gridbot.trader.config;

import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.enums.GridType;
import com.trade.gridbot.trader.enums.OrderType;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.enums.TimeInForce;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.service.execution.GridEngineSettings;
import com.trade.gridbot.trader.service.risk.RiskSettings;
import com.trade.gridbot.trader.service.streaming.ReconnectPolicy;
import com.trade.gridbot.trader.service.streaming.StreamingClientSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "grid")
public class GridBotProperties {

    private boolean autoStart = true;
    private boolean resume = true;
    private String streamUrl;
    private List<Bot> bots = new ArrayList<>();
    private Streaming streaming = new Streaming();
    private Engine engine = new Engine();
    private Risk risk = new Risk();
    private Persistence persistence = new Persistence();
    private Retry retry = new Retry();

    @Data
    public static class Bot {
        private String symbol;
        private String instance = "default";
        private String streamUrl;
        private PositionDirection direction = PositionDirection.LONG;
        private GridType gridType = GridType.ARITHMETIC;
        private BigDecimal lowerPrice;
        private BigDecimal upperPrice;
        private int gridCount;
        private BigDecimal totalInvestment;
        private int leverage = 1;
        private BigDecimal stopLoss;
        private BigDecimal takeProfit;
        private BigDecimal maxPositionSize;
        private BigDecimal maxDrawdownPct;
        private OrderType orderType = OrderType.LIMIT;
        private TimeInForce timeInForce = TimeInForce.GTC;
        private boolean postOnly;
        private boolean trailingUp;
        private boolean trailingDown;
        private boolean cancelOrdersOnStop = true;
        private boolean closePositionOnStop;
        private boolean acceptHighRisk;
        private boolean acceptOutOfRangeEntry;
        private int replenishStep = 1;
        private BigDecimal feeRate = GridConstants.DEFAULT_FEE_RATE;

        public GridConfig toGridConfig() {
            return GridConfig.builder()
                    .symbol(symbol)
                    .direction(direction)
                    .gridType(gridType)
                    .lowerPrice(lowerPrice)
                    .upperPrice(upperPrice)
                    .gridCount(gridCount)
                    .totalInvestment(totalInvestment)
                    .leverage(leverage)
                    .stopLoss(stopLoss)
                    .takeProfit(takeProfit)
                    .maxPositionSize(maxPositionSize)
                    .maxDrawdownPct(maxDrawdownPct)
                    .orderType(orderType)
                    .timeInForce(timeInForce)
                    .postOnly(postOnly)
                    .trailingUp(trailingUp)
                    .trailingDown(trailingDown)
                    .cancelOrdersOnStop(cancelOrdersOnStop)
                    .closePositionOnStop(closePositionOnStop)
                    .acceptHighRisk(acceptHighRisk)
                    .acceptOutOfRangeEntry(acceptOutOfRangeEntry)
                    .replenishStep(replenishStep)
                    .feeRate(feeRate)
                    .build();
        }
    }

    @Data
    public static class Streaming {
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration heartbeatCheckInterval = Duration.ofSeconds(5);
        private int subscriptionLimit = 250;
        private int subscriptionBatchSize = 100;
        private boolean reconnectEnabled = true;
        /** Negative retries forever. */
        private int maxReconnectAttempts = -1;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 1.5;

        public StreamingClientSettings toSettings() {
            return StreamingClientSettings.builder()
                    .heartbeatInterval(heartbeatInterval)
                    .heartbeatCheckInterval(heartbeatCheckInterval)
                    .subscriptionLimit(subscriptionLimit)
                    .subscriptionBatchSize(subscriptionBatchSize)
                    .reconnect(ReconnectPolicy.builder()
                            .enabled(reconnectEnabled)
                            .maxAttempts(maxReconnectAttempts)
                            .initialDelay(initialDelay)
                            .maxDelay(maxDelay)
                            .multiplier(multiplier)
                            .build())
                    .build();
        }
    }

    @Data
    public static class Engine {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration reconcileInterval = Duration.ofSeconds(60);
        private Duration fallbackPollInterval = Duration.ofSeconds(5);
        private int fallbackThreads = 2;
        private Duration stopTimeout = Duration.ofSeconds(5);
        private Duration ioBudget = Duration.ofMillis(200);
        private BigDecimal priceTolerance = BigDecimal.ONE;
        private Duration placementPacing = Duration.ofMillis(100);
        private Duration unknownOrderGrace = Duration.ofSeconds(60);
        private int positionVerifyAttempts = 3;
        private Duration positionVerifyDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Risk {
        private BigDecimal maintenanceMarginRate;
        private int maxSafeLeverage = 20;
        private BigDecimal minGridSpacingPct = new BigDecimal("0.1");
        private BigDecimal minLiquidationDistancePct = new BigDecimal("5");
        private int maxConsecutiveLosses = 5;
        private Duration lossCooldown = Duration.ofMinutes(5);

        public RiskSettings toSettings() {
            return RiskSettings.builder()
                    .maintenanceMarginRate(maintenanceMarginRate)
                    .maxSafeLeverage(maxSafeLeverage)
                    .minGridSpacingPct(minGridSpacingPct)
                    .minLiquidationDistancePct(minLiquidationDistancePct)
                    .maxConsecutiveLosses(maxConsecutiveLosses)
                    .lossCooldown(lossCooldown)
                    .build();
        }
    }

    @Data
    public static class Persistence {
        private boolean enabled = true;
        private Path dir = Path.of("data");
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration wait = Duration.ofMillis(500);
    }

    public GridEngineSettings engineSettings(Bot bot) {
        String url = bot.getStreamUrl() != null ? bot.getStreamUrl() : streamUrl;
        return GridEngineSettings.builder()
                .streamUrl(url)
                .connectTimeout(engine.getConnectTimeout())
                .reconcileInterval(engine.getReconcileInterval())
                .fallbackPollInterval(engine.getFallbackPollInterval())
                .fallbackThreads(engine.getFallbackThreads())
                .stopTimeout(engine.getStopTimeout())
                .ioBudget(engine.getIoBudget())
                .priceTolerance(engine.getPriceTolerance())
                .placementPacing(engine.getPlacementPacing())
                .unknownOrderGrace(engine.getUnknownOrderGrace())
                .positionVerifyAttempts(engine.getPositionVerifyAttempts())
                .positionVerifyDelay(engine.getPositionVerifyDelay())
                .streaming(streaming.toSettings())
                .build();
    }
}
