package com.trade.gridbot.trader.service.execution;

import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.service.streaming.StreamingClientSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridEngineSettings {

    private String streamUrl;

    // ---- Tunables ----
    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default
    private Duration reconcileInterval = Duration.ofSeconds(60);
    @Builder.Default
    private Duration fallbackPollInterval = Duration.ofSeconds(5);
    @Builder.Default
    private int fallbackThreads = 2;
    @Builder.Default
    private Duration stopTimeout = Duration.ofSeconds(5);
    /** Snapshot writes slower than this are logged. */
    @Builder.Default
    private Duration ioBudget = Duration.ofMillis(200);
    @Builder.Default
    private BigDecimal priceTolerance = GridConstants.DEFAULT_PRICE_TOLERANCE;
    @Builder.Default
    private Duration placementPacing = Duration.ofMillis(100);
    /** How long an order may be missing from the open-order list before it is retired. */
    @Builder.Default
    private Duration unknownOrderGrace = GridConstants.DEFAULT_UNKNOWN_ORDER_GRACE;
    @Builder.Default
    private int positionVerifyAttempts = 3;
    @Builder.Default
    private Duration positionVerifyDelay = Duration.ofSeconds(2);
    @Builder.Default
    private StreamingClientSettings streaming = StreamingClientSettings.builder().build();
}
