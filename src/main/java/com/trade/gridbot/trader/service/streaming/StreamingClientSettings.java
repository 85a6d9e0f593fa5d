package com.trade.gridbot.trader.service.streaming;

import com.trade.gridbot.trader.common.constants.GridConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamingClientSettings {

    // ---- Tunables ----
    @Builder.Default
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    @Builder.Default
    private Duration heartbeatCheckInterval = Duration.ofSeconds(5);
    @Builder.Default
    private int subscriptionLimit = GridConstants.DEFAULT_SUBSCRIPTION_LIMIT;
    /** Channels per subscribe frame; exchanges cap this per message. */
    @Builder.Default
    private int subscriptionBatchSize = GridConstants.DEFAULT_SUBSCRIPTION_BATCH;
    @Builder.Default
    private ReconnectPolicy reconnect = ReconnectPolicy.builder().build();
}
