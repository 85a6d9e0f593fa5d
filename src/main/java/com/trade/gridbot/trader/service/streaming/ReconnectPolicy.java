package com.trade.gridbot.trader.service.streaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(initialDelay * multiplier^attempt, maxDelay)}.
 * A negative {@code maxAttempts} retries forever.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconnectPolicy {

    @Builder.Default
    private boolean enabled = true;
    @Builder.Default
    private Duration initialDelay = Duration.ofSeconds(1);
    @Builder.Default
    private double multiplier = 1.5;
    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(30);
    @Builder.Default
    private int maxAttempts = -1;

    public Duration delayFor(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public boolean isExhausted(int attempts) {
        return maxAttempts >= 0 && attempts >= maxAttempts;
    }
}
