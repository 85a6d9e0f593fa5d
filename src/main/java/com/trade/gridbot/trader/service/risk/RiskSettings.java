package com.trade.gridbot.trader.service.risk;

import com.trade.gridbot.trader.common.constants.GridConstants;
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
public class RiskSettings {

    /** Overrides the exchange's maintenance margin rate when set. */
    private BigDecimal maintenanceMarginRate;
    @Builder.Default
    private int maxSafeLeverage = GridConstants.MAX_SAFE_LEVERAGE;
    @Builder.Default
    private BigDecimal minGridSpacingPct = GridConstants.MIN_GRID_SPACING_PCT;
    @Builder.Default
    private BigDecimal minLiquidationDistancePct = GridConstants.MIN_LIQUIDATION_DISTANCE_PCT;
    @Builder.Default
    private int maxConsecutiveLosses = GridConstants.MAX_CONSECUTIVE_LOSSES;
    @Builder.Default
    private Duration lossCooldown = Duration.ofMinutes(5);
}
