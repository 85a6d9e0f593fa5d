package com.trade.gridbot.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GridStats {

    private long totalFills;
    private long completedCycles;
    private long winningCycles;
    private long losingCycles;
    @Builder.Default
    private BigDecimal realizedProfit = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal feesPaid = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal peakEquity = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal currentDrawdown = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal maxDrawdown = BigDecimal.ZERO;
    @Builder.Default
    private List<CompletedCycle> recentCycles = new ArrayList<>();

    /** Percentage of completed cycles that closed with a profit. */
    @JsonIgnore
    public BigDecimal getWinRate() {
        if (completedCycles == 0) return BigDecimal.ZERO;
        return BigDecimal.valueOf(winningCycles * 100L)
                .divide(BigDecimal.valueOf(completedCycles), 2, RoundingMode.HALF_UP);
    }

    public GridStats copy() {
        return toBuilder().recentCycles(recentCycles == null ? new ArrayList<>() : new ArrayList<>(recentCycles)).build();
    }
}
