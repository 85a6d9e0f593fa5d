package com.trade.gridbot.trader.service.risk;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of the pre-start check. {@code reasons} are failures, {@code warnings} are advisory.
 * {@code liquidationPrice} is null for NEUTRAL grids.
 */
public record RiskReport(boolean ok,
                         List<String> reasons,
                         List<String> warnings,
                         BigDecimal liquidationPrice,
                         BigDecimal liquidationDistancePct,
                         BigDecimal perLevelQuantity) {

    public String describe() {
        if (ok) return "risk checks passed" + (warnings.isEmpty() ? "" : " with warnings: " + String.join("; ", warnings));
        return "risk checks failed: " + String.join("; ", reasons);
    }
}
