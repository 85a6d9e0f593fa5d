package com.trade.gridbot.trader.model.events;

import java.math.BigDecimal;

/**
 * The exchange position drifted from what the confirmed fills imply. Never auto-corrected.
 */
public record ImbalanceDetected(String symbol,
                                BigDecimal actualSize,
                                BigDecimal impliedSize,
                                BigDecimal expectedFinalSize,
                                BigDecimal tolerance) {

    public BigDecimal difference() {
        return actualSize.subtract(impliedSize);
    }
}
