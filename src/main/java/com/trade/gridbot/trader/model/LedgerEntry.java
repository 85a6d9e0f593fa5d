package com.trade.gridbot.trader.model;

import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ledger row linking a grid level to its client and exchange order ids.
 * Mutated only by the order ledger; everything else sees copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    private int levelIndex;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;

    private String clientOrderId;
    private String exchangeOrderId;   // null until acknowledged
    private OrderStatus status;
    private long placementEpoch;
    private String lastError;

    private Instant createdAt;
    private Instant updatedAt;
    private BigDecimal fillPrice;
    private BigDecimal filledQuantity;
    private Instant filledAt;
    /** Left over from a ladder that was re-laid; no longer bound to a level. */
    private boolean detached;

    public LedgerEntry copy() {
        return toBuilder().build();
    }
}
