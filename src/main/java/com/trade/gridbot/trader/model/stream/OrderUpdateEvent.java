package com.trade.gridbot.trader.model.stream;

import com.trade.gridbot.trader.enums.OrderSide;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Order lifecycle update. {@code status} is upper case (NEW, PARTIALLY_FILLED, FILLED,
 * CANCELLED, REJECTED, EXPIRED).
 */
public record OrderUpdateEvent(String symbol,
                               String orderId,
                               String clientOrderId,
                               OrderSide side,
                               String status,
                               BigDecimal filledQuantity,
                               BigDecimal averagePrice,
                               Instant timestamp) implements StreamEvent {

    public static final String CHANNEL = "order";

    @Override
    public String channel() {
        return CHANNEL;
    }

    public boolean isFilled() {
        return "FILLED".equals(status);
    }

    /** Closed before a complete fill; {@code filledQuantity} may still be non-zero. */
    public boolean isClosedWithoutFill() {
        return "CANCELLED".equals(status) || "REJECTED".equals(status) || "EXPIRED".equals(status);
    }

    /**
     * Maps exchange spellings onto one vocabulary (FULL_FILLED, CANCELED, PART_FILLED...).
     */
    public static String normalizeStatus(String raw) {
        if (raw == null) return "UNKNOWN";
        String s = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        switch (s) {
            case "FULL_FILLED":
            case "FILLED":
                return "FILLED";
            case "PART_FILLED":
            case "PARTIAL_FILLED":
            case "PARTIALLY_FILLED":
                return "PARTIALLY_FILLED";
            case "CANCELED":
            case "CANCELLED":
                return "CANCELLED";
            case "INIT":
            case "NEW":
            case "OPEN":
            case "LIVE":
                return "NEW";
            default:
                return s;
        }
    }
}
