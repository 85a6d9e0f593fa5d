package com.trade.gridbot.trader.common.constants;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;

public interface GridConstants {

    MathContext MC = MathContext.DECIMAL64;
    BigDecimal HUNDRED = new BigDecimal("100");

    // Grid geometry
    BigDecimal DEFAULT_SIDE_BUFFER_PCT = new BigDecimal("0.001"); // 0.1% of reference price
    BigDecimal TRAIL_TRIGGER_PCT = new BigDecimal("0.05");        // 5% beyond the range
    BigDecimal TRAIL_NEAR_SHARE = new BigDecimal("0.4");
    BigDecimal TRAIL_FAR_SHARE = new BigDecimal("0.6");
    BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.001");        // 0.1% per leg

    // Ledger
    BigDecimal DEFAULT_PRICE_TOLERANCE = BigDecimal.ONE;          // quote currency
    String CLIENT_ID_PREFIX = "grid";
    Duration DEFAULT_UNKNOWN_ORDER_GRACE = Duration.ofSeconds(60);

    // Initial position
    BigDecimal POSITION_SIZE_TOLERANCE = new BigDecimal("0.1");   // 10% of the expected size

    // Risk
    BigDecimal DEFAULT_MAINTENANCE_MARGIN_RATE = new BigDecimal("0.005");
    int MAX_SAFE_LEVERAGE = 20;
    int MAX_LEVERAGE = 125;
    BigDecimal MIN_GRID_SPACING_PCT = new BigDecimal("0.1");
    BigDecimal MIN_LIQUIDATION_DISTANCE_PCT = new BigDecimal("5");
    int MAX_CONSECUTIVE_LOSSES = 5;

    // Streaming
    int DEFAULT_SUBSCRIPTION_LIMIT = 250;
    int DEFAULT_SUBSCRIPTION_BATCH = 100;

    // Error codes used in Result failures and event codes
    String NOT_CONNECTED = "NOT_CONNECTED";
    String ALREADY_CONNECTED = "ALREADY_CONNECTED";
    String SUBSCRIPTION_LIMIT = "SUBSCRIPTION_LIMIT";
    String SEND_FAILED = "SEND_FAILED";
    String LEVEL_ACTIVE = "LEVEL_ACTIVE";
    String LEDGER_CLOSED = "LEDGER_CLOSED";
    String CIRCUIT_OPEN = "CIRCUIT_OPEN";
    String BAD_STATE = "BAD_STATE";
    String DUPLICATE_ORDER = "DUPLICATE_ORDER";
    String IMBALANCE = "IMBALANCE";
    String POSITION_LIMIT = "POSITION_LIMIT";
}
