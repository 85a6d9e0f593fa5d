package com.trade.gridbot.trader.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a grid configuration breaks one or more rules.
 * The message enumerates every violation, not just the first.
 */
@Getter
public class ConfigInvalidException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    private final List<String> violations;

    public ConfigInvalidException(List<String> violations) {
        super("Invalid grid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
