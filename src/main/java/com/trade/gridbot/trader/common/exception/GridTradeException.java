package com.trade.gridbot.trader.common.exception;

import lombok.Getter;

/**
 * Base exception for the grid engine.
 * Carries a stable error code so callers can branch without parsing messages.
 */
@Getter
public abstract class GridTradeException extends RuntimeException {

    private final String errorCode;

    protected GridTradeException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected GridTradeException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected GridTradeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
