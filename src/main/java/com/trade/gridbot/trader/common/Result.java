package com.trade.gridbot.trader.common;

import com.trade.gridbot.trader.common.exception.GridTradeException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    /**
     * Failure carrying the code of a grid exception.
     */
    public static <T> Result<T> fail(GridTradeException e) {
        return new Result<>(false, null, messageOf(e), e.getErrorCode());
    }

    public static <T> Result<T> fail(String code, Throwable t) {
        return new Result<>(false, null, messageOf(t), code);
    }

    // ---------- convenience helpers ----------

    /**
     * Convenience alias: true when successful.
     */
    public boolean isOk() {
        return success;
    }

    /**
     * Convenience alias for the payload (same as getData()).
     */
    public T get() {
        return data;
    }

    public boolean isFailure() {
        return !success;
    }

    private static String messageOf(Throwable t) {
        if (t == null) return "Unknown error";
        return t.getMessage() == null ? t.toString() : t.getMessage();
    }
}
