package com.trade.gridbot.trader.common.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class RiskCheckFailedException extends GridTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-RISK-001";

    private final List<String> reasons;

    public RiskCheckFailedException(List<String> reasons) {
        super("Risk check failed: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
