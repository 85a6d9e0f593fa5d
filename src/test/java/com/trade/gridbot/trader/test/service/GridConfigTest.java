package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.common.exception.ConfigInvalidException;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.model.PriceRange;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GridConfigTest {

    @Test
    void reportsEveryViolationAtOnce() {
        GridConfig cfg = GridConfig.builder()
                .symbol(" ")
                .lowerPrice(new BigDecimal("110"))
                .upperPrice(new BigDecimal("100"))
                .gridCount(1)
                .totalInvestment(BigDecimal.ZERO)
                .leverage(200)
                .build();

        ConfigInvalidException e = catchThrowableOfType(cfg::validate, ConfigInvalidException.class);

        assertThat(e.getViolations()).hasSize(5);
        assertThat(e.getErrorCode()).isEqualTo("ERR-CFG-001");
        assertThat(e.getMessage()).contains("lowerPrice must be < upperPrice").contains("gridCount");
    }

    @Test
    void longStopLossMustSitBelowTheRange() {
        GridConfig cfg = GridConfig.builder()
                .symbol("ETHUSDT")
                .direction(PositionDirection.LONG)
                .lowerPrice(new BigDecimal("100"))
                .upperPrice(new BigDecimal("110"))
                .gridCount(5)
                .totalInvestment(new BigDecimal("500"))
                .stopLoss(new BigDecimal("101"))
                .build();

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("LONG stopLoss must be below lowerPrice");
    }

    @Test
    void defaultsAndRangeCopy() {
        GridConfig cfg = GridConfig.builder()
                .symbol("ETHUSDT")
                .lowerPrice(new BigDecimal("100"))
                .upperPrice(new BigDecimal("110"))
                .gridCount(10)
                .totalInvestment(new BigDecimal("1000"))
                .leverage(2)
                .build()
                .validate();

        assertThat(cfg.getDirection()).isEqualTo(PositionDirection.LONG);
        assertThat(cfg.isCancelOrdersOnStop()).isTrue();
        assertThat(cfg.getReplenishStep()).isEqualTo(1);
        assertThat(cfg.notionalPerLevel()).isEqualByComparingTo("200");

        GridConfig moved = cfg.withRange(new PriceRange(new BigDecimal("120"), new BigDecimal("130")));
        assertThat(moved.getLowerPrice()).isEqualByComparingTo("120");
        assertThat(moved.getGridCount()).isEqualTo(10);
        assertThat(cfg.getLowerPrice()).isEqualByComparingTo("100");
    }
}
