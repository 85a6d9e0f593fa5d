package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.config.GridBotProperties;
import com.trade.gridbot.trader.enums.PositionDirection;
import com.trade.gridbot.trader.model.GridConfig;
import com.trade.gridbot.trader.service.execution.GridEngineSettings;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GridBotPropertiesTest {

    private GridBotProperties.Bot bot() {
        GridBotProperties.Bot bot = new GridBotProperties.Bot();
        bot.setSymbol("ETHUSDT");
        bot.setInstance("eth-1");
        bot.setDirection(PositionDirection.SHORT);
        bot.setLowerPrice(new BigDecimal("2000"));
        bot.setUpperPrice(new BigDecimal("2400"));
        bot.setGridCount(21);
        bot.setTotalInvestment(new BigDecimal("1000"));
        bot.setLeverage(3);
        bot.setStopLoss(new BigDecimal("2600"));
        return bot;
    }

    @Test
    void botMapsToValidGridConfig() {
        GridConfig cfg = bot().toGridConfig();

        assertThat(cfg.getSymbol()).isEqualTo("ETHUSDT");
        assertThat(cfg.getDirection()).isEqualTo(PositionDirection.SHORT);
        assertThat(cfg.getGridCount()).isEqualTo(21);
        assertThat(cfg.getLeverage()).isEqualTo(3);
        assertThat(cfg.getStopLoss()).isEqualByComparingTo("2600");
        assertThat(cfg.isCancelOrdersOnStop()).isTrue();
        assertThat(cfg.getReplenishStep()).isEqualTo(1);
        assertThat(cfg.getFeeRate()).isEqualByComparingTo("0.001");
        cfg.validate();
    }

    @Test
    void botStreamUrlOverridesGlobalOne() {
        GridBotProperties props = new GridBotProperties();
        props.setStreamUrl("wss://global/ws");
        GridBotProperties.Bot bot = bot();

        assertThat(props.engineSettings(bot).getStreamUrl()).isEqualTo("wss://global/ws");

        bot.setStreamUrl("wss://eth/ws");
        assertThat(props.engineSettings(bot).getStreamUrl()).isEqualTo("wss://eth/ws");
    }

    @Test
    void engineSettingsCarryTunables() {
        GridBotProperties props = new GridBotProperties();
        props.getEngine().setReconcileInterval(Duration.ofSeconds(15));
        props.getEngine().setUnknownOrderGrace(Duration.ofSeconds(90));
        props.getStreaming().setReconnectEnabled(false);
        props.getStreaming().setInitialDelay(Duration.ofMillis(250));

        GridEngineSettings s = props.engineSettings(bot());

        assertThat(s.getReconcileInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(s.getPriceTolerance()).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(s.getUnknownOrderGrace()).isEqualTo(Duration.ofSeconds(90));
        assertThat(s.getPositionVerifyAttempts()).isEqualTo(3);
        assertThat(s.getPositionVerifyDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(s.getStreaming().getReconnect().isEnabled()).isFalse();
        assertThat(s.getStreaming().getReconnect().getInitialDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(s.getStreaming().getSubscriptionLimit()).isEqualTo(250);
    }
}
