package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.common.exception.OrderRejectedException;
import com.trade.gridbot.trader.common.exception.TransportException;
import com.trade.gridbot.trader.model.exchange.ExchangeOrderRequest;
import com.trade.gridbot.trader.model.exchange.ExchangePosition;
import com.trade.gridbot.trader.service.exchange.ExchangeClient;
import com.trade.gridbot.trader.service.exchange.ResilientExchangeClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientExchangeClientTest {

    @Mock
    ExchangeClient delegate;

    private ResilientExchangeClient client() {
        return new ResilientExchangeClient(delegate, "test", 3, Duration.ofMillis(1));
    }

    @Test
    void readsAreRetriedUntilSuccess() {
        ExchangePosition flat = new ExchangePosition("BTCUSDT", BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        when(delegate.fetchPosition("BTCUSDT"))
                .thenThrow(new TransportException("503"))
                .thenThrow(new TransportException("503"))
                .thenReturn(flat);

        assertThat(client().fetchPosition("BTCUSDT")).isSameAs(flat);
        verify(delegate, times(3)).fetchPosition("BTCUSDT");
    }

    @Test
    void readsGiveUpAfterMaxAttempts() {
        when(delegate.fetchTickers()).thenThrow(new TransportException("down"));

        assertThatThrownBy(() -> client().fetchTickers()).isInstanceOf(TransportException.class);
        verify(delegate, times(3)).fetchTickers();
    }

    @Test
    void rejectionsAreNotRetried() {
        when(delegate.fetchLimits("NOPE")).thenThrow(new OrderRejectedException("unknown symbol"));

        assertThatThrownBy(() -> client().fetchLimits("NOPE")).isInstanceOf(OrderRejectedException.class);
        verify(delegate, times(1)).fetchLimits("NOPE");
    }

    @Test
    void placementIsNeverRetried() {
        when(delegate.placeOrder(any())).thenThrow(new TransportException("timeout"));

        assertThatThrownBy(() -> client().placeOrder(ExchangeOrderRequest.builder().symbol("BTCUSDT").build()))
                .isInstanceOf(TransportException.class);
        verify(delegate, times(1)).placeOrder(any());
    }
}
