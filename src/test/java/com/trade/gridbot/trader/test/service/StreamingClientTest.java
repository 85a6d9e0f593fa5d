package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.common.Result;
import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.common.exception.TransportException;
import com.trade.gridbot.trader.config.CustomConfig;
import com.trade.gridbot.trader.enums.StreamState;
import com.trade.gridbot.trader.model.stream.ChannelSubscription;
import com.trade.gridbot.trader.model.stream.StreamEvent;
import com.trade.gridbot.trader.model.stream.TickerEvent;
import com.trade.gridbot.trader.service.streaming.JsonStreamProtocol;
import com.trade.gridbot.trader.service.streaming.ReconnectPolicy;
import com.trade.gridbot.trader.service.streaming.StreamListener;
import com.trade.gridbot.trader.service.streaming.StreamingClient;
import com.trade.gridbot.trader.service.streaming.StreamingClientSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StreamingClientTest {

    private static final String URL = "wss://stream.test/ws";

    @Mock
    ScheduledExecutorService scheduler;
    @Mock
    StreamListener listener;

    FakeStreamTransport transport;
    JsonStreamProtocol protocol;

    @BeforeEach
    void setUp() {
        transport = new FakeStreamTransport();
        protocol = new JsonStreamProtocol(CustomConfig.gridMapper());
    }

    private StreamingClient client(StreamingClientSettings settings) {
        return new StreamingClient("test", transport, protocol, settings, listener, scheduler, new DirectExecutorService());
    }

    private StreamingClient client() {
        return client(StreamingClientSettings.builder().build());
    }

    private Runnable lastScheduledReconnect() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, atLeastOnce()).schedule(task.capture(), anyLong(), eq(TimeUnit.MILLISECONDS));
        return task.getValue();
    }

    @Test
    void backoffGrowsByHalfEachAttempt() {
        StreamingClient c = client();
        c.connect(URL);

        transport.dropLast();
        lastScheduledReconnect().run();
        transport.dropLast();
        lastScheduledReconnect().run();
        transport.dropLast();

        ArgumentCaptor<Long> delays = ArgumentCaptor.forClass(Long.class);
        verify(scheduler, times(3)).schedule(any(Runnable.class), delays.capture(), eq(TimeUnit.MILLISECONDS));
        assertThat(delays.getAllValues()).containsExactly(1000L, 1500L, 2250L);
        assertThat(c.getState()).isEqualTo(StreamState.RECONNECTING);
        assertThat(c.getReconnectAttempts()).isEqualTo(3);
    }

    @Test
    void successfulOpenResetsBackoff() {
        StreamingClient c = client();
        c.connect(URL);
        transport.dropLast();
        lastScheduledReconnect().run();
        transport.openLast();

        assertThat(c.getState()).isEqualTo(StreamState.CONNECTED);
        assertThat(c.getReconnectAttempts()).isZero();

        transport.dropLast();
        ArgumentCaptor<Long> delays = ArgumentCaptor.forClass(Long.class);
        verify(scheduler, times(2)).schedule(any(Runnable.class), delays.capture(), eq(TimeUnit.MILLISECONDS));
        assertThat(delays.getAllValues()).containsExactly(1000L, 1000L);
    }

    @Test
    void resubscribesFullSetAfterReconnect() {
        StreamingClient c = client();
        c.subscribe(List.of(
                ChannelSubscription.of("ticker", "BTCUSDT"),
                ChannelSubscription.of("order"),
                ChannelSubscription.of("position")));
        c.connect(URL);
        transport.openLast();

        assertThat(transport.lastConnection().sent).hasSize(1);
        assertThat(transport.lastConnection().sent.get(0))
                .contains("\"op\":\"subscribe\"")
                .contains("\"channel\":\"ticker\"")
                .contains("\"channel\":\"order\"")
                .contains("\"channel\":\"position\"");

        transport.dropLast();
        lastScheduledReconnect().run();
        transport.openLast();

        assertThat(transport.connections).hasSize(2);
        assertThat(transport.lastConnection().sent).hasSize(1);
        assertThat(transport.lastConnection().sent.get(0)).contains("ticker").contains("order").contains("position");
    }

    @Test
    void subscribeFramesAreBatched() {
        StreamingClient c = client(StreamingClientSettings.builder().subscriptionBatchSize(2).build());
        c.connect(URL);
        transport.openLast();

        Result<List<ChannelSubscription>> r = c.subscribe(List.of(
                ChannelSubscription.of("ticker", "A"),
                ChannelSubscription.of("ticker", "B"),
                ChannelSubscription.of("ticker", "C"),
                ChannelSubscription.of("ticker", "D"),
                ChannelSubscription.of("ticker", "E")));

        assertThat(r.get()).hasSize(5);
        assertThat(transport.lastConnection().sent).hasSize(3);
    }

    @Test
    void activeChannelsAreNotSubscribedTwice() {
        StreamingClient c = client();
        c.connect(URL);
        transport.openLast();

        c.subscribe(List.of(ChannelSubscription.of("ticker", "BTCUSDT")));
        Result<List<ChannelSubscription>> again = c.subscribe(List.of(
                ChannelSubscription.of("ticker", "BTCUSDT"),
                ChannelSubscription.of("ticker", "BTCUSDT")));

        assertThat(again.isOk()).isTrue();
        assertThat(again.get()).isEmpty();
        assertThat(c.getActiveSubscriptions()).hasSize(1);
        assertThat(transport.lastConnection().sent).hasSize(1);
    }

    @Test
    void requestOverTheLimitIsRejectedWhole() {
        StreamingClient c = client(StreamingClientSettings.builder().subscriptionLimit(2).build());
        c.subscribe(List.of(ChannelSubscription.of("ticker", "A")));

        Result<List<ChannelSubscription>> r = c.subscribe(List.of(
                ChannelSubscription.of("ticker", "B"),
                ChannelSubscription.of("ticker", "C")));

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo(GridConstants.SUBSCRIPTION_LIMIT);
        assertThat(c.getActiveSubscriptions()).extracting(ChannelSubscription::symbol).containsExactly("A");
    }

    @Test
    void unsubscribeDropsChannelFromResubscription() {
        StreamingClient c = client();
        c.subscribe(List.of(ChannelSubscription.of("ticker", "A"), ChannelSubscription.of("ticker", "B")));
        c.connect(URL);
        transport.openLast();

        Result<List<ChannelSubscription>> removed = c.unsubscribe(List.of(ChannelSubscription.of("ticker", "A")));

        assertThat(removed.get()).hasSize(1);
        assertThat(transport.lastConnection().sent.get(1)).contains("\"op\":\"unsubscribe\"");
        assertThat(c.getActiveSubscriptions()).extracting(ChannelSubscription::symbol).containsExactly("B");
    }

    @Test
    void sendWhileDisconnectedFails() {
        StreamingClient c = client();

        Result<Void> r = c.send("{}");

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo(GridConstants.NOT_CONNECTED);
    }

    @Test
    void secondConnectIsRejected() {
        StreamingClient c = client();
        c.connect(URL);

        assertThat(c.connect(URL).getErrorCode()).isEqualTo(GridConstants.ALREADY_CONNECTED);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        ReconnectPolicy policy = ReconnectPolicy.builder().maxAttempts(1).build();
        StreamingClient c = client(StreamingClientSettings.builder().reconnect(policy).build());
        c.connect(URL);

        transport.dropLast();
        lastScheduledReconnect().run();
        transport.dropLast();

        assertThat(c.getState()).isEqualTo(StreamState.DISCONNECTED);
        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(listener).onError(error.capture());
        assertThat(error.getValue()).isInstanceOf(TransportException.class);
        assertThat(((TransportException) error.getValue()).getErrorCode()).isEqualTo("RECONNECT_EXHAUSTED");
    }

    @Test
    void eventsReachListenerInArrivalOrder() {
        StreamingClient c = client();
        c.connect(URL);
        transport.openLast();

        transport.push("{\"channel\":\"ticker\",\"data\":[{\"symbol\":\"BTCUSDT\",\"last\":\"100\"},"
                + "{\"symbol\":\"BTCUSDT\",\"last\":\"101\"}]}");

        ArgumentCaptor<StreamEvent> events = ArgumentCaptor.forClass(StreamEvent.class);
        verify(listener, times(2)).onMessage(events.capture());
        assertThat(events.getAllValues())
                .extracting(e -> ((TickerEvent) e).last().toPlainString())
                .containsExactly("100", "101");
    }

    @Test
    void loginAckAuthenticatesAndIsNotForwarded() {
        StreamingClient c = client();
        c.connect(URL);
        transport.openLast();

        transport.push("{\"event\":\"login\",\"code\":0}");

        assertThat(c.getState()).isEqualTo(StreamState.AUTHENTICATED);
        verify(listener, never()).onMessage(any());
        InOrder order = inOrder(listener);
        order.verify(listener).onStateChange(StreamState.DISCONNECTED, StreamState.CONNECTING);
        order.verify(listener).onStateChange(StreamState.CONNECTING, StreamState.CONNECTED);
        order.verify(listener).onStateChange(StreamState.CONNECTED, StreamState.AUTHENTICATED);
    }

    @Test
    void malformedFrameIsReportedAndConnectionStays() {
        StreamingClient c = client();
        c.connect(URL);
        transport.openLast();

        transport.push("not json");

        verify(listener).onError(any(TransportException.class));
        assertThat(c.getState()).isEqualTo(StreamState.CONNECTED);
    }

    @Test
    void callbacksFromReplacedConnectionAreIgnored() {
        StreamingClient c = client();
        c.connect(URL);
        FakeStreamTransport.FakeConnection first = transport.lastConnection();
        transport.dropLast();
        lastScheduledReconnect().run();
        transport.openLast();

        transport.listeners.get(0).onText(first, "{\"channel\":\"ticker\",\"data\":{\"symbol\":\"X\",\"last\":\"1\"}}");
        transport.listeners.get(0).onFailure(first, new RuntimeException("late"));

        verify(listener, never()).onMessage(any());
        assertThat(c.getState()).isEqualTo(StreamState.CONNECTED);
    }

    @Test
    void heartbeatPingsOnlyWhileOpen() {
        StreamingClient c = client(StreamingClientSettings.builder().heartbeatInterval(Duration.ZERO).build());
        c.connect(URL);
        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(tick.capture(), anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS));

        tick.getValue().run();
        assertThat(transport.lastConnection().sent).isEmpty();

        transport.openLast();
        tick.getValue().run();
        assertThat(transport.lastConnection().sent).anyMatch(f -> f.contains("\"op\":\"ping\""));
    }

    @Test
    void disconnectStopsReconnecting() {
        StreamingClient c = client();
        c.connect(URL);
        transport.openLast();

        c.disconnect();

        assertThat(c.getState()).isEqualTo(StreamState.DISCONNECTED);
        assertThat(transport.lastConnection().closed).isTrue();
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }
}
