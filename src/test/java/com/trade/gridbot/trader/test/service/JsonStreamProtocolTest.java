package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.common.exception.TransportException;
import com.trade.gridbot.trader.config.CustomConfig;
import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.model.stream.ChannelSubscription;
import com.trade.gridbot.trader.model.stream.ControlEvent;
import com.trade.gridbot.trader.model.stream.OrderUpdateEvent;
import com.trade.gridbot.trader.model.stream.PositionEvent;
import com.trade.gridbot.trader.model.stream.StreamEvent;
import com.trade.gridbot.trader.service.streaming.JsonStreamProtocol;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonStreamProtocolTest {

    private final JsonStreamProtocol protocol = new JsonStreamProtocol(CustomConfig.gridMapper());

    @Test
    void subscribeFrameListsEveryChannel() {
        String frame = protocol.subscriptionFrame(List.of(
                ChannelSubscription.of("ticker", "BTCUSDT"),
                ChannelSubscription.of("order")), true);

        assertThat(frame).isEqualTo("{\"op\":\"subscribe\",\"args\":[{\"channel\":\"ticker\",\"symbol\":\"BTCUSDT\"},"
                + "{\"channel\":\"order\"}]}");
    }

    @Test
    void authFrameOnlyWhenCredentialsSupplied() {
        assertThat(protocol.authFrame()).isEmpty();

        JsonStreamProtocol withLogin = new JsonStreamProtocol(CustomConfig.gridMapper(),
                () -> Map.of("apiKey", "k1"));
        assertThat(withLogin.authFrame()).hasValueSatisfying(f -> assertThat(f).contains("\"op\":\"login\"").contains("k1"));
    }

    @Test
    void decodesFilledOrderWithExchangeSpelling() {
        List<StreamEvent> events = protocol.decode("{\"channel\":\"order\",\"data\":{\"symbol\":\"BTCUSDT\","
                + "\"orderId\":\"9\",\"clientOrderId\":\"grid_BTCUSDT_3_B_1\",\"side\":\"buy\","
                + "\"status\":\"full_filled\",\"filledQty\":\"0.5\",\"avgPrice\":\"103.5\",\"ts\":1700000000000}}");

        assertThat(events).hasSize(1);
        OrderUpdateEvent o = (OrderUpdateEvent) events.get(0);
        assertThat(o.isFilled()).isTrue();
        assertThat(o.side()).isEqualTo(OrderSide.BUY);
        assertThat(o.filledQuantity()).isEqualByComparingTo("0.5");
        assertThat(o.averagePrice()).isEqualByComparingTo("103.5");
        assertThat(o.timestamp()).isEqualTo(Instant.ofEpochMilli(1700000000000L));
    }

    @Test
    void cancelledSpellingsCloseWithoutFill() {
        assertThat(OrderUpdateEvent.normalizeStatus("canceled")).isEqualTo("CANCELLED");
        assertThat(OrderUpdateEvent.normalizeStatus("Part Filled")).isEqualTo("PARTIALLY_FILLED");
        assertThat(OrderUpdateEvent.normalizeStatus(null)).isEqualTo("UNKNOWN");
    }

    @Test
    void decodesPositionWithMissingFieldsAsZero() {
        List<StreamEvent> events = protocol.decode("{\"channel\":\"position\",\"data\":[{\"symbol\":\"ETHUSDT\",\"size\":\"-2\"}]}");

        PositionEvent p = (PositionEvent) events.get(0);
        assertThat(p.signedSize()).isEqualByComparingTo("-2");
        assertThat(p.entryPrice()).isEqualByComparingTo("0");
    }

    @Test
    void controlFrames() {
        assertThat(protocol.decode("{\"op\":\"pong\"}"))
                .containsExactly(new ControlEvent(ControlEvent.Kind.PONG, null));
        assertThat(((ControlEvent) protocol.decode("{\"event\":\"login\",\"code\":0}").get(0)).kind())
                .isEqualTo(ControlEvent.Kind.AUTH_OK);
        assertThat(((ControlEvent) protocol.decode("{\"event\":\"login\",\"code\":60009,\"msg\":\"bad key\"}").get(0)).detail())
                .contains("bad key");
        assertThat(((ControlEvent) protocol.decode("{\"event\":\"error\",\"msg\":\"oops\"}").get(0)).kind())
                .isEqualTo(ControlEvent.Kind.ERROR);
    }

    @Test
    void frameWithoutDataIsIgnored() {
        assertThat(protocol.decode("{\"channel\":\"ticker\"}")).isEmpty();
        assertThat(protocol.decode("{\"channel\":\"unknown\",\"data\":{\"x\":1}}")).isEmpty();
    }

    @Test
    void malformedFramesRaiseTransportException() {
        assertThatThrownBy(() -> protocol.decode("{oops"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Unparseable");
        assertThatThrownBy(() -> protocol.decode("[1,2]"))
                .isInstanceOf(TransportException.class);
        assertThatThrownBy(() -> protocol.decode("{\"channel\":\"ticker\",\"data\":{\"last\":\"abc\"}}"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("last");
    }
}
