package com.trade.gridbot.trader.service.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trade.gridbot.trader.common.exception.TransportException;
import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.model.stream.ChannelSubscription;
import com.trade.gridbot.trader.model.stream.ControlEvent;
import com.trade.gridbot.trader.model.stream.OrderUpdateEvent;
import com.trade.gridbot.trader.model.stream.PositionEvent;
import com.trade.gridbot.trader.model.stream.StreamEvent;
import com.trade.gridbot.trader.model.stream.TickerEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Default JSON wire format.
 * <pre>
 * out: {"op":"subscribe","args":[{"channel":"ticker","symbol":"BTCUSDT"}]}
 *      {"op":"ping","ts":1700000000000}
 *      {"op":"login","args":{...}}
 * in:  {"channel":"ticker","data":{"symbol":"BTCUSDT","last":"65000.1","bid":"65000","ask":"65000.2","ts":...}}
 *      {"channel":"order","data":[{"orderId":"1","clientOrderId":"grid_...","side":"BUY","status":"FILLED",
 *                                  "filledQty":"0.01","avgPrice":"64000","ts":...}]}
 *      {"channel":"position","data":{"symbol":"BTCUSDT","size":"-0.02","entryPrice":"...","markPrice":"...","pnl":"..."}}
 *      {"op":"pong"} / {"event":"login","code":0} / {"event":"subscribe"} / {"event":"error","msg":"..."}
 * </pre>
 */
@Slf4j
public class JsonStreamProtocol implements StreamProtocol {

    private final ObjectMapper mapper;
    private final Supplier<Map<String, Object>> loginArgs;

    public JsonStreamProtocol(ObjectMapper mapper) {
        this(mapper, null);
    }

    /**
     * @param loginArgs supplies signed login arguments for private endpoints; null for public ones
     */
    public JsonStreamProtocol(ObjectMapper mapper, Supplier<Map<String, Object>> loginArgs) {
        this.mapper = mapper;
        this.loginArgs = loginArgs;
    }

    @Override
    public String subscriptionFrame(List<ChannelSubscription> channels, boolean subscribe) {
        List<Map<String, String>> args = new ArrayList<>(channels.size());
        for (ChannelSubscription c : channels) {
            Map<String, String> arg = new LinkedHashMap<>();
            arg.put("channel", c.channel());
            if (c.symbol() != null) arg.put("symbol", c.symbol());
            args.add(arg);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("op", subscribe ? "subscribe" : "unsubscribe");
        payload.put("args", args);
        return write(payload);
    }

    @Override
    public String pingFrame() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("op", "ping");
        payload.put("ts", System.currentTimeMillis());
        return write(payload);
    }

    @Override
    public Optional<String> authFrame() {
        if (loginArgs == null) return Optional.empty();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("op", "login");
        payload.put("args", loginArgs.get());
        return Optional.of(write(payload));
    }

    @Override
    public List<StreamEvent> decode(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new TransportException("MALFORMED_FRAME", "Unparseable stream frame", e);
        }
        if (root == null || !root.isObject()) {
            throw new TransportException("MALFORMED_FRAME", "Stream frame is not a JSON object", null);
        }

        String op = root.path("op").asText("");
        if ("pong".equalsIgnoreCase(op)) {
            return List.of(new ControlEvent(ControlEvent.Kind.PONG, null));
        }
        String event = root.path("event").asText("");
        if (!event.isBlank()) {
            return List.of(control(event, root));
        }

        String channel = root.path("channel").asText("");
        JsonNode data = root.path("data");
        if (channel.isBlank() || data.isMissingNode() || data.isNull()) {
            log.debug("Ignoring frame without channel/data: {}", text);
            return Collections.emptyList();
        }

        List<StreamEvent> out = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode row : data) addRow(out, channel, row);
        } else {
            addRow(out, channel, data);
        }
        return out;
    }

    // ---------------- decoding ----------------

    private ControlEvent control(String event, JsonNode root) {
        switch (event.toLowerCase(Locale.ROOT)) {
            case "login":
                return root.path("code").asInt(-1) == 0
                        ? new ControlEvent(ControlEvent.Kind.AUTH_OK, null)
                        : new ControlEvent(ControlEvent.Kind.ERROR, "login rejected: " + root.path("msg").asText(""));
            case "subscribe":
            case "unsubscribe":
                return new ControlEvent(ControlEvent.Kind.SUBSCRIBED, root.path("arg").toString());
            case "error":
                return new ControlEvent(ControlEvent.Kind.ERROR, root.path("msg").asText("unknown"));
            default:
                return new ControlEvent(ControlEvent.Kind.SUBSCRIBED, event);
        }
    }

    private void addRow(List<StreamEvent> out, String channel, JsonNode row) {
        if (row == null || !row.isObject()) return;
        Instant ts = timestamp(row);
        switch (channel) {
            case TickerEvent.CHANNEL:
                out.add(new TickerEvent(
                        row.path("symbol").asText(null),
                        decimal(row, "last"),
                        decimal(row, "bid"),
                        decimal(row, "ask"),
                        ts));
                break;
            case OrderUpdateEvent.CHANNEL:
                out.add(new OrderUpdateEvent(
                        row.path("symbol").asText(null),
                        row.path("orderId").asText(null),
                        row.path("clientOrderId").asText(null),
                        side(row.path("side").asText(null)),
                        OrderUpdateEvent.normalizeStatus(row.path("status").asText(null)),
                        decimal(row, "filledQty"),
                        decimal(row, "avgPrice"),
                        ts));
                break;
            case PositionEvent.CHANNEL:
                out.add(new PositionEvent(
                        row.path("symbol").asText(null),
                        orZero(decimal(row, "size")),
                        orZero(decimal(row, "entryPrice")),
                        orZero(decimal(row, "markPrice")),
                        orZero(decimal(row, "pnl")),
                        ts));
                break;
            default:
                log.debug("Ignoring row on unknown channel {}", channel);
        }
    }

    private static BigDecimal decimal(JsonNode row, String field) {
        JsonNode n = row.get(field);
        if (n == null || n.isNull()) return null;
        String s = n.asText("");
        if (s.isBlank()) return null;
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            throw new TransportException("MALFORMED_FRAME", "Field " + field + " is not a number: " + s, e);
        }
    }

    private static BigDecimal orZero(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }

    private static Instant timestamp(JsonNode row) {
        long ts = row.path("ts").asLong(0L);
        return ts > 0 ? Instant.ofEpochMilli(ts) : Instant.now();
    }

    private static OrderSide side(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("B")) return OrderSide.BUY;
        if (s.startsWith("S")) return OrderSide.SELL;
        return null;
    }

    private String write(Object payload) {
        try {
            return mapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode stream frame", e);
        }
    }
}
