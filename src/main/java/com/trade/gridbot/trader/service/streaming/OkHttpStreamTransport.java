package com.trade.gridbot.trader.service.streaming;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import java.util.concurrent.atomic.AtomicReference;

/**
 * WebSocket transport on OkHttp. OkHttp's reader thread only forwards frames to the listener.
 */
@Slf4j
@RequiredArgsConstructor
public class OkHttpStreamTransport implements StreamTransport {

    private final OkHttpClient httpClient;

    @Override
    public Connection open(String url, Listener listener) {
        OkHttpConnection connection = new OkHttpConnection();
        WebSocket ws = httpClient.newWebSocket(new Request.Builder().url(url).build(), new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                connection.bind(webSocket);
                listener.onOpen(connection);
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                listener.onText(connection, text);
            }

            @Override
            public void onMessage(WebSocket webSocket, ByteString bytes) {
                listener.onText(connection, bytes.utf8());
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(code, reason);
            }

            @Override
            public void onClosed(WebSocket webSocket, int code, String reason) {
                listener.onClosed(connection, code, reason);
            }

            @Override
            public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                listener.onFailure(connection, t);
            }
        });
        connection.bind(ws);
        return connection;
    }

    private static final class OkHttpConnection implements Connection {

        private final AtomicReference<WebSocket> socket = new AtomicReference<>();

        void bind(WebSocket ws) {
            socket.compareAndSet(null, ws);
        }

        @Override
        public boolean send(String text) {
            WebSocket ws = socket.get();
            return ws != null && ws.send(text);
        }

        @Override
        public void close(int code, String reason) {
            WebSocket ws = socket.get();
            if (ws == null) return;
            if (!ws.close(code, reason)) {
                log.debug("WebSocket already closing; cancelling");
                ws.cancel();
            }
        }
    }
}
