package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.service.streaming.OkHttpStreamTransport;
import com.trade.gridbot.trader.service.streaming.StreamTransport;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OkHttpStreamTransportTest {

    private MockWebServer server;
    private OkHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = new OkHttpClient();
    }

    @AfterEach
    void tearDown() throws Exception {
        client.dispatcher().executorService().shutdown();
        server.shutdown();
    }

    @Test
    void forwardsFramesBothWaysAndReportsClose() throws Exception {
        BlockingQueue<String> serverReceived = new LinkedBlockingQueue<>();
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send("{\"op\":\"pong\"}");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                serverReceived.add(text);
                webSocket.close(1000, "bye");
            }
        }));

        CountDownLatch opened = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);
        BlockingQueue<String> clientReceived = new LinkedBlockingQueue<>();
        StreamTransport.Listener listener = new StreamTransport.Listener() {
            @Override
            public void onOpen(StreamTransport.Connection connection) {
                opened.countDown();
            }

            @Override
            public void onText(StreamTransport.Connection connection, String text) {
                clientReceived.add(text);
            }

            @Override
            public void onClosed(StreamTransport.Connection connection, int code, String reason) {
                closed.countDown();
            }

            @Override
            public void onFailure(StreamTransport.Connection connection, Throwable error) {
                closed.countDown();
            }
        };

        StreamTransport.Connection connection = new OkHttpStreamTransport(client)
                .open(server.url("/ws").toString(), listener);

        assertThat(opened.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(clientReceived.poll(5, TimeUnit.SECONDS)).isEqualTo("{\"op\":\"pong\"}");

        assertThat(connection.send("{\"op\":\"ping\"}")).isTrue();
        assertThat(serverReceived.poll(5, TimeUnit.SECONDS)).isEqualTo("{\"op\":\"ping\"}");
        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void refusedUpgradeIsAFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        CountDownLatch failed = new CountDownLatch(1);

        new OkHttpStreamTransport(client).open(server.url("/ws").toString(), new StreamTransport.Listener() {
            @Override
            public void onOpen(StreamTransport.Connection connection) {
            }

            @Override
            public void onText(StreamTransport.Connection connection, String text) {
            }

            @Override
            public void onClosed(StreamTransport.Connection connection, int code, String reason) {
            }

            @Override
            public void onFailure(StreamTransport.Connection connection, Throwable error) {
                failed.countDown();
            }
        });

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
