package com.trade.gridbot.trader.test.service;

import com.trade.gridbot.trader.service.streaming.StreamTransport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport. Opens synchronously when {@code autoOpen} is set, otherwise the test
 * drives the callbacks through {@link #lastListener()}.
 */
class FakeStreamTransport implements StreamTransport {

    final List<Listener> listeners = new CopyOnWriteArrayList<>();
    final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    volatile boolean autoOpen;
    volatile RuntimeException failOnOpen;

    @Override
    public Connection open(String url, Listener listener) {
        if (failOnOpen != null) throw failOnOpen;
        FakeConnection c = new FakeConnection();
        listeners.add(listener);
        connections.add(c);
        if (autoOpen) listener.onOpen(c);
        return c;
    }

    Listener lastListener() {
        return listeners.get(listeners.size() - 1);
    }

    FakeConnection lastConnection() {
        return connections.get(connections.size() - 1);
    }

    void openLast() {
        lastListener().onOpen(lastConnection());
    }

    void push(String frame) {
        lastListener().onText(lastConnection(), frame);
    }

    void dropLast() {
        lastListener().onFailure(lastConnection(), new IOException("connection reset"));
    }

    List<String> allSent() {
        List<String> out = new ArrayList<>();
        connections.forEach(c -> out.addAll(c.sent));
        return out;
    }

    static class FakeConnection implements Connection {
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        @Override
        public boolean send(String text) {
            if (closed) return false;
            sent.add(text);
            return true;
        }

        @Override
        public void close(int code, String reason) {
            closed = true;
        }
    }
}
