package com.trade.gridbot.trader.service.streaming;

/**
 * Raw text-frame transport underneath the streaming client.
 */
public interface StreamTransport {

    /**
     * Starts opening a connection. Progress is reported through {@code listener}, possibly
     * before this method returns.
     */
    Connection open(String url, Listener listener);

    interface Connection {

        /** Enqueues a frame; false when the connection can no longer accept writes. */
        boolean send(String text);

        void close(int code, String reason);
    }

    interface Listener {

        void onOpen(Connection connection);

        void onText(Connection connection, String text);

        void onClosed(Connection connection, int code, String reason);

        void onFailure(Connection connection, Throwable error);
    }
}
