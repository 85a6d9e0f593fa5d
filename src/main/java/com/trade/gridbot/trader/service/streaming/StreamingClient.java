package com.trade.gridbot.trader.service.streaming;

import com.trade.gridbot.trader.common.Result;
import com.trade.gridbot.trader.common.constants.GridConstants;
import com.trade.gridbot.trader.common.exception.TransportException;
import com.trade.gridbot.trader.enums.StreamState;
import com.trade.gridbot.trader.model.stream.ChannelSubscription;
import com.trade.gridbot.trader.model.stream.ControlEvent;
import com.trade.gridbot.trader.model.stream.StreamEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reconnecting stream client.
 * <p>
 * Threads: the transport's reader thread decodes frames and enqueues them; a single
 * dispatch thread runs every listener callback in arrival order; one scheduler thread
 * drives the heartbeat and reconnect timers. State is guarded by {@code lock}.
 * Callbacks from a connection that has since been replaced are ignored.
 */
@Slf4j
public class StreamingClient {

    private static final int NORMAL_CLOSE = 1000;

    private final String name;
    private final StreamTransport transport;
    private final StreamProtocol protocol;
    private final StreamingClientSettings settings;
    private final StreamListener listener;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService dispatcher;
    private final boolean ownsExecutors;
    private final ThreadLocal<Boolean> inDispatch = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final Object lock = new Object();
    private final Map<String, ChannelSubscription> active = new LinkedHashMap<>();

    private volatile StreamState state = StreamState.DISCONNECTED;
    private StreamTransport.Connection connection;
    private String url;
    private boolean shouldReconnect;
    private volatile long generation;   // written under lock, read lock-free by onText
    private int attempt;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> heartbeatTask;
    private long lastPingNanos;

    public StreamingClient(String name,
                           StreamTransport transport,
                           StreamProtocol protocol,
                           StreamingClientSettings settings,
                           StreamListener listener) {
        this(name, transport, protocol, settings, listener,
                Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "stream-timer-" + name)),
                Executors.newSingleThreadExecutor(r -> daemon(r, "stream-dispatch-" + name)),
                true);
    }

    /**
     * Uses caller-owned executors. {@code dispatcher} must run tasks one at a time in submission order.
     */
    public StreamingClient(String name,
                           StreamTransport transport,
                           StreamProtocol protocol,
                           StreamingClientSettings settings,
                           StreamListener listener,
                           ScheduledExecutorService scheduler,
                           ExecutorService dispatcher) {
        this(name, transport, protocol, settings, listener, scheduler, dispatcher, false);
    }

    private StreamingClient(String name,
                            StreamTransport transport,
                            StreamProtocol protocol,
                            StreamingClientSettings settings,
                            StreamListener listener,
                            ScheduledExecutorService scheduler,
                            ExecutorService dispatcher,
                            boolean ownsExecutors) {
        this.name = Objects.requireNonNull(name, "name");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.settings = settings == null ? StreamingClientSettings.builder().build() : settings;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.ownsExecutors = ownsExecutors;
    }

    // ---------------- lifecycle ----------------

    public Result<Void> connect(String url) {
        synchronized (lock) {
            if (state != StreamState.DISCONNECTED) {
                return Result.fail(GridConstants.ALREADY_CONNECTED, "Stream " + name + " is " + state);
            }
            this.url = Objects.requireNonNull(url, "url");
            this.shouldReconnect = true;
            this.attempt = 0;
            startHeartbeatLocked();
            openLocked();
        }
        return Result.ok();
    }

    /**
     * Stops reconnecting and closes the connection. Subscriptions are kept for the next connect.
     */
    public void disconnect() {
        synchronized (lock) {
            shouldReconnect = false;
            generation++;
            cancel(reconnectTask);
            cancel(heartbeatTask);
            reconnectTask = null;
            heartbeatTask = null;
            if (connection != null) {
                try {
                    connection.close(NORMAL_CLOSE, "client disconnect");
                } catch (RuntimeException e) {
                    log.debug("[{}] close failed: {}", name, e.getMessage());
                }
                connection = null;
            }
            setStateLocked(StreamState.DISCONNECTED);
        }
    }

    /**
     * Disconnects and stops the executors this client created itself.
     */
    public void shutdown() {
        disconnect();
        if (!ownsExecutors) return;
        scheduler.shutdownNow();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(1, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }

    // ---------------- subscriptions ----------------

    /**
     * Adds channels to the active set. Channels already active are skipped. A request that
     * would push the set past the limit is rejected as a whole.
     *
     * @return the channels that were newly added
     */
    public Result<List<ChannelSubscription>> subscribe(Collection<ChannelSubscription> channels) {
        synchronized (lock) {
            Map<String, ChannelSubscription> fresh = new LinkedHashMap<>();
            for (ChannelSubscription c : channels) {
                if (!active.containsKey(c.key())) fresh.putIfAbsent(c.key(), c);
            }
            if (active.size() + fresh.size() > settings.getSubscriptionLimit()) {
                return Result.fail(GridConstants.SUBSCRIPTION_LIMIT, String.format(
                        "Stream %s: %d active + %d new exceeds limit %d",
                        name, active.size(), fresh.size(), settings.getSubscriptionLimit()));
            }
            active.putAll(fresh);
            List<ChannelSubscription> added = new ArrayList<>(fresh.values());
            if (state.isOpen() && !added.isEmpty()) {
                sendBatchesLocked(added, true);
            }
            return Result.ok(added);
        }
    }

    /**
     * @return the channels that were active and have been removed
     */
    public Result<List<ChannelSubscription>> unsubscribe(Collection<ChannelSubscription> channels) {
        synchronized (lock) {
            List<ChannelSubscription> removed = new ArrayList<>();
            for (ChannelSubscription c : channels) {
                ChannelSubscription r = active.remove(c.key());
                if (r != null) removed.add(r);
            }
            if (state.isOpen() && !removed.isEmpty()) {
                sendBatchesLocked(removed, false);
            }
            return Result.ok(removed);
        }
    }

    public List<ChannelSubscription> getActiveSubscriptions() {
        synchronized (lock) {
            return List.copyOf(active.values());
        }
    }

    // ---------------- outbound ----------------

    public Result<Void> send(String message) {
        synchronized (lock) {
            return sendLocked(message);
        }
    }

    private Result<Void> sendLocked(String message) {
        if (!state.isOpen() || connection == null) {
            return Result.fail(GridConstants.NOT_CONNECTED, "Stream " + name + " is " + state);
        }
        if (!connection.send(message)) {
            return Result.fail(GridConstants.SEND_FAILED, "Stream " + name + " rejected the frame");
        }
        return Result.ok();
    }

    private void sendBatchesLocked(List<ChannelSubscription> channels, boolean subscribe) {
        int batch = Math.max(1, settings.getSubscriptionBatchSize());
        for (int i = 0; i < channels.size(); i += batch) {
            List<ChannelSubscription> slice = channels.subList(i, Math.min(i + batch, channels.size()));
            Result<Void> r = sendLocked(protocol.subscriptionFrame(slice, subscribe));
            if (r.isFailure()) {
                log.warn("[{}] {} frame not sent: {}", name, subscribe ? "subscribe" : "unsubscribe", r.getError());
                return;
            }
        }
    }

    // ---------------- dispatch ----------------

    public void runOnDispatch(Runnable task) {
        dispatch(task);
    }

    /**
     * Runs {@code task} on the dispatch thread, inline when already on it.
     */
    public <T> CompletableFuture<T> callOnDispatch(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable body = () -> {
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        };
        if (isDispatchThread()) {
            body.run();
        } else if (!dispatch(body)) {
            future.completeExceptionally(new IllegalStateException("Stream " + name + " dispatcher is shut down"));
        }
        return future;
    }

    public boolean isDispatchThread() {
        return inDispatch.get();
    }

    private boolean dispatch(Runnable task) {
        try {
            dispatcher.execute(() -> {
                inDispatch.set(Boolean.TRUE);
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[{}] dispatch handler failed", name, e);
                } finally {
                    inDispatch.remove();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("[{}] dispatcher rejected task: {}", name, e.getMessage());
            return false;
        }
    }

    private void dispatchError(Throwable error) {
        dispatch(() -> listener.onError(error));
    }

    // ---------------- state ----------------

    public StreamState getState() {
        return state;
    }

    public int getReconnectAttempts() {
        synchronized (lock) {
            return attempt;
        }
    }

    public String getName() {
        return name;
    }

    private void setStateLocked(StreamState next) {
        StreamState prev = state;
        if (prev == next) return;
        state = next;
        log.info("[{}] stream {} -> {}", name, prev, next);
        dispatch(() -> listener.onStateChange(prev, next));
    }

    // ---------------- connection management ----------------

    private void openLocked() {
        setStateLocked(StreamState.CONNECTING);
        long gen = ++generation;
        try {
            StreamTransport.Connection c = transport.open(url, new TransportCallbacks(gen));
            if (gen == generation && connection == null) {
                connection = c;
            }
        } catch (RuntimeException e) {
            log.warn("[{}] open {} failed: {}", name, url, e.getMessage());
            if (gen == generation) handleDropLocked(e);
        }
    }

    private void handleDropLocked(Throwable cause) {
        connection = null;
        if (!shouldReconnect) {
            setStateLocked(StreamState.DISCONNECTED);
            return;
        }
        ReconnectPolicy policy = settings.getReconnect();
        if (policy == null || !policy.isEnabled() || policy.isExhausted(attempt)) {
            shouldReconnect = false;
            cancel(heartbeatTask);
            heartbeatTask = null;
            setStateLocked(StreamState.DISCONNECTED);
            String reason = cause == null ? "closed" : cause.getMessage();
            log.error("[{}] giving up after {} reconnect attempts: {}", name, attempt, reason);
            dispatchError(new TransportException("RECONNECT_EXHAUSTED",
                    "Stream " + name + " gave up after " + attempt + " attempts", cause));
            return;
        }
        Duration delay = policy.delayFor(attempt);
        attempt++;
        generation++;
        setStateLocked(StreamState.RECONNECTING);
        log.warn("[{}] reconnect #{} in {} ms", name, attempt, delay.toMillis());
        reconnectTask = scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        synchronized (lock) {
            if (!shouldReconnect || state != StreamState.RECONNECTING) return;
            reconnectTask = null;
            openLocked();
        }
    }

    private void startHeartbeatLocked() {
        cancel(heartbeatTask);
        long every = Math.max(1L, settings.getHeartbeatCheckInterval().toMillis());
        heartbeatTask = scheduler.scheduleAtFixedRate(this::heartbeatTick, every, every, TimeUnit.MILLISECONDS);
    }

    private void heartbeatTick() {
        synchronized (lock) {
            if (!state.isOpen()) return;
            long now = System.nanoTime();
            if (now - lastPingNanos < settings.getHeartbeatInterval().toNanos()) return;
            lastPingNanos = now;
            Result<Void> r = sendLocked(protocol.pingFrame());
            if (r.isFailure()) log.debug("[{}] ping not sent: {}", name, r.getError());
        }
    }

    private static void cancel(ScheduledFuture<?> f) {
        if (f != null) f.cancel(false);
    }

    private static Thread daemon(Runnable r, String threadName) {
        Thread t = new Thread(r, threadName);
        t.setDaemon(true);
        return t;
    }

    /**
     * Transport callbacks bound to one connection attempt.
     */
    private final class TransportCallbacks implements StreamTransport.Listener {

        private final long gen;

        TransportCallbacks(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(StreamTransport.Connection conn) {
            synchronized (lock) {
                if (gen != generation) {
                    conn.close(NORMAL_CLOSE, "superseded");
                    return;
                }
                connection = conn;
                attempt = 0;
                lastPingNanos = System.nanoTime();
                setStateLocked(StreamState.CONNECTED);
                protocol.authFrame().ifPresent(frame -> {
                    Result<Void> r = sendLocked(frame);
                    if (r.isFailure()) log.warn("[{}] auth frame not sent: {}", name, r.getError());
                });
                if (!active.isEmpty()) {
                    sendBatchesLocked(new ArrayList<>(active.values()), true);
                }
            }
        }

        @Override
        public void onText(StreamTransport.Connection conn, String text) {
            if (gen != generation) return;
            List<StreamEvent> events;
            try {
                events = protocol.decode(text);
            } catch (TransportException e) {
                log.warn("[{}] dropping frame: {}", name, e.getMessage());
                dispatchError(e);
                return;
            }
            for (StreamEvent event : events) {
                if (event instanceof ControlEvent) {
                    onControl((ControlEvent) event);
                } else {
                    dispatch(() -> listener.onMessage(event));
                }
            }
        }

        @Override
        public void onClosed(StreamTransport.Connection conn, int code, String reason) {
            synchronized (lock) {
                if (gen != generation) return;
                log.warn("[{}] closed by peer: {} {}", name, code, reason);
                handleDropLocked(null);
            }
        }

        @Override
        public void onFailure(StreamTransport.Connection conn, Throwable error) {
            synchronized (lock) {
                if (gen != generation) return;
                log.warn("[{}] transport failure: {}", name, error == null ? "unknown" : error.getMessage());
                handleDropLocked(error);
            }
        }

        private void onControl(ControlEvent control) {
            switch (control.kind()) {
                case PONG:
                    log.debug("[{}] pong", name);
                    break;
                case AUTH_OK:
                    synchronized (lock) {
                        if (gen == generation && state == StreamState.CONNECTED) {
                            setStateLocked(StreamState.AUTHENTICATED);
                        }
                    }
                    break;
                case ERROR:
                    log.warn("[{}] server error: {}", name, control.detail());
                    dispatchError(new TransportException("STREAM_ERROR", control.detail(), null));
                    break;
                default:
                    log.debug("[{}] ack {}", name, control.detail());
            }
        }
    }
}
