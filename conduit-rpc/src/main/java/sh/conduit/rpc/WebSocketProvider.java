// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;
import sh.conduit.core.error.ChainMismatchException;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.model.LogEntry;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.types.Hash;
import sh.conduit.rpc.internal.RpcUtils;
import sh.conduit.rpc.transport.NettyWebSocketTransport;
import sh.conduit.rpc.transport.TransportFactory;
import sh.conduit.rpc.transport.TransportListener;
import sh.conduit.rpc.transport.WebSocketTransport;

/**
 * JSON-RPC provider over one persistent WebSocket connection.
 *
 * <p>
 * Concurrent requests are correlated by id; server pushes are routed to event
 * listeners by subscription id. Requests issued while the connection is not open
 * are queued and written, in order, as soon as it opens. An idle connection
 * (no inbound frame within {@link WebSocketConfig#timeout()}) is treated as dead.
 *
 * <p>
 * <strong>Reconnect:</strong> when enabled, a lost connection is re-established
 * after {@link WebSocketConfig#reconnectInterval()}, forever, and every event
 * with listeners is subscribed again. Requests that were already written to the
 * lost connection are <em>not</em> resent and stay pending until
 * {@link #destroy()}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (WebSocketProvider provider = WebSocketProvider.create(
 *         WebSocketConfig.builder("wss://eth.example.com").reconnect(true).build())) {
 *     Object block = provider.send("eth_blockNumber", List.of()).get();
 *     Subscription heads = provider.onBlock(number -> System.out.println("block " + number));
 *     ...
 *     heads.unsubscribe();
 * }
 * }</pre>
 *
 * <p>
 * <strong>Threading:</strong> subscription listeners run on the transport's I/O
 * thread in arrival order and must not block.
 */
public final class WebSocketProvider implements ConduitProvider {

    private static final Logger log = LoggerFactory.getLogger(WebSocketProvider.class);

    static final int NORMAL_CLOSURE = 1000;

    private static final Set<String> SUBSCRIPTION_METHODS = Set.of("eth_subscribe", "eth_unsubscribe");

    private final WebSocketConfig config;
    private final TransportFactory transportFactory;
    private final Timer timer;
    private final boolean ownsTimer;
    private final @Nullable EventLoopGroup ownedGroup;

    private final RequestTracker tracker = new RequestTracker();
    private final SubscriptionRegistry registry;
    private final EventListeners listeners = new EventListeners();
    private final EventDispatcher dispatcher;
    private final HeartbeatMonitor heartbeat;
    private final List<Consumer<DebugEvent>> debugListeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> destroyed = new CompletableFuture<>();

    // connection state, guarded by lock
    private final Object lock = new Object();
    private ConnectionState state = ConnectionState.CLOSED;
    private WebSocketTransport transport;
    private CompletableFuture<Void> connectSettled = CompletableFuture.completedFuture(null);
    private Timeout reconnectTimeout;
    private boolean destroying;
    private boolean openedBefore;

    // serializes listener changes with start/stop of their events
    private final Object eventLock = new Object();

    private CompletableFuture<Long> network;
    private volatile ConduitMetrics metrics = ConduitMetrics.noop();

    WebSocketProvider(
            final WebSocketConfig config,
            final TransportFactory transportFactory,
            final Timer timer,
            final boolean ownsTimer,
            final @Nullable EventLoopGroup ownedGroup) {
        rejectAnyNetwork(config);
        this.config = config;
        this.transportFactory = transportFactory;
        this.timer = timer;
        this.ownsTimer = ownsTimer;
        this.ownedGroup = ownedGroup;
        this.registry = new SubscriptionRegistry(this::send);
        this.dispatcher = new EventDispatcher(registry, this::send, listeners);
        this.heartbeat = new HeartbeatMonitor(timer, config.timeout(), this::onHeartbeatExpired);
    }

    /**
     * Creates a provider backed by Netty and starts connecting.
     *
     * @param config provider configuration
     * @return the provider; requests may be issued immediately
     * @throws UnsupportedOperationException if {@link WebSocketConfig#anyNetwork()} is set
     */
    public static WebSocketProvider create(final WebSocketConfig config) {
        rejectAnyNetwork(Objects.requireNonNull(config, "config"));
        final EventLoopGroup external = config.eventLoopGroup();
        final EventLoopGroup owned = external == null
                ? new NioEventLoopGroup(config.ioThreads(), new DefaultThreadFactory("conduit-ws", true))
                : null;
        final EventLoopGroup group = external != null ? external : owned;
        try {
            final WebSocketProvider provider = new WebSocketProvider(
                    config, NettyWebSocketTransport.factory(group), newTimer(), true, owned);
            provider.connect();
            return provider;
        } catch (RuntimeException e) {
            if (owned != null) {
                owned.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            }
            throw e;
        }
    }

    /**
     * Creates a provider with a custom transport and starts connecting.
     *
     * @param config           provider configuration
     * @param transportFactory creates one transport per connection attempt
     * @return the provider
     */
    public static WebSocketProvider create(final WebSocketConfig config, final TransportFactory transportFactory) {
        rejectAnyNetwork(Objects.requireNonNull(config, "config"));
        final WebSocketProvider provider = new WebSocketProvider(
                config,
                Objects.requireNonNull(transportFactory, "transportFactory"),
                newTimer(),
                true,
                null);
        provider.connect();
        return provider;
    }

    private static void rejectAnyNetwork(final WebSocketConfig config) {
        if (config.anyNetwork()) {
            throw new UnsupportedOperationException("WebSocketProvider does not support the \"any\" network");
        }
    }

    private static Timer newTimer() {
        return new HashedWheelTimer(new DefaultThreadFactory("conduit-timer", true), 10, TimeUnit.MILLISECONDS);
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Object> send(final String method, final List<?> params) {
        Objects.requireNonNull(method, "method");
        synchronized (lock) {
            if (destroying) {
                return CompletableFuture.failedFuture(
                        new RpcException(RpcException.UNKNOWN_ERROR_CODE, "Provider destroyed", (Long) null));
            }
        }

        final PendingRequest request = tracker.register(method, params);
        metrics.onRequestStarted(method);
        emitDebug(DebugEvent.request(request));

        final WebSocketTransport target;
        synchronized (lock) {
            if (destroying && tracker.remove(request)) {
                request.future().completeExceptionally(
                        new RpcException(RpcException.UNKNOWN_ERROR_CODE, "Provider destroyed", request.id()));
                return request.future();
            }
            target = state == ConnectionState.OPEN && tracker.claim(request) ? transport : null;
        }
        if (target != null) {
            write(target, request);
        }
        return request.future();
    }

    @Override
    public CompletableFuture<Long> detectNetwork() {
        synchronized (lock) {
            if (network == null) {
                final CompletableFuture<Long> detected = send("eth_chainId", List.of()).thenApply(this::checkChainId);
                detected.whenComplete((id, error) -> {
                    if (error != null) {
                        synchronized (lock) {
                            if (network == detected) {
                                network = null;
                            }
                        }
                    }
                });
                network = detected;
            }
            return network;
        }
    }

    private Long checkChainId(final Object result) {
        final Long actual = RpcUtils.decodeHexLong(result);
        if (actual == null) {
            throw new RpcException(RpcException.UNKNOWN_ERROR_CODE, "eth_chainId returned null", (Long) null);
        }
        final Long expected = config.chainId();
        if (expected != null && !expected.equals(actual)) {
            throw new ChainMismatchException(expected, actual);
        }
        return actual;
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    /**
     * Adds a listener; the first listener of an event starts its subscription.
     */
    public void on(final LogicalEvent event, final Consumer<Object> listener) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(listener, "listener");
        synchronized (eventLock) {
            if (isDestroyed()) {
                throw new IllegalStateException("Provider destroyed");
            }
            if (listeners.add(event, listener)) {
                dispatcher.start(event);
            }
        }
    }

    /**
     * Removes a listener; the subscription is released once the event has none.
     */
    public void off(final LogicalEvent event, final Consumer<Object> listener) {
        synchronized (eventLock) {
            if (listeners.remove(event, listener) && listeners.count(event) == 0) {
                dispatcher.stop(event);
            }
        }
    }

    /**
     * Starts the upstream subscription for an event regardless of listeners.
     */
    public void startEvent(final LogicalEvent event) {
        synchronized (eventLock) {
            dispatcher.start(event);
        }
    }

    /**
     * Stops the upstream subscription for an event.
     */
    public void stopEvent(final LogicalEvent event) {
        synchronized (eventLock) {
            dispatcher.stop(event);
        }
    }

    public Subscription onBlock(final Consumer<Long> listener) {
        return listen(LogicalEvent.block(), Long.class, listener);
    }

    public Subscription onPendingTransaction(final Consumer<Object> listener) {
        return listen(LogicalEvent.pending(), Object.class, listener);
    }

    public Subscription onLogs(final LogFilter filter, final Consumer<LogEntry> listener) {
        return listen(LogicalEvent.logs(filter), LogEntry.class, listener);
    }

    /**
     * Emits the receipt of {@code hash} once it is mined.
     */
    public Subscription onTransactionReceipt(final Hash hash, final Consumer<TransactionReceipt> listener) {
        return listen(LogicalEvent.transaction(hash), TransactionReceipt.class, listener);
    }

    private <T> Subscription listen(final LogicalEvent event, final Class<T> type, final Consumer<T> listener) {
        Objects.requireNonNull(listener, "listener");
        final Consumer<Object> adapter = payload -> listener.accept(type.cast(payload));
        on(event, adapter);
        return new Subscription() {
            @Override
            public String id() {
                return event.tag();
            }

            @Override
            public void unsubscribe() {
                off(event, adapter);
            }
        };
    }

    /**
     * @return the number of listeners registered for an event
     */
    public int listenerCount(final LogicalEvent event) {
        return listeners.count(event);
    }

    /**
     * @return the last block number emitted to {@code block} listeners, or -1
     */
    public long getLastEmittedBlock() {
        return dispatcher.lastEmittedBlock();
    }

    // ---------------------------------------------------------------------
    // Polling (unsupported)
    // ---------------------------------------------------------------------

    @Override
    public Duration pollingInterval() {
        return Duration.ZERO;
    }

    @Override
    public void setPollingInterval(final Duration interval) {
        throw new UnsupportedOperationException("WebSocketProvider does not poll");
    }

    @Override
    public void setPolling(final boolean polling) {
        if (polling) {
            throw new UnsupportedOperationException("WebSocketProvider does not poll");
        }
    }

    @Override
    public void resetEventsBlock(final long blockNumber) {
        throw new UnsupportedOperationException("WebSocketProvider does not support resetEventsBlock");
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    /**
     * Registers a listener for request/response tracing.
     */
    public void addDebugListener(final Consumer<DebugEvent> listener) {
        debugListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeDebugListener(final Consumer<DebugEvent> listener) {
        debugListeners.remove(listener);
    }

    /**
     * Sets the metrics collector.
     *
     * @param metrics the collector; must not be null
     */
    public void setMetrics(final ConduitMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ConnectionState getConnectionState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getPendingRequestCount() {
        return tracker.size();
    }

    public long getOrphanedResponseCount() {
        return tracker.orphanedResponses();
    }

    // ---------------------------------------------------------------------
    // Teardown
    // ---------------------------------------------------------------------

    /**
     * Closes the connection for good.
     *
     * <p>
     * Waits for an in-progress connect to settle, cancels any scheduled reconnect,
     * closes with code 1000 and rejects every outstanding request. Later requests
     * are rejected immediately. Idempotent.
     *
     * @return a future completed once teardown is done
     */
    public CompletableFuture<Void> destroy() {
        final CompletableFuture<Void> settled;
        synchronized (lock) {
            if (destroying) {
                return destroyed;
            }
            destroying = true;
            if (reconnectTimeout != null) {
                reconnectTimeout.cancel();
                reconnectTimeout = null;
            }
            settled = state == ConnectionState.CONNECTING ? connectSettled : CompletableFuture.completedFuture(null);
        }
        settled.whenComplete((v, e) -> finishDestroy());
        return destroyed;
    }

    @Override
    public void close() {
        destroy().join();
    }

    private boolean isDestroyed() {
        synchronized (lock) {
            return destroying;
        }
    }

    private void finishDestroy() {
        final WebSocketTransport current;
        synchronized (lock) {
            state = ConnectionState.CLOSING;
            current = transport;
        }
        heartbeat.stop();
        if (current != null) {
            current.close(NORMAL_CLOSURE);
        }

        final List<PendingRequest> outstanding = tracker.drain();
        for (PendingRequest request : outstanding) {
            final RpcException error = new RpcException(
                    RpcException.UNKNOWN_ERROR_CODE, "Provider destroyed", request.id());
            request.future().completeExceptionally(error);
            metrics.onRequestFailed(request.method(), error);
        }
        registry.invalidate();

        synchronized (lock) {
            state = ConnectionState.CLOSED;
        }
        if (ownsTimer) {
            try {
                timer.stop();
            } catch (IllegalStateException e) {
                // stop() is refused from a timer task; the timer thread is a daemon
                log.debug("Timer not stopped: {}", e.getMessage());
            }
        }
        if (ownedGroup != null) {
            ownedGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        log.info("WebSocketProvider for {} destroyed ({} request(s) rejected)", config.url(), outstanding.size());
        destroyed.complete(null);
    }

    // ---------------------------------------------------------------------
    // Connection lifecycle
    // ---------------------------------------------------------------------

    void connect() {
        final WebSocketTransport next;
        synchronized (lock) {
            if (destroying) {
                return;
            }
            reconnectTimeout = null;
            state = ConnectionState.CONNECTING;
            connectSettled = new CompletableFuture<>();
            final Connection connection = new Connection();
            next = transportFactory.create(config, connection);
            connection.transport = next;
            transport = next;
        }
        DebugLogger.logConnection(LogFormatter.formatConnection(ConnectionState.CONNECTING.name(), config.url()));
        try {
            next.connect();
        } catch (RuntimeException e) {
            onTerminated(next, -1, "", e);
        }
    }

    private void onOpen(final WebSocketTransport source) {
        final boolean reconnected;
        final CompletableFuture<Void> settled;
        synchronized (lock) {
            if (source != transport || state != ConnectionState.CONNECTING) {
                return;
            }
            settled = connectSettled;
            reconnected = openedBefore;
            openedBefore = true;
        }

        heartbeat.reset();
        final boolean opened = flushQueued(source);
        settled.complete(null);
        if (!opened) {
            // lost during the flush, or destroy() was waiting for this connect and now closes it
            return;
        }

        log.info("Connected to {}", config.url());
        DebugLogger.logConnection(LogFormatter.formatConnection(ConnectionState.OPEN.name(), config.url()));
        if (reconnected) {
            metrics.onReconnect();
        }
        synchronized (eventLock) {
            if (!isDestroyed()) {
                dispatcher.resubscribe();
            }
        }
    }

    /**
     * Writes queued requests in issue order, then publishes OPEN once the queue
     * is empty so that no direct send can overtake a queued request.
     *
     * @return false if the connection was lost or abandoned before it opened
     */
    private boolean flushQueued(final WebSocketTransport source) {
        while (true) {
            final List<PendingRequest> flush;
            synchronized (lock) {
                if (source != transport || state != ConnectionState.CONNECTING || destroying) {
                    return false;
                }
                flush = tracker.claimUnwritten();
                if (flush.isEmpty()) {
                    state = ConnectionState.OPEN;
                    return true;
                }
            }
            for (PendingRequest request : flush) {
                write(source, request);
            }
        }
    }

    private void onMessage(final WebSocketTransport source, final String text) {
        synchronized (lock) {
            if (source != transport || destroying) {
                return;
            }
        }
        heartbeat.reset();

        final JsonNode frame;
        try {
            frame = RpcUtils.MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed frame: {}", e.getOriginalMessage());
            return;
        }
        if (frame == null || !frame.isObject()) {
            log.warn("Dropping non-object frame: {}", text);
            return;
        }

        final JsonNode id = frame.get("id");
        if (id != null && !id.isNull()) {
            onResponse(id, frame, text);
        } else if ("eth_subscription".equals(frame.path("method").asText(null))) {
            onNotification(frame, text);
        } else {
            log.warn("Dropping unrecognized frame: {}", text);
        }
    }

    private void onResponse(final JsonNode idNode, final JsonNode frame, final String text) {
        final long id;
        if (idNode.isIntegralNumber() && idNode.canConvertToLong()) {
            id = idNode.asLong();
        } else if (idNode.isTextual()) {
            try {
                id = Long.parseLong(idNode.asText());
            } catch (NumberFormatException e) {
                log.warn("Dropping response with non-numeric id: {}", text);
                return;
            }
        } else {
            log.warn("Dropping response with unsupported id: {}", text);
            return;
        }

        final RequestTracker.Completion completion = tracker.complete(id, frame, text);
        if (completion == null) {
            metrics.onOrphanedResponse();
            return;
        }
        final PendingRequest request = completion.request();
        final long micros = request.elapsedNanos() / 1_000;
        if (completion.error() == null) {
            metrics.onRequestCompleted(request.method(), Duration.ofNanos(request.elapsedNanos()));
            DebugLogger.logRpc(LogFormatter.formatRpc(request.method(), id, micros));
        } else {
            final RpcException error = completion.error();
            metrics.onRequestFailed(request.method(), error);
            DebugLogger.logRpc(LogFormatter.formatRpcError(request.method(), id, error.code(), error.getMessage(),
                    micros));
        }
        emitDebug(DebugEvent.response(request, completion.result(), completion.error()));
    }

    private void onNotification(final JsonNode frame, final String text) {
        final JsonNode params = frame.get("params");
        final JsonNode subscription = params == null ? null : params.get("subscription");
        if (subscription == null || subscription.isNull()) {
            log.warn("Dropping subscription push without id: {}", text);
            return;
        }
        final String subscriptionId = subscription.asText();
        metrics.onSubscriptionNotification(subscriptionId);
        final Object payload = RpcUtils.MAPPER.convertValue(params.get("result"), Object.class);
        registry.deliver(subscriptionId, payload);
    }

    private void onTerminated(
            final WebSocketTransport source, final int code, final String reason, final @Nullable Throwable cause) {
        final boolean wasOpen;
        final boolean reconnecting;
        final CompletableFuture<Void> settled;
        synchronized (lock) {
            if (source != transport || state == ConnectionState.CLOSED) {
                return;
            }
            wasOpen = state == ConnectionState.OPEN;
            if (state != ConnectionState.CLOSING) {
                state = ConnectionState.CLOSED;
            }
            settled = connectSettled;
            reconnecting = config.reconnect() && !destroying;
            if (reconnecting) {
                reconnectTimeout = timer.newTimeout(
                        t -> connect(), config.reconnectInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        heartbeat.stop();
        registry.invalidate();
        rejectQueuedSubscriptionCalls();
        settled.complete(null);
        if (cause != null) {
            source.terminate();
        }

        if (wasOpen) {
            metrics.onConnectionLost();
        }
        if (cause != null) {
            log.warn("Connection to {} failed: {}", config.url(), cause.getMessage());
        } else if (code == NORMAL_CLOSURE) {
            log.info("Connection to {} closed (code={})", config.url(), code);
        } else {
            log.warn("Connection to {} closed (code={}, reason={})", config.url(), code, reason);
        }
        DebugLogger.logConnection(LogFormatter.formatConnection(ConnectionState.CLOSED.name(), config.url()));
        if (reconnecting) {
            log.info("Reconnecting to {} in {}ms", config.url(), config.reconnectInterval().toMillis());
        }
    }

    /**
     * Subscription ids are scoped to one connection, so queued subscribe and
     * unsubscribe calls are dropped instead of being flushed on the next one.
     * Subscriptions that still have listeners are reissued on open.
     */
    private void rejectQueuedSubscriptionCalls() {
        for (PendingRequest request : tracker.removeUnwritten(SUBSCRIPTION_METHODS)) {
            final RpcException error = new RpcException(
                    RpcException.UNKNOWN_ERROR_CODE, "Connection lost before request was sent", request.id());
            metrics.onRequestFailed(request.method(), error);
            request.future().completeExceptionally(error);
        }
    }

    private void onHeartbeatExpired() {
        final WebSocketTransport current;
        synchronized (lock) {
            if (state != ConnectionState.OPEN) {
                return;
            }
            current = transport;
        }
        metrics.onHeartbeatTimeout();
        log.warn("No traffic from {} within {}ms, terminating connection", config.url(), config.timeout().toMillis());
        current.terminate();
    }

    private void write(final WebSocketTransport target, final PendingRequest request) {
        DebugLogger.logRpc(LogFormatter.formatRpcSend(request.method(), request.id(), request.payload()));
        target.send(request.payload());
    }

    private void emitDebug(final DebugEvent event) {
        for (Consumer<DebugEvent> listener : debugListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Debug listener failed", e);
            }
        }
    }

    /**
     * Listener bound to exactly one transport; callbacks from superseded
     * transports are ignored by the provider.
     */
    private final class Connection implements TransportListener {
        private volatile WebSocketTransport transport;

        @Override
        public void onOpen() {
            WebSocketProvider.this.onOpen(transport);
        }

        @Override
        public void onMessage(final String text) {
            WebSocketProvider.this.onMessage(transport, text);
        }

        @Override
        public void onClose(final int code, final String reason) {
            onTerminated(transport, code, reason, null);
        }

        @Override
        public void onError(final Throwable cause) {
            onTerminated(transport, -1, "", cause);
        }
    }
}
