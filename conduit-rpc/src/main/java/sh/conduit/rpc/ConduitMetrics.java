// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.time.Duration;

/**
 * Interface for collecting metrics from the Conduit RPC layer.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or a custom collector.
 * By default a no-op implementation is used ({@link #noop()}).
 *
 * <pre>{@code
 * WebSocketProvider provider = WebSocketProvider.create(config);
 * provider.setMetrics(new MyMicrometerMetrics(meterRegistry));
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> methods may be called concurrently from
 * caller threads, the transport thread and the timer thread.
 */
public interface ConduitMetrics {

    /**
     * Called when a request is registered.
     *
     * @param method the JSON-RPC method name (e.g., "eth_call")
     */
    default void onRequestStarted(String method) {
    }

    /**
     * Called when a request resolves with a result.
     *
     * @param method  the JSON-RPC method name
     * @param latency time from registration to response
     */
    default void onRequestCompleted(String method, Duration latency) {
    }

    /**
     * Called when a request is rejected, by the endpoint or by destroy.
     *
     * @param method the JSON-RPC method name
     * @param error  the failure
     */
    default void onRequestFailed(String method, Throwable error) {
    }

    /**
     * Called when a response arrives for an id with no pending request.
     */
    default void onOrphanedResponse() {
    }

    /**
     * Called when an open connection is lost.
     */
    default void onConnectionLost() {
    }

    /**
     * Called when a connection opens after a previous one was lost.
     */
    default void onReconnect() {
    }

    /**
     * Called when no inbound traffic arrived within the heartbeat window.
     */
    default void onHeartbeatTimeout() {
    }

    /**
     * Called when a subscription notification is received.
     *
     * @param subscriptionId the subscription ID
     */
    default void onSubscriptionNotification(String subscriptionId) {
    }

    /**
     * Returns a no-op metrics implementation.
     *
     * @return a no-op ConduitMetrics instance
     */
    static ConduitMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of ConduitMetrics.
 */
enum NoopMetrics implements ConduitMetrics {
    INSTANCE
}
