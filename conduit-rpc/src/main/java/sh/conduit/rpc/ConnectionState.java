// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

/**
 * Lifecycle of the single physical connection owned by {@link WebSocketProvider}.
 *
 * <pre>
 * CONNECTING ---(open)---------> OPEN
 *     ^  |                        |
 *     |  | (error)                | (close / error / heartbeat timeout)
 *     |  v                        v
 *     +-- CLOSED &lt;----------------+
 *  (reconnect, only if enabled)
 *
 * any state ---(destroy)---> CLOSING ---> CLOSED
 * </pre>
 *
 * <p>Requests issued while not {@link #OPEN} are queued and written on the next open.
 */
public enum ConnectionState {
    /** A transport has been created and is opening. */
    CONNECTING,
    /** The transport is open; requests are written immediately. */
    OPEN,
    /** {@link WebSocketProvider#destroy()} is closing the transport. */
    CLOSING,
    /** No live transport. A reconnect may be scheduled. */
    CLOSED
}
