// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.transport;

/**
 * One physical WebSocket connection attempt.
 *
 * <p>
 * A transport is single-use: once it reports close or error it is discarded and
 * a new one is created for the next attempt. Lifecycle events are reported to the
 * {@link TransportListener} it was created with.
 */
public interface WebSocketTransport {

    /**
     * Starts opening the connection. Returns immediately; the outcome is reported
     * through {@link TransportListener#onOpen()} or
     * {@link TransportListener#onError(Throwable)}.
     */
    void connect();

    /**
     * Writes one text frame. Write failures are logged, not thrown.
     *
     * @param text the frame payload
     */
    void send(String text);

    /**
     * Starts a graceful close with the given status code.
     *
     * @param code WebSocket close code, e.g. 1000
     */
    void close(int code);

    /**
     * Drops the connection without a close handshake.
     */
    void terminate();

    /**
     * @return whether the upgrade completed and the connection is still up
     */
    boolean isOpen();
}
