// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.transport;

/**
 * Callback slots of a {@link WebSocketTransport}.
 *
 * <p>
 * For a given transport the callbacks are never invoked concurrently with each other.
 */
public interface TransportListener {

    void onOpen();

    void onMessage(String text);

    void onClose(int code, String reason);

    void onError(Throwable cause);
}
