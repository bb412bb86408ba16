// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.transport;

import sh.conduit.rpc.WebSocketConfig;

/**
 * Creates an unconnected transport for one connection attempt.
 */
@FunctionalInterface
public interface TransportFactory {

    WebSocketTransport create(WebSocketConfig config, TransportListener listener);
}
