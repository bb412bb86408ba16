// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Capabilities shared by streaming and polling JSON-RPC providers.
 *
 * <p>
 * Polling-related operations exist so callers can treat providers uniformly;
 * a streaming provider reports a zero polling interval and rejects attempts to
 * configure polling.
 */
public interface ConduitProvider extends RpcSender, AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the method name, e.g. {@code eth_blockNumber}
     * @param params positional parameters, serialized with Jackson
     * @return a future completed with the response's {@code result}, or failed with
     *         {@link sh.conduit.core.error.RpcException}
     */
    @Override
    CompletableFuture<Object> send(String method, List<?> params);

    /**
     * Resolves the chain id of the connected endpoint.
     *
     * @return the chain id
     */
    CompletableFuture<Long> detectNetwork();

    Duration pollingInterval();

    void setPollingInterval(Duration interval);

    void setPolling(boolean polling);

    void resetEventsBlock(long blockNumber);

    @Override
    void close();
}
