// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a correlated JSON-RPC request and completes with its {@code result}.
 */
@FunctionalInterface
public interface RpcSender {

    CompletableFuture<Object> send(String method, List<?> params);
}
