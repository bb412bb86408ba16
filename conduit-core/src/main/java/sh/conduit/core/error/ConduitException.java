// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Base runtime exception for all Conduit failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ConduitException
 * ├── {@link RpcException} - JSON-RPC protocol and connection failures
 * ├── {@link ChainMismatchException} - connected chain differs from the expected one
 * └── {@link PayloadFormatException} - subscription payload could not be formatted
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * provider.send("eth_call", params).exceptionally(e -> {
 *     if (e.getCause() instanceof RpcException rpc) {
 *         // endpoint returned an error envelope, or the provider was destroyed
 *     }
 *     return null;
 * });
 * }</pre>
 */
public sealed class ConduitException extends RuntimeException
        permits RpcException,
        ChainMismatchException,
        PayloadFormatException {

    public ConduitException(final String message) {
        super(message);
    }

    public ConduitException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
