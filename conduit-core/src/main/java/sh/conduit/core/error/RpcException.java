// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Exception thrown when a JSON-RPC request fails.
 *
 * <p>
 * Raised for error envelopes returned by the endpoint (the code, message, error
 * data and raw response frame are kept) and for requests rejected locally, for
 * example when the provider is destroyed while they are still outstanding.
 *
 * <p>
 * <strong>Common Standard Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32600</strong>: Invalid JSON-RPC request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error, also used when the
 * endpoint's error envelope carries no code</li>
 * <li><strong>-32000 to -32099</strong>: Server/implementation-specific
 * errors</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends ConduitException {

    /** Code used when an error envelope has no usable {@code code} field. */
    public static final int UNKNOWN_ERROR_CODE = -32603;

    private final int code;
    private final String data;
    private final Long requestId;
    private final String response;

    public RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final String response,
            final Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
        this.response = response;
    }

    public RpcException(final int code, final String message, final String data, final Long requestId,
            final String response) {
        this(code, message, data, requestId, response, null);
    }

    public RpcException(final int code, final String message, final String data, final Throwable cause) {
        this(code, message, data, null, null, cause);
    }

    public RpcException(final int code, final String message, final Long requestId) {
        this(code, message, null, requestId, null, null);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    /**
     * Returns the raw response frame that carried the error, or {@code null}
     * when the failure was raised locally.
     */
    public String response() {
        return response;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
