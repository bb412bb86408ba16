// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import org.jspecify.annotations.Nullable;

/**
 * Tracing event published to listeners registered with
 * {@link WebSocketProvider#addDebugListener}.
 *
 * @param action   whether the request was sent or its response arrived
 * @param id       the correlation id
 * @param method   the JSON-RPC method
 * @param request  the serialized request envelope
 * @param result   the result on success, {@code null} otherwise
 * @param error    the failure when the endpoint returned an error envelope
 */
public record DebugEvent(
        Action action,
        long id,
        String method,
        String request,
        @Nullable Object result,
        @Nullable Throwable error) {

    public enum Action {
        REQUEST,
        RESPONSE
    }

    static DebugEvent request(final PendingRequest request) {
        return new DebugEvent(Action.REQUEST, request.id(), request.method(), request.payload(), null, null);
    }

    static DebugEvent response(final PendingRequest request, final @Nullable Object result,
            final @Nullable Throwable error) {
        return new DebugEvent(Action.RESPONSE, request.id(), request.method(), request.payload(), result, error);
    }
}
