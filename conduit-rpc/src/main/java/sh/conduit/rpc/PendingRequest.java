// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.concurrent.CompletableFuture;

/**
 * An issued request awaiting its response.
 *
 * <p>
 * {@code written} is only read and changed under the {@link RequestTracker} lock.
 */
final class PendingRequest {

    private final long id;
    private final String method;
    private final String payload;
    private final CompletableFuture<Object> future = new CompletableFuture<>();
    private final long startNanos = System.nanoTime();
    private boolean written;

    PendingRequest(final long id, final String method, final String payload) {
        this.id = id;
        this.method = method;
        this.payload = payload;
    }

    long id() {
        return id;
    }

    String method() {
        return method;
    }

    /** Serialized envelope, exactly as written to the wire. */
    String payload() {
        return payload;
    }

    CompletableFuture<Object> future() {
        return future;
    }

    long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    boolean written() {
        return written;
    }

    void markWritten() {
        written = true;
    }
}
