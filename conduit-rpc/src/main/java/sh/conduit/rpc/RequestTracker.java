// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.conduit.core.error.RpcException;
import sh.conduit.rpc.internal.RpcUtils;

/**
 * Correlates outbound requests with inbound responses by id.
 *
 * <p>
 * Ids come from one process-wide counter and are never reused, so a late
 * response can never be matched to a newer request. Requests are kept in
 * insertion order so queued requests are flushed in the order they were issued.
 *
 * <p>
 * Futures are always completed after the tracker lock is released.
 */
final class RequestTracker {

    private static final Logger log = LoggerFactory.getLogger(RequestTracker.class);

    static final String UNKNOWN_ERROR = "unknown error";

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final Map<Long, PendingRequest> pending = new LinkedHashMap<>();
    private final LongAdder orphanedResponses = new LongAdder();

    /**
     * Outcome of a completed request.
     */
    record Completion(PendingRequest request, @Nullable Object result, @Nullable RpcException error) {}

    /**
     * Allocates an id, serializes the envelope and stores the request as unwritten.
     *
     * @throws IllegalArgumentException if the params cannot be serialized
     */
    PendingRequest register(final String method, final List<?> params) {
        final long id = NEXT_ID.getAndIncrement();
        final String payload;
        try {
            payload = RpcUtils.MAPPER.writeValueAsString(JsonRpcRequest.of(method, params, id));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize params for " + method, e);
        }
        final PendingRequest request = new PendingRequest(id, method, payload);
        synchronized (this) {
            pending.put(id, request);
        }
        return request;
    }

    /**
     * Marks the request written if it is still pending and unwritten.
     *
     * @return true if the caller must now write it
     */
    synchronized boolean claim(final PendingRequest request) {
        if (request.written() || !pending.containsKey(request.id())) {
            return false;
        }
        request.markWritten();
        return true;
    }

    /**
     * Marks every unwritten request written and returns them in insertion order.
     * Requests already written on an earlier connection are left alone.
     */
    synchronized List<PendingRequest> claimUnwritten() {
        final List<PendingRequest> flush = new ArrayList<>();
        for (PendingRequest request : pending.values()) {
            if (!request.written()) {
                request.markWritten();
                flush.add(request);
            }
        }
        return flush;
    }

    /**
     * Removes the unwritten requests whose method is one of {@code methods}.
     */
    synchronized List<PendingRequest> removeUnwritten(final Set<String> methods) {
        final List<PendingRequest> removed = new ArrayList<>();
        final Iterator<PendingRequest> it = pending.values().iterator();
        while (it.hasNext()) {
            final PendingRequest request = it.next();
            if (!request.written() && methods.contains(request.method())) {
                it.remove();
                removed.add(request);
            }
        }
        return removed;
    }

    /**
     * Resolves or rejects the request matching the frame's id.
     *
     * @param id    the correlation id of the frame
     * @param frame the parsed response
     * @param raw   the frame text, attached to errors
     * @return the completion, or null if no request was pending under that id
     */
    @Nullable Completion complete(final long id, final JsonNode frame, final String raw) {
        final PendingRequest request;
        synchronized (this) {
            request = pending.remove(id);
        }
        if (request == null) {
            orphanedResponses.increment();
            log.debug("Dropping response for unknown request id {}", id);
            return null;
        }

        if (frame.has("result")) {
            final Object result = RpcUtils.MAPPER.convertValue(frame.get("result"), Object.class);
            request.future().complete(result);
            return new Completion(request, result, null);
        }

        final RpcException error = toException(id, frame.get("error"), raw);
        request.future().completeExceptionally(error);
        return new Completion(request, null, error);
    }

    /**
     * Removes one request without completing it.
     *
     * @return true if it was still pending
     */
    synchronized boolean remove(final PendingRequest request) {
        return pending.remove(request.id(), request);
    }

    /**
     * Removes every pending request, written or not.
     */
    synchronized List<PendingRequest> drain() {
        final List<PendingRequest> drained = new ArrayList<>(pending.values());
        pending.clear();
        return drained;
    }

    synchronized int size() {
        return pending.size();
    }

    long orphanedResponses() {
        return orphanedResponses.sum();
    }

    private static RpcException toException(final long id, final @Nullable JsonNode errorNode, final String raw) {
        JsonRpcError error = null;
        if (errorNode != null && errorNode.isObject()) {
            try {
                error = RpcUtils.MAPPER.treeToValue(errorNode, JsonRpcError.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("Unreadable error member in response {}: {}", id, e.getMessage());
            }
        }
        final int code = error != null && error.code() != null ? error.code() : RpcException.UNKNOWN_ERROR_CODE;
        final String message = error != null && error.message() != null ? error.message() : UNKNOWN_ERROR;
        final String data = error != null ? RpcUtils.extractErrorData(error.data()) : null;
        return new RpcException(code, message, data, id, raw);
    }
}
