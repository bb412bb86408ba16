// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;
import sh.conduit.core.error.RpcException;
import sh.conduit.rpc.internal.RpcUtils;

class RequestTrackerTest {

    private final RequestTracker tracker = new RequestTracker();

    @Test
    void serializesEnvelopeInFieldOrder() {
        PendingRequest request = tracker.register("eth_getBalance", List.of("0xabc", "latest"));

        assertEquals("{\"method\":\"eth_getBalance\",\"params\":[\"0xabc\",\"latest\"],\"id\":" + request.id()
                + ",\"jsonrpc\":\"2.0\"}", request.payload());
    }

    @Test
    void idsIncreaseAcrossTrackers() {
        PendingRequest first = tracker.register("eth_chainId", List.of());
        PendingRequest second = new RequestTracker().register("eth_chainId", List.of());
        PendingRequest third = tracker.register("eth_chainId", List.of());

        assertTrue(first.id() < second.id());
        assertTrue(second.id() < third.id());
    }

    @Test
    void claimUnwrittenReturnsInsertionOrderOnce() {
        PendingRequest a = tracker.register("a", List.of());
        PendingRequest b = tracker.register("b", List.of());
        assertTrue(tracker.claim(a));

        PendingRequest c = tracker.register("c", List.of());

        assertEquals(List.of(b, c), tracker.claimUnwritten());
        assertTrue(tracker.claimUnwritten().isEmpty());
        assertFalse(tracker.claim(b));
    }

    @Test
    void resolvesResult() throws Exception {
        PendingRequest request = tracker.register("eth_blockNumber", List.of());

        RequestTracker.Completion completion = tracker.complete(request.id(),
                frame("{\"jsonrpc\":\"2.0\",\"id\":" + request.id() + ",\"result\":\"0x10\"}"), "raw");

        assertNotNull(completion);
        assertEquals("0x10", request.future().get());
        assertEquals(0, tracker.size());
    }

    @Test
    void explicitNullResultResolves() throws Exception {
        PendingRequest request = tracker.register("eth_getTransactionReceipt", List.of("0x1"));

        tracker.complete(request.id(), frame("{\"id\":" + request.id() + ",\"result\":null}"), "raw");

        assertTrue(request.future().isDone());
        assertNull(request.future().get());
    }

    @Test
    void rejectsWithEndpointError() {
        PendingRequest request = tracker.register("eth_call", List.of());
        String raw = "{\"id\":" + request.id()
                + ",\"error\":{\"code\":-32000,\"message\":\"execution reverted\",\"data\":{\"data\":\"0x08c3\"}}}";

        RequestTracker.Completion completion = tracker.complete(request.id(), frame(raw), raw);

        RpcException error = completion.error();
        assertEquals(-32000, error.code());
        assertEquals("[requestId=" + request.id() + "] execution reverted", error.getMessage());
        assertEquals("0x08c3", error.data());
        assertEquals(raw, error.response());
        ExecutionException thrown = org.junit.jupiter.api.Assertions.assertThrows(
                ExecutionException.class, () -> request.future().get());
        assertInstanceOf(RpcException.class, thrown.getCause());
    }

    @Test
    void fallsBackToUnknownError() {
        PendingRequest request = tracker.register("eth_call", List.of());

        RequestTracker.Completion completion = tracker.complete(request.id(),
                frame("{\"id\":" + request.id() + "}"), "{}");

        assertEquals(RpcException.UNKNOWN_ERROR_CODE, completion.error().code());
        assertTrue(completion.error().getMessage().endsWith("unknown error"));
    }

    @Test
    void orphanedResponseIsCountedNotThrown() {
        assertNull(tracker.complete(Long.MAX_VALUE, frame("{\"id\":1,\"result\":\"0x1\"}"), "raw"));
        assertNull(tracker.complete(Long.MAX_VALUE, frame("{\"id\":1,\"error\":{}}"), "raw"));

        assertEquals(2, tracker.orphanedResponses());
    }

    @Test
    void drainRemovesEverything() {
        tracker.register("a", List.of());
        tracker.register("b", List.of());

        assertEquals(2, tracker.drain().size());
        assertEquals(0, tracker.size());
    }

    private static JsonNode frame(String json) {
        try {
            return RpcUtils.MAPPER.readTree(json);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
