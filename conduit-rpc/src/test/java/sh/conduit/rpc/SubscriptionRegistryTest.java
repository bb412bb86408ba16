// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscriptionRegistryTest {

    @Mock
    private RpcSender sender;

    private final CompletableFuture<Object> subscribeResponse = new CompletableFuture<>();
    private final List<Object> delivered = new ArrayList<>();
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(sender);
    }

    @Test
    void subscribesAndDeliversInOrder() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);

        CompletableFuture<String> id = registry.subscribe("block", List.of("newHeads"), delivered::add);
        subscribeResponse.complete("0xabc");

        assertEquals("0xabc", id.join());
        assertTrue(registry.deliver("0xabc", 1));
        assertTrue(registry.deliver("0xabc", 2));
        assertEquals(List.of(1, 2), delivered);
    }

    @Test
    void secondSubscribeForTagIsNoOp() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);
        List<Object> other = new ArrayList<>();

        CompletableFuture<String> first = registry.subscribe("block", List.of("newHeads"), delivered::add);
        CompletableFuture<String> second = registry.subscribe("block", List.of("newHeads"), other::add);
        subscribeResponse.complete("0xabc");
        registry.deliver("0xabc", "head");

        assertSame(first, second);
        verify(sender, times(1)).send(eq("eth_subscribe"), anyList());
        assertEquals(List.of("head"), delivered);
        assertTrue(other.isEmpty());
    }

    @Test
    void waitsForDeferredParams() {
        CompletableFuture<List<?>> params = new CompletableFuture<>();

        registry.subscribe("pending", params, delivered::add);

        verify(sender, never()).send(eq("eth_subscribe"), anyList());
        assertTrue(registry.hasTag("pending"));

        when(sender.send("eth_subscribe", List.of("newPendingTransactions"))).thenReturn(subscribeResponse);
        params.complete(List.of("newPendingTransactions"));
        verify(sender).send("eth_subscribe", List.of("newPendingTransactions"));
    }

    @Test
    void releaseUnsubscribesResolvedId() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);
        when(sender.send("eth_unsubscribe", List.of("0xabc"))).thenReturn(CompletableFuture.completedFuture(true));
        registry.subscribe("block", List.of("newHeads"), delivered::add);
        subscribeResponse.complete("0xabc");

        registry.release("block");

        verify(sender).send("eth_unsubscribe", List.of("0xabc"));
        assertFalse(registry.hasTag("block"));
        assertFalse(registry.deliver("0xabc", "late"));
        assertTrue(delivered.isEmpty());
    }

    @Test
    void releaseBeforeResolutionUnsubscribesOnResolution() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);
        when(sender.send("eth_unsubscribe", List.of("0xabc"))).thenReturn(CompletableFuture.completedFuture(true));
        registry.subscribe("block", List.of("newHeads"), delivered::add);

        registry.release("block");
        verify(sender, never()).send(eq("eth_unsubscribe"), anyList());

        subscribeResponse.complete("0xabc");

        verify(sender).send("eth_unsubscribe", List.of("0xabc"));
        assertFalse(registry.deliver("0xabc", "head"));
        assertEquals(0, registry.size());
    }

    @Test
    void releaseOfUnknownTagIsNoOp() {
        registry.release("nothing");

        verify(sender, never()).send(eq("eth_unsubscribe"), anyList());
    }

    @Test
    void unknownSubscriptionIdIsDropped() {
        assertFalse(registry.deliver("0xstale", "payload"));
    }

    @Test
    void throwingCallbackDoesNotPropagate() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);
        registry.subscribe("block", List.of("newHeads"), payload -> {
            throw new IllegalStateException("listener bug");
        });
        subscribeResponse.complete("0xabc");

        assertTrue(registry.deliver("0xabc", "head"));
    }

    @Test
    void lateResolutionAfterInvalidateIsUnsubscribed() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);
        when(sender.send("eth_unsubscribe", List.of("0xold"))).thenReturn(CompletableFuture.completedFuture(true));
        registry.subscribe("block", List.of("newHeads"), delivered::add);

        registry.invalidate();
        subscribeResponse.complete("0xold");

        assertFalse(registry.hasTag("block"));
        assertFalse(registry.deliver("0xold", "head"));
        verify(sender).send("eth_unsubscribe", List.of("0xold"));
    }

    @Test
    void deferredParamsAfterInvalidateAreNotSent() {
        CompletableFuture<List<?>> params = new CompletableFuture<>();
        CompletableFuture<String> id = registry.subscribe("pending", params, delivered::add);

        registry.invalidate();
        params.complete(List.of("newPendingTransactions"));

        verify(sender, never()).send(eq("eth_subscribe"), anyList());
        assertTrue(id.isCompletedExceptionally());
        assertFalse(registry.hasTag("pending"));
    }

    @Test
    void failedSubscribeForgetsTag() {
        when(sender.send("eth_subscribe", List.of("newHeads"))).thenReturn(subscribeResponse);
        CompletableFuture<String> id = registry.subscribe("block", List.of("newHeads"), delivered::add);

        subscribeResponse.completeExceptionally(new IllegalStateException("rejected"));

        assertTrue(id.isCompletedExceptionally());
        assertFalse(registry.hasTag("block"));
    }
}
