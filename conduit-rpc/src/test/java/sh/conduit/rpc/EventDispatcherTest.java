// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.conduit.core.model.LogEntry;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

class EventDispatcherTest {

    private static final Address CONTRACT = new Address("0x" + "a".repeat(40));
    private static final Hash TX = new Hash("0x" + "1".repeat(64));
    private static final Hash TOPIC = new Hash("0x" + "2".repeat(64));

    private final RecordingSender sender = new RecordingSender();
    private final EventListeners listeners = new EventListeners();
    private SubscriptionRegistry registry;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(sender);
        dispatcher = new EventDispatcher(registry, sender, listeners);
    }

    @Test
    void blockEventEmitsNumberAndRecordsIt() {
        List<Object> blocks = new ArrayList<>();
        listen(LogicalEvent.block(), blocks::add);
        sender.respond("eth_subscribe", "0xs1");

        registry.deliver("0xs1", Map.of("number", "0x1b4", "hash", "0xfeed"));

        assertEquals(List.of(436L), blocks);
        assertEquals(436L, dispatcher.lastEmittedBlock());
        assertEquals(List.of("newHeads"), sender.paramsOf("eth_subscribe").get(0));
    }

    @Test
    void pendingEventEmitsRawPayload() {
        List<Object> hashes = new ArrayList<>();
        listen(LogicalEvent.pending(), hashes::add);
        sender.respond("eth_subscribe", "0xs2");

        registry.deliver("0xs2", TX.value());

        assertEquals(List.of(TX.value()), hashes);
        assertEquals(List.of("newPendingTransactions"), sender.paramsOf("eth_subscribe").get(0));
    }

    @Test
    void filterEventDefaultsRemovedAndFormatsLog() {
        LogFilter filter = LogFilter.byContract(CONTRACT, List.of(TOPIC));
        List<Object> logs = new ArrayList<>();
        listen(LogicalEvent.logs(filter), logs::add);
        sender.respond("eth_subscribe", "0xs3");

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("address", CONTRACT.value());
        raw.put("topics", List.of(TOPIC.value()));
        raw.put("data", "0x");
        raw.put("blockNumber", "0x10");
        raw.put("transactionHash", TX.value());
        raw.put("logIndex", "0x2");
        registry.deliver("0xs3", raw);

        LogEntry entry = assertInstanceOf(LogEntry.class, logs.get(0));
        assertFalse(entry.removed());
        assertEquals(16L, entry.blockNumber());
        assertEquals(2L, entry.logIndex());
        assertEquals(List.of("logs", filter.toParams()), sender.paramsOf("eth_subscribe").get(0));
    }

    @Test
    void malformedPushIsDroppedWithoutEmission() {
        List<Object> blocks = new ArrayList<>();
        listen(LogicalEvent.block(), blocks::add);
        sender.respond("eth_subscribe", "0xs1");

        assertTrue(registry.deliver("0xs1", "not a header"));

        assertTrue(blocks.isEmpty());
    }

    @Test
    void transactionWatchChecksImmediatelyAndEmitsOnce() {
        List<Object> receipts = new ArrayList<>();
        listen(LogicalEvent.transaction(TX), receipts::add);

        // immediate check: not mined yet
        sender.respond("eth_getTransactionReceipt", null);
        sender.respond("eth_subscribe", "0xtx");
        assertTrue(receipts.isEmpty());

        registry.deliver("0xtx", Map.of("number", "0x2"));
        sender.respond("eth_getTransactionReceipt", receipt());
        registry.deliver("0xtx", Map.of("number", "0x3"));

        // no further lookups once the receipt has been emitted
        assertEquals(2, sender.paramsOf("eth_getTransactionReceipt").size());
        assertEquals(1, receipts.size());
        TransactionReceipt receipt = assertInstanceOf(TransactionReceipt.class, receipts.get(0));
        assertEquals(TX, receipt.transactionHash());
        assertTrue(receipt.status());
    }

    @Test
    void transactionWatchesShareOneSubscription() {
        Hash other = new Hash("0x" + "3".repeat(64));
        Consumer<Object> first = payload -> { };
        Consumer<Object> second = payload -> { };
        listen(LogicalEvent.transaction(TX), first);
        listen(LogicalEvent.transaction(other), second);

        assertEquals(1, sender.paramsOf("eth_subscribe").size());
        assertTrue(registry.hasTag("tx"));

        unlisten(LogicalEvent.transaction(TX), first);
        assertTrue(registry.hasTag("tx"));

        unlisten(LogicalEvent.transaction(other), second);
        assertFalse(registry.hasTag("tx"));
    }

    @Test
    void resubscribeRestartsEventsWithoutRegistryEntry() {
        listen(LogicalEvent.block(), payload -> { });
        listen(LogicalEvent.pending(), payload -> { });

        registry.invalidate();
        dispatcher.resubscribe();

        assertEquals(4, sender.paramsOf("eth_subscribe").size());
        assertTrue(registry.hasTag("block"));
        assertTrue(registry.hasTag("pending"));
    }

    private void listen(LogicalEvent event, Consumer<Object> listener) {
        if (listeners.add(event, listener)) {
            dispatcher.start(event);
        }
    }

    private void unlisten(LogicalEvent event, Consumer<Object> listener) {
        if (listeners.remove(event, listener) && listeners.count(event) == 0) {
            dispatcher.stop(event);
        }
    }

    private static Map<String, Object> receipt() {
        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("transactionHash", TX.value());
        receipt.put("blockHash", "0x" + "4".repeat(64));
        receipt.put("blockNumber", "0x2");
        receipt.put("from", "0x" + "b".repeat(40));
        receipt.put("to", CONTRACT.value());
        receipt.put("contractAddress", null);
        receipt.put("logs", List.of());
        receipt.put("status", "0x1");
        receipt.put("cumulativeGasUsed", "0x5208");
        return receipt;
    }

    /**
     * Records calls and leaves each future open until {@link #respond} completes
     * the oldest unanswered call for that method.
     */
    static final class RecordingSender implements RpcSender {
        private final List<String> methods = new ArrayList<>();
        private final List<List<?>> params = new ArrayList<>();
        private final List<CompletableFuture<Object>> futures = new ArrayList<>();

        @Override
        public CompletableFuture<Object> send(String method, List<?> params) {
            CompletableFuture<Object> future = new CompletableFuture<>();
            methods.add(method);
            this.params.add(params);
            futures.add(future);
            return future;
        }

        void respond(String method, Object result) {
            for (int i = 0; i < methods.size(); i++) {
                if (methods.get(i).equals(method) && !futures.get(i).isDone()) {
                    futures.get(i).complete(result);
                    return;
                }
            }
            throw new AssertionError("No open " + method + " call; calls=" + methods);
        }

        List<List<?>> paramsOf(String method) {
            List<List<?>> matching = new ArrayList<>();
            for (int i = 0; i < methods.size(); i++) {
                if (methods.get(i).equals(method)) {
                    matching.add(params.get(i));
                }
            }
            return matching;
        }
    }
}
