// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.conduit.core.error.PayloadFormatException;
import sh.conduit.core.model.LogEntry;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.types.Hash;
import sh.conduit.rpc.internal.LogParser;
import sh.conduit.rpc.internal.RpcUtils;

/**
 * Turns logical events into upstream subscriptions and formats their pushes.
 *
 * <ul>
 * <li>{@code block}: {@code newHeads}, emits the block number as a {@code Long}</li>
 * <li>{@code pending}: {@code newPendingTransactions}, emits the raw payload</li>
 * <li>filter: {@code logs} with the filter object, emits a {@link LogEntry}</li>
 * <li>transaction: receipt lookup on every new head through the shared
 * {@code tx} subscription, emits the {@link TransactionReceipt} once</li>
 * </ul>
 *
 * <p>
 * Callers serialize {@link #start} and {@link #stop}; {@link #stop} is only
 * called once the event has no listeners left.
 */
final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final SubscriptionRegistry registry;
    private final RpcSender sender;
    private final EventListeners listeners;

    private final Set<Hash> receiptsEmitted = ConcurrentHashMap.newKeySet();
    private volatile long lastEmittedBlock = -1;

    EventDispatcher(final SubscriptionRegistry registry, final RpcSender sender, final EventListeners listeners) {
        this.registry = registry;
        this.sender = sender;
        this.listeners = listeners;
    }

    void start(final LogicalEvent event) {
        switch (event.kind()) {
            case BLOCK:
                registry.subscribe(event.registryTag(), List.of("newHeads"), this::deliverBlock);
                break;
            case PENDING:
                registry.subscribe(event.registryTag(), List.of("newPendingTransactions"),
                        payload -> listeners.emit(event, payload));
                break;
            case FILTER:
                registry.subscribe(event.registryTag(), List.of("logs", event.filter().toParams()),
                        payload -> deliverLog(event, payload));
                break;
            case TRANSACTION:
                checkReceipt(event);
                registry.subscribe(event.registryTag(), List.of("newHeads"), head -> checkWatchedReceipts());
                break;
            default:
                throw new IllegalArgumentException("Unknown event kind: " + event.kind());
        }
    }

    void stop(final LogicalEvent event) {
        if (event.kind() == LogicalEvent.Kind.TRANSACTION) {
            receiptsEmitted.remove(event.transactionHash());
            if (listeners.count(LogicalEvent.Kind.TRANSACTION) == 0) {
                registry.release(event.registryTag());
            }
            return;
        }
        registry.release(event.registryTag());
    }

    /**
     * Restarts every event that has listeners but no registry entry. Called after
     * a connection opens.
     */
    void resubscribe() {
        for (LogicalEvent event : listeners.activeEvents()) {
            if (!registry.hasTag(event.registryTag())) {
                start(event);
            }
        }
    }

    long lastEmittedBlock() {
        return lastEmittedBlock;
    }

    private void deliverBlock(final Object payload) {
        final Long number = RpcUtils.decodeHexLong(asMap(payload, "block header").get("number"));
        if (number == null) {
            throw new PayloadFormatException("Block header without number: " + payload);
        }
        lastEmittedBlock = number;
        listeners.emit(LogicalEvent.block(), number);
    }

    private void deliverLog(final LogicalEvent event, final Object payload) {
        final Map<String, Object> raw = new LinkedHashMap<>(asMap(payload, "log"));
        if (raw.get("removed") == null) {
            raw.put("removed", false);
        }
        final LogEntry entry = LogParser.parseLog(raw);
        listeners.emit(event, entry);
    }

    private void checkWatchedReceipts() {
        for (LogicalEvent event : listeners.activeEvents(LogicalEvent.Kind.TRANSACTION)) {
            if (!receiptsEmitted.contains(event.transactionHash())) {
                checkReceipt(event);
            }
        }
    }

    private void checkReceipt(final LogicalEvent event) {
        final Hash hash = event.transactionHash();
        sender.send("eth_getTransactionReceipt", List.of(hash.value()))
                .thenAccept(result -> {
                    if (result == null || listeners.count(event) == 0) {
                        return;
                    }
                    final TransactionReceipt receipt = LogParser.parseReceipt(asMap(result, "receipt"));
                    if (receiptsEmitted.add(hash)) {
                        listeners.emit(event, receipt);
                    }
                })
                .exceptionally(error -> {
                    log.warn("Receipt check for {} failed: {}", hash.value(), error.getMessage());
                    return null;
                });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(final Object payload, final String what) {
        if (!(payload instanceof Map)) {
            throw new PayloadFormatException("Expected " + what + " object, got: " + payload);
        }
        return (Map<String, Object>) payload;
    }
}
