// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;

/**
 * Maps logical tags to server-assigned subscription ids and ids to delivery
 * callbacks.
 *
 * <p>
 * A tag owns at most one upstream subscription. Subscribing a tag that is
 * already pending or resolved returns the existing subscription and keeps the
 * first callback. Subscription ids only mean something on the connection that
 * issued them, so {@link #invalidate()} drops everything when that connection
 * is lost and ignores any resolution that arrives afterwards.
 */
final class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final RpcSender sender;

    private final Map<String, CompletableFuture<String>> tagToId = new HashMap<>();
    private final Map<String, SubscriptionEntry> entries = new HashMap<>();
    private long epoch;

    SubscriptionRegistry(final RpcSender sender) {
        this.sender = sender;
    }

    /**
     * Subscribes {@code tag} unless it is already known.
     *
     * @param tag     logical key
     * @param params  {@code eth_subscribe} params, possibly still being computed
     * @param deliver receives each push, in arrival order
     * @return a future of the subscription id
     */
    CompletableFuture<String> subscribe(
            final String tag, final CompletionStage<List<?>> params, final Consumer<Object> deliver) {
        final CompletableFuture<String> idFuture = new CompletableFuture<>();
        final long issuedIn;
        synchronized (this) {
            final CompletableFuture<String> existing = tagToId.get(tag);
            if (existing != null) {
                return existing;
            }
            tagToId.put(tag, idFuture);
            issuedIn = epoch;
        }

        params.thenCompose(p -> isCurrent(issuedIn)
                ? sender.send("eth_subscribe", p)
                : CompletableFuture.<Object>failedFuture(new IllegalStateException("Connection lost before subscribing")))
                .whenComplete((result, error) -> {
                    if (error != null) {
                        onSubscribeFailed(tag, idFuture, error);
                    } else {
                        onSubscribed(tag, idFuture, issuedIn, String.valueOf(result), deliver);
                    }
                });
        return idFuture;
    }

    CompletableFuture<String> subscribe(final String tag, final List<?> params, final Consumer<Object> deliver) {
        return subscribe(tag, CompletableFuture.completedFuture(params), deliver);
    }

    /**
     * Forgets {@code tag} and unsubscribes upstream once its id is known.
     * Unknown tags are ignored.
     */
    void release(final String tag) {
        final CompletableFuture<String> idFuture;
        final long releasedIn;
        synchronized (this) {
            idFuture = tagToId.remove(tag);
            releasedIn = epoch;
        }
        if (idFuture == null) {
            return;
        }
        idFuture.thenAccept(id -> {
            final boolean known;
            synchronized (this) {
                known = releasedIn == epoch && entries.remove(id) != null;
            }
            if (known) {
                unsubscribe(tag, id);
            }
        });
    }

    /**
     * Hands a push to the callback registered for {@code subscriptionId}.
     *
     * @return false if the id is unknown and the push was dropped
     */
    boolean deliver(final String subscriptionId, final Object payload) {
        final SubscriptionEntry entry;
        synchronized (this) {
            entry = entries.get(subscriptionId);
        }
        if (entry == null) {
            log.debug("Dropping push for unknown subscription {}", subscriptionId);
            return false;
        }
        try {
            entry.deliver().accept(payload);
        } catch (RuntimeException e) {
            log.error("Subscription callback for tag {} failed", entry.tag(), e);
        }
        return true;
    }

    /**
     * Drops every tag and entry. Called when the connection that owns them is lost.
     */
    void invalidate() {
        final int dropped;
        synchronized (this) {
            epoch++;
            dropped = tagToId.size();
            tagToId.clear();
            entries.clear();
        }
        if (dropped > 0) {
            log.debug("Invalidated {} subscription(s)", dropped);
        }
    }

    private synchronized boolean isCurrent(final long issuedIn) {
        return issuedIn == epoch;
    }

    synchronized boolean hasTag(final String tag) {
        return tagToId.containsKey(tag);
    }

    synchronized int size() {
        return entries.size();
    }

    private void onSubscribed(
            final String tag,
            final CompletableFuture<String> idFuture,
            final long issuedIn,
            final String id,
            final Consumer<Object> deliver) {
        final boolean stored;
        synchronized (this) {
            stored = issuedIn == epoch && tagToId.get(tag) == idFuture;
            if (stored) {
                entries.put(id, new SubscriptionEntry(tag, deliver));
            }
        }
        if (stored) {
            DebugLogger.logRpc(LogFormatter.formatSubscribed(tag, id));
        } else {
            // released or invalidated before the id arrived
            unsubscribe(tag, id);
        }
        idFuture.complete(id);
    }

    private void onSubscribeFailed(final String tag, final CompletableFuture<String> idFuture, final Throwable failure) {
        final Throwable error = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        synchronized (this) {
            tagToId.remove(tag, idFuture);
        }
        log.warn("Subscribe for tag {} failed: {}", tag, error.getMessage());
        idFuture.completeExceptionally(error);
    }

    private void unsubscribe(final String tag, final String id) {
        DebugLogger.logRpc(LogFormatter.formatUnsubscribed(tag, id));
        sender.send("eth_unsubscribe", List.of(id)).whenComplete((ok, error) -> {
            if (error != null) {
                log.debug("eth_unsubscribe {} failed: {}", id, error.getMessage());
            }
        });
    }
}
