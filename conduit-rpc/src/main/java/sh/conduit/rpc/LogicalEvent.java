// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.conduit.core.types.Hash;

/**
 * A user-visible event stream: new blocks, pending transactions, logs matching a
 * filter, or the receipt of one transaction.
 *
 * <p>
 * Listeners are keyed by event; equal events share listeners and one upstream
 * subscription.
 *
 * @param kind            which stream
 * @param tag             unique key of this event
 * @param filter          set for {@link Kind#FILTER}
 * @param transactionHash set for {@link Kind#TRANSACTION}
 */
public record LogicalEvent(Kind kind, String tag, @Nullable LogFilter filter, @Nullable Hash transactionHash) {

    /** Registry tag shared by every transaction watch. */
    static final String TRANSACTION_TAG = "tx";

    public enum Kind {
        /** New block numbers ({@code newHeads}). */
        BLOCK,
        /** Pending transaction hashes ({@code newPendingTransactions}). */
        PENDING,
        /** Logs matching a filter ({@code logs}). */
        FILTER,
        /** The receipt of one transaction, emitted once it is mined. */
        TRANSACTION
    }

    private static final LogicalEvent BLOCK = new LogicalEvent(Kind.BLOCK, "block", null, null);
    private static final LogicalEvent PENDING = new LogicalEvent(Kind.PENDING, "pending", null, null);

    public LogicalEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(tag, "tag");
        if (kind == Kind.FILTER && filter == null) {
            throw new IllegalArgumentException("FILTER event requires a filter");
        }
        if (kind == Kind.TRANSACTION && transactionHash == null) {
            throw new IllegalArgumentException("TRANSACTION event requires a hash");
        }
    }

    public static LogicalEvent block() {
        return BLOCK;
    }

    public static LogicalEvent pending() {
        return PENDING;
    }

    public static LogicalEvent logs(final LogFilter filter) {
        return new LogicalEvent(Kind.FILTER, filter.tag(), filter, null);
    }

    public static LogicalEvent transaction(final Hash hash) {
        return new LogicalEvent(Kind.TRANSACTION, "tx:" + hash.value(), null, hash);
    }

    /**
     * @return the Subscription Registry tag backing this event
     */
    public String registryTag() {
        return kind == Kind.TRANSACTION ? TRANSACTION_TAG : tag;
    }
}
