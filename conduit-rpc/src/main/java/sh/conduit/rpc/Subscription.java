// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

/**
 * Handle for a listener registered with {@link WebSocketProvider}.
 */
public interface Subscription {
    /**
     * Returns the tag of the logical event this listener observes.
     *
     * @return the event tag
     */
    String id();

    /**
     * Removes the listener. The upstream subscription is released once the
     * event has no listeners left.
     */
    void unsubscribe();
}
