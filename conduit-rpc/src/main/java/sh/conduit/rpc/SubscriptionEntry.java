// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.function.Consumer;

/**
 * A resolved upstream subscription: the tag that requested it and the callback
 * that receives its pushes.
 */
record SubscriptionEntry(String tag, Consumer<Object> deliver) {}
