// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

/**
 * Filter for a {@code logs} subscription.
 *
 * <p>
 * Topics are positional. A {@code null} entry matches any value at that position.
 * Two filters with the same address and topics map to the same upstream
 * subscription.
 *
 * @param address emitting contract, or empty for any
 * @param topics  positional topic filter, or empty for any
 */
public record LogFilter(Optional<Address> address, Optional<List<Hash>> topics) {

    public LogFilter {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(topics, "topics");
        topics = topics.map(t -> Collections.unmodifiableList(new ArrayList<>(t)));
    }

    public static LogFilter all() {
        return new LogFilter(Optional.empty(), Optional.empty());
    }

    public static LogFilter byContract(final Address address) {
        return new LogFilter(Optional.of(address), Optional.empty());
    }

    public static LogFilter byContract(final Address address, final List<@Nullable Hash> topics) {
        return new LogFilter(Optional.of(address), Optional.of(topics));
    }

    /**
     * Registry tag for this filter, e.g. {@code filter:0xabc...:0xddf...,null}.
     *
     * @return a tag that is equal for equal filters
     */
    public String tag() {
        final String topicPart = topics
                .map(t -> t.stream().map(h -> h == null ? "null" : h.value()).collect(Collectors.joining(",")))
                .orElse("*");
        return "filter:" + address.map(Address::value).orElse("*") + ":" + topicPart;
    }

    /**
     * @return the filter object passed as the second {@code eth_subscribe} parameter
     */
    public Map<String, Object> toParams() {
        final Map<String, Object> params = new LinkedHashMap<>();
        address.ifPresent(a -> params.put("address", a.value()));
        topics.ifPresent(t -> params.put("topics",
                t.stream().map(h -> h == null ? null : h.value()).collect(Collectors.toList())));
        return params;
    }
}
