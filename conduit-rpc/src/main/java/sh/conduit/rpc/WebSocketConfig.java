// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import io.netty.channel.EventLoopGroup;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link WebSocketProvider}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * WebSocketConfig config = WebSocketConfig.builder("wss://eth.example.com")
 *         .header("Authorization", "Bearer " + token)
 *         .timeout(Duration.ofSeconds(30))
 *         .reconnect(true)
 *         .build();
 *
 * WebSocketProvider provider = WebSocketProvider.create(config);
 * }</pre>
 *
 * @param url               the WebSocket URL (ws:// or wss://)
 * @param headers           extra HTTP headers sent with the upgrade request
 * @param timeout           connect timeout, and the idle window after which the
 *                          connection is considered dead
 * @param reconnect         whether to re-establish the connection after it is lost
 * @param reconnectInterval fixed delay between a loss and the next attempt
 * @param chainId           expected chain id, checked by
 *                          {@link WebSocketProvider#detectNetwork()}; null skips
 *                          the check
 * @param anyNetwork        request a network-agnostic provider (unsupported)
 * @param ioThreads         number of Netty I/O threads when no group is supplied
 * @param eventLoopGroup    external Netty group; the caller owns its lifecycle
 * @param maxFrameSize      largest aggregated inbound message in bytes
 */
public record WebSocketConfig(
        String url,
        Map<String, String> headers,
        Duration timeout,
        boolean reconnect,
        Duration reconnectInterval,
        @Nullable Long chainId,
        boolean anyNetwork,
        int ioThreads,
        @Nullable EventLoopGroup eventLoopGroup,
        int maxFrameSize) {

    // Defaults
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofMillis(5000);
    private static final int DEFAULT_IO_THREADS = 1;
    private static final int DEFAULT_MAX_FRAME_SIZE = 10 * 1024 * 1024;

    /**
     * Compact constructor with validation and defaults.
     */
    public WebSocketConfig {
        Objects.requireNonNull(url, "url");
        final String scheme = URI.create(url).getScheme();
        if (scheme == null
                || !(scheme.toLowerCase(Locale.ROOT).equals("ws") || scheme.toLowerCase(Locale.ROOT).equals("wss"))) {
            throw new IllegalArgumentException("url must use ws:// or wss://, got: " + url);
        }

        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (timeout == null)
            timeout = DEFAULT_TIMEOUT;
        if (reconnectInterval == null)
            reconnectInterval = DEFAULT_RECONNECT_INTERVAL;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (maxFrameSize <= 0)
            maxFrameSize = DEFAULT_MAX_FRAME_SIZE;

        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        if (reconnectInterval.isNegative()) {
            throw new IllegalArgumentException("reconnectInterval must not be negative, got: " + reconnectInterval);
        }
    }

    /**
     * Creates a configuration with all defaults for the given URL.
     *
     * @param url the WebSocket URL
     * @return a new WebSocketConfig with default settings
     */
    public static WebSocketConfig withDefaults(String url) {
        return new WebSocketConfig(url, null, null, false, null, null, false, 0, null, 0);
    }

    /**
     * Creates a builder for constructing a WebSocketConfig.
     *
     * @param url the WebSocket URL
     * @return a new builder
     */
    public static Builder builder(String url) {
        return new Builder(url);
    }

    /**
     * Builder for {@link WebSocketConfig}.
     */
    public static final class Builder {
        private final String url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout = null;
        private boolean reconnect = false;
        private Duration reconnectInterval = null;
        private Long chainId = null;
        private boolean anyNetwork = false;
        private int ioThreads = 0;
        private EventLoopGroup eventLoopGroup = null;
        private int maxFrameSize = 0;

        private Builder(String url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        /**
         * Adds a header to the upgrade request.
         */
        public Builder header(String name, String value) {
            this.headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * Sets the connect timeout and heartbeat window.
         * Default: 120 seconds.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Enables reconnection after the connection is lost.
         * Default: false.
         */
        public Builder reconnect(boolean reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        /**
         * Sets the delay before a reconnect attempt.
         * Default: 5000 ms.
         */
        public Builder reconnectInterval(Duration interval) {
            this.reconnectInterval = interval;
            return this;
        }

        /**
         * Sets the chain id the endpoint is expected to report.
         */
        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        /**
         * Requests a network-agnostic provider. {@link WebSocketProvider} rejects this.
         */
        public Builder anyNetwork(boolean anyNetwork) {
            this.anyNetwork = anyNetwork;
            return this;
        }

        /**
         * Sets the number of Netty I/O threads.
         * Default: 1. Ignored if eventLoopGroup is provided.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets a custom Netty EventLoopGroup.
         * When set, ioThreads is ignored.
         * The caller is responsible for shutting down this group.
         */
        public Builder eventLoopGroup(EventLoopGroup group) {
            this.eventLoopGroup = group;
            return this;
        }

        /**
         * Sets the largest inbound message accepted, in bytes.
         * Default: 10 MiB.
         */
        public Builder maxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        /**
         * Builds the WebSocketConfig.
         *
         * @return a new WebSocketConfig
         */
        public WebSocketConfig build() {
            return new WebSocketConfig(
                    url,
                    headers,
                    timeout,
                    reconnect,
                    reconnectInterval,
                    chainId,
                    anyNetwork,
                    ioThreads,
                    eventLoopGroup,
                    maxFrameSize);
        }
    }
}
