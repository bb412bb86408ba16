// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class WebSocketConfigTest {

    @Test
    void testDefaults() {
        WebSocketConfig config = WebSocketConfig.withDefaults("ws://localhost:8546");

        assertEquals("ws://localhost:8546", config.url());
        assertEquals(Map.of(), config.headers());
        assertEquals(Duration.ofSeconds(120), config.timeout());
        assertFalse(config.reconnect());
        assertEquals(Duration.ofMillis(5000), config.reconnectInterval());
        assertNull(config.chainId());
        assertFalse(config.anyNetwork());
        assertEquals(1, config.ioThreads());
        assertNull(config.eventLoopGroup());
        assertEquals(10 * 1024 * 1024, config.maxFrameSize());
    }

    @Test
    void testBuilderOverrides() {
        WebSocketConfig config = WebSocketConfig.builder("wss://eth-mainnet.example.com")
                .header("Authorization", "Bearer abc")
                .timeout(Duration.ofSeconds(5))
                .reconnect(true)
                .reconnectInterval(Duration.ofMillis(250))
                .chainId(1)
                .ioThreads(2)
                .maxFrameSize(1024)
                .build();

        assertEquals("Bearer abc", config.headers().get("Authorization"));
        assertEquals(Duration.ofSeconds(5), config.timeout());
        assertTrue(config.reconnect());
        assertEquals(Duration.ofMillis(250), config.reconnectInterval());
        assertEquals(1L, config.chainId());
        assertEquals(2, config.ioThreads());
        assertEquals(1024, config.maxFrameSize());
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://localhost:8545", "https://eth-mainnet.example.com", "localhost:8545"})
    void testRejectsNonWebSocketUrls(String url) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> WebSocketConfig.withDefaults(url));
        assertTrue(ex.getMessage().contains("ws:// or wss://"));
    }

    @Test
    void testRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> WebSocketConfig.builder("ws://localhost:8546").timeout(Duration.ZERO).build());
    }

    @Test
    void testHeadersAreImmutable() {
        WebSocketConfig config = WebSocketConfig.builder("ws://localhost:8546").header("X-Key", "1").build();

        assertThrows(UnsupportedOperationException.class, () -> config.headers().put("X-Other", "2"));
    }
}
