// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    @Test
    void shortensLongHexValues() {
        assertEquals("0x9ce5...1c2d",
                LogFormatter.shortenHash("0x9ce59a13059e417087c02d3236a0b1cc0000000000000000000000000000001c2d"));
    }

    @Test
    void keepsShortValues() {
        assertEquals("0x1", LogFormatter.shortenHash("0x1"));
        assertEquals("null", LogFormatter.shortenHash(null));
    }

    @Test
    void formatsRpcError() {
        final String line = LogFormatter.formatRpcError("eth_call", 9L, -32000, "execution reverted", 500);

        assertTrue(line.contains("[RPC-ERROR]"));
        assertTrue(line.contains("code=-32000"));
        assertTrue(line.contains("execution reverted"));
        assertTrue(line.contains("500μs"));
    }

    @Test
    void formatsSubscriptionLines() {
        assertTrue(LogFormatter.formatSubscribed("block", "0x1").contains("tag=block id=0x1"));
        assertTrue(LogFormatter.formatUnsubscribed("pending", "0x2").contains("[UNSUB]"));
    }

    @Test
    void formatsRpcSendWithFullEnvelope() {
        final String envelope = "{\"method\":\"eth_subscribe\",\"params\":[\"newHeads\"],\"id\":7,\"jsonrpc\":\"2.0\"}";

        final String line = LogFormatter.formatRpcSend("eth_subscribe", 7L, envelope);

        assertTrue(line.contains("[RPC-SEND]"));
        assertTrue(line.contains("id=7 method=eth_subscribe payload=" + envelope));
    }
}
