// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HexTypesTest {

    @Test
    void addressIsLowercased() {
        assertEquals("0xabcdef0000000000000000000000000000000001",
                new Address("0xABCDEF0000000000000000000000000000000001").value());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0x", "0x123", "abcdef0000000000000000000000000000000001",
            "0xZZcdef0000000000000000000000000000000001"})
    void rejectsInvalidAddresses(String value) {
        assertThrows(IllegalArgumentException.class, () -> new Address(value));
    }

    @Test
    void hashRequires32Bytes() {
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x1234"));
        assertEquals(66, new Hash("0x" + "A".repeat(64)).value().length());
    }

    @Test
    void hexDataCountsBytes() {
        assertEquals(0, HexData.EMPTY.byteLength());
        assertEquals(2, new HexData("0xbeef").byteLength());
        assertThrows(IllegalArgumentException.class, () -> new HexData("0xabc"));
    }
}
