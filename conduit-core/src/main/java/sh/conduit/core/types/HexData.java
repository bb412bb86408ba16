// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Arbitrary-length hex-encoded byte data with "0x" prefix.
 *
 * <p>
 * The value must start with "0x" and contain an even number of hex digits.
 * {@link #EMPTY} ("0x") stands for explicitly empty data.
 */
public record HexData(@JsonValue String value) {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData("0x");

    public HexData {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
    }

    /**
     * Returns the number of bytes represented by this value.
     */
    public int byteLength() {
        return (value.length() - 2) / 2;
    }
}
