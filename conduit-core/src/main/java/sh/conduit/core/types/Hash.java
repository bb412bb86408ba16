// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Hex-encoded 32-byte hash.
 */
public record Hash(@JsonValue String value) {
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }
}
