// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Internal helpers shared by the RPC layer: the shared {@link ObjectMapper},
 * hex quantity decoding and error data extraction.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON serialization/deserialization.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Flattens JSON-RPC error data to a string.
     *
     * <p>
     * Nodes often nest the revert payload ({@code {data: {data: "0x..."}}}); the
     * first string found depth-first is returned, otherwise the value's string form.
     *
     * @param dataValue the error data object from a JSON-RPC response
     * @return extracted error data string, or null if dataValue is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return map.values().stream()
                    .map(RpcUtils::extractErrorData)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElseGet(dataValue::toString);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            for (final Object item : iterable) {
                final String extracted = extractErrorData(item);
                if (extracted != null) {
                    return extracted;
                }
            }
        }
        return dataValue.toString();
    }

    /**
     * Safely converts object to string, returning null for null inputs.
     */
    public static String stringValue(final Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Decodes hex quantity string to Long, handling "0x" prefix and null/empty
     * values.
     */
    public static Long decodeHexLong(final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        final String hex = value.toString();
        final String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.isEmpty()) {
            return 0L;
        }
        return Long.parseLong(normalized, 16);
    }

    /**
     * Decodes hex quantity string to BigInteger, handling "0x" prefix and
     * null/empty values.
     */
    public static BigInteger decodeHexBigInteger(final Object value) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        final String hex = value.toString();
        final String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(normalized, 16);
    }
}
