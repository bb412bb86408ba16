// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

import static sh.conduit.core.AnsiColors.AMBER;
import static sh.conduit.core.AnsiColors.CORAL;
import static sh.conduit.core.AnsiColors.INDIGO;
import static sh.conduit.core.AnsiColors.LAVENDER;
import static sh.conduit.core.AnsiColors.RESET;
import static sh.conduit.core.AnsiColors.SLATE;
import static sh.conduit.core.AnsiColors.TEAL;

/**
 * Log formatter for Conduit debug output.
 *
 * <p>
 * Every line uses a bracketed {@code [OPERATION]} prefix, a status symbol
 * where one applies (✓ ✗ ○) and shortened hex values:
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("eth_chainId", 7L, 1060));
 * // [RPC] id=7 method=eth_chainId 1.1ms
 *
 * DebugLogger.logRpc(LogFormatter.formatRpcError("eth_call", 7L, -32000, "execution reverted", 1500));
 * // ✗ [RPC-ERROR] id=7 method=eth_call code=-32000 message=execution reverted 1.5ms
 *
 * DebugLogger.logConnection(LogFormatter.formatConnection("OPEN", "wss://node.example"));
 * // ○ [WS] state=OPEN url=wss://node.example
 * }</pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RPC-SEND] id=7 method=eth_subscribe payload={"method":"eth_subscribe","params":["newHeads"],"id":7,"jsonrpc":"2.0"}
     */
    public static String formatRpcSend(String method, long id, String payload) {
        return String.format(
                "%s[RPC-SEND]%s id=%d method=%s payload=%s",
                INDIGO, RESET,
                id,
                method,
                payload);
    }

    /**
     * Format: [RPC] id=7 method=eth_chainId 1.1ms
     */
    public static String formatRpc(String method, long id, long durationMicros) {
        return String.format(
                "%s[RPC]%s id=%d method=%s %s",
                INDIGO, RESET,
                id,
                method,
                AnsiColors.duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] id=7 method=eth_call code=-32000 message=error 1.5ms
     */
    public static String formatRpcError(String method, long id, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s id=%d method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                id,
                method,
                code,
                CORAL + message + RESET,
                AnsiColors.duration(durationMicros));
    }

    /**
     * Format: ○ [WS] state=OPEN url=wss://node.example
     */
    public static String formatConnection(String state, String url) {
        return String.format(
                "%s○%s %s[WS]%s state=%s url=%s",
                SLATE, RESET,
                AMBER, RESET,
                state,
                url);
    }

    /**
     * Format: [SUB] tag=block id=0x9ce5...1c2d
     */
    public static String formatSubscribed(String tag, String subscriptionId) {
        return String.format(
                "%s✓%s %s[SUB]%s tag=%s id=%s",
                TEAL, RESET,
                LAVENDER, RESET,
                tag,
                shortenHash(subscriptionId));
    }

    /**
     * Format: [UNSUB] tag=block id=0x9ce5...1c2d
     */
    public static String formatUnsubscribed(String tag, String subscriptionId) {
        return String.format(
                "%s[UNSUB]%s tag=%s id=%s",
                LAVENDER, RESET,
                tag,
                shortenHash(subscriptionId));
    }

    /**
     * Shortens a hex value to {@code 0xabcd...ef12}. Short values are returned as-is.
     */
    public static String shortenHash(String value) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= HASH_SHORTEN_THRESHOLD + 3) {
            return value;
        }
        return value.substring(0, HASH_PREFIX_LENGTH) + "..." + value.substring(value.length() - HASH_SUFFIX_LENGTH);
    }
}
