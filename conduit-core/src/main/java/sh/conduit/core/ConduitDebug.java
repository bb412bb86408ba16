// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

/**
 * Global toggle for enabling verbose debug logging across Conduit modules.
 *
 * <p>RPC logging traces every request and response on the wire. Connection
 * logging traces socket lifecycle events (open, close, reconnect, heartbeat).
 */
public final class ConduitDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean connectionLogging = false;

    private ConduitDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || connectionLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        connectionLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setConnectionLogging(final boolean enabled) {
        connectionLogging = enabled;
    }

    public static boolean isConnectionLoggingEnabled() {
        return connectionLogging;
    }
}
