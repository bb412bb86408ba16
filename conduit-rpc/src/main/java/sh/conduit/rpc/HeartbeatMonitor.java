// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Idle-liveness deadline.
 *
 * <p>
 * Every {@link #reset()} replaces the outstanding deadline; if no reset happens
 * within the window the expiry action runs once. A superseded or stopped
 * deadline never fires its action.
 */
final class HeartbeatMonitor {

    private final Timer timer;
    private final long windowMillis;
    private final Runnable onExpired;

    private Timeout deadline;

    HeartbeatMonitor(final Timer timer, final Duration window, final Runnable onExpired) {
        this.timer = timer;
        this.windowMillis = window.toMillis();
        this.onExpired = onExpired;
    }

    synchronized void reset() {
        if (deadline != null) {
            deadline.cancel();
        }
        deadline = timer.newTimeout(this::expire, windowMillis, TimeUnit.MILLISECONDS);
    }

    synchronized void stop() {
        if (deadline != null) {
            deadline.cancel();
            deadline = null;
        }
    }

    synchronized boolean isArmed() {
        return deadline != null;
    }

    private void expire(final Timeout fired) {
        synchronized (this) {
            if (fired != deadline) {
                return;
            }
            deadline = null;
        }
        onExpired.run();
    }
}
