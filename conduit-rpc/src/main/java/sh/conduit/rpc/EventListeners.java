// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listener lists per {@link LogicalEvent}.
 *
 * <p>
 * Emission iterates a snapshot, so listeners may add or remove listeners from
 * inside a callback. A throwing listener is logged and the remaining listeners
 * still run.
 */
final class EventListeners {

    private static final Logger log = LoggerFactory.getLogger(EventListeners.class);

    private final Map<LogicalEvent, List<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    /**
     * @return true if this is the first listener for the event
     */
    boolean add(final LogicalEvent event, final Consumer<Object> listener) {
        final boolean[] first = new boolean[1];
        listeners.compute(event, (key, list) -> {
            final List<Consumer<Object>> target = list != null ? list : new CopyOnWriteArrayList<>();
            first[0] = target.isEmpty();
            target.add(listener);
            return target;
        });
        return first[0];
    }

    /**
     * @return true if the listener was registered and is now removed
     */
    boolean remove(final LogicalEvent event, final Consumer<Object> listener) {
        final boolean[] removed = new boolean[1];
        listeners.computeIfPresent(event, (key, list) -> {
            removed[0] = list.remove(listener);
            return list.isEmpty() ? null : list;
        });
        return removed[0];
    }

    int count(final LogicalEvent event) {
        final List<Consumer<Object>> list = listeners.get(event);
        return list == null ? 0 : list.size();
    }

    int count(final LogicalEvent.Kind kind) {
        int total = 0;
        for (Map.Entry<LogicalEvent, List<Consumer<Object>>> entry : listeners.entrySet()) {
            if (entry.getKey().kind() == kind) {
                total += entry.getValue().size();
            }
        }
        return total;
    }

    List<LogicalEvent> activeEvents() {
        return new ArrayList<>(listeners.keySet());
    }

    List<LogicalEvent> activeEvents(final LogicalEvent.Kind kind) {
        final List<LogicalEvent> events = new ArrayList<>();
        for (LogicalEvent event : listeners.keySet()) {
            if (event.kind() == kind) {
                events.add(event);
            }
        }
        return events;
    }

    void emit(final LogicalEvent event, final Object payload) {
        final List<Consumer<Object>> list = listeners.get(event);
        if (list == null) {
            return;
        }
        for (Consumer<Object> listener : list) {
            try {
                listener.accept(payload);
            } catch (RuntimeException e) {
                log.error("Listener for {} failed", event.tag(), e);
            }
        }
    }
}
