package com.vivek.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-memory fan-out of {@link VivekEvent}s.
 * <p>
 * Listeners register either for one run id or for every run. Events are delivered on the
 * publishing thread, run listeners first. A listener that throws is logged at WARN and the
 * remaining listeners still receive the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<VivekEvent>>> byRun = new ConcurrentHashMap<>();
    private final List<Consumer<VivekEvent>> everyRun = new CopyOnWriteArrayList<>();

    public void publish(VivekEvent event) {
        log.debug("{} [run={}, item={}]", event.eventType(), event.runId(), event.itemId());
        byRun.getOrDefault(event.runId(), List.of()).forEach(listener -> deliver(listener, event));
        everyRun.forEach(listener -> deliver(listener, event));
    }

    /**
     * Registers a listener for the events of one run.
     *
     * @return handle that removes the listener when closed
     */
    public Subscription subscribe(String runId, Consumer<VivekEvent> listener) {
        byRun.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byRun.computeIfPresent(runId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<VivekEvent> listener) {
        everyRun.add(listener);
        return () -> everyRun.remove(listener);
    }

    /**
     * Registration handle, usable in try-with-resources.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private static void deliver(Consumer<VivekEvent> listener, VivekEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
