package com.vivek.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, consumed by the CLI for live progress.
 *
 * @param eventType event type (e.g. "run.started", "item.iteration", "item.failed")
 * @param runId     the run this event belongs to
 * @param itemId    the work item this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record VivekEvent(
    String eventType,
    String runId,
    String itemId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String RUN_PLANNED = "run.planned";
    public static final String ITEM_STARTED = "item.started";
    public static final String ITEM_ITERATION = "item.iteration";
    public static final String ITEM_ACCEPTED = "item.accepted";
    public static final String ITEM_FAILED = "item.failed";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";

    public VivekEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
