package com.vivek.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static VivekEvent event(String type, String runId) {
        return new VivekEvent(type, runId, null, Map.of(), Instant.EPOCH);
    }

    @Test
    @DisplayName("run subscribers only see their own run")
    void perRunDelivery() {
        var received = new ArrayList<String>();
        eventBus.subscribe("R1", e -> received.add(e.eventType()));

        eventBus.publish(event(VivekEvent.RUN_STARTED, "R1"));
        eventBus.publish(event(VivekEvent.RUN_STARTED, "R2"));
        eventBus.publish(event(VivekEvent.RUN_COMPLETED, "R1"));

        assertEquals(List.of("run.started", "run.completed"), received);
    }

    @Test
    void globalSubscribersSeeEverything() {
        var received = new ArrayList<String>();
        eventBus.subscribeAll(e -> received.add(e.runId()));

        eventBus.publish(event(VivekEvent.ITEM_STARTED, "R1"));
        eventBus.publish(event(VivekEvent.ITEM_STARTED, "R2"));

        assertEquals(List.of("R1", "R2"), received);
    }

    @Test
    void unsubscribeStopsDelivery() {
        var received = new ArrayList<VivekEvent>();
        var subscription = eventBus.subscribe("R1", received::add);
        try (var global = eventBus.subscribeAll(received::add)) {
            eventBus.publish(event(VivekEvent.RUN_STARTED, "R1"));
        }
        subscription.unsubscribe();
        eventBus.publish(event(VivekEvent.RUN_COMPLETED, "R1"));

        assertEquals(2, received.size());
    }

    @Test
    @DisplayName("a throwing subscriber does not stop delivery to others")
    void failingSubscriberIsIsolated() {
        var received = new ArrayList<VivekEvent>();
        eventBus.subscribe("R1", e -> {
            throw new IllegalStateException("broken");
        });
        eventBus.subscribe("R1", received::add);

        assertDoesNotThrow(() -> eventBus.publish(event(VivekEvent.ITEM_FAILED, "R1")));
        assertEquals(1, received.size());
    }

    @Test
    void payloadIsCopied() {
        var payload = new HashMap<String, Object>();
        payload.put("score", 0.8);
        var event = new VivekEvent(VivekEvent.ITEM_ITERATION, "R1", "ITEM-001", payload, Instant.EPOCH);
        payload.put("score", 0.1);

        assertEquals(0.8, event.payload().get("score"));
        assertEquals(Map.of(), new VivekEvent("x", "R1", null, null, Instant.EPOCH).payload());
    }
}
