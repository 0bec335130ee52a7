package com.vivek.core.persistence;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    @Test
    void saveLoadListDelete() {
        var t0 = Instant.parse("2026-03-01T09:00:00Z");
        store.save(RunCheckpoint.started("R1", "a", t0));
        store.save(RunCheckpoint.started("R2", "b", t0.plusSeconds(5)));

        assertEquals("a", store.load("R1").orElseThrow().request());
        assertTrue(store.load(null).isEmpty());
        assertEquals(List.of("R2", "R1"), store.listRecent(5).stream().map(RunCheckpoint::runId).toList());
        assertEquals(1, store.listRecent(1).size());
        assertTrue(store.delete("R1"));
        assertTrue(store.load("R1").isEmpty());
    }
}
