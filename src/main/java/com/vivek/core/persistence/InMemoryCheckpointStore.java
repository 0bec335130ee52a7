package com.vivek.core.persistence;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link CheckpointStore}; checkpoints are lost when the process exits.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentHashMap<String, RunCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(RunCheckpoint checkpoint) {
        checkpoints.put(checkpoint.runId(), checkpoint);
    }

    @Override
    public Optional<RunCheckpoint> load(String runId) {
        return Optional.ofNullable(runId != null ? checkpoints.get(runId) : null);
    }

    @Override
    public List<RunCheckpoint> listRecent(int limit) {
        return checkpoints.values().stream()
                .sorted(Comparator.comparing(RunCheckpoint::updatedAt).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    @Override
    public boolean delete(String runId) {
        return checkpoints.remove(runId) != null;
    }
}
