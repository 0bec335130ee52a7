package com.vivek.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the latest checkpoint of every run.
 */
public interface CheckpointStore {

    /** Inserts or replaces the checkpoint for {@code checkpoint.runId()}. */
    void save(RunCheckpoint checkpoint);

    Optional<RunCheckpoint> load(String runId);

    /** Most recently updated runs first. */
    List<RunCheckpoint> listRecent(int limit);

    boolean delete(String runId);
}
