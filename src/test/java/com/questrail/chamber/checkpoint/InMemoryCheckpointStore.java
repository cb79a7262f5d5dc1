package com.questrail.chamber.checkpoint;

import java.io.IOException;
import java.util.Optional;

/**
 * In-memory {@link CheckpointStore} for tests.
 */
public final class InMemoryCheckpointStore implements CheckpointStore {

    private Checkpoint stored;
    private boolean corrupt;
    private int saves;
    private int deletes;

    @Override
    public synchronized void save(Checkpoint checkpoint) {
        stored = checkpoint;
        corrupt = false;
        saves++;
    }

    @Override
    public synchronized Optional<Checkpoint> load() throws IOException {
        if (corrupt) {
            throw new CheckpointCorruptException("simulated corruption");
        }
        return Optional.ofNullable(stored);
    }

    @Override
    public synchronized void delete() {
        stored = null;
        corrupt = false;
        deletes++;
    }

    public synchronized void markCorrupt() {
        corrupt = true;
    }

    public synchronized Checkpoint stored() {
        return stored;
    }

    public synchronized boolean isEmpty() {
        return stored == null && !corrupt;
    }

    public synchronized int saves() {
        return saves;
    }

    public synchronized int deletes() {
        return deletes;
    }
}
