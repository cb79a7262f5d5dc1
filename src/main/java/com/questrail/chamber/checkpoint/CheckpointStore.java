package com.questrail.chamber.checkpoint;

import java.io.IOException;
import java.util.Optional;

/**
 * CheckpointStore
 * -----------------------------------------------------------------------------
 * Single-slot durable storage for the current run.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #save(Checkpoint)} is atomic: after a crash at any point,
 *       {@link #load()} returns either the previous or the new checkpoint,
 *       never a mixture.</li>
 *   <li>{@link #load()} returns empty when nothing is stored and throws
 *       {@link CheckpointCorruptException} when the stored content cannot be
 *       decoded.</li>
 *   <li>{@link #delete()} is idempotent.</li>
 * </ul>
 */
public interface CheckpointStore
{
    void save(Checkpoint checkpoint) throws IOException;

    Optional<Checkpoint> load() throws IOException;

    void delete() throws IOException;
}
