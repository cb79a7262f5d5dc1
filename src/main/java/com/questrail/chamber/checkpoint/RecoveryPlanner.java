package com.questrail.chamber.checkpoint;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RecoveryPlanner
 * -----------------------------------------------------------------------------
 * Startup decision for the stored checkpoint.
 *
 * <p>Loads the checkpoint and classifies it. Anything that cannot be resumed
 * (absent, corrupt, stale, or written in a phase that is never resumed) is
 * removed so the next start begins clean.</p>
 */
public final class RecoveryPlanner
{
    /**
     * Outcome of {@link #plan(Instant)}.
     *
     * @param checkpoint the resumable checkpoint, if any
     * @param outcome    what was found
     * @param detail     human-readable detail for logs
     */
    public record Plan(Optional<Checkpoint> checkpoint, Outcome outcome, String detail) {
        public Plan {
            Objects.requireNonNull(checkpoint, "checkpoint");
            Objects.requireNonNull(outcome, "outcome");
            Objects.requireNonNull(detail, "detail");
        }
    }

    public enum Outcome {
        NOTHING_STORED,
        RESUMABLE,
        DISCARDED_CORRUPT,
        DISCARDED_STALE,
        DISCARDED_NOT_RESUMABLE
    }

    private final CheckpointStore store;
    private final CheckpointValidator validator;

    public RecoveryPlanner(CheckpointStore store, CheckpointValidator validator) {
        this.store = Objects.requireNonNull(store, "store");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @throws IOException if the store cannot be read or a discarded checkpoint
     *                     cannot be removed
     */
    public Plan plan(Instant now) throws IOException {
        Optional<Checkpoint> loaded;
        try {
            loaded = store.load();
        } catch (CheckpointCorruptException e) {
            store.delete();
            return new Plan(Optional.empty(), Outcome.DISCARDED_CORRUPT, e.getMessage());
        }

        if (loaded.isEmpty()) {
            return new Plan(Optional.empty(), Outcome.NOTHING_STORED, "no checkpoint");
        }

        Checkpoint checkpoint = loaded.get();
        switch (validator.assess(checkpoint, now)) {
            case RESUMABLE:
                return new Plan(loaded, Outcome.RESUMABLE,
                        checkpoint.state().phase() + " written at " + checkpoint.writtenAt());
            case STALE:
                store.delete();
                return new Plan(Optional.empty(), Outcome.DISCARDED_STALE,
                        checkpoint.state().phase() + " written at " + checkpoint.writtenAt() + " is stale");
            default:
                store.delete();
                return new Plan(Optional.empty(), Outcome.DISCARDED_NOT_RESUMABLE,
                        checkpoint.state().phase() + " is not resumable");
        }
    }
}
