package com.questrail.chamber.control.internal.events;

import com.questrail.chamber.checkpoint.Checkpoint;

import java.time.Instant;
import java.util.Objects;

/**
 * RecoveryEvent
 * -----------------------------------------------------------------------------
 * Startup recovery from a validated checkpoint.
 *
 * <ul>
 *   <li>{@link Resumed}: restore the run immediately.</li>
 *   <li>{@link Offered}: hold the checkpoint until the operator confirms or
 *       discards it.</li>
 * </ul>
 */
public sealed interface RecoveryEvent extends ChamberEvent
        permits RecoveryEvent.Resumed, RecoveryEvent.Offered
{
    Checkpoint checkpoint();

    final class Resumed extends ChamberEvent.Base implements RecoveryEvent {
        private final Checkpoint checkpoint;

        public Resumed(Instant timestamp, Checkpoint checkpoint) {
            super(timestamp);
            this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
        }

        @Override
        public Checkpoint checkpoint() {
            return checkpoint;
        }
    }

    final class Offered extends ChamberEvent.Base implements RecoveryEvent {
        private final Checkpoint checkpoint;

        public Offered(Instant timestamp, Checkpoint checkpoint) {
            super(timestamp);
            this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
        }

        @Override
        public Checkpoint checkpoint() {
            return checkpoint;
        }
    }
}
