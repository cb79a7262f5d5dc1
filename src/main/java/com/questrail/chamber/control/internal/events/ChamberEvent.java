package com.questrail.chamber.control.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * ChamberEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything the phase state machine reacts to.
 *
 * <h2>Role in the architecture</h2>
 * All changes to chamber state happen in response to events that the
 * coordinator serializes and hands to the reducer one at a time:
 * <ul>
 *   <li>operator commands ({@link CommandEvent})</li>
 *   <li>control-loop ticks carrying probe readings ({@link ControlTickEvent})</li>
 *   <li>print-job notifications ({@link JobSourceEvent})</li>
 *   <li>safety monitor samples ({@link SafetyEvent})</li>
 *   <li>actuator command outcomes ({@link ActuatorFeedbackEvent})</li>
 *   <li>crash recovery ({@link RecoveryEvent})</li>
 * </ul>
 *
 * <p>Events are immutable. The timestamp is wall-clock time and is what ends
 * up in checkpoints and run start stamps.</p>
 */
public interface ChamberEvent
{
    /**
     * Wall-clock time at which the event was generated.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements ChamberEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
