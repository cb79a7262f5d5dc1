package com.questrail.chamber.control.internal.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * ChamberIntents
 * -----------------------------------------------------------------------------
 * Immutable set of side effects requested by the {@link PhaseReducer}.
 *
 * <h2>Role in the architecture</h2>
 * The reducer decides <b>what</b> should happen (drive the actuators, persist
 * or remove the checkpoint, publish a status snapshot); the coordinator's
 * intent executor decides <b>how</b>. No intent performs I/O by itself.
 *
 * <p>Intents carry no payload. The executor reads what it needs (actuator
 * states, the run to persist) from the state the reducer returned alongside.</p>
 */
public final class ChamberIntents
{
    /**
     * Kinds of side effect the coordinator may need to perform.
     */
    public enum Kind {
        /** Send the run's hardware intent to the driver if it differs from what was last confirmed. */
        APPLY_ACTUATORS,

        /** Send the hardware intent unconditionally (after recovery or an emergency stop). */
        RESYNC_ACTUATORS,

        /** Persist the current run as the checkpoint. */
        WRITE_CHECKPOINT,

        /** Remove the checkpoint; the run ended or was abandoned. */
        DELETE_CHECKPOINT,

        /** Publish a new sequenced status snapshot. */
        BROADCAST_STATUS
    }

    private static final ChamberIntents NONE = new ChamberIntents(EnumSet.noneOf(Kind.class));

    private final Set<Kind> kinds;

    private ChamberIntents(EnumSet<Kind> kinds) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static ChamberIntents none() {
        return NONE;
    }

    public static ChamberIntents of(Kind first, Kind... rest) {
        return new ChamberIntents(EnumSet.of(first, rest));
    }

    public static ChamberIntents applyActuators() {
        return of(Kind.APPLY_ACTUATORS);
    }

    public static ChamberIntents resyncActuators() {
        return of(Kind.RESYNC_ACTUATORS);
    }

    public static ChamberIntents writeCheckpoint() {
        return of(Kind.WRITE_CHECKPOINT);
    }

    public static ChamberIntents deleteCheckpoint() {
        return of(Kind.DELETE_CHECKPOINT);
    }

    public static ChamberIntents broadcastStatus() {
        return of(Kind.BROADCAST_STATUS);
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Union of this intent set and another.
     */
    public ChamberIntents and(ChamberIntents other) {
        Objects.requireNonNull(other, "other");
        EnumSet<Kind> merged = EnumSet.noneOf(Kind.class);
        merged.addAll(this.kinds);
        merged.addAll(other.kinds);
        return new ChamberIntents(merged);
    }

    public ChamberIntents and(Kind kind) {
        return and(of(kind));
    }

    @Override
    public String toString() {
        return "ChamberIntents" + kinds;
    }
}
