package com.questrail.chamber.api;

import java.util.Objects;

/**
 * Raised when a command is not valid in the current {@link Phase}.
 *
 * <p>Commands never silently no-op: an action the phase does not accept is
 * always reported with the phase it was attempted in.</p>
 */
public final class InvalidTransitionException extends ChamberCommandException
{
    private final Phase currentPhase;
    private final String action;

    public InvalidTransitionException(Phase currentPhase, String action) {
        this(currentPhase, action, null);
    }

    public InvalidTransitionException(Phase currentPhase, String action, String reason) {
        super(describe(currentPhase, action, reason));
        this.currentPhase = Objects.requireNonNull(currentPhase, "currentPhase");
        this.action = Objects.requireNonNull(action, "action");
    }

    public Phase currentPhase() {
        return currentPhase;
    }

    public String action() {
        return action;
    }

    private static String describe(Phase phase, String action, String reason) {
        String base = action + " is not valid in phase " + phase;
        return reason == null ? base : base + " (" + reason + ")";
    }
}
