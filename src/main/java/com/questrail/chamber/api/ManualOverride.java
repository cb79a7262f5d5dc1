package com.questrail.chamber.api;

/**
 * ManualOverride
 * -----------------------------------------------------------------------------
 * Operator override for a single actuator.
 *
 * <p>While an override is {@link #ON} or {@link #OFF} the regulator's computed
 * intent for that actuator is ignored. Overrides belong to the run and are
 * cleared whenever the controller returns to IDLE.</p>
 */
public enum ManualOverride
{
    /** Automatic control. */
    NONE,

    /** Forced on. */
    ON,

    /** Forced off. */
    OFF;

    /**
     * Returns the override matching a toggle request.
     */
    public static ManualOverride of(boolean on) {
        return on ? ON : OFF;
    }

    /**
     * Applies this override to a computed intent.
     *
     * @param computed the intent the regulator would issue
     * @return the intent to actually issue
     */
    public boolean resolve(boolean computed) {
        return switch (this) {
            case NONE -> computed;
            case ON -> true;
            case OFF -> false;
        };
    }

    public boolean isActive() {
        return this != NONE;
    }
}
