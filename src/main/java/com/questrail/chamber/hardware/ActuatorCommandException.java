package com.questrail.chamber.hardware;

import com.questrail.chamber.api.ActuatorStates;

/**
 * An actuator command failed or did not complete within its timeout.
 *
 * <p>Never fatal: the controller reports it and re-issues the command on the
 * next tick.</p>
 */
public final class ActuatorCommandException extends Exception
{
    private final ActuatorStates requested;

    public ActuatorCommandException(ActuatorStates requested, String message, Throwable cause) {
        super(message, cause);
        this.requested = requested;
    }

    public ActuatorStates requested() {
        return requested;
    }
}
