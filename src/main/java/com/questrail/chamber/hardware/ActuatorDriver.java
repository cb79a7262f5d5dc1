package com.questrail.chamber.hardware;

import com.questrail.chamber.api.ActuatorStates;

/**
 * ActuatorDriver
 * -----------------------------------------------------------------------------
 * Port to the relay/fan drivers.
 *
 * <p>Commands are idempotent: applying the same {@link ActuatorStates} twice is
 * safe, so the controller may re-issue a command whenever it is unsure of the
 * physical state (after a failure, or after a restart).</p>
 *
 * <p>Implementations may block on I/O. The controller always calls them
 * through {@link TimedActuatorDriver}.</p>
 */
@FunctionalInterface
public interface ActuatorDriver
{
    void apply(ActuatorStates states) throws Exception;
}
