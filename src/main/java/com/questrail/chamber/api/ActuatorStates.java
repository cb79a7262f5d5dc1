package com.questrail.chamber.api;

/**
 * Desired on/off state of every actuator, as sent to the actuator driver.
 *
 * @param heaterOn heater relay state
 * @param fansOn   filtration fan state
 */
public record ActuatorStates(boolean heaterOn, boolean fansOn)
{
    /** Everything off. */
    public static final ActuatorStates OFF = new ActuatorStates(false, false);

    public ActuatorStates withHeater(boolean on) {
        return new ActuatorStates(on, fansOn);
    }

    public ActuatorStates withFans(boolean on) {
        return new ActuatorStates(heaterOn, on);
    }

    public boolean isOn(Actuator actuator) {
        return switch (actuator) {
            case HEATER -> heaterOn;
            case FANS -> fansOn;
        };
    }
}
