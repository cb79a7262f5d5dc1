package com.questrail.chamber.control.internal.regulation;

/**
 * ThermalRegulator
 * -----------------------------------------------------------------------------
 * Bang-bang heater decision with a symmetric hysteresis band.
 *
 * <h2>Rule</h2>
 * <ul>
 *   <li>{@code temperature < setpoint - h}: heater on</li>
 *   <li>{@code temperature > setpoint + h}: heater off</li>
 *   <li>otherwise: keep the previous intent</li>
 * </ul>
 *
 * The band keeps the relay from chattering around the setpoint. The regulator
 * is pure and holds no state of its own; the caller supplies the previous
 * intent.
 */
public final class ThermalRegulator
{
    private final double hysteresis;

    public ThermalRegulator(double hysteresis) {
        if (!(hysteresis > 0) || !Double.isFinite(hysteresis)) {
            throw new IllegalArgumentException("hysteresis must be positive and finite");
        }
        this.hysteresis = hysteresis;
    }

    /**
     * Decides the heater intent for one tick.
     *
     * @param temperature averaged chamber temperature
     * @param setpoint    effective setpoint
     * @param previous    heater intent issued on the previous decision
     * @return {@code true} to run the heater
     */
    public boolean decide(double temperature, double setpoint, boolean previous) {
        if (temperature < setpoint - hysteresis) {
            return true;
        }
        if (temperature > setpoint + hysteresis) {
            return false;
        }
        return previous;
    }

    public double hysteresis() {
        return hysteresis;
    }
}
