package com.questrail.chamber.hardware;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One probe's result for one acquisition cycle.
 *
 * @param probeId     stable probe identifier (e.g. 1-Wire serial)
 * @param temperature reading in degrees Celsius, empty if the probe failed
 */
public record ProbeReading(String probeId, OptionalDouble temperature)
{
    public ProbeReading {
        Objects.requireNonNull(probeId, "probeId");
        Objects.requireNonNull(temperature, "temperature");
    }

    public static ProbeReading of(String probeId, double celsius) {
        return new ProbeReading(probeId, OptionalDouble.of(celsius));
    }

    public static ProbeReading failed(String probeId) {
        return new ProbeReading(probeId, OptionalDouble.empty());
    }

    /**
     * A probe is healthy when it produced a finite value.
     */
    public boolean healthy() {
        return temperature.isPresent() && Double.isFinite(temperature.getAsDouble());
    }
}
