package com.questrail.chamber.hardware;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * ProbeReadings
 * -----------------------------------------------------------------------------
 * The readings of every configured probe for one control tick.
 *
 * <p>The chamber temperature is the mean of the healthy probes only. When no
 * probe is healthy the average is empty and the controller treats the chamber
 * as sensor-unavailable for that tick.</p>
 */
public final class ProbeReadings
{
    private static final ProbeReadings NONE = new ProbeReadings(List.of());

    private final List<ProbeReading> readings;

    private ProbeReadings(List<ProbeReading> readings) {
        this.readings = List.copyOf(readings);
    }

    public static ProbeReadings of(List<ProbeReading> readings) {
        Objects.requireNonNull(readings, "readings");
        return new ProbeReadings(readings);
    }

    public static ProbeReadings of(ProbeReading... readings) {
        return new ProbeReadings(List.of(readings));
    }

    /**
     * No probe produced anything (acquisition itself failed).
     */
    public static ProbeReadings none() {
        return NONE;
    }

    public List<ProbeReading> readings() {
        return readings;
    }

    public long healthyCount() {
        return readings.stream().filter(ProbeReading::healthy).count();
    }

    /**
     * Returns the mean of the healthy probes, or empty if none is healthy.
     */
    public OptionalDouble average() {
        return readings.stream()
                .filter(ProbeReading::healthy)
                .mapToDouble(r -> r.temperature().getAsDouble())
                .average();
    }

    @Override
    public String toString() {
        return "ProbeReadings" + readings;
    }
}
