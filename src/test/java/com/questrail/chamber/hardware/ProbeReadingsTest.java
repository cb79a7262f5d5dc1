package com.questrail.chamber.hardware;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ProbeReadingsTest {

    @Test
    void averagesHealthyProbesOnly() {
        ProbeReadings readings = ProbeReadings.of(
                ProbeReading.of("left", 58.0),
                ProbeReading.failed("middle"),
                ProbeReading.of("right", 62.0));

        assertEquals(2, readings.healthyCount());
        assertEquals(60.0, readings.average().getAsDouble(), 1e-9);
    }

    @Test
    void nonFiniteReadingCountsAsFailed() {
        ProbeReadings readings = ProbeReadings.of(
                ProbeReading.of("left", Double.NaN),
                ProbeReading.of("right", 40.0));

        assertEquals(1, readings.healthyCount());
        assertEquals(40.0, readings.average().getAsDouble(), 1e-9);
    }

    @Test
    void noHealthyProbeMeansNoAverage() {
        assertEquals(OptionalDouble.empty(), ProbeReadings.none().average());
        assertEquals(OptionalDouble.empty(),
                ProbeReadings.of(ProbeReading.failed("left"), ProbeReading.failed("right")).average());
    }
}
