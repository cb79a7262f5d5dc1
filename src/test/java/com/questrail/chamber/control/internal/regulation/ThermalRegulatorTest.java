package com.questrail.chamber.control.internal.regulation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThermalRegulatorTest {

    private final ThermalRegulator regulator = new ThermalRegulator(2.0);

    @Test
    void belowBandTurnsHeaterOn() {
        assertTrue(regulator.decide(57.9, 60.0, false));
        assertTrue(regulator.decide(20.0, 60.0, true));
    }

    @Test
    void aboveBandTurnsHeaterOff() {
        assertFalse(regulator.decide(62.1, 60.0, true));
        assertFalse(regulator.decide(80.0, 60.0, false));
    }

    @Test
    void insideBandKeepsPreviousDecision() {
        assertTrue(regulator.decide(60.0, 60.0, true));
        assertFalse(regulator.decide(60.0, 60.0, false));

        // Band edges are inclusive.
        assertTrue(regulator.decide(62.0, 60.0, true));
        assertFalse(regulator.decide(58.0, 60.0, false));
    }

    @Test
    void noChatterWhileDriftingThroughBand() {
        boolean heater = true;
        int switches = 0;
        double[] temps = {56.0, 57.0, 58.5, 59.5, 60.5, 61.5, 61.9, 61.0, 60.0, 59.0, 58.1};
        for (double t : temps) {
            boolean next = regulator.decide(t, 60.0, heater);
            if (next != heater) {
                switches++;
            }
            heater = next;
        }
        assertEquals(0, switches);
    }

    @Test
    void rejectsNonPositiveHysteresis() {
        assertThrows(IllegalArgumentException.class, () -> new ThermalRegulator(0.0));
        assertThrows(IllegalArgumentException.class, () -> new ThermalRegulator(-1.0));
        assertThrows(IllegalArgumentException.class, () -> new ThermalRegulator(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new ThermalRegulator(Double.POSITIVE_INFINITY));
    }
}
