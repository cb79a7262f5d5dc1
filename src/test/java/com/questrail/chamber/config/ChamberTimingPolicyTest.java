package com.questrail.chamber.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ChamberTimingPolicyTest {

    @Test
    void defaultsMatchFieldValues() {
        ChamberTimingPolicy p = ChamberTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), p.tickInterval());
        assertEquals(Duration.ofSeconds(10), p.runningCheckpointInterval());
        assertEquals(Duration.ofMinutes(5), p.cooldownStepInterval());
        assertEquals(Duration.ofHours(12), p.maxCooldownResumeAge());
    }

    @Test
    void intervalsMustBePositive() {
        ChamberTimingPolicy p = ChamberTimingPolicy.defaults();

        assertThrows(IllegalArgumentException.class, () -> p.withTickInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> p.withActuatorTimeout(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> p.withTickInterval(null));
    }

    @Test
    void graceMayBeZeroButNotNegative() {
        Duration s = Duration.ofSeconds(1);

        assertDoesNotThrow(() -> new ChamberTimingPolicy(s, s, s, s, s, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new ChamberTimingPolicy(s, s, s, s, s, Duration.ofSeconds(-1), Duration.ZERO));
    }

    @Test
    void withersOnlyTouchTheirField() {
        ChamberTimingPolicy p = ChamberTimingPolicy.defaults().withTickInterval(Duration.ofMillis(50));

        assertEquals(Duration.ofMillis(50), p.tickInterval());
        assertEquals(ChamberTimingPolicy.defaults().actuatorTimeout(), p.actuatorTimeout());
    }
}
