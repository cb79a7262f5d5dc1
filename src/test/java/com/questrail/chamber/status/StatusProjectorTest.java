package com.questrail.chamber.status;

import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.RunSettings;
import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.checkpoint.CheckpointFixtures;
import com.questrail.chamber.config.RegulationPolicy;
import com.questrail.chamber.control.internal.state.ChamberState;
import com.questrail.chamber.control.internal.state.RunState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StatusProjectorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private final StatusProjector projector = new StatusProjector(RegulationPolicy.defaults());

    @Test
    void idleChamberAtPowerOn() {
        StatusSnapshot s = projector.project(ChamberState.initial(), 1);

        assertEquals(1, s.sequenceNumber());
        assertEquals(Phase.IDLE, s.phase());
        assertTrue(s.temperature().isEmpty());
        assertEquals(Duration.ZERO, s.remaining());
        assertFalse(s.recoveryPending());
    }

    @Test
    void runningChamberReportsElapsedAndRemaining() {
        RunState run = RunState.started(RunSettings.builder()
                        .withSetpoint(60.0)
                        .withDuration(Duration.ofHours(1))
                        .build(), T0)
                .withPhase(Phase.MAINTAINING)
                .withActiveElapsed(Duration.ofMinutes(20))
                .withPaused(true);
        ChamberState state = ChamberState.initial().withTemperature(59.5).withRun(run).withActuatorFault(true);

        StatusSnapshot s = projector.project(state, 17);

        assertEquals(Phase.MAINTAINING, s.phase());
        assertEquals(59.5, s.temperature().getAsDouble());
        assertEquals(Duration.ofMinutes(20), s.activeElapsed());
        assertEquals(Duration.ofMinutes(40), s.remaining());
        assertTrue(s.paused());
        assertTrue(s.actuatorFault());
        assertEquals(Duration.ZERO, s.coolingRemaining());
    }

    @Test
    void coolingReportsRemainingBudget() {
        RunState cooling = CheckpointFixtures.cooling(Duration.ofMinutes(30), T0).state();

        StatusSnapshot s = projector.project(ChamberState.initial().withRun(cooling), 2);

        assertEquals(Phase.COOLING, s.phase());
        assertEquals(Duration.ofMinutes(210), s.coolingRemaining());
        assertEquals(Duration.ZERO, s.remaining());
    }

    @Test
    void pendingRecoveryIsFlagged() {
        ChamberState state = ChamberState.initial().withPendingRecovery(
                CheckpointFixtures.running(Phase.HEATING, Duration.ofMinutes(5), T0));

        assertTrue(projector.project(state, 3).recoveryPending());
    }

    @Test
    void unavailableProbesHideTheLastReading() {
        ChamberState state = ChamberState.initial().withTemperature(58.0).withSensorUnavailable(true);

        StatusSnapshot s = projector.project(state, 4);

        assertTrue(s.sensorUnavailable());
        assertTrue(s.temperature().isEmpty());
        assertEquals(58.0, state.temperature().getAsDouble(), "last reading is kept internally");

        StatusSnapshot recovered = projector.project(state.withTemperature(58.5), 5);
        assertFalse(recovered.sensorUnavailable());
        assertEquals(58.5, recovered.temperature().getAsDouble());
    }
}
