package com.questrail.chamber.control.internal.regulation;

import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.RunSettings;
import com.questrail.chamber.control.internal.state.RunState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ElapsedTimeAccountantTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private static RunState run(Phase phase, Duration target) {
        return RunState.started(RunSettings.builder().withDuration(target).build(), T0).withPhase(phase);
    }

    @Test
    void advancesOnlyWhileRunning() {
        Duration second = Duration.ofSeconds(1);

        assertEquals(Duration.ZERO,
                ElapsedTimeAccountant.advance(run(Phase.WARMING_UP, Duration.ofHours(1)), second).activeElapsed());
        assertEquals(second,
                ElapsedTimeAccountant.advance(run(Phase.HEATING, Duration.ofHours(1)), second).activeElapsed());
        assertEquals(second,
                ElapsedTimeAccountant.advance(run(Phase.MAINTAINING, Duration.ofHours(1)), second).activeElapsed());
        assertEquals(Duration.ZERO,
                ElapsedTimeAccountant.advance(run(Phase.COOLING, Duration.ofHours(1)), second).activeElapsed());
    }

    @Test
    void pausedRunDoesNotAdvance() {
        RunState paused = run(Phase.HEATING, Duration.ofHours(1)).withPaused(true);

        assertSame(paused, ElapsedTimeAccountant.advance(paused, Duration.ofSeconds(1)));
    }

    @Test
    void elapsedIsClampedAtTarget() {
        RunState nearlyDone = run(Phase.MAINTAINING, Duration.ofSeconds(10)).withActiveElapsed(Duration.ofSeconds(9));

        RunState done = ElapsedTimeAccountant.advance(nearlyDone, Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(10), done.activeElapsed());
        assertTrue(ElapsedTimeAccountant.targetReached(done));
        assertEquals(Duration.ZERO, ElapsedTimeAccountant.remaining(done));
    }

    @Test
    void remainingIsZeroOutsideActiveRun() {
        assertEquals(Duration.ZERO, ElapsedTimeAccountant.remaining(RunState.idle()));
        assertEquals(Duration.ZERO, ElapsedTimeAccountant.remaining(run(Phase.COOLING, Duration.ofHours(1))));
        assertEquals(Duration.ofHours(1), ElapsedTimeAccountant.remaining(run(Phase.WARMING_UP, Duration.ofHours(1))));
    }
}
