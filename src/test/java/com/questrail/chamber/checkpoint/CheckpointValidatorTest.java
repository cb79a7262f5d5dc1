package com.questrail.chamber.checkpoint;

import com.questrail.chamber.api.Phase;
import com.questrail.chamber.config.ChamberTimingPolicy;
import com.questrail.chamber.control.internal.state.RunState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointValidatorTest {

    private static final Instant WRITTEN = Instant.parse("2026-03-01T09:00:00Z");

    private final CheckpointValidator validator = new CheckpointValidator(ChamberTimingPolicy.defaults());

    @Test
    void runningCheckpointResumableWithinRemainingPlusGrace() {
        // 1000 s of 3600 s done: 2600 s remaining + 300 s grace.
        Checkpoint cp = CheckpointFixtures.running(Phase.MAINTAINING, Duration.ofSeconds(1000), WRITTEN);

        assertEquals(CheckpointValidator.Verdict.RESUMABLE, validator.assess(cp, WRITTEN.plusSeconds(300)));
        assertEquals(CheckpointValidator.Verdict.RESUMABLE, validator.assess(cp, WRITTEN.plusSeconds(2900)));
        assertEquals(CheckpointValidator.Verdict.STALE, validator.assess(cp, WRITTEN.plusSeconds(2901)));
    }

    @Test
    void clockBehindCheckpointCountsAsNoGap() {
        Checkpoint cp = CheckpointFixtures.running(Phase.HEATING, Duration.ofSeconds(3590), WRITTEN);

        assertEquals(CheckpointValidator.Verdict.RESUMABLE, validator.assess(cp, WRITTEN.minusSeconds(3600)));
    }

    @Test
    void coolingCheckpointLimitedByMaxAge() {
        Checkpoint cp = CheckpointFixtures.cooling(Duration.ofMinutes(30), WRITTEN);

        assertEquals(CheckpointValidator.Verdict.RESUMABLE, validator.assess(cp, WRITTEN.plus(Duration.ofHours(12))));
        assertEquals(CheckpointValidator.Verdict.STALE,
                validator.assess(cp, WRITTEN.plus(Duration.ofHours(12)).plusSeconds(1)));
    }

    @Test
    void idleAndWarmUpAreNotResumable() {
        Checkpoint warmUp = new Checkpoint(
                CheckpointFixtures.running(Phase.HEATING, Duration.ZERO, WRITTEN).state().withPhase(Phase.WARMING_UP),
                WRITTEN);

        assertEquals(CheckpointValidator.Verdict.NOT_RESUMABLE, validator.assess(warmUp, WRITTEN));
        assertEquals(CheckpointValidator.Verdict.NOT_RESUMABLE,
                validator.assess(new Checkpoint(RunState.idle(), WRITTEN), WRITTEN));
    }
}
