package com.questrail.chamber.status;

import com.questrail.chamber.api.StatusSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SequencedStatusFilterTest {

    @Test
    void acceptsIncreasingSequence() {
        SequencedStatusFilter filter = new SequencedStatusFilter();

        assertTrue(filter.accept(StatusFixtures.snapshot(1)));
        assertTrue(filter.accept(StatusFixtures.snapshot(2)));
        assertTrue(filter.accept(StatusFixtures.snapshot(5)));
        assertEquals(5, filter.lastAcceptedSequence());
    }

    @Test
    void dropsDuplicatesAndOlderSnapshots() {
        SequencedStatusFilter filter = new SequencedStatusFilter();
        filter.accept(StatusFixtures.snapshot(7));

        assertFalse(filter.accept(StatusFixtures.snapshot(7)));
        assertFalse(filter.accept(StatusFixtures.snapshot(3)));
        assertEquals(7, filter.latest().sequenceNumber());
    }

    @Test
    void shuffledDeliveryNeverGoesBackwards() {
        List<StatusSnapshot> snapshots = new ArrayList<>();
        for (long seq = 1; seq <= 200; seq++) {
            snapshots.add(StatusFixtures.snapshot(seq));
        }
        Collections.shuffle(snapshots, new Random(42));

        SequencedStatusFilter filter = new SequencedStatusFilter();
        long lastSeen = 0;
        for (StatusSnapshot s : snapshots) {
            if (filter.accept(s)) {
                assertTrue(s.sequenceNumber() > lastSeen);
                lastSeen = s.sequenceNumber();
            }
            assertEquals(lastSeen, filter.lastAcceptedSequence());
        }
        assertEquals(200, lastSeen, "the newest snapshot is always accepted");
    }

    @Test
    void sequencerStartsAtOneAndIncrements() {
        StatusSequencer sequencer = new StatusSequencer();

        assertEquals(0, sequencer.current());
        assertEquals(1, sequencer.next());
        assertEquals(2, sequencer.next());
        assertEquals(2, sequencer.current());
    }

    @Test
    void seededSequencerOutrunsItsPredecessor() {
        Instant boot = Instant.parse("2026-03-01T08:00:00Z");
        StatusSequencer first = StatusSequencer.seededAt(boot);
        for (int i = 0; i < 50_000; i++) {
            first.next();
        }

        StatusSequencer restarted = StatusSequencer.seededAt(boot.plusSeconds(1));

        assertTrue(restarted.next() > first.current());
        assertThrows(IllegalArgumentException.class, () -> new StatusSequencer(-1));
    }
}
