package com.questrail.chamber.status;

import com.questrail.chamber.api.StatusSnapshot;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class StatusSnapshotCodecTest {

    private final StatusSnapshotCodec codec = new StatusSnapshotCodec();

    @Test
    void snapshotSurvivesTheWire() throws Exception {
        StatusSnapshot snapshot = StatusFixtures.snapshot(42);

        assertEquals(snapshot, codec.decode(codec.encode(snapshot)));
    }

    @Test
    void missingTemperatureIsEncodedAsNull() throws Exception {
        StatusSnapshot base = StatusFixtures.snapshot(3);
        StatusSnapshot noReading = new StatusSnapshot(base.sequenceNumber(), base.phase(), OptionalDouble.empty(),
                base.setpoint(), base.activeElapsed(), base.remaining(), base.paused(), base.actuators(),
                base.awaitingConfirmation(), true, base.actuatorFault(), base.emergencyLatched(),
                base.heaterOverride(), base.fanOverride(), base.coolingRemaining(), base.recoveryPending());

        byte[] payload = codec.encode(noReading);

        assertTrue(new String(payload, StandardCharsets.UTF_8).contains("\"temperature\":null"));
        assertEquals(noReading, codec.decode(payload));
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception {
        String json = new String(codec.encode(StatusFixtures.snapshot(9)), StandardCharsets.UTF_8);
        String extended = json.substring(0, json.length() - 1) + ",\"firmware\":\"2.1\"}";

        assertEquals(9, codec.decode(extended.getBytes(StandardCharsets.UTF_8)).sequenceNumber());
    }

    @Test
    void malformedDatagramsAreRejected() {
        assertThrows(IOException.class, () -> codec.decode("{\"seq\":".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> codec.decode("{\"seq\":4}".getBytes(StandardCharsets.UTF_8)));

        String json = new String(codec.encode(StatusFixtures.snapshot(9)), StandardCharsets.UTF_8);
        assertThrows(IOException.class,
                () -> codec.decode(json.replace("\"MAINTAINING\"", "\"ON_FIRE\"").getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class,
                () -> codec.decode(json.replace("\"seq\":9", "\"seq\":0").getBytes(StandardCharsets.UTF_8)));
    }
}
