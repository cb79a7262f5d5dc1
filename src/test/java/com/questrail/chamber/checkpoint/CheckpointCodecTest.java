package com.questrail.chamber.checkpoint;

import com.questrail.chamber.api.Actuator;
import com.questrail.chamber.api.ManualOverride;
import com.questrail.chamber.api.Phase;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CheckpointCodecTest
 * -----------------------------------------------------------------------------
 * The checkpoint document must carry everything needed to continue a run,
 * and anything that is not a well-formed checkpoint must surface as
 * {@link CheckpointCorruptException}, never as a half-built state.
 */
class CheckpointCodecTest {

    private static final Instant WRITTEN = Instant.parse("2026-03-01T09:15:30Z");

    private final CheckpointCodec codec = new CheckpointCodec();

    @Test
    void preservesRunAcrossEncodeAndDecode() throws Exception {
        Checkpoint original = CheckpointFixtures.running(Phase.MAINTAINING, Duration.ofSeconds(1000), WRITTEN);
        Checkpoint withOverride = new Checkpoint(
                original.state().withOverride(Actuator.FANS, ManualOverride.OFF).withPaused(true),
                WRITTEN);

        Checkpoint decoded = codec.decode(codec.encode(withOverride));

        assertEquals(withOverride, decoded);
    }

    @Test
    void documentIsReadableJson() throws Exception {
        String json = new String(codec.encode(
                CheckpointFixtures.running(Phase.HEATING, Duration.ofSeconds(90), WRITTEN)), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"version\" : 1"), json);
        assertTrue(json.contains("\"phase\" : \"HEATING\""), json);
        assertTrue(json.contains("\"activeElapsed\" : \"PT1M30S\""), json);
        assertTrue(json.contains("\"writtenAt\" : \"2026-03-01T09:15:30Z\""), json);
    }

    @Test
    void truncatedDocumentIsCorrupt() throws Exception {
        byte[] full = codec.encode(CheckpointFixtures.running(Phase.HEATING, Duration.ofSeconds(90), WRITTEN));
        byte[] truncated = new byte[full.length / 2];
        System.arraycopy(full, 0, truncated, 0, truncated.length);

        assertThrows(CheckpointCorruptException.class, () -> codec.decode(truncated));
    }

    @Test
    void garbageIsCorrupt() {
        assertThrows(CheckpointCorruptException.class,
                () -> codec.decode("not json at all".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CheckpointCorruptException.class, () -> codec.decode(new byte[0]));
        assertThrows(CheckpointCorruptException.class,
                () -> codec.decode("null".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unknownVersionIsCorrupt() throws Exception {
        String json = new String(codec.encode(
                CheckpointFixtures.running(Phase.HEATING, Duration.ofSeconds(90), WRITTEN)), StandardCharsets.UTF_8);

        byte[] future = json.replace("\"version\" : 1", "\"version\" : 2").getBytes(StandardCharsets.UTF_8);

        assertThrows(CheckpointCorruptException.class, () -> codec.decode(future));
    }

    @Test
    void missingFieldIsCorrupt() {
        String json = "{\"version\":1,\"writtenAt\":\"2026-03-01T09:15:30Z\",\"phase\":\"HEATING\"}";

        CheckpointCorruptException ex = assertThrows(CheckpointCorruptException.class,
                () -> codec.decode(json.getBytes(StandardCharsets.UTF_8)));
        assertTrue(ex.getMessage().contains("missing"));
    }

    @Test
    void invalidValuesAreCorrupt() throws Exception {
        String json = new String(codec.encode(
                CheckpointFixtures.running(Phase.HEATING, Duration.ofSeconds(90), WRITTEN)), StandardCharsets.UTF_8);

        byte[] badPhase = json.replace("\"HEATING\"", "\"BOILING\"").getBytes(StandardCharsets.UTF_8);
        byte[] badDuration = json.replace("\"PT1M30S\"", "\"ninety seconds\"").getBytes(StandardCharsets.UTF_8);
        byte[] elapsedPastTarget = json.replace("\"PT1M30S\"", "\"PT2H\"").getBytes(StandardCharsets.UTF_8);

        assertThrows(CheckpointCorruptException.class, () -> codec.decode(badPhase));
        assertThrows(CheckpointCorruptException.class, () -> codec.decode(badDuration));
        assertThrows(CheckpointCorruptException.class, () -> codec.decode(elapsedPastTarget));
    }
}
