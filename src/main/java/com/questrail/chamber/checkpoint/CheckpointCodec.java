package com.questrail.chamber.checkpoint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.questrail.chamber.api.ActuatorStates;
import com.questrail.chamber.api.ManualOverride;
import com.questrail.chamber.api.Phase;
import com.questrail.chamber.control.internal.state.RunState;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * CheckpointCodec
 * -----------------------------------------------------------------------------
 * JSON encoding of a {@link Checkpoint}.
 *
 * <h2>Format (version 1)</h2>
 * A flat object; instants and durations are ISO-8601 strings
 * ({@code 2024-05-01T10:15:30Z}, {@code PT16M40S}) so a round trip is exact to
 * the nanosecond. Unknown properties are ignored; a missing property, a wrong
 * version or a value that does not describe a valid run is reported as
 * {@link CheckpointCorruptException}.
 */
public final class CheckpointCodec
{
    static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;

    public CheckpointCodec() {
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.ALWAYS);
    }

    public byte[] encode(Checkpoint checkpoint) throws IOException {
        RunState run = checkpoint.state();
        Document doc = new Document(
                FORMAT_VERSION,
                checkpoint.writtenAt().toString(),
                run.phase().name(),
                run.awaitingConfirmation(),
                run.setpoint(),
                run.durationTarget().toString(),
                run.activeElapsed().toString(),
                run.paused(),
                run.heaterOverride().name(),
                run.fanOverride().name(),
                run.hardwareIntent().heaterOn(),
                run.hardwareIntent().fansOn(),
                run.fansEnabled(),
                run.followJob(),
                run.requireConfirmation(),
                run.runStartedAt() == null ? null : run.runStartedAt().toString(),
                run.lastCheckpointAt() == null ? null : run.lastCheckpointAt().toString(),
                run.sinceCheckpoint().toString(),
                run.coolingElapsed().toString(),
                run.coolingStartSetpoint());
        return mapper.writeValueAsBytes(doc);
    }

    public Checkpoint decode(byte[] content) throws CheckpointCorruptException {
        Document doc;
        try {
            doc = mapper.readValue(content, Document.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptException("Checkpoint is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CheckpointCorruptException("Checkpoint could not be read", e);
        }
        if (doc == null) {
            throw new CheckpointCorruptException("Checkpoint is empty");
        }

        if (doc.version() == null || doc.version() != FORMAT_VERSION) {
            throw new CheckpointCorruptException("Unsupported checkpoint version " + doc.version());
        }

        try {
            RunState run = new RunState(
                    Phase.valueOf(require(doc.phase(), "phase")),
                    require(doc.awaitingConfirmation(), "awaitingConfirmation"),
                    require(doc.setpoint(), "setpoint"),
                    Duration.parse(require(doc.durationTarget(), "durationTarget")),
                    Duration.parse(require(doc.activeElapsed(), "activeElapsed")),
                    require(doc.paused(), "paused"),
                    ManualOverride.valueOf(require(doc.heaterOverride(), "heaterOverride")),
                    ManualOverride.valueOf(require(doc.fanOverride(), "fanOverride")),
                    new ActuatorStates(require(doc.heaterOn(), "heaterOn"), require(doc.fansOn(), "fansOn")),
                    require(doc.fansEnabled(), "fansEnabled"),
                    require(doc.followJob(), "followJob"),
                    require(doc.requireConfirmation(), "requireConfirmation"),
                    doc.runStartedAt() == null ? null : Instant.parse(doc.runStartedAt()),
                    doc.lastCheckpointAt() == null ? null : Instant.parse(doc.lastCheckpointAt()),
                    Duration.parse(require(doc.sinceCheckpoint(), "sinceCheckpoint")),
                    Duration.parse(require(doc.coolingElapsed(), "coolingElapsed")),
                    require(doc.coolingStartSetpoint(), "coolingStartSetpoint"));
            return new Checkpoint(run, Instant.parse(require(doc.writtenAt(), "writtenAt")));
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new CheckpointCorruptException("Checkpoint content is invalid: " + e.getMessage(), e);
        }
    }

    private static <T> T require(T value, String field) throws CheckpointCorruptException {
        if (value == null) {
            throw new CheckpointCorruptException("Checkpoint is missing '" + field + "'");
        }
        return value;
    }

    /**
     * On-disk shape. Boxed types so that a missing property is detectable.
     */
    public record Document(
            Integer version,
            String writtenAt,
            String phase,
            Boolean awaitingConfirmation,
            Double setpoint,
            String durationTarget,
            String activeElapsed,
            Boolean paused,
            String heaterOverride,
            String fanOverride,
            Boolean heaterOn,
            Boolean fansOn,
            Boolean fansEnabled,
            Boolean followJob,
            Boolean requireConfirmation,
            String runStartedAt,
            String lastCheckpointAt,
            String sinceCheckpoint,
            String coolingElapsed,
            Double coolingStartSetpoint
    ) {}
}
