package com.questrail.chamber.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.chamber.api.ActuatorStates;
import com.questrail.chamber.api.ManualOverride;
import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.StatusSnapshot;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalDouble;

/**
 * StatusSnapshotCodec
 * -----------------------------------------------------------------------------
 * Compact JSON encoding of a {@link StatusSnapshot}, one snapshot per datagram.
 *
 * <p>Durations travel as whole milliseconds; an absent temperature is
 * {@code null}. Decoding failures are reported as {@link IOException} so the
 * receiver can drop the datagram.</p>
 */
public final class StatusSnapshotCodec
{
    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public byte[] encode(StatusSnapshot s) {
        Wire wire = new Wire(
                s.sequenceNumber(),
                s.phase().name(),
                s.temperature().isPresent() ? s.temperature().getAsDouble() : null,
                s.setpoint(),
                s.activeElapsed().toMillis(),
                s.remaining().toMillis(),
                s.paused(),
                s.actuators().heaterOn(),
                s.actuators().fansOn(),
                s.awaitingConfirmation(),
                s.sensorUnavailable(),
                s.actuatorFault(),
                s.emergencyLatched(),
                s.heaterOverride().name(),
                s.fanOverride().name(),
                s.coolingRemaining().toMillis(),
                s.recoveryPending());
        try {
            return mapper.writeValueAsBytes(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Status snapshot could not be encoded", e);
        }
    }

    public StatusSnapshot decode(byte[] content) throws IOException {
        Wire w = mapper.readValue(content, Wire.class);
        if (w == null || w.phase() == null || w.heaterOverride() == null || w.fanOverride() == null) {
            throw new IOException("Status datagram is incomplete");
        }
        try {
            return new StatusSnapshot(
                    w.seq(),
                    Phase.valueOf(w.phase()),
                    w.temperature() == null ? OptionalDouble.empty() : OptionalDouble.of(w.temperature()),
                    w.setpoint(),
                    Duration.ofMillis(w.activeElapsedMs()),
                    Duration.ofMillis(w.remainingMs()),
                    w.paused(),
                    new ActuatorStates(w.heaterOn(), w.fansOn()),
                    w.awaitingConfirmation(),
                    w.sensorUnavailable(),
                    w.actuatorFault(),
                    w.emergencyLatched(),
                    ManualOverride.valueOf(w.heaterOverride()),
                    ManualOverride.valueOf(w.fanOverride()),
                    Duration.ofMillis(w.coolingRemainingMs()),
                    w.recoveryPending());
        } catch (IllegalArgumentException e) {
            throw new IOException("Status datagram is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Wire shape.
     */
    public record Wire(
            long seq,
            String phase,
            Double temperature,
            double setpoint,
            long activeElapsedMs,
            long remainingMs,
            boolean paused,
            boolean heaterOn,
            boolean fansOn,
            boolean awaitingConfirmation,
            boolean sensorUnavailable,
            boolean actuatorFault,
            boolean emergencyLatched,
            String heaterOverride,
            String fanOverride,
            long coolingRemainingMs,
            boolean recoveryPending
    ) {}
}
