package com.questrail.chamber.hardware;

import com.questrail.chamber.api.ActuatorStates;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * TimedActuatorDriver
 * =============================================================================
 * Bounds every call into an {@link ActuatorDriver} with a timeout.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The delegate runs on the supplied executor; the caller waits at most
 *       {@code timeout}.</li>
 *   <li>A timeout cancels the call (interrupting it) and is reported as an
 *       {@link ActuatorCommandException}, as is any exception thrown by the
 *       delegate.</li>
 * </ul>
 *
 * <h2>Executor Ownership</h2>
 * The executor is owned by the caller. A single-threaded executor keeps driver
 * calls serialized even when a timed-out call is still unwinding.
 */
public final class TimedActuatorDriver
{
    private final ActuatorDriver delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimedActuatorDriver(ActuatorDriver delegate, ExecutorService executor, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Applies the given states, waiting at most the configured timeout.
     *
     * @throws ActuatorCommandException if the driver failed, timed out, or the
     *                                  calling thread was interrupted
     */
    public void apply(ActuatorStates states) throws ActuatorCommandException {
        Objects.requireNonNull(states, "states");

        Future<?> call;
        try {
            call = executor.submit(() -> {
                delegate.apply(states);
                return null;
            });
        } catch (RuntimeException e) {
            throw new ActuatorCommandException(states, "Actuator executor rejected command", e);
        }

        try {
            call.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ActuatorCommandException(states, "Actuator command timed out after " + timeout, e);
        } catch (ExecutionException e) {
            throw new ActuatorCommandException(states, "Actuator command failed", e.getCause());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ActuatorCommandException(states, "Interrupted while commanding actuators", e);
        }
    }
}
