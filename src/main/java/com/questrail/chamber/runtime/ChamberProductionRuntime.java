package com.questrail.chamber.runtime;

import com.questrail.chamber.api.ChamberController;
import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.checkpoint.CheckpointCodec;
import com.questrail.chamber.checkpoint.CheckpointStore;
import com.questrail.chamber.checkpoint.CheckpointValidator;
import com.questrail.chamber.checkpoint.FileCheckpointStore;
import com.questrail.chamber.checkpoint.RecoveryPlanner;
import com.questrail.chamber.config.ChamberRuntimeConfig;
import com.questrail.chamber.control.internal.exec.ChamberCoordinator;
import com.questrail.chamber.control.internal.exec.HardwareIntentExecutor;
import com.questrail.chamber.control.internal.state.PhaseReducer;
import com.questrail.chamber.control.internal.time.MonotonicClock;
import com.questrail.chamber.control.internal.time.MonotonicScheduler;
import com.questrail.chamber.control.internal.time.ScheduledExecutorScheduler;
import com.questrail.chamber.control.internal.time.SystemMonotonicClock;
import com.questrail.chamber.control.internal.time.SystemWallClock;
import com.questrail.chamber.control.internal.time.Ticker;
import com.questrail.chamber.control.internal.time.WallClock;
import com.questrail.chamber.hardware.ActuatorDriver;
import com.questrail.chamber.hardware.HazardDetector;
import com.questrail.chamber.hardware.ProbeSource;
import com.questrail.chamber.hardware.TimedActuatorDriver;
import com.questrail.chamber.observability.ChamberErrorEvent;
import com.questrail.chamber.observability.ChamberObservabilitySink;
import com.questrail.chamber.observability.NullObservabilitySink;
import com.questrail.chamber.status.StatusProjector;
import com.questrail.chamber.status.StatusSnapshotCodec;
import com.questrail.chamber.transport.DatagramEndpoint;
import com.questrail.chamber.transport.udp.UdpStatusBroadcaster;
import com.questrail.chamber.transport.udp.netty.NettyUdpDatagramEndpoint;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * ChamberProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production chamber heater.
 *
 * <h2>Wiring</h2>
 * <ul>
 *   <li>one scheduler thread driving the control-loop and safety tickers</li>
 *   <li>one actuator thread so a hung driver call can be abandoned after the
 *       actuator timeout</li>
 *   <li>file checkpoint store, UDP status broadcaster, the coordinator</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()  → status transport up, checkpoint recovery, tickers armed
 *   runtime.stop()   → tickers cancelled, transport down, executors shut down
 * </pre>
 * Stopping leaves the checkpoint in place so the next start can resume.
 */
public final class ChamberProductionRuntime {
    private final ChamberCoordinator coordinator;
    private final UdpStatusBroadcaster broadcaster;
    private final Ticker controlTicker;
    private final Ticker safetyTicker;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService actuatorExecutor;

    private ChamberProductionRuntime(
            ChamberCoordinator coordinator,
            UdpStatusBroadcaster broadcaster,
            Ticker controlTicker,
            Ticker safetyTicker,
            ScheduledExecutorService schedulerExecutor,
            ExecutorService actuatorExecutor) {
        this.coordinator = coordinator;
        this.broadcaster = broadcaster;
        this.controlTicker = controlTicker;
        this.safetyTicker = safetyTicker;
        this.schedulerExecutor = schedulerExecutor;
        this.actuatorExecutor = actuatorExecutor;
    }

    public void start() {
        broadcaster.start();
        coordinator.recover();
        safetyTicker.start();
        controlTicker.start();
    }

    public void stop() {
        controlTicker.cancel();
        safetyTicker.cancel();
        broadcaster.stop();
        shutdown(schedulerExecutor);
        shutdown(actuatorExecutor);
    }

    /**
     * Command surface for whatever transport the application puts in front.
     */
    public ChamberController controller() {
        return coordinator;
    }

    public StatusSnapshot currentStatus() {
        return coordinator.currentStatus();
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChamberRuntimeConfig config = ChamberRuntimeConfig.builder().build();
        private ProbeSource probes;
        private ActuatorDriver actuators;
        private HazardDetector hazards = HazardDetector.none();
        private ChamberObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Function<ChamberRuntimeConfig, DatagramEndpoint> endpointFactory =
                cfg -> new NettyUdpDatagramEndpoint(cfg.statusBindAddress());

        public Builder withConfig(ChamberRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withProbeSource(ProbeSource probes) {
            this.probes = probes;
            return this;
        }

        public Builder withActuatorDriver(ActuatorDriver actuators) {
            this.actuators = actuators;
            return this;
        }

        public Builder withHazardDetector(HazardDetector hazards) {
            this.hazards = hazards;
            return this;
        }

        public Builder withObservabilitySink(ChamberObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the Netty endpoint, e.g. with an in-memory one in tests.
         */
        public Builder withEndpointFactory(Function<ChamberRuntimeConfig, DatagramEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public ChamberProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(probes, "probes");
            Objects.requireNonNull(actuators, "actuators");
            Objects.requireNonNull(hazards, "hazards");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(endpointFactory, "endpointFactory");

            // 1. Time and threads
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(
                    new DefaultThreadFactory("chamber-scheduler", true));
            ExecutorService actuatorExec = Executors.newSingleThreadExecutor(
                    new DefaultThreadFactory("chamber-actuator", true));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Storage and status transport
            CheckpointStore store = new FileCheckpointStore(config.checkpointFile(), new CheckpointCodec());
            UdpStatusBroadcaster broadcaster = new UdpStatusBroadcaster(
                    endpointFactory.apply(config),
                    new StatusSnapshotCodec(),
                    config.statusObservers());

            // 3. Core
            TimedActuatorDriver timedDriver = new TimedActuatorDriver(
                    actuators, actuatorExec, config.timingPolicy().actuatorTimeout());
            PhaseReducer reducer = new PhaseReducer(
                    config.regulationPolicy(), config.timingPolicy(), config.jobPolicy());
            RecoveryPlanner planner = new RecoveryPlanner(store, new CheckpointValidator(config.timingPolicy()));

            ChamberCoordinator coordinator = new ChamberCoordinator(
                    reducer,
                    feedback -> new HardwareIntentExecutor(timedDriver, store, feedback, wallClock, observabilitySink),
                    probes,
                    hazards,
                    broadcaster,
                    new StatusProjector(config.regulationPolicy()),
                    planner,
                    config.timingPolicy(),
                    config.requireRecoveryConfirmation(),
                    wallClock,
                    observabilitySink);

            // 4. Tickers; a failed iteration is reported and the next one runs on schedule
            Ticker controlTicker = new Ticker("control-loop", config.timingPolicy().tickInterval(),
                    clock, scheduler, coordinator::tick,
                    e -> observabilitySink.onError(new ChamberErrorEvent(wallClock.now(), "Control tick failed", e)));
            Ticker safetyTicker = new Ticker("safety-monitor", config.timingPolicy().safetyInterval(),
                    clock, scheduler, coordinator::safetyTick,
                    e -> observabilitySink.onError(new ChamberErrorEvent(wallClock.now(), "Safety tick failed", e)));

            return new ChamberProductionRuntime(coordinator, broadcaster, controlTicker, safetyTicker,
                    schedulerExec, actuatorExec);
        }
    }
}
