package com.questrail.chamber.config;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for the production chamber runtime.
 */
public record ChamberRuntimeConfig(
    ChamberTimingPolicy timingPolicy,
    RegulationPolicy regulationPolicy,
    JobPolicy jobPolicy,
    boolean requireRecoveryConfirmation,
    Path checkpointFile,
    InetSocketAddress statusBindAddress,
    List<InetSocketAddress> statusObservers
) {
    public ChamberRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(regulationPolicy, "regulationPolicy");
        Objects.requireNonNull(jobPolicy, "jobPolicy");
        Objects.requireNonNull(checkpointFile, "checkpointFile");
        Objects.requireNonNull(statusBindAddress, "statusBindAddress");
        statusObservers = List.copyOf(statusObservers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChamberTimingPolicy timingPolicy = ChamberTimingPolicy.defaults();
        private RegulationPolicy regulationPolicy = RegulationPolicy.defaults();
        private JobPolicy jobPolicy = JobPolicy.defaults();
        private boolean requireRecoveryConfirmation = false;
        private Path checkpointFile = Path.of("print_state.json");
        private InetSocketAddress statusBindAddress = new InetSocketAddress(0);
        private final List<InetSocketAddress> statusObservers = new ArrayList<>();

        public Builder withTimingPolicy(ChamberTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withRegulationPolicy(RegulationPolicy regulationPolicy) {
            this.regulationPolicy = regulationPolicy;
            return this;
        }

        public Builder withJobPolicy(JobPolicy jobPolicy) {
            this.jobPolicy = jobPolicy;
            return this;
        }

        public Builder withRequireRecoveryConfirmation(boolean required) {
            this.requireRecoveryConfirmation = required;
            return this;
        }

        public Builder withCheckpointFile(Path checkpointFile) {
            this.checkpointFile = checkpointFile;
            return this;
        }

        public Builder withStatusBindAddress(InetSocketAddress address) {
            this.statusBindAddress = address;
            return this;
        }

        public Builder addStatusObserver(InetSocketAddress observer) {
            statusObservers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public ChamberRuntimeConfig build() {
            return new ChamberRuntimeConfig(timingPolicy, regulationPolicy, jobPolicy,
                    requireRecoveryConfirmation, checkpointFile, statusBindAddress, statusObservers);
        }
    }
}
