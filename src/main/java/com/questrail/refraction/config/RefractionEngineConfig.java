package com.questrail.refraction.config;

import com.questrail.refraction.controller.NudgePolicy;
import com.questrail.refraction.model.PupillaryDistance;
import com.questrail.refraction.protocol.ProtocolStepTable;
import com.questrail.refraction.quality.QualityThresholds;
import com.questrail.refraction.safety.DurationPolicy;
import com.questrail.refraction.safety.FatiguePolicy;
import com.questrail.refraction.validation.SafetyLimits;

import java.util.Objects;

/**
 * Aggregated configuration for a refraction engine session.
 *
 * <p>Every threshold and nudge magnitude the engine uses lives in one of these
 * components. The protocol table is validated when it is built, so holding a
 * config implies holding a valid table.</p>
 */
public record RefractionEngineConfig(
    ProtocolStepTable protocol,
    SafetyLimits safetyLimits,
    QualityThresholds qualityThresholds,
    DurationPolicy durationPolicy,
    FatiguePolicy fatiguePolicy,
    NudgePolicy nudgePolicy,
    PupillaryDistance initialPupillaryDistance
) {
    public RefractionEngineConfig {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(safetyLimits, "safetyLimits");
        Objects.requireNonNull(qualityThresholds, "qualityThresholds");
        Objects.requireNonNull(durationPolicy, "durationPolicy");
        Objects.requireNonNull(fatiguePolicy, "fatiguePolicy");
        Objects.requireNonNull(nudgePolicy, "nudgePolicy");
        Objects.requireNonNull(initialPupillaryDistance, "initialPupillaryDistance");
    }

    /**
     * Standard protocol with every component at its defaults.
     */
    public static RefractionEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProtocolStepTable protocol;
        private SafetyLimits safetyLimits = SafetyLimits.defaults();
        private QualityThresholds qualityThresholds = QualityThresholds.defaults();
        private DurationPolicy durationPolicy = DurationPolicy.defaults();
        private FatiguePolicy fatiguePolicy = FatiguePolicy.defaults();
        private NudgePolicy nudgePolicy = NudgePolicy.defaults();
        private PupillaryDistance initialPupillaryDistance = PupillaryDistance.averageAdult();

        public Builder withProtocol(ProtocolStepTable protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder withSafetyLimits(SafetyLimits safetyLimits) {
            this.safetyLimits = safetyLimits;
            return this;
        }

        public Builder withQualityThresholds(QualityThresholds qualityThresholds) {
            this.qualityThresholds = qualityThresholds;
            return this;
        }

        public Builder withDurationPolicy(DurationPolicy durationPolicy) {
            this.durationPolicy = durationPolicy;
            return this;
        }

        public Builder withFatiguePolicy(FatiguePolicy fatiguePolicy) {
            this.fatiguePolicy = fatiguePolicy;
            return this;
        }

        public Builder withNudgePolicy(NudgePolicy nudgePolicy) {
            this.nudgePolicy = nudgePolicy;
            return this;
        }

        public Builder withInitialPupillaryDistance(PupillaryDistance pupillaryDistance) {
            this.initialPupillaryDistance = pupillaryDistance;
            return this;
        }

        public RefractionEngineConfig build() {
            return new RefractionEngineConfig(
                    protocol != null ? protocol : ProtocolStepTable.standard(),
                    safetyLimits,
                    qualityThresholds,
                    durationPolicy,
                    fatiguePolicy,
                    nudgePolicy,
                    initialPupillaryDistance);
        }
    }
}
