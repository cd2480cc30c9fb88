package com.questrail.refraction.engine;

import com.questrail.refraction.model.PhoropterState;
import com.questrail.refraction.protocol.StepId;
import com.questrail.refraction.safety.ExamQualityMetrics;
import com.questrail.refraction.safety.SafetySnapshot;

import java.util.Objects;

/**
 * Read-only view of a whole session, for the persistence and reporting
 * collaborators. {@link PhoropterState#adjustmentHistory()} carries the full
 * history.
 */
public record SessionSnapshot(
        String sessionId,
        PhoropterState phoropter,
        StepId currentStep,
        SafetySnapshot safety,
        ExamQualityMetrics quality
) {
    public SessionSnapshot {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(phoropter, "phoropter");
        Objects.requireNonNull(currentStep, "currentStep");
        Objects.requireNonNull(safety, "safety");
        Objects.requireNonNull(quality, "quality");
    }
}
