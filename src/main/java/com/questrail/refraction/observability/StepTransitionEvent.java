package com.questrail.refraction.observability;

import com.questrail.refraction.protocol.StepId;

import java.time.Instant;

/**
 * Record representing the protocol step chosen at the end of a turn.
 */
public record StepTransitionEvent(
    Instant timestamp,
    String sessionId,
    StepId fromStep,
    StepId toStep,
    String cause
) {
    /**
     * Whether the turn repeated the current step.
     */
    public boolean isRepeat() {
        return fromStep.equals(toStep);
    }
}
