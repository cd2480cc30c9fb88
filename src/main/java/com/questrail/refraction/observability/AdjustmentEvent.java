package com.questrail.refraction.observability;

import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.validation.RejectionReason;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing one attempted lens adjustment.
 */
public record AdjustmentEvent(
    Instant timestamp,
    String sessionId,
    Eye eye,
    RefractiveParameter parameter,
    double magnitude,
    Optional<RejectionReason> rejection,
    String message
) {
    public boolean isApplied() {
        return rejection.isEmpty();
    }
}
