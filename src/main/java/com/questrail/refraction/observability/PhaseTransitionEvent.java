package com.questrail.refraction.observability;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.model.ControllerPhase;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a phoropter controller phase change.
 */
public record PhaseTransitionEvent(
    Instant timestamp,
    String sessionId,
    ControllerPhase oldPhase,
    ControllerPhase newPhase,
    Optional<EscalationReason> reason
) {
}
