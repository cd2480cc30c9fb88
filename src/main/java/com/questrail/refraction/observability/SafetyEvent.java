package com.questrail.refraction.observability;

import java.time.Instant;

/**
 * Record representing a safety monitor finding.
 */
public record SafetyEvent(
    Instant timestamp,
    String sessionId,
    Type type,
    double elapsedSeconds,
    String detail
) {
    public enum Type {
        RED_FLAG,
        HARD_STOP,
        WARN_AND_COMPLETE,
        OFFER_BREAK,
        PERSONA_OVERRIDE,
        FATIGUE
    }
}
