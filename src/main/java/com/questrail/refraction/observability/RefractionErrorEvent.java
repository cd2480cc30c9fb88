package com.questrail.refraction.observability;

import java.time.Instant;

/**
 * Record representing an error or caller bug observed by the engine.
 */
public record RefractionErrorEvent(
    Instant timestamp,
    String sessionId,
    String message,
    Throwable cause
) {
}
