package com.questrail.refraction.safety;

import java.time.Instant;
import java.util.Objects;

/**
 * Entry in the safety monitor's incident log.
 */
public record SafetyIncident(
        Instant timestamp,
        Kind kind,
        IncidentSeverity severity,
        double elapsedSeconds,
        String description
) {
    public enum Kind {
        RED_FLAG(IncidentSeverity.CRITICAL),
        HARD_STOP(IncidentSeverity.HIGH),
        PERSONA_OVERRIDE(IncidentSeverity.MEDIUM),
        FATIGUE(IncidentSeverity.LOW);

        private final IncidentSeverity severity;

        Kind(IncidentSeverity severity) {
            this.severity = severity;
        }

        public IncidentSeverity severity() {
            return severity;
        }
    }

    public SafetyIncident {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(description, "description");
    }

    static SafetyIncident of(Instant timestamp, Kind kind, double elapsedSeconds, String description) {
        return new SafetyIncident(timestamp, kind, kind.severity(), elapsedSeconds, description);
    }
}
