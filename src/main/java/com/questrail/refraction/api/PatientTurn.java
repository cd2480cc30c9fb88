package com.questrail.refraction.api;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PatientTurn
 * -----------------------------------------------------------------------------
 * The complete per-turn input to the engine: a classified response plus the
 * session timing the orchestration layer measured for it.
 *
 * <p>The engine does not own a clock. {@code elapsedSeconds} is the session
 * clock as supplied by the caller and is the only time source used for
 * duration thresholds.</p>
 *
 * @param response               classifier output
 * @param elapsedSeconds         seconds since the session started
 * @param responseLatencySeconds seconds the patient took to answer
 */
public record PatientTurn(
        ClassifiedResponse response,
        double elapsedSeconds,
        double responseLatencySeconds
) {
    public PatientTurn {
        Objects.requireNonNull(response, "response");
        if (!Double.isFinite(elapsedSeconds) || elapsedSeconds < 0.0) {
            throw new IllegalArgumentException("elapsedSeconds must be finite and non-negative: " + elapsedSeconds);
        }
        if (!Double.isFinite(responseLatencySeconds) || responseLatencySeconds < 0.0) {
            throw new IllegalArgumentException(
                    "responseLatencySeconds must be finite and non-negative: " + responseLatencySeconds);
        }
    }

    public static PatientTurn of(ClassifiedResponse response, double elapsedSeconds) {
        return new PatientTurn(response, elapsedSeconds, 0.0);
    }

    // Convenience accessors so callers rarely reach through response().

    public Intent intent() {
        return response.intent();
    }

    public double confidence() {
        return response.confidence();
    }

    public Map<SlotKey, String> slots() {
        return response.slots();
    }

    public Optional<String> slot(SlotKey key) {
        return response.slot(key);
    }

    public Sentiment sentiment() {
        return response.sentiment();
    }

    public boolean redFlag() {
        return response.redFlag();
    }

    public boolean personaOverride() {
        return response.personaOverride();
    }
}
