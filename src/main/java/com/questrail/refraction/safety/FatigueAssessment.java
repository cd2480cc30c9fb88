package com.questrail.refraction.safety;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a fatigue evaluation. A recommendation only: a fatigued patient is
 * offered a break, the session is never halted for fatigue.
 *
 * @param fatigued whether any fatigue indicator fired
 * @param reason   the first indicator that fired
 * @param score    0.0 (fresh) to 1.0 (exhausted) over the recent window
 */
public record FatigueAssessment(boolean fatigued, Optional<String> reason, double score)
{
    public FatigueAssessment {
        Objects.requireNonNull(reason, "reason");
        if (fatigued && reason.isEmpty()) {
            throw new IllegalArgumentException("a fatigued assessment needs a reason");
        }
    }

    public static FatigueAssessment rested(double score) {
        return new FatigueAssessment(false, Optional.empty(), score);
    }

    public static FatigueAssessment fatigued(String reason, double score) {
        return new FatigueAssessment(true, Optional.of(reason), score);
    }
}
