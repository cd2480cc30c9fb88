package com.questrail.refraction.safety;

/**
 * Fatigue heuristic configuration.
 *
 * <p>The mean of the last {@code windowSize} samples is compared with the mean
 * of the first {@code windowSize} samples of the session. Fatigue is flagged
 * when accuracy drops by more than {@code accuracyDrop}, confidence drops by
 * more than {@code confidenceDrop}, or the recent mean latency exceeds
 * {@code latencySeconds}. Nothing is evaluated until {@code windowSize}
 * samples exist.</p>
 *
 * @param windowSize     samples per window, at least 1
 * @param accuracyDrop   tolerated drop in mean accuracy, within (0, 1]
 * @param confidenceDrop tolerated drop in mean confidence, within (0, 1]
 * @param latencySeconds tolerated mean response latency
 */
public record FatiguePolicy(
        int windowSize,
        double accuracyDrop,
        double confidenceDrop,
        double latencySeconds
) {
    public FatiguePolicy {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        if (!(accuracyDrop > 0.0 && accuracyDrop <= 1.0)) {
            throw new IllegalArgumentException("accuracyDrop must be within (0.0, 1.0]");
        }
        if (!(confidenceDrop > 0.0 && confidenceDrop <= 1.0)) {
            throw new IllegalArgumentException("confidenceDrop must be within (0.0, 1.0]");
        }
        if (!(latencySeconds > 0.0) || !Double.isFinite(latencySeconds)) {
            throw new IllegalArgumentException("latencySeconds must be positive and finite");
        }
    }

    /**
     * Window 5, accuracy drop 0.2, confidence drop 0.3, latency 3.0 s.
     */
    public static FatiguePolicy defaults() {
        return new FatiguePolicy(5, 0.2, 0.3, 3.0);
    }
}
