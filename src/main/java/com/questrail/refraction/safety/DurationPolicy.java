package com.questrail.refraction.safety;

/**
 * DurationPolicy
 * -----------------------------------------------------------------------------
 * Elapsed-time breakpoints for the session, in seconds.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>offerBreakAtSeconds</b>: from here on the patient is offered a break.</li>
 *   <li><b>warnAndCompleteAtSeconds</b>: the orchestration layer should wrap
 *       the exam up.</li>
 *   <li><b>hardStopAtSeconds</b>: the session is escalated with
 *       {@code duration_exceeded} regardless of any other outcome.</li>
 * </ul>
 *
 * <p>Elapsed time is always supplied by the caller; this policy never reads a
 * clock.</p>
 */
public record DurationPolicy(
        double offerBreakAtSeconds,
        double warnAndCompleteAtSeconds,
        double hardStopAtSeconds
) {
    public DurationPolicy {
        if (!(offerBreakAtSeconds > 0.0) || !Double.isFinite(offerBreakAtSeconds)) {
            throw new IllegalArgumentException("offerBreakAtSeconds must be positive and finite");
        }
        if (!(warnAndCompleteAtSeconds > offerBreakAtSeconds) || !Double.isFinite(warnAndCompleteAtSeconds)) {
            throw new IllegalArgumentException("warnAndCompleteAtSeconds must exceed offerBreakAtSeconds");
        }
        if (!(hardStopAtSeconds > warnAndCompleteAtSeconds) || !Double.isFinite(hardStopAtSeconds)) {
            throw new IllegalArgumentException("hardStopAtSeconds must exceed warnAndCompleteAtSeconds");
        }
    }

    /**
     * 12, 20 and 25 minutes.
     */
    public static DurationPolicy defaults() {
        return new DurationPolicy(12 * 60, 20 * 60, 25 * 60);
    }

    public DurationStatus classify(double elapsedSeconds) {
        if (elapsedSeconds >= hardStopAtSeconds) {
            return DurationStatus.HARD_STOP;
        }
        if (elapsedSeconds >= warnAndCompleteAtSeconds) {
            return DurationStatus.WARN_AND_COMPLETE;
        }
        if (elapsedSeconds >= offerBreakAtSeconds) {
            return DurationStatus.OFFER_BREAK;
        }
        return DurationStatus.CONTINUE;
    }
}
