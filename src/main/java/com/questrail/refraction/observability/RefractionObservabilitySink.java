package com.questrail.refraction.observability;

/**
 * Main interface for receiving refraction engine observability events.
 * Implementations can provide logging, metrics, or audit trails.
 */
public interface RefractionObservabilitySink {
    /**
     * Called when the phoropter controller changes phase (finalized, halted).
     * @param event the transition details
     */
    void onPhaseTransition(PhaseTransitionEvent event);

    /**
     * Called after every processed turn with the step the session moved to
     * (which may equal the step it was on).
     * @param event the step transition
     */
    void onStepTransition(StepTransitionEvent event);

    /**
     * Called for every attempted lens adjustment, applied or not.
     * @param event the adjustment attempt
     */
    void onAdjustment(AdjustmentEvent event);

    /**
     * Called when the safety monitor raises a red flag, duration advisory,
     * persona lock or fatigue recommendation.
     * @param event the safety event
     */
    void onSafetyEvent(SafetyEvent event);

    /**
     * Called when an operation fails in a way that indicates a caller bug.
     * @param event the error event
     */
    void onError(RefractionErrorEvent event);
}
