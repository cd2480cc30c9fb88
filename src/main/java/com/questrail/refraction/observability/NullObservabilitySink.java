package com.questrail.refraction.observability;

/**
 * No-op implementation of RefractionObservabilitySink.
 */
public final class NullObservabilitySink implements RefractionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {}

    @Override
    public void onStepTransition(StepTransitionEvent event) {}

    @Override
    public void onAdjustment(AdjustmentEvent event) {}

    @Override
    public void onSafetyEvent(SafetyEvent event) {}

    @Override
    public void onError(RefractionErrorEvent event) {}
}
