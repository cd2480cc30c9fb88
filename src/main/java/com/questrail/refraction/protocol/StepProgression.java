package com.questrail.refraction.protocol;

import com.questrail.refraction.quality.ResponseVerdict;

import java.util.Objects;

/**
 * StepProgression
 * -----------------------------------------------------------------------------
 * Pure, deterministic step transition function over a validated
 * {@link ProtocolStepTable}.
 *
 * <pre>
 *   redFlag          → escalate_to_professional
 *   verdict != CLEAR → current step (repeat)
 *   otherwise        → configured successor
 * </pre>
 *
 * Terminal steps have no successor and therefore map to themselves.
 */
public final class StepProgression
{
    private final ProtocolStepTable table;

    public StepProgression(ProtocolStepTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public StepId nextStep(StepId currentStep, ResponseVerdict verdict, boolean redFlag) {
        Objects.requireNonNull(currentStep, "currentStep");

        if (redFlag) {
            return StepId.ESCALATE_TO_PROFESSIONAL;
        }

        Objects.requireNonNull(verdict, "verdict");
        if (!verdict.isClear()) {
            return currentStep;
        }

        return table.step(currentStep).successor().orElse(currentStep);
    }

    public ProtocolStepTable table() {
        return table;
    }
}
