package com.questrail.refraction.engine;

import com.questrail.refraction.controller.AdjustmentOutcome;
import com.questrail.refraction.controller.DeviceCommand;
import com.questrail.refraction.protocol.StepId;
import com.questrail.refraction.quality.ResponseVerdict;
import com.questrail.refraction.safety.FatigueAssessment;
import com.questrail.refraction.safety.SafetyVerdict;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything the orchestration layer needs after one turn.
 *
 * @param kind        how the turn was resolved
 * @param fromStep    step the turn answered
 * @param nextStep    step the session is now on
 * @param verdict     quality verdict; empty when the safety monitor decided
 *                    the turn before the gate ran
 * @param safety      safety verdict; empty for a closed session
 * @param adjustments every adjustment attempted this turn, applied or not
 * @param command     device command to carry out
 * @param fatigue     fatigue recommendation when a sample was recorded
 */
public record TurnOutcome(
        Kind kind,
        StepId fromStep,
        StepId nextStep,
        Optional<ResponseVerdict> verdict,
        Optional<SafetyVerdict> safety,
        List<AdjustmentOutcome> adjustments,
        DeviceCommand command,
        Optional<FatigueAssessment> fatigue
) {
    public enum Kind {
        /** Clear response; the session moved to the successor step. */
        ADVANCED,

        /** Response not clear enough; the step is presented again. */
        REPEAT,

        /**
         * Clear response, but the validator refused the resulting adjustment.
         * The command presents the step the session is now on.
         */
        ADJUSTMENT_REJECTED,

        /** Binocular balance nudged one eye; the balance test repeats. */
        RETEST,

        /** Persona override; step locked and no adjustment made. */
        PERSONA_LOCKED,

        /** Red flag or hard stop; the controller is halted. */
        ESCALATED,

        /** The session is over; nothing was done. */
        SESSION_CLOSED
    }

    public TurnOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(fromStep, "fromStep");
        Objects.requireNonNull(nextStep, "nextStep");
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(safety, "safety");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(fatigue, "fatigue");
        adjustments = List.copyOf(adjustments);
    }

    public boolean isEscalated() {
        return kind == Kind.ESCALATED;
    }

    public boolean isRepeat() {
        return fromStep.equals(nextStep);
    }

    /**
     * Audit messages of the attempted adjustments, in order.
     */
    public List<String> messages() {
        return adjustments.stream().map(AdjustmentOutcome::message).collect(Collectors.toList());
    }

    /**
     * Messages of the adjustments the validator refused.
     */
    public List<String> rejectionMessages() {
        return adjustments.stream()
                .filter(a -> !a.isApplied())
                .map(AdjustmentOutcome::message)
                .collect(Collectors.toList());
    }
}
