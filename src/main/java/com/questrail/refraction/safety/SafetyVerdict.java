package com.questrail.refraction.safety;

import com.questrail.refraction.api.EscalationReason;

import java.util.Objects;
import java.util.Optional;

/**
 * The safety monitor's decision for one turn. A verdict other than
 * {@link Directive#CONTINUE} overrides everything else the engine would do.
 *
 * @param directive  what the engine must do
 * @param escalation reason, present exactly when the directive is ESCALATE
 * @param duration   duration advisory for the turn's elapsed time
 */
public record SafetyVerdict(Directive directive, Optional<EscalationReason> escalation, DurationStatus duration)
{
    public enum Directive {
        /** Proceed to the quality gate. */
        CONTINUE,

        /** Halt the controller and hand over to a professional. */
        ESCALATE,

        /** Repeat the current step without any adjustment. */
        PERSONA_LOCK
    }

    public SafetyVerdict {
        Objects.requireNonNull(directive, "directive");
        Objects.requireNonNull(escalation, "escalation");
        Objects.requireNonNull(duration, "duration");
        if ((directive == Directive.ESCALATE) != escalation.isPresent()) {
            throw new IllegalArgumentException("escalation reason must be present exactly for ESCALATE");
        }
    }

    public static SafetyVerdict proceed(DurationStatus duration) {
        return new SafetyVerdict(Directive.CONTINUE, Optional.empty(), duration);
    }

    public static SafetyVerdict escalate(EscalationReason reason, DurationStatus duration) {
        return new SafetyVerdict(Directive.ESCALATE, Optional.of(reason), duration);
    }

    public static SafetyVerdict personaLock(DurationStatus duration) {
        return new SafetyVerdict(Directive.PERSONA_LOCK, Optional.empty(), duration);
    }

    public boolean isEscalation() {
        return directive == Directive.ESCALATE;
    }
}
