package com.questrail.refraction.validation;

import java.util.Objects;

/**
 * Outcome of {@link AdjustmentValidator#validate}.
 */
public sealed interface ValidationResult
        permits ValidationResult.Accepted, ValidationResult.Rejected
{
    boolean isAccepted();

    /**
     * The adjustment is safe; {@code newValue} is the value the parameter
     * would take.
     */
    record Accepted(double newValue) implements ValidationResult {
        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * The adjustment must not be applied.
     */
    record Rejected(RejectionReason reason, String message) implements ValidationResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
