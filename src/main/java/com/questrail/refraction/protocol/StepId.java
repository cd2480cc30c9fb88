package com.questrail.refraction.protocol;

import java.util.Objects;

/**
 * Identifier of a protocol step, e.g. {@code "6.1"} or
 * {@code "escalate_to_professional"}.
 */
public record StepId(String value)
{
    /** Terminal step reached when the examination completes normally. */
    public static final StepId COMPLETE = new StepId("complete");

    /** Terminal step reached when the session is escalated. */
    public static final StepId ESCALATE_TO_PROFESSIONAL = new StepId("escalate_to_professional");

    public StepId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("step id must not be blank");
        }
    }

    public static StepId of(String value) {
        return new StepId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
