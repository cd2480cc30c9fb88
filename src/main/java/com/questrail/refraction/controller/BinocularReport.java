package com.questrail.refraction.controller;

import com.questrail.refraction.protocol.SlotValues;

import java.util.Objects;
import java.util.Optional;

/**
 * Subjective clarity comparison with both eyes open.
 */
public enum BinocularReport
{
    OD_CLEARER,
    OS_CLEARER,
    EQUAL;

    /**
     * Maps a binocular {@code clarity_feedback} slot value; empty for anything else.
     * {@code first_better} names the right eye's image and {@code second_better}
     * the left eye's.
     */
    public static Optional<BinocularReport> fromClarityFeedback(String value) {
        Objects.requireNonNull(value, "value");
        switch (value) {
            case SlotValues.FIRST_BETTER:
            case SlotValues.RIGHT_CLEARER:
                return Optional.of(OD_CLEARER);
            case SlotValues.SECOND_BETTER:
            case SlotValues.LEFT_CLEARER:
                return Optional.of(OS_CLEARER);
            case SlotValues.BOTH_SAME:
                return Optional.of(EQUAL);
            default:
                return Optional.empty();
        }
    }
}
