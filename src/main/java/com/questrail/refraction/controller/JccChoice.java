package com.questrail.refraction.controller;

import com.questrail.refraction.protocol.SlotValues;

import java.util.Objects;
import java.util.Optional;

/**
 * Patient answer to a JCC flip ("which is clearer, one or two?").
 */
public enum JccChoice
{
    FIRST,
    SECOND,
    SAME;

    /**
     * Maps a {@code clarity_feedback} slot value; empty for anything else.
     */
    public static Optional<JccChoice> fromClarityFeedback(String value) {
        Objects.requireNonNull(value, "value");
        switch (value) {
            case SlotValues.FIRST_BETTER:
                return Optional.of(FIRST);
            case SlotValues.SECOND_BETTER:
                return Optional.of(SECOND);
            case SlotValues.BOTH_SAME:
                return Optional.of(SAME);
            default:
                return Optional.empty();
        }
    }
}
