package com.questrail.refraction.controller;

import com.questrail.refraction.protocol.SlotValues;

import java.util.Objects;
import java.util.Optional;

/**
 * Patient answer to the red/green duochrome comparison.
 */
public enum DuochromeResult
{
    /** Over-minused side is blurrier: reduce sphere. */
    RED_CLEARER,

    /** Under-minused side is blurrier: increase sphere. */
    GREEN_CLEARER,

    /** Balanced; no change. */
    EQUAL;

    /**
     * Maps a {@code color_preference} slot value; empty for anything else.
     */
    public static Optional<DuochromeResult> fromColorPreference(String value) {
        Objects.requireNonNull(value, "value");
        switch (value) {
            case SlotValues.RED:
                return Optional.of(RED_CLEARER);
            case SlotValues.GREEN:
                return Optional.of(GREEN_CLEARER);
            case SlotValues.BOTH:
                return Optional.of(EQUAL);
            default:
                return Optional.empty();
        }
    }
}
