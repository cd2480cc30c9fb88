package com.questrail.refraction.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Intent
 * -----------------------------------------------------------------------------
 * Closed vocabulary of intents produced by the upstream classifier.
 *
 * <p>Classifiers speak in string tags; {@link #fromTag(String)} maps any tag the
 * engine does not know to {@link #UNKNOWN} so that an unrecognized tag can never
 * be mistaken for an actionable response.</p>
 */
public enum Intent
{
    GREETING("greeting"),
    TEST_COMPLETE("test_complete"),
    VISION_REPORTED("vision_reported"),
    HEALTH_CHECK("health_check"),
    ALIGNMENT_OK("alignment_ok"),
    PD_READY("pd_ready"),
    REFRACTION_FEEDBACK("refraction_feedback"),
    READING_ABILITY("reading_ability"),
    PRESCRIPTION_OK("prescription_ok"),
    PRODUCT_CHOICE("product_choice"),

    /** Reserved: the classifier could not attribute the utterance. */
    UNKNOWN("unknown"),

    /** Reserved: the classifier rejected the utterance outright. */
    INVALID("invalid");

    private final String tag;

    Intent(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Returns {@code false} for the reserved {@link #UNKNOWN} and {@link #INVALID}
     * values.
     */
    public boolean isRecognized() {
        return this != UNKNOWN && this != INVALID;
    }

    /**
     * Resolves a classifier tag. Matching is case-insensitive; unrecognized tags
     * resolve to {@link #UNKNOWN}.
     */
    public static Intent fromTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.tag.equals(normalized)) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
