package com.questrail.refraction.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Patient sentiment as tagged by the classifier.
 *
 * <p>Only the safety monitor reads sentiment, and only {@link #FATIGUED} has an
 * effect (it flags fatigue for the turn).</p>
 */
public enum Sentiment
{
    CONFIDENT("confident"),
    UNDER_CONFIDENT("under_confident"),
    CONFUSED("confused"),
    OVERCONFIDENT("overconfident"),
    FATIGUED("fatigued");

    private final String tag;

    Sentiment(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a classifier tag such as {@code "Under Confident"} or
     * {@code "fatigued"}. Unrecognized tags resolve to {@link #CONFIDENT}, the
     * classifier's own default.
     */
    public static Sentiment fromTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (Sentiment sentiment : values()) {
            if (sentiment.tag.equals(normalized)) {
                return sentiment;
            }
        }
        return CONFIDENT;
    }
}
