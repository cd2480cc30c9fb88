package com.questrail.refraction.safety;

/**
 * Session duration advisories, in increasing order of severity.
 */
public enum DurationStatus
{
    CONTINUE("continue"),
    OFFER_BREAK("offer_break"),
    WARN_AND_COMPLETE("warn_and_complete"),

    /** Forces escalation with {@code duration_exceeded}. */
    HARD_STOP("hard_stop");

    private final String code;

    DurationStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isMoreSevereThan(DurationStatus other) {
        return compareTo(other) > 0;
    }
}
