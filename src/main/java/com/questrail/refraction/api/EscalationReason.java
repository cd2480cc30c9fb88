package com.questrail.refraction.api;

/**
 * Reason a session was escalated (halted and handed to a professional).
 */
public enum EscalationReason
{
    /** The classifier detected an emergency symptom keyword. */
    RED_FLAG("red_flag"),

    /** The session reached the hard-stop duration. */
    DURATION_EXCEEDED("duration_exceeded"),

    /** The orchestration layer aborted the session. */
    EXTERNAL_ABORT("external_abort");

    private final String code;

    EscalationReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
