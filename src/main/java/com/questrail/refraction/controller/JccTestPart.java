package com.questrail.refraction.controller;

/**
 * The three parts of a Jackson Cross Cylinder presentation, in order.
 */
public enum JccTestPart
{
    HORIZONTAL_AXIS("jcc.horizontal_axis"),
    VERTICAL_AXIS("jcc.vertical_axis"),
    DUOCHROME("jcc.duochrome");

    private final String questionKey;

    JccTestPart(String questionKey) {
        this.questionKey = questionKey;
    }

    /**
     * Opaque key the orchestration layer resolves to patient-facing text.
     */
    public String questionKey() {
        return questionKey;
    }
}
