package com.questrail.refraction.api;

/**
 * RefractiveParameter
 * -----------------------------------------------------------------------------
 * The three adjustable components of a per-eye lens configuration.
 */
public enum RefractiveParameter
{
    SPHERE("SPH"),
    CYLINDER("CYL"),
    AXIS("AXIS");

    private final String code;

    RefractiveParameter(String code) {
        this.code = code;
    }

    /**
     * Short clinical code (SPH, CYL, AXIS) used in audit messages.
     */
    public String code() {
        return code;
    }
}
