package com.questrail.refraction.validation;

/**
 * Why an adjustment was not applied.
 */
public enum RejectionReason
{
    /** |magnitude| exceeds the per-step safety limit. */
    UNSAFE_JUMP,

    /** The resulting value would leave the parameter's domain. */
    OUT_OF_RANGE,

    /** NaN/infinite magnitude, or a fractional axis change. */
    INVALID_MAGNITUDE,

    /** The controller has been finalized (invalid transition). */
    CONTROLLER_FINALIZED,

    /** The controller has been halted (invalid transition). */
    CONTROLLER_HALTED;

    /**
     * Whether this reason signals a call made in the wrong controller phase
     * rather than a rejected value.
     */
    public boolean isInvalidTransition() {
        return this == CONTROLLER_FINALIZED || this == CONTROLLER_HALTED;
    }
}
