package com.questrail.refraction.protocol;

/**
 * StepCategory
 * -----------------------------------------------------------------------------
 * Behavioral category of a protocol step.
 *
 * <p>The engine switches exhaustively over this enum to decide what a clear
 * response means for the lenses and which device command follows. Adding a
 * category therefore fails compilation at every decision point until it is
 * handled, instead of silently falling through.</p>
 */
public enum StepCategory
{
    /** History, acuity, health and product steps; no lens activity. */
    GENERAL,

    /** Lens-pair sphere refinement for one eye, fellow eye occluded. */
    MONOCULAR_REFRACTION,

    /** Jackson Cross Cylinder axis refinement plus duochrome for one eye. */
    JCC_DUOCHROME,

    /** Both eyes open; equalize clarity, then finalize. */
    BINOCULAR_BALANCE,

    /** Near vision / presbyopia assessment. */
    NEAR_VISION,

    /** No successor. */
    TERMINAL
}
