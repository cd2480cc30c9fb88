package com.questrail.refraction.api;

/**
 * Eye
 * -----------------------------------------------------------------------------
 * Clinical eye designation used throughout the engine.
 */
public enum Eye
{
    /** Oculus dexter (right eye). */
    OD,

    /** Oculus sinister (left eye). */
    OS;

    /**
     * Returns the fellow eye.
     */
    public Eye other() {
        return this == OD ? OS : OD;
    }
}
