package com.questrail.refraction.quality;

/**
 * Classification of a single patient response.
 */
public enum ResponseQuality
{
    /** Confident, recognized, and carrying every required slot. Advances. */
    CLEAR,

    /** Mid confidence, or missing required information. Repeats. */
    AMBIGUOUS,

    /** Low confidence. Repeats. */
    UNCLEAR,

    /** The classifier reported an invalid or unknown intent. Repeats. */
    INVALID
}
