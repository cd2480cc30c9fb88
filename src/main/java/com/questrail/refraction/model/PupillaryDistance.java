package com.questrail.refraction.model;

/**
 * Pupillary distance for distance and near vision, in millimetres.
 *
 * @param distanceMm PD at distance, within [50, 80]
 * @param nearMm     PD at near, within [45, 75]
 */
public record PupillaryDistance(double distanceMm, double nearMm)
{
    public static final double DISTANCE_MIN_MM = 50.0;
    public static final double DISTANCE_MAX_MM = 80.0;
    public static final double NEAR_MIN_MM = 45.0;
    public static final double NEAR_MAX_MM = 75.0;

    /** Typical convergence reduction from distance to near PD. */
    public static final double NEAR_REDUCTION_MM = 3.0;

    public PupillaryDistance {
        if (!(distanceMm >= DISTANCE_MIN_MM && distanceMm <= DISTANCE_MAX_MM)) {
            throw new IllegalArgumentException("PD out of typical range: " + distanceMm + "mm");
        }
        if (!(nearMm >= NEAR_MIN_MM && nearMm <= NEAR_MAX_MM)) {
            throw new IllegalArgumentException("Near PD out of typical range: " + nearMm + "mm");
        }
    }

    /**
     * Distance PD with near PD derived by the typical reduction.
     */
    public static PupillaryDistance ofDistance(double distanceMm) {
        return new PupillaryDistance(distanceMm, distanceMm - NEAR_REDUCTION_MM);
    }

    /**
     * Average adult PD: 63 mm distance, 60 mm near.
     */
    public static PupillaryDistance averageAdult() {
        return new PupillaryDistance(63.0, 60.0);
    }
}
