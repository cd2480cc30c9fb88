package com.questrail.refraction.model;

import com.questrail.refraction.api.RefractiveParameter;

import java.util.Locale;
import java.util.Objects;

/**
 * LensConfiguration
 * -----------------------------------------------------------------------------
 * Immutable per-eye prescription.
 *
 * <h2>Domain</h2>
 * <ul>
 *   <li>sphere: [-20.00, +20.00] D</li>
 *   <li>cylinder: [-6.00, 0.00] D (minus-cylinder convention)</li>
 *   <li>axis: [0, 180] degrees</li>
 * </ul>
 *
 * The domain is enforced at construction. Callers that need a soft answer
 * ("would this value be legal?") use {@link #inDomain(RefractiveParameter, double)}
 * before constructing; nothing in the engine clamps a value into the domain.
 */
public record LensConfiguration(double sphere, double cylinder, int axis)
{
    public static final double SPHERE_MIN = -20.0;
    public static final double SPHERE_MAX = 20.0;
    public static final double CYLINDER_MIN = -6.0;
    public static final double CYLINDER_MAX = 0.0;
    public static final int AXIS_MIN = 0;
    public static final int AXIS_MAX = 180;

    // Absorbs binary representation error in sums such as 0.1 + 0.2.
    private static final double TOLERANCE = 1e-9;

    public LensConfiguration {
        if (!inDomain(RefractiveParameter.SPHERE, sphere)) {
            throw new IllegalArgumentException(
                    "sphere out of range [" + SPHERE_MIN + ", " + SPHERE_MAX + "]: " + sphere);
        }
        if (!inDomain(RefractiveParameter.CYLINDER, cylinder)) {
            throw new IllegalArgumentException(
                    "cylinder out of range [" + CYLINDER_MIN + ", " + CYLINDER_MAX + "]: " + cylinder);
        }
        if (!inDomain(RefractiveParameter.AXIS, axis)) {
            throw new IllegalArgumentException(
                    "axis out of range [" + AXIS_MIN + ", " + AXIS_MAX + "]: " + axis);
        }
    }

    /**
     * No correction: 0.00 / 0.00 x 0.
     */
    public static LensConfiguration plano() {
        return new LensConfiguration(0.0, 0.0, 0);
    }

    public double valueOf(RefractiveParameter parameter) {
        Objects.requireNonNull(parameter, "parameter");
        return switch (parameter) {
            case SPHERE -> sphere;
            case CYLINDER -> cylinder;
            case AXIS -> axis;
        };
    }

    /**
     * Returns a copy with one parameter replaced.
     *
     * @throws IllegalArgumentException if the value is outside the parameter's
     *                                  domain, or a non-integral axis
     */
    public LensConfiguration with(RefractiveParameter parameter, double value) {
        Objects.requireNonNull(parameter, "parameter");
        return switch (parameter) {
            case SPHERE -> withSphere(value);
            case CYLINDER -> withCylinder(value);
            case AXIS -> {
                long rounded = Math.round(value);
                if (Math.abs(value - rounded) > TOLERANCE) {
                    throw new IllegalArgumentException("axis must be a whole number of degrees: " + value);
                }
                yield withAxis((int) rounded);
            }
        };
    }

    public LensConfiguration withSphere(double sphere) {
        return new LensConfiguration(sphere, cylinder, axis);
    }

    public LensConfiguration withCylinder(double cylinder) {
        return new LensConfiguration(sphere, cylinder, axis);
    }

    public LensConfiguration withAxis(int axis) {
        return new LensConfiguration(sphere, cylinder, axis);
    }

    /**
     * Whether {@code value} lies within the domain of {@code parameter}.
     */
    public static boolean inDomain(RefractiveParameter parameter, double value) {
        Objects.requireNonNull(parameter, "parameter");
        if (!Double.isFinite(value)) {
            return false;
        }
        return value >= minOf(parameter) - TOLERANCE && value <= maxOf(parameter) + TOLERANCE;
    }

    public static double minOf(RefractiveParameter parameter) {
        return switch (parameter) {
            case SPHERE -> SPHERE_MIN;
            case CYLINDER -> CYLINDER_MIN;
            case AXIS -> AXIS_MIN;
        };
    }

    public static double maxOf(RefractiveParameter parameter) {
        return switch (parameter) {
            case SPHERE -> SPHERE_MAX;
            case CYLINDER -> CYLINDER_MAX;
            case AXIS -> AXIS_MAX;
        };
    }

    /**
     * Clinical notation, e.g. {@code -1.25 / -0.50 x 90}.
     */
    public String notation() {
        return String.format(Locale.ROOT, "%+.2f / %.2f x %d", sphere, cylinder, axis);
    }
}
