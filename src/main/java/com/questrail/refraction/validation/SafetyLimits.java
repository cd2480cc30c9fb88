package com.questrail.refraction.validation;

import com.questrail.refraction.api.RefractiveParameter;

import java.util.Objects;

/**
 * SafetyLimits
 * -----------------------------------------------------------------------------
 * Maximum magnitude of a single adjustment per parameter.
 *
 * <p>These bound how far one turn may move a lens. The absolute domains
 * (sphere ±20 D, cylinder 0 to -6 D, axis 0-180°) are properties of
 * {@link com.questrail.refraction.model.LensConfiguration} and are not
 * configurable.</p>
 *
 * @param maxSphereStep   largest accepted |sphere delta| in diopters
 * @param maxCylinderStep largest accepted |cylinder delta| in diopters
 * @param maxAxisStep     largest accepted |axis delta| in degrees
 */
public record SafetyLimits(
        double maxSphereStep,
        double maxCylinderStep,
        double maxAxisStep
) {
    public SafetyLimits {
        if (!(maxSphereStep > 0.0) || Double.isInfinite(maxSphereStep)) {
            throw new IllegalArgumentException("maxSphereStep must be positive and finite");
        }
        if (!(maxCylinderStep > 0.0) || Double.isInfinite(maxCylinderStep)) {
            throw new IllegalArgumentException("maxCylinderStep must be positive and finite");
        }
        if (!(maxAxisStep > 0.0) || Double.isInfinite(maxAxisStep)) {
            throw new IllegalArgumentException("maxAxisStep must be positive and finite");
        }
    }

    public double maxStepFor(RefractiveParameter parameter) {
        Objects.requireNonNull(parameter, "parameter");
        return switch (parameter) {
            case SPHERE -> maxSphereStep;
            case CYLINDER -> maxCylinderStep;
            case AXIS -> maxAxisStep;
        };
    }

    /**
     * 0.50 D sphere, 0.50 D cylinder, 10° axis.
     */
    public static SafetyLimits defaults() {
        return new SafetyLimits(0.50, 0.50, 10.0);
    }
}
