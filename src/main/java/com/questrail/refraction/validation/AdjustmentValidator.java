package com.questrail.refraction.validation;

import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.model.AdjustmentRequest;
import com.questrail.refraction.model.LensConfiguration;
import com.questrail.refraction.model.PhoropterState;

import java.util.Locale;
import java.util.Objects;

/**
 * AdjustmentValidator
 * -----------------------------------------------------------------------------
 * Pure safety check for a proposed lens change.
 *
 * <h2>Checks, in order</h2>
 * <ol>
 *   <li>the magnitude is finite (and whole degrees for axis), else
 *       {@link RejectionReason#INVALID_MAGNITUDE}</li>
 *   <li>{@code |magnitude| <= maxStep}, else {@link RejectionReason#UNSAFE_JUMP}</li>
 *   <li>{@code current + magnitude} within the parameter domain, else
 *       {@link RejectionReason#OUT_OF_RANGE}</li>
 * </ol>
 *
 * <p>The validator never mutates anything and never clamps. Magnitudes are not
 * assumed to be quarter-diopter multiples; any real value within the step
 * bound is accepted. Axis does not wrap at 180.</p>
 *
 * <p>Phase checks (finalized / halted) are the controller's job, not the
 * validator's.</p>
 */
public final class AdjustmentValidator
{
    private static final double TOLERANCE = 1e-9;

    private final SafetyLimits limits;

    public AdjustmentValidator(SafetyLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public ValidationResult validate(PhoropterState state, AdjustmentRequest request) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(request, "request");

        RefractiveParameter parameter = request.parameter();
        double magnitude = request.magnitude();

        if (!Double.isFinite(magnitude)) {
            return new ValidationResult.Rejected(RejectionReason.INVALID_MAGNITUDE,
                    "Invalid magnitude: " + magnitude);
        }
        if (parameter == RefractiveParameter.AXIS && Math.abs(magnitude - Math.rint(magnitude)) > TOLERANCE) {
            return new ValidationResult.Rejected(RejectionReason.INVALID_MAGNITUDE,
                    "Axis must change by whole degrees: " + magnitude);
        }

        double maxStep = limits.maxStepFor(parameter);
        if (Math.abs(magnitude) > maxStep + TOLERANCE) {
            return new ValidationResult.Rejected(RejectionReason.UNSAFE_JUMP,
                    String.format(Locale.ROOT, "Unsafe jump: %s %s ±%s > ±%s",
                            request.eye(), parameter.code(),
                            format(parameter, Math.abs(magnitude)), format(parameter, maxStep)));
        }

        double current = state.lens(request.eye()).valueOf(parameter);
        double proposed = current + magnitude;
        if (parameter == RefractiveParameter.AXIS) {
            proposed = Math.rint(proposed);
        }
        if (!LensConfiguration.inDomain(parameter, proposed)) {
            return new ValidationResult.Rejected(RejectionReason.OUT_OF_RANGE,
                    String.format(Locale.ROOT, "Out of range: %s %s %s not in [%s, %s]",
                            request.eye(), parameter.code(), format(parameter, proposed),
                            format(parameter, LensConfiguration.minOf(parameter)),
                            format(parameter, LensConfiguration.maxOf(parameter))));
        }

        return new ValidationResult.Accepted(proposed);
    }

    static String format(RefractiveParameter parameter, double value) {
        return parameter == RefractiveParameter.AXIS
                ? String.format(Locale.ROOT, "%.0f°", value)
                : String.format(Locale.ROOT, "%.3fD", value);
    }
}
