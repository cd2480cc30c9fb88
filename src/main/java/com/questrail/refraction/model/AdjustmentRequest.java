package com.questrail.refraction.model;

import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.protocol.StepId;

import java.util.Objects;

/**
 * A proposed lens change for one turn. Never persisted beyond validation.
 *
 * @param eye        target eye
 * @param parameter  parameter to change
 * @param magnitude  signed change (diopters, or degrees for axis)
 * @param sourceStep protocol step that produced the request
 */
public record AdjustmentRequest(
        Eye eye,
        RefractiveParameter parameter,
        double magnitude,
        StepId sourceStep
) {
    public AdjustmentRequest {
        Objects.requireNonNull(eye, "eye");
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(sourceStep, "sourceStep");
    }
}
