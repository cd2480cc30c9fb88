package com.questrail.refraction.model;

import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.protocol.StepId;

import java.time.Instant;
import java.util.Objects;

/**
 * One applied adjustment in a session's append-only history.
 */
public record AdjustmentRecord(
        Instant timestamp,
        Eye eye,
        RefractiveParameter parameter,
        double magnitude,
        double resultingValue,
        StepId sourceStep
) {
    public AdjustmentRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(eye, "eye");
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(sourceStep, "sourceStep");
    }
}
