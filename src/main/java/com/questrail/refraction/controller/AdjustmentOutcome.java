package com.questrail.refraction.controller;

import com.questrail.refraction.model.AdjustmentRecord;
import com.questrail.refraction.model.AdjustmentRequest;
import com.questrail.refraction.validation.RejectionReason;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link PhoropterController#adjust(AdjustmentRequest)}.
 *
 * @param status    applied, rejected on value, or rejected on phase
 * @param request   the request as submitted
 * @param rejection reason when not applied
 * @param applied   history record when applied
 * @param message   plain-text audit message naming the result
 */
public record AdjustmentOutcome(
        Status status,
        AdjustmentRequest request,
        Optional<RejectionReason> rejection,
        Optional<AdjustmentRecord> applied,
        String message
) {
    public enum Status {
        APPLIED,

        /** Failed the validator (unsafe jump, out of range, bad magnitude). */
        REJECTED,

        /** Attempted after finalize or escalate. */
        INVALID_TRANSITION
    }

    public AdjustmentOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(rejection, "rejection");
        Objects.requireNonNull(applied, "applied");
        Objects.requireNonNull(message, "message");
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    static AdjustmentOutcome applied(AdjustmentRequest request, AdjustmentRecord record, String message) {
        return new AdjustmentOutcome(Status.APPLIED, request, Optional.empty(), Optional.of(record), message);
    }

    static AdjustmentOutcome rejected(AdjustmentRequest request, RejectionReason reason, String message) {
        Status status = reason.isInvalidTransition() ? Status.INVALID_TRANSITION : Status.REJECTED;
        return new AdjustmentOutcome(status, request, Optional.of(reason), Optional.empty(), message);
    }
}
