package com.questrail.refraction.controller;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link PhoropterController#balanceBinocular(BinocularReport, com.questrail.refraction.protocol.StepId)}.
 *
 * @param resolution what the balance step decided
 * @param adjustment the balancing nudge, when one was attempted
 * @param command    the device command that follows
 */
public record BalanceOutcome(
        Resolution resolution,
        Optional<AdjustmentOutcome> adjustment,
        DeviceCommand command
) {
    public enum Resolution {
        /** One eye was clearer; the fellow eye was nudged and the test repeats. */
        RETEST,

        /** Both eyes equal; the prescription was finalized. */
        FINALIZED,

        /** The balancing nudge was rejected by the validator. */
        REJECTED
    }

    public BalanceOutcome {
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(adjustment, "adjustment");
        Objects.requireNonNull(command, "command");
    }
}
