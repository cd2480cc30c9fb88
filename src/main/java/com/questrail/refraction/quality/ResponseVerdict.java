package com.questrail.refraction.quality;

import java.util.Objects;

/**
 * Per-turn verdict of the {@link ResponseQualityGate}.
 *
 * @param quality              the classification
 * @param confidence           the classifier confidence that produced it
 * @param requiredSlotsPresent whether every required slot held an accepted value
 * @param reason               short plain-text explanation for audit logs
 */
public record ResponseVerdict(
        ResponseQuality quality,
        double confidence,
        boolean requiredSlotsPresent,
        String reason
) {
    public ResponseVerdict {
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(reason, "reason");
    }

    public boolean isClear() {
        return quality == ResponseQuality.CLEAR;
    }
}
