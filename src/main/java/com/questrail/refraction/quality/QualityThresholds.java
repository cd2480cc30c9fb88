package com.questrail.refraction.quality;

/**
 * Confidence thresholds used by the {@link ResponseQualityGate}.
 *
 * <ul>
 *   <li>{@code confidence < unclearBelow} : UNCLEAR</li>
 *   <li>{@code unclearBelow <= confidence < clearAtOrAbove} : AMBIGUOUS</li>
 *   <li>{@code confidence >= clearAtOrAbove} : CLEAR (subject to intent and slots)</li>
 * </ul>
 */
public record QualityThresholds(double unclearBelow, double clearAtOrAbove)
{
    public QualityThresholds {
        if (!(unclearBelow >= 0.0 && unclearBelow <= 1.0)) {
            throw new IllegalArgumentException("unclearBelow must be within [0.0, 1.0]");
        }
        if (!(clearAtOrAbove >= 0.0 && clearAtOrAbove <= 1.0)) {
            throw new IllegalArgumentException("clearAtOrAbove must be within [0.0, 1.0]");
        }
        if (unclearBelow > clearAtOrAbove) {
            throw new IllegalArgumentException("unclearBelow must not exceed clearAtOrAbove");
        }
    }

    /**
     * 0.3 / 0.6.
     */
    public static QualityThresholds defaults() {
        return new QualityThresholds(0.3, 0.6);
    }
}
