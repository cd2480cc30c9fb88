package com.questrail.refraction.safety;

/**
 * Examination quality summary.
 *
 * @param responsesAnalyzed     judged responses
 * @param clearResponseRate     share judged CLEAR
 * @param averageConfidence     mean classifier confidence
 * @param adjustmentsAttempted  lens adjustments attempted
 * @param adjustmentSuccessRate share of attempts applied; 1.0 when none attempted
 */
public record ExamQualityMetrics(
        int responsesAnalyzed,
        double clearResponseRate,
        double averageConfidence,
        int adjustmentsAttempted,
        double adjustmentSuccessRate
) {
    public static final double MIN_CLEAR_RESPONSE_RATE = 0.90;
    public static final double MIN_AVERAGE_CONFIDENCE = 0.70;
    public static final double MIN_ADJUSTMENT_SUCCESS_RATE = 0.95;

    /**
     * Whether every metric meets its minimum. An exam with no judged responses
     * is never acceptable.
     */
    public boolean qualityAcceptable() {
        return responsesAnalyzed > 0
                && clearResponseRate >= MIN_CLEAR_RESPONSE_RATE
                && averageConfidence >= MIN_AVERAGE_CONFIDENCE
                && adjustmentSuccessRate >= MIN_ADJUSTMENT_SUCCESS_RATE;
    }
}
