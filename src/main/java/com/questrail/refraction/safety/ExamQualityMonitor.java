package com.questrail.refraction.safety;

import com.questrail.refraction.quality.ResponseQuality;

import java.util.Objects;

/**
 * Running counters behind {@link ExamQualityMetrics}. Not thread-safe.
 */
public final class ExamQualityMonitor
{
    private int responses;
    private int clearResponses;
    private double confidenceSum;
    private int adjustmentsAttempted;
    private int adjustmentsApplied;

    public void recordResponse(double confidence, ResponseQuality quality) {
        Objects.requireNonNull(quality, "quality");
        responses++;
        confidenceSum += confidence;
        if (quality == ResponseQuality.CLEAR) {
            clearResponses++;
        }
    }

    public void recordAdjustment(boolean applied) {
        adjustmentsAttempted++;
        if (applied) {
            adjustmentsApplied++;
        }
    }

    public ExamQualityMetrics metrics() {
        return new ExamQualityMetrics(
                responses,
                responses == 0 ? 0.0 : (double) clearResponses / responses,
                responses == 0 ? 0.0 : confidenceSum / responses,
                adjustmentsAttempted,
                adjustmentsAttempted == 0 ? 1.0 : (double) adjustmentsApplied / adjustmentsAttempted
        );
    }
}
