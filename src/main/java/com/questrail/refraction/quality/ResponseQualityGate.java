package com.questrail.refraction.quality;

import com.questrail.refraction.api.Intent;
import com.questrail.refraction.api.SlotKey;
import com.questrail.refraction.protocol.ProtocolStep;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ResponseQualityGate
 * -----------------------------------------------------------------------------
 * Pure classifier of an already-parsed patient response.
 *
 * <h2>Rules, in order</h2>
 * <ol>
 *   <li>An {@link Intent#INVALID} or {@link Intent#UNKNOWN} intent is
 *       {@link ResponseQuality#INVALID}, whatever the confidence.</li>
 *   <li>Confidence below {@link QualityThresholds#unclearBelow()} is
 *       {@link ResponseQuality#UNCLEAR}.</li>
 *   <li>Confidence below {@link QualityThresholds#clearAtOrAbove()} is
 *       {@link ResponseQuality#AMBIGUOUS}.</li>
 *   <li>Otherwise the response would be clear; the step's required slots are
 *       then checked, and a missing slot or an unrecognized value downgrades
 *       the verdict to {@link ResponseQuality#AMBIGUOUS}.</li>
 * </ol>
 *
 * The gate has no state and no side effects; the same inputs always produce
 * the same verdict.
 */
public final class ResponseQualityGate
{
    private final QualityThresholds thresholds;

    public ResponseQualityGate(QualityThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public ResponseVerdict assess(double confidence,
                                  Intent intent,
                                  Map<SlotKey, String> slots,
                                  ProtocolStep step) {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(slots, "slots");
        Objects.requireNonNull(step, "step");

        if (!intent.isRecognized()) {
            return new ResponseVerdict(ResponseQuality.INVALID, confidence, false,
                    "intent '" + intent.tag() + "' is not actionable");
        }
        // Negated so that NaN lands on UNCLEAR.
        if (!(confidence >= thresholds.unclearBelow())) {
            return new ResponseVerdict(ResponseQuality.UNCLEAR, confidence, false,
                    String.format(Locale.ROOT, "confidence %.2f below %.2f",
                            confidence, thresholds.unclearBelow()));
        }
        if (confidence < thresholds.clearAtOrAbove()) {
            return new ResponseVerdict(ResponseQuality.AMBIGUOUS, confidence, false,
                    String.format(Locale.ROOT, "confidence %.2f below %.2f",
                            confidence, thresholds.clearAtOrAbove()));
        }

        for (Map.Entry<SlotKey, Set<String>> required : step.requiredSlots().entrySet()) {
            String value = slots.get(required.getKey());
            if (value == null) {
                return new ResponseVerdict(ResponseQuality.AMBIGUOUS, confidence, false,
                        "missing required slot " + required.getKey().key() + " for step " + step.id());
            }
            if (!required.getValue().contains(value)) {
                return new ResponseVerdict(ResponseQuality.AMBIGUOUS, confidence, false,
                        "unrecognized value '" + value + "' for slot " + required.getKey().key());
            }
        }

        return new ResponseVerdict(ResponseQuality.CLEAR, confidence, true, "clear");
    }
}
