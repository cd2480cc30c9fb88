package com.questrail.refraction.quality;

import com.questrail.refraction.api.Intent;
import com.questrail.refraction.api.SlotKey;
import com.questrail.refraction.protocol.ProtocolStep;
import com.questrail.refraction.protocol.ProtocolStepTable;
import com.questrail.refraction.protocol.StepId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResponseQualityGateTest
 * -----------------------------------------------------------------------------
 * Threshold bands, intent override and the required-slot downgrade.
 */
class ResponseQualityGateTest {

    private ResponseQualityGate gate;
    private ProtocolStep lensStep;
    private ProtocolStep nearStep;
    private ProtocolStep greeting;
    private ProtocolStep balanceStep;

    @BeforeEach
    void setUp() {
        gate = new ResponseQualityGate(QualityThresholds.defaults());
        ProtocolStepTable table = ProtocolStepTable.standard();
        lensStep = table.step(StepId.of("6.1"));
        nearStep = table.step(StepId.of("7.1"));
        greeting = table.step(StepId.of("0.1"));
        balanceStep = table.step(StepId.of("6.5"));
    }

    private static Map<SlotKey, String> clarity(String value) {
        return Map.of(SlotKey.CLARITY_FEEDBACK, value);
    }

    @Test
    void highConfidenceWithRequiredSlotIsClear() {
        ResponseVerdict verdict = gate.assess(0.95, Intent.REFRACTION_FEEDBACK, clarity("first_better"), lensStep);

        assertEquals(ResponseQuality.CLEAR, verdict.quality());
        assertTrue(verdict.requiredSlotsPresent());
        assertEquals(0.95, verdict.confidence());
    }

    @Test
    void balanceStepAcceptsLensPairAndEyeAnswers() {
        for (String value : new String[] {"first_better", "second_better", "both_same", "right_clearer", "left_clearer"}) {
            assertEquals(ResponseQuality.CLEAR,
                    gate.assess(0.95, Intent.REFRACTION_FEEDBACK, clarity(value), balanceStep).quality(), value);
        }
    }

    @Test
    void confidenceBandsMapToQuality() {
        assertEquals(ResponseQuality.UNCLEAR,
                gate.assess(0.29, Intent.GREETING, Map.of(), greeting).quality());
        assertEquals(ResponseQuality.AMBIGUOUS,
                gate.assess(0.30, Intent.GREETING, Map.of(), greeting).quality());
        assertEquals(ResponseQuality.AMBIGUOUS,
                gate.assess(0.59, Intent.GREETING, Map.of(), greeting).quality());
        assertEquals(ResponseQuality.CLEAR,
                gate.assess(0.60, Intent.GREETING, Map.of(), greeting).quality());
    }

    @Test
    void midConfidenceOnLensStepIsAmbiguous() {
        ResponseVerdict verdict = gate.assess(0.45, Intent.REFRACTION_FEEDBACK, clarity("first_better"), lensStep);

        assertEquals(ResponseQuality.AMBIGUOUS, verdict.quality());
        assertFalse(verdict.isClear());
    }

    @Test
    void invalidOrUnknownIntentWinsOverConfidence() {
        assertEquals(ResponseQuality.INVALID,
                gate.assess(1.0, Intent.INVALID, clarity("first_better"), lensStep).quality());
        assertEquals(ResponseQuality.INVALID,
                gate.assess(0.99, Intent.UNKNOWN, Map.of(), greeting).quality());
    }

    @Test
    void missingRequiredSlotDowngradesToAmbiguous() {
        ResponseVerdict verdict = gate.assess(0.9, Intent.REFRACTION_FEEDBACK, Map.of(), lensStep);

        assertEquals(ResponseQuality.AMBIGUOUS, verdict.quality());
        assertFalse(verdict.requiredSlotsPresent());
        assertTrue(verdict.reason().contains("clarity_feedback"));
    }

    @Test
    void unrecognizedSlotValueDowngradesToAmbiguous() {
        assertEquals(ResponseQuality.AMBIGUOUS,
                gate.assess(0.9, Intent.REFRACTION_FEEDBACK, clarity("blurry"), lensStep).quality());
        assertEquals(ResponseQuality.AMBIGUOUS,
                gate.assess(0.9, Intent.READING_ABILITY, Map.of(SlotKey.COLOR_PREFERENCE, "blue"), nearStep).quality());
    }

    @Test
    void slotsAreOnlyCheckedWhenOtherwiseClear() {
        ResponseVerdict verdict = gate.assess(0.1, Intent.REFRACTION_FEEDBACK, Map.of(), lensStep);

        assertEquals(ResponseQuality.UNCLEAR, verdict.quality());
    }

    @Test
    void nanConfidenceIsUnclear() {
        assertEquals(ResponseQuality.UNCLEAR,
                gate.assess(Double.NaN, Intent.GREETING, Map.of(), greeting).quality());
    }

    @Test
    void thresholdsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new QualityThresholds(0.7, 0.6));
        assertThrows(IllegalArgumentException.class, () -> new QualityThresholds(-0.1, 0.6));
        assertThrows(IllegalArgumentException.class, () -> new QualityThresholds(0.3, 1.1));
    }
}
