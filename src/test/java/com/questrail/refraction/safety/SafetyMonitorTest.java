package com.questrail.refraction.safety;

import com.questrail.refraction.api.ClassifiedResponse;
import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.Intent;
import com.questrail.refraction.api.PatientTurn;
import com.questrail.refraction.api.Sentiment;
import com.questrail.refraction.observability.RecordingObservabilitySink;
import com.questrail.refraction.observability.SafetyEvent;
import com.questrail.refraction.quality.ResponseQuality;
import com.questrail.refraction.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SafetyMonitorTest
 * -----------------------------------------------------------------------------
 * Precedence between red flag, hard stop and persona override; duration
 * advisories; fatigue windows; incident log.
 */
class SafetyMonitorTest {

    private RecordingObservabilitySink sink;
    private SafetyMonitor monitor;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        monitor = new SafetyMonitor("exam-1", DurationPolicy.defaults(), FatiguePolicy.defaults(),
                new ManualWallClock(), sink);
    }

    private static PatientTurn turn(double elapsed, boolean redFlag, boolean persona) {
        return new PatientTurn(ClassifiedResponse.builder()
                .intent(Intent.REFRACTION_FEEDBACK)
                .confidence(0.9)
                .redFlag(redFlag)
                .personaOverride(persona)
                .build(), elapsed, 1.0);
    }

    private static PatientTurn sample(double confidence, double latency, Sentiment sentiment) {
        return new PatientTurn(ClassifiedResponse.builder()
                .intent(Intent.REFRACTION_FEEDBACK)
                .confidence(confidence)
                .sentiment(sentiment)
                .build(), 60.0, latency);
    }

    // ---------------------------------------------------------------------
    // Precedence
    // ---------------------------------------------------------------------

    @Test
    void ordinaryTurnContinues() {
        SafetyVerdict verdict = monitor.screen(turn(30, false, false));

        assertEquals(SafetyVerdict.Directive.CONTINUE, verdict.directive());
        assertEquals(DurationStatus.CONTINUE, verdict.duration());
        assertTrue(monitor.incidents().isEmpty());
    }

    @Test
    void redFlagEscalatesAheadOfEverythingElse() {
        SafetyVerdict verdict = monitor.screen(turn(1600, true, true));

        assertTrue(verdict.isEscalation());
        assertEquals(Optional.of(EscalationReason.RED_FLAG), verdict.escalation());
        assertEquals(1, monitor.incidents().size());
        assertEquals(IncidentSeverity.CRITICAL, monitor.incidents().get(0).severity());
        assertEquals(1, monitor.personaOverrideCount());
    }

    @Test
    void hardStopBeatsPersonaOverride() {
        SafetyVerdict verdict = monitor.screen(turn(1500, false, true));

        assertEquals(Optional.of(EscalationReason.DURATION_EXCEEDED), verdict.escalation());
        assertEquals(DurationStatus.HARD_STOP, verdict.duration());
        assertEquals(1, monitor.incidentCount(IncidentSeverity.HIGH));
        assertEquals(0, monitor.incidentCount(IncidentSeverity.MEDIUM));
    }

    @Test
    void personaOverrideLocksWithoutEscalating() {
        SafetyVerdict verdict = monitor.screen(turn(100, false, true));

        assertEquals(SafetyVerdict.Directive.PERSONA_LOCK, verdict.directive());
        assertFalse(verdict.isEscalation());
        assertEquals(1, monitor.incidentCount(IncidentSeverity.MEDIUM));
    }

    @Test
    void countersOnlyIncrease() {
        monitor.screen(turn(10, true, false));
        monitor.screen(turn(20, false, false));
        monitor.screen(turn(30, true, true));

        SafetySnapshot snapshot = monitor.snapshot();
        assertEquals(2, snapshot.redFlagCount());
        assertEquals(1, snapshot.personaOverrideCount());
        assertEquals(3, snapshot.turnCount());
        assertEquals(30.0, snapshot.elapsedSeconds());
    }

    // ---------------------------------------------------------------------
    // Duration
    // ---------------------------------------------------------------------

    @Test
    void durationBreakpointsClassifyElapsedTime() {
        DurationPolicy policy = DurationPolicy.defaults();

        assertEquals(DurationStatus.CONTINUE, policy.classify(719.9));
        assertEquals(DurationStatus.OFFER_BREAK, policy.classify(720));
        assertEquals(DurationStatus.WARN_AND_COMPLETE, policy.classify(1200));
        assertEquals(DurationStatus.HARD_STOP, policy.classify(1500));
    }

    @Test
    void durationAdvisoriesAreEmittedOncePerLevel() {
        monitor.screen(turn(730, false, false));
        monitor.screen(turn(740, false, false));
        monitor.screen(turn(1210, false, false));

        assertEquals(List.of(SafetyEvent.Type.OFFER_BREAK, SafetyEvent.Type.WARN_AND_COMPLETE),
                sink.safetyEventTypes());
        assertEquals(DurationStatus.WARN_AND_COMPLETE, monitor.durationStatus());
    }

    @Test
    void durationPolicyRequiresAscendingBreakpoints() {
        assertThrows(IllegalArgumentException.class, () -> new DurationPolicy(720, 700, 1500));
        assertThrows(IllegalArgumentException.class, () -> new DurationPolicy(0, 700, 1500));
    }

    // ---------------------------------------------------------------------
    // Fatigue
    // ---------------------------------------------------------------------

    @Test
    void noFatigueBeforeFullWindow() {
        for (int i = 0; i < 4; i++) {
            FatigueAssessment assessment = monitor.recordResponse(sample(0.1, 9.0, Sentiment.CONFIDENT),
                    ResponseQuality.UNCLEAR);
            assertFalse(assessment.fatigued());
        }
    }

    @Test
    void accuracyDropFlagsFatigue() {
        for (int i = 0; i < 5; i++) {
            monitor.recordResponse(sample(0.9, 1.0, Sentiment.CONFIDENT), ResponseQuality.CLEAR);
        }
        FatigueAssessment assessment = null;
        for (int i = 0; i < 2; i++) {
            assessment = monitor.recordResponse(sample(0.9, 1.0, Sentiment.CONFIDENT), ResponseQuality.AMBIGUOUS);
        }

        assertTrue(assessment.fatigued());
        assertTrue(assessment.reason().orElseThrow().startsWith("Accuracy degradation"));
    }

    @Test
    void confidenceDropFlagsFatigue() {
        for (int i = 0; i < 5; i++) {
            monitor.recordResponse(sample(0.95, 1.0, Sentiment.CONFIDENT), ResponseQuality.CLEAR);
        }
        FatigueAssessment assessment = null;
        for (int i = 0; i < 5; i++) {
            assessment = monitor.recordResponse(sample(0.6, 1.0, Sentiment.CONFIDENT), ResponseQuality.CLEAR);
        }

        assertTrue(assessment.fatigued());
        assertTrue(assessment.reason().orElseThrow().startsWith("Confidence degradation"));
    }

    @Test
    void slowResponsesFlagFatigue() {
        FatigueAssessment assessment = null;
        for (int i = 0; i < 5; i++) {
            assessment = monitor.recordResponse(sample(0.9, 3.5, Sentiment.CONFIDENT), ResponseQuality.CLEAR);
        }

        assertTrue(assessment.fatigued());
        assertTrue(assessment.reason().orElseThrow().startsWith("Excessive hesitation"));
    }

    @Test
    void fatiguedSentimentFlagsImmediately() {
        FatigueAssessment assessment = monitor.recordResponse(sample(0.9, 1.0, Sentiment.FATIGUED),
                ResponseQuality.CLEAR);

        assertTrue(assessment.fatigued());
        assertEquals(1, monitor.incidentCount(IncidentSeverity.LOW));
    }

    @Test
    void fatigueIncidentIsLoggedOncePerEpisode() {
        for (int i = 0; i < 3; i++) {
            monitor.recordResponse(sample(0.9, 1.0, Sentiment.FATIGUED), ResponseQuality.CLEAR);
        }

        assertEquals(1, monitor.incidentCount(IncidentSeverity.LOW));
        assertEquals(List.of(SafetyEvent.Type.FATIGUE), sink.safetyEventTypes());
    }

    @Test
    void fatigueScoreWeighsRecentWindow() {
        assertEquals(0.0, monitor.fatigueScore());

        monitor.recordResponse(sample(0.5, 2.5, Sentiment.CONFIDENT), ResponseQuality.AMBIGUOUS);

        // 0.4 * 1.0 + 0.3 * 0.5 + 0.3 * 0.5
        assertEquals(0.7, monitor.fatigueScore(), 1e-9);
    }

    @Test
    void fatigueNeverEscalates() {
        for (int i = 0; i < 10; i++) {
            monitor.recordResponse(sample(0.1, 9.0, Sentiment.FATIGUED), ResponseQuality.UNCLEAR);
        }

        assertEquals(SafetyVerdict.Directive.CONTINUE, monitor.screen(turn(60, false, false)).directive());
    }

    // ---------------------------------------------------------------------
    // Examination quality
    // ---------------------------------------------------------------------

    @Test
    void qualityMetricsSummariseSession() {
        ExamQualityMonitor quality = new ExamQualityMonitor();
        for (int i = 0; i < 9; i++) {
            quality.recordResponse(0.9, ResponseQuality.CLEAR);
        }
        quality.recordResponse(0.4, ResponseQuality.AMBIGUOUS);
        quality.recordAdjustment(true);

        ExamQualityMetrics metrics = quality.metrics();
        assertEquals(10, metrics.responsesAnalyzed());
        assertEquals(0.9, metrics.clearResponseRate(), 1e-9);
        assertEquals(0.85, metrics.averageConfidence(), 1e-9);
        assertEquals(1.0, metrics.adjustmentSuccessRate(), 1e-9);
        assertTrue(metrics.qualityAcceptable());

        quality.recordAdjustment(false);
        assertFalse(quality.metrics().qualityAcceptable());
    }

    @Test
    void emptyExamIsNotAcceptable() {
        assertFalse(new ExamQualityMonitor().metrics().qualityAcceptable());
    }
}
