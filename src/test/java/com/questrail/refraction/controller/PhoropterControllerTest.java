package com.questrail.refraction.controller;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.model.AdjustmentRecord;
import com.questrail.refraction.model.ControllerPhase;
import com.questrail.refraction.model.LensConfiguration;
import com.questrail.refraction.model.PhoropterState;
import com.questrail.refraction.model.PupillaryDistance;
import com.questrail.refraction.observability.AdjustmentEvent;
import com.questrail.refraction.observability.PhaseTransitionEvent;
import com.questrail.refraction.observability.RecordingObservabilitySink;
import com.questrail.refraction.protocol.StepId;
import com.questrail.refraction.time.ManualWallClock;
import com.questrail.refraction.validation.AdjustmentValidator;
import com.questrail.refraction.validation.RejectionReason;
import com.questrail.refraction.validation.SafetyLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PhoropterControllerTest
 * -----------------------------------------------------------------------------
 * Validated mutation, command construction and the ACTIVE / FINALIZED / HALTED
 * lifecycle of the phoropter controller.
 */
class PhoropterControllerTest {

    private static final StepId STEP = StepId.of("6.2");

    private ManualWallClock clock;
    private RecordingObservabilitySink sink;
    private PhoropterController controller;

    @BeforeEach
    void setUp() {
        clock = new ManualWallClock();
        sink = new RecordingObservabilitySink();
        controller = newController(PhoropterState.initial(
                new LensConfiguration(-1.00, -0.50, 90),
                new LensConfiguration(-1.25, -0.75, 180),
                PupillaryDistance.averageAdult()));
    }

    private PhoropterController newController(PhoropterState initial) {
        return new PhoropterController("exam-1", initial,
                new AdjustmentValidator(SafetyLimits.defaults()), NudgePolicy.defaults(), clock, sink);
    }

    // ---------------------------------------------------------------------
    // Adjustments
    // ---------------------------------------------------------------------

    @Test
    void appliedAdjustmentUpdatesLensAndHistory() {
        AdjustmentOutcome outcome = controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 0.25);

        assertTrue(outcome.isApplied());
        assertEquals(-0.75, controller.snapshot().od().sphere(), 1e-9);
        assertEquals(-1.25, controller.snapshot().os().sphere(), 1e-9);

        List<AdjustmentRecord> history = controller.snapshot().adjustmentHistory();
        assertEquals(1, history.size());
        AdjustmentRecord record = history.get(0);
        assertEquals(Eye.OD, record.eye());
        assertEquals(RefractiveParameter.SPHERE, record.parameter());
        assertEquals(0.25, record.magnitude(), 1e-9);
        assertEquals(-0.75, record.resultingValue(), 1e-9);
        assertEquals(PhoropterController.MANUAL_STEP, record.sourceStep());
        assertEquals(clock.now(), record.timestamp());
    }

    @Test
    void rejectedAdjustmentLeavesStateUntouched() {
        PhoropterState before = controller.snapshot();

        AdjustmentOutcome outcome = controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 0.75);

        assertEquals(AdjustmentOutcome.Status.REJECTED, outcome.status());
        assertEquals(Optional.of(RejectionReason.UNSAFE_JUMP), outcome.rejection());
        assertTrue(outcome.message().contains("Unsafe jump"));
        assertSame(before, controller.snapshot());
    }

    @Test
    void repeatedRejectedAdjustmentsAreIdempotent() {
        PhoropterState before = controller.snapshot();

        for (double magnitude : new double[] {0.51, -0.75, 1.0, -20.0}) {
            assertFalse(controller.adjustParameter(Eye.OS, RefractiveParameter.SPHERE, magnitude).isApplied());
            assertFalse(controller.adjustParameter(Eye.OS, RefractiveParameter.CYLINDER, magnitude).isApplied());
        }
        assertFalse(controller.adjustParameter(Eye.OS, RefractiveParameter.AXIS, 15).isApplied());

        assertEquals(before, controller.snapshot());
        assertTrue(controller.snapshot().adjustmentHistory().isEmpty());
    }

    @Test
    void everyAttemptIsReportedToTheSink() {
        controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 0.25);
        controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 5.0);

        List<AdjustmentEvent> events = sink.eventsOfType(AdjustmentEvent.class);
        assertEquals(2, events.size());
        assertTrue(events.get(0).isApplied());
        assertEquals(Optional.of(RejectionReason.UNSAFE_JUMP), events.get(1).rejection());
        assertEquals("exam-1", events.get(1).sessionId());
    }

    // ---------------------------------------------------------------------
    // JCC and duochrome
    // ---------------------------------------------------------------------

    @Test
    void duochromeRedClearerReducesSphereByEighthDiopter() {
        double before = controller.snapshot().od().sphere();

        Optional<AdjustmentOutcome> outcome = controller.applyDuochrome(Eye.OD, DuochromeResult.RED_CLEARER, STEP);

        assertTrue(outcome.orElseThrow().isApplied());
        assertEquals(-0.125, controller.snapshot().od().sphere() - before, 1e-9);
    }

    @Test
    void duochromeGreenClearerIncreasesSphereByEighthDiopter() {
        double before = controller.snapshot().os().sphere();

        controller.applyDuochrome(Eye.OS, DuochromeResult.GREEN_CLEARER, STEP);

        assertEquals(0.125, controller.snapshot().os().sphere() - before, 1e-9);
    }

    @Test
    void duochromeEqualLeavesSphereAlone() {
        PhoropterState before = controller.snapshot();

        assertTrue(controller.applyDuochrome(Eye.OD, DuochromeResult.EQUAL, STEP).isEmpty());
        assertEquals(before, controller.snapshot());
    }

    @Test
    void jccChoicesRotateAxisByConfiguredStep() {
        controller.applyJccAxis(Eye.OD, JccChoice.FIRST, STEP);
        assertEquals(95, controller.snapshot().od().axis());

        controller.applyJccAxis(Eye.OD, JccChoice.SECOND, STEP);
        controller.applyJccAxis(Eye.OD, JccChoice.SECOND, STEP);
        assertEquals(85, controller.snapshot().od().axis());

        assertTrue(controller.applyJccAxis(Eye.OD, JccChoice.SAME, STEP).isEmpty());
        assertEquals(3, controller.snapshot().adjustmentHistory().size());
    }

    @Test
    void jccAxisAtUpperBoundIsRejectedNotWrapped() {
        AdjustmentOutcome outcome = controller.applyJccAxis(Eye.OS, JccChoice.FIRST, STEP).orElseThrow();

        assertEquals(Optional.of(RejectionReason.OUT_OF_RANGE), outcome.rejection());
        assertEquals(180, controller.snapshot().os().axis());
    }

    // ---------------------------------------------------------------------
    // Presentations
    // ---------------------------------------------------------------------

    @Test
    void presentLensPairIsPure() {
        PhoropterState before = controller.snapshot();

        DeviceCommand.PresentLensPair command = controller.presentLensPair(Eye.OD);

        assertSame(before, controller.snapshot());
        assertEquals(DeviceCommand.Kind.PRESENT_LENS_PAIR, command.kind());
        assertEquals(-0.75, command.lensA().sphere(), 1e-9);
        assertEquals(before.od(), command.lensB());
        assertEquals(PhoropterController.LENS_PAIR_QUESTION, command.questionKey());
        assertEquals(PhoropterController.LENS_PAIR_OPTIONS, command.options());
    }

    @Test
    void presentJccCarriesThreePartSequence() {
        DeviceCommand.PresentJcc command = controller.presentJcc(Eye.OS);

        assertEquals(Eye.OS, command.eye());
        assertEquals(controller.snapshot().os(), command.currentPrescription());
        assertEquals(List.of(JccTestPart.HORIZONTAL_AXIS, JccTestPart.VERTICAL_AXIS, JccTestPart.DUOCHROME),
                command.sequence());
    }

    // ---------------------------------------------------------------------
    // Binocular balance
    // ---------------------------------------------------------------------

    @Test
    void odClearerNudgesFellowEyeAndRequestsRetest() {
        BalanceOutcome outcome = controller.balanceBinocular(BinocularReport.OD_CLEARER, StepId.of("6.5"));

        assertEquals(BalanceOutcome.Resolution.RETEST, outcome.resolution());
        assertEquals(-1.50, controller.snapshot().os().sphere(), 1e-9);
        assertEquals(-1.00, controller.snapshot().od().sphere(), 1e-9);
        assertInstanceOf(DeviceCommand.BalanceBinocular.class, outcome.command());
        assertEquals(ControllerPhase.ACTIVE, controller.phase());
    }

    @Test
    void osClearerNudgesRightEye() {
        controller.balanceBinocular(BinocularReport.OS_CLEARER, StepId.of("6.5"));

        assertEquals(-1.25, controller.snapshot().od().sphere(), 1e-9);
    }

    @Test
    void equalBalanceFinalizes() {
        BalanceOutcome outcome = controller.balanceBinocular(BinocularReport.EQUAL, StepId.of("6.5"));

        assertEquals(BalanceOutcome.Resolution.FINALIZED, outcome.resolution());
        DeviceCommand.Finalize finalize = assertInstanceOf(DeviceCommand.Finalize.class, outcome.command());
        assertEquals(ControllerPhase.FINALIZED, finalize.prescription().phase());
        assertEquals(ControllerPhase.FINALIZED, controller.phase());
    }

    @Test
    void rejectedBalanceNudgeIsReported() {
        PhoropterController atLimit = newController(PhoropterState.initial(
                LensConfiguration.plano(), new LensConfiguration(-20.0, 0.0, 0), PupillaryDistance.averageAdult()));

        BalanceOutcome outcome = atLimit.balanceBinocular(BinocularReport.OD_CLEARER, StepId.of("6.5"));

        assertEquals(BalanceOutcome.Resolution.REJECTED, outcome.resolution());
        assertEquals(Optional.of(RejectionReason.OUT_OF_RANGE), outcome.adjustment().orElseThrow().rejection());
        assertInstanceOf(DeviceCommand.NoAction.class, outcome.command());
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void finalizedControllerRejectsAdjustmentsWithoutTouchingHistory() {
        controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 0.25);
        controller.finalizePrescription();
        List<AdjustmentRecord> history = controller.snapshot().adjustmentHistory();

        AdjustmentOutcome outcome = controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 0.25);

        assertEquals(AdjustmentOutcome.Status.INVALID_TRANSITION, outcome.status());
        assertEquals(Optional.of(RejectionReason.CONTROLLER_FINALIZED), outcome.rejection());
        assertEquals(history, controller.snapshot().adjustmentHistory());
    }

    @Test
    void finalizedControllerRefusesPresentationsAndSecondFinalize() {
        controller.finalizePrescription();

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> controller.presentLensPair(Eye.OD));
        assertEquals(ControllerPhase.FINALIZED, e.phase());
        assertThrows(InvalidTransitionException.class, () -> controller.finalizePrescription());
        assertThrows(InvalidTransitionException.class, () -> controller.presentJcc(Eye.OD));
        assertThrows(InvalidTransitionException.class, () -> controller.setOcclusion(Optional.empty()));
    }

    @Test
    void haltedControllerRejectsEverything() {
        controller.escalate(EscalationReason.RED_FLAG);
        int historySize = controller.snapshot().adjustmentHistory().size();

        AdjustmentOutcome outcome = controller.adjustParameter(Eye.OD, RefractiveParameter.SPHERE, 0.25);

        assertEquals(Optional.of(RejectionReason.CONTROLLER_HALTED), outcome.rejection());
        assertEquals(AdjustmentOutcome.Status.INVALID_TRANSITION, outcome.status());
        assertThrows(InvalidTransitionException.class, () -> controller.presentLensPair(Eye.OD));
        assertThrows(InvalidTransitionException.class, () -> controller.presentBinocularBalance());
        assertThrows(InvalidTransitionException.class,
                () -> controller.balanceBinocular(BinocularReport.EQUAL, StepId.of("6.5")));
        assertThrows(InvalidTransitionException.class,
                () -> controller.applyDuochrome(Eye.OD, DuochromeResult.RED_CLEARER, STEP));
        assertThrows(InvalidTransitionException.class, () -> controller.setPupillaryDistance(64, 61));
        assertEquals(historySize, controller.snapshot().adjustmentHistory().size());
    }

    @Test
    void escalateIsIdempotentAndKeepsFirstReason() {
        DeviceCommand.Escalate first = controller.escalate(EscalationReason.RED_FLAG);
        PhoropterState halted = controller.snapshot();

        DeviceCommand.Escalate second = controller.escalate(EscalationReason.DURATION_EXCEEDED);

        assertEquals(first, second);
        assertEquals(EscalationReason.RED_FLAG, second.reason());
        assertSame(halted, controller.snapshot());
        assertEquals(Optional.of(EscalationReason.RED_FLAG), controller.snapshot().haltReason());
        assertEquals(1, sink.eventsOfType(PhaseTransitionEvent.class).size());
    }

    @Test
    void escalateFromFinalizedHalts() {
        controller.finalizePrescription();

        controller.escalate(EscalationReason.EXTERNAL_ABORT);

        assertEquals(ControllerPhase.HALTED, controller.phase());
        List<PhaseTransitionEvent> events = sink.eventsOfType(PhaseTransitionEvent.class);
        assertEquals(2, events.size());
        assertEquals(ControllerPhase.FINALIZED, events.get(1).oldPhase());
        assertEquals(Optional.of(EscalationReason.EXTERNAL_ABORT), events.get(1).reason());
    }

    @Test
    void occlusionAndPupillaryDistanceAreStored() {
        controller.setOcclusion(Optional.of(Eye.OD));
        controller.setPupillaryDistance(PupillaryDistance.ofDistance(66));

        assertEquals(Optional.of(Eye.OD), controller.snapshot().occludedEye());
        assertEquals(63.0, controller.snapshot().pupillaryDistance().nearMm(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> controller.setPupillaryDistance(90, 60));
    }
}
