package com.questrail.refraction.controller;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.model.AdjustmentRecord;
import com.questrail.refraction.model.AdjustmentRequest;
import com.questrail.refraction.model.ControllerPhase;
import com.questrail.refraction.model.LensConfiguration;
import com.questrail.refraction.model.PhoropterState;
import com.questrail.refraction.model.PupillaryDistance;
import com.questrail.refraction.observability.AdjustmentEvent;
import com.questrail.refraction.observability.NullObservabilitySink;
import com.questrail.refraction.observability.PhaseTransitionEvent;
import com.questrail.refraction.observability.RefractionObservabilitySink;
import com.questrail.refraction.protocol.SlotValues;
import com.questrail.refraction.protocol.StepId;
import com.questrail.refraction.time.SystemWallClock;
import com.questrail.refraction.time.WallClock;
import com.questrail.refraction.validation.AdjustmentValidator;
import com.questrail.refraction.validation.RejectionReason;
import com.questrail.refraction.validation.ValidationResult;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * PhoropterController
 * -----------------------------------------------------------------------------
 * Sole owner of a session's {@link PhoropterState}.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Routes every lens change through the {@link AdjustmentValidator} and
 *       applies only accepted changes</li>
 *   <li>Appends each applied change to the adjustment history</li>
 *   <li>Builds device commands (lens pair, JCC, binocular balance, finalize,
 *       escalate)</li>
 *   <li>Maps JCC flip, duochrome and binocular answers to fixed nudges taken
 *       from the {@link NudgePolicy}</li>
 *   <li>Enforces its own lifecycle: ACTIVE, FINALIZED, HALTED</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * <ul>
 *   <li>Decide whether a patient response is trustworthy (quality gate)</li>
 *   <li>Decide which protocol step comes next (step progression)</li>
 *   <li>Decide whether the session must stop (safety monitor); it only
 *       carries out {@link #escalate(EscalationReason)} when told to</li>
 *   <li>Talk to hardware; commands are values</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   ACTIVE ──finalizePrescription()──▶ FINALIZED
 *     │                                    │
 *     └────────────escalate()──────────────┴──▶ HALTED
 * </pre>
 * FINALIZED and HALTED never return to ACTIVE. Outside ACTIVE:
 * <ul>
 *   <li>{@link #adjust(AdjustmentRequest)} returns an
 *       {@link AdjustmentOutcome.Status#INVALID_TRANSITION} outcome</li>
 *   <li>every other operation except {@link #escalate(EscalationReason)} and
 *       {@link #snapshot()} throws {@link InvalidTransitionException}</li>
 * </ul>
 * Neither path touches the adjustment history. {@code escalate} is idempotent:
 * once halted it returns the command for the original reason.
 *
 * <p>The finalize operation is named {@code finalizePrescription} because
 * {@code finalize()} is reserved by {@link Object}.</p>
 *
 * <h2>Threading</h2>
 * Not thread-safe. One controller belongs to one session and is driven by one
 * caller in turn order.
 */
public class PhoropterController
{
    /** Source step recorded for adjustments made outside the protocol. */
    public static final StepId MANUAL_STEP = StepId.of("manual");

    public static final String LENS_PAIR_QUESTION = "lens_pair.sharper_rounder";
    public static final List<String> LENS_PAIR_OPTIONS =
            List.of(SlotValues.FIRST_BETTER, SlotValues.SECOND_BETTER, SlotValues.BOTH_SAME);

    public static final String BINOCULAR_QUESTION = "binocular.equal_clarity";
    public static final List<String> BINOCULAR_OPTIONS =
            List.of(SlotValues.BOTH_SAME, SlotValues.RIGHT_CLEARER, SlotValues.LEFT_CLEARER);

    private final String sessionId;
    private final AdjustmentValidator validator;
    private final NudgePolicy nudges;
    private final WallClock clock;
    private final RefractionObservabilitySink observabilitySink;

    private PhoropterState state;

    public PhoropterController(String sessionId,
                               PhoropterState initialState,
                               AdjustmentValidator validator,
                               NudgePolicy nudges,
                               WallClock clock,
                               RefractionObservabilitySink observabilitySink)
    {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.nudges = Objects.requireNonNull(nudges, "nudges");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Standalone controller with default nudges, system clock and no observability.
     */
    public PhoropterController(PhoropterState initialState, AdjustmentValidator validator)
    {
        this("standalone", initialState, validator, NudgePolicy.defaults(), SystemWallClock.INSTANCE, null);
    }

    // ---------------------------------------------------------------------
    // Adjustments
    // ---------------------------------------------------------------------

    /**
     * Validates and, if accepted, applies one adjustment.
     *
     * <p>On any non-applied outcome the state, including the history, is left
     * exactly as it was.</p>
     */
    public AdjustmentOutcome adjust(AdjustmentRequest request)
    {
        Objects.requireNonNull(request, "request");

        AdjustmentOutcome outcome;
        ControllerPhase phase = state.phase();

        if (!phase.acceptsAdjustments()) {
            RejectionReason reason = phase == ControllerPhase.FINALIZED
                    ? RejectionReason.CONTROLLER_FINALIZED
                    : RejectionReason.CONTROLLER_HALTED;
            outcome = AdjustmentOutcome.rejected(request, reason,
                    "Adjustment refused: controller is " + phase);
        } else {
            ValidationResult result = validator.validate(state, request);
            if (result instanceof ValidationResult.Rejected rejected) {
                outcome = AdjustmentOutcome.rejected(request, rejected.reason(), rejected.message());
            } else {
                outcome = apply(request, ((ValidationResult.Accepted) result).newValue());
            }
        }

        observabilitySink.onAdjustment(new AdjustmentEvent(
                clock.now(), sessionId, request.eye(), request.parameter(), request.magnitude(),
                outcome.rejection(), outcome.message()));
        return outcome;
    }

    /**
     * Adjustment outside the protocol, recorded against {@link #MANUAL_STEP}.
     */
    public AdjustmentOutcome adjustParameter(Eye eye, RefractiveParameter parameter, double magnitude)
    {
        return adjust(new AdjustmentRequest(eye, parameter, magnitude, MANUAL_STEP));
    }

    private AdjustmentOutcome apply(AdjustmentRequest request, double newValue)
    {
        Eye eye = request.eye();
        LensConfiguration updated = state.lens(eye).with(request.parameter(), newValue);
        AdjustmentRecord record = new AdjustmentRecord(
                clock.now(), eye, request.parameter(), request.magnitude(), newValue, request.sourceStep());

        state = state.withLens(eye, updated).withAdjustment(record);

        String message = request.parameter() == RefractiveParameter.AXIS
                ? String.format(Locale.ROOT, "Adjusted %s axis to %.0f°", eye, newValue)
                : String.format(Locale.ROOT, "Adjusted %s %s to %.3fD",
                        eye, request.parameter().name().toLowerCase(Locale.ROOT), newValue);
        return AdjustmentOutcome.applied(request, record, message);
    }

    /**
     * Maps a JCC flip answer to an axis refinement: FIRST rotates by
     * +{@link NudgePolicy#jccAxisStep()}, SECOND by the negative, SAME leaves
     * the axis alone.
     *
     * @return the adjustment outcome, or empty when no change was requested
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public Optional<AdjustmentOutcome> applyJccAxis(Eye eye, JccChoice choice, StepId sourceStep)
    {
        Objects.requireNonNull(eye, "eye");
        Objects.requireNonNull(choice, "choice");
        requireActive("applyJccAxis");

        return switch (choice) {
            case FIRST -> Optional.of(adjust(new AdjustmentRequest(
                    eye, RefractiveParameter.AXIS, nudges.jccAxisStep(), sourceStep)));
            case SECOND -> Optional.of(adjust(new AdjustmentRequest(
                    eye, RefractiveParameter.AXIS, -nudges.jccAxisStep(), sourceStep)));
            case SAME -> Optional.empty();
        };
    }

    /**
     * Maps a duochrome answer to a sphere nudge: red clearer reduces sphere by
     * {@link NudgePolicy#duochromeStep()}, green clearer increases it, equal
     * leaves it alone.
     *
     * @return the adjustment outcome, or empty when no change was requested
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public Optional<AdjustmentOutcome> applyDuochrome(Eye eye, DuochromeResult result, StepId sourceStep)
    {
        Objects.requireNonNull(eye, "eye");
        Objects.requireNonNull(result, "result");
        requireActive("applyDuochrome");

        return switch (result) {
            case RED_CLEARER -> Optional.of(adjust(new AdjustmentRequest(
                    eye, RefractiveParameter.SPHERE, -nudges.duochromeStep(), sourceStep)));
            case GREEN_CLEARER -> Optional.of(adjust(new AdjustmentRequest(
                    eye, RefractiveParameter.SPHERE, nudges.duochromeStep(), sourceStep)));
            case EQUAL -> Optional.empty();
        };
    }

    // ---------------------------------------------------------------------
    // Presentations
    // ---------------------------------------------------------------------

    /**
     * Builds a lens pair presentation. Pure: state is not changed.
     *
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public DeviceCommand.PresentLensPair presentLensPair(Eye eye,
                                                         LensConfiguration lensA,
                                                         LensConfiguration lensB,
                                                         String questionKey,
                                                         List<String> options)
    {
        requireActive("presentLensPair");
        return new DeviceCommand.PresentLensPair(eye, lensA, lensB, questionKey, options);
    }

    /**
     * Standard lens pair around the eye's current lens: option one is one
     * refraction step more plus, option two is the current lens. At the top of
     * the sphere domain both options are the current lens.
     */
    public DeviceCommand.PresentLensPair presentLensPair(Eye eye)
    {
        Objects.requireNonNull(eye, "eye");
        requireActive("presentLensPair");

        LensConfiguration current = state.lens(eye);
        double plusSphere = current.sphere() + nudges.refractionStep();
        LensConfiguration first = LensConfiguration.inDomain(RefractiveParameter.SPHERE, plusSphere)
                ? current.withSphere(Math.min(plusSphere, LensConfiguration.SPHERE_MAX))
                : current;
        return presentLensPair(eye, first, current, LENS_PAIR_QUESTION, LENS_PAIR_OPTIONS);
    }

    /**
     * Builds the three-part JCC presentation (horizontal axis, vertical axis,
     * duochrome) for one eye. Each answer comes back later through
     * {@link #applyJccAxis} or {@link #applyDuochrome}.
     *
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public DeviceCommand.PresentJcc presentJcc(Eye eye)
    {
        Objects.requireNonNull(eye, "eye");
        requireActive("presentJcc");
        return new DeviceCommand.PresentJcc(eye, state.lens(eye), List.of(JccTestPart.values()));
    }

    /**
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public DeviceCommand.BalanceBinocular presentBinocularBalance()
    {
        requireActive("presentBinocularBalance");
        return new DeviceCommand.BalanceBinocular(state.od(), state.os(), BINOCULAR_QUESTION, BINOCULAR_OPTIONS);
    }

    // ---------------------------------------------------------------------
    // Binocular balance and lifecycle
    // ---------------------------------------------------------------------

    /**
     * Applies a binocular comparison.
     * <ul>
     *   <li>one eye clearer: the <em>other</em> eye's sphere is nudged by
     *       {@link NudgePolicy#binocularBalanceStep()} and the balance test is
     *       presented again</li>
     *   <li>equal: the prescription is finalized</li>
     * </ul>
     *
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public BalanceOutcome balanceBinocular(BinocularReport report, StepId sourceStep)
    {
        Objects.requireNonNull(report, "report");
        requireActive("balanceBinocular");

        if (report == BinocularReport.EQUAL) {
            return new BalanceOutcome(BalanceOutcome.Resolution.FINALIZED, Optional.empty(), finalizePrescription());
        }

        Eye nudged = report == BinocularReport.OD_CLEARER ? Eye.OS : Eye.OD;
        AdjustmentOutcome outcome = adjust(new AdjustmentRequest(
                nudged, RefractiveParameter.SPHERE, nudges.binocularBalanceStep(), sourceStep));

        if (!outcome.isApplied()) {
            return new BalanceOutcome(BalanceOutcome.Resolution.REJECTED, Optional.of(outcome),
                    new DeviceCommand.NoAction(outcome.message()));
        }
        return new BalanceOutcome(BalanceOutcome.Resolution.RETEST, Optional.of(outcome), presentBinocularBalance());
    }

    /**
     * Freezes both lenses.
     *
     * @return the finalize command carrying the frozen snapshot
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public DeviceCommand.Finalize finalizePrescription()
    {
        requireActive("finalize");
        transitionTo(state.finalized(), Optional.empty());
        return new DeviceCommand.Finalize(state);
    }

    /**
     * Halts the controller and emits a shutdown command. Idempotent: when
     * already halted, returns the command for the first reason and changes
     * nothing.
     */
    public DeviceCommand.Escalate escalate(EscalationReason reason)
    {
        Objects.requireNonNull(reason, "reason");

        if (state.phase() == ControllerPhase.HALTED) {
            return new DeviceCommand.Escalate(state.haltReason().orElse(reason));
        }

        transitionTo(state.halted(reason), Optional.of(reason));
        return new DeviceCommand.Escalate(reason);
    }

    /**
     * @param occludedEye eye to occlude, or empty for both eyes open
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public void setOcclusion(Optional<Eye> occludedEye)
    {
        Objects.requireNonNull(occludedEye, "occludedEye");
        requireActive("setOcclusion");
        state = state.withOcclusion(occludedEye);
    }

    /**
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public void setPupillaryDistance(PupillaryDistance pupillaryDistance)
    {
        Objects.requireNonNull(pupillaryDistance, "pupillaryDistance");
        requireActive("setPupillaryDistance");
        state = state.withPupillaryDistance(pupillaryDistance);
    }

    /**
     * @throws IllegalArgumentException if either value is outside its range
     * @throws InvalidTransitionException if the controller is not ACTIVE
     */
    public void setPupillaryDistance(double distanceMm, double nearMm)
    {
        setPupillaryDistance(new PupillaryDistance(distanceMm, nearMm));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Read-only snapshot, including the full adjustment history.
     */
    public PhoropterState snapshot()
    {
        return state;
    }

    public ControllerPhase phase()
    {
        return state.phase();
    }

    public boolean isActive()
    {
        return state.phase() == ControllerPhase.ACTIVE;
    }

    // ---------------------------------------------------------------------

    private void requireActive(String operation)
    {
        if (state.phase() != ControllerPhase.ACTIVE) {
            throw new InvalidTransitionException(operation, state.phase());
        }
    }

    private void transitionTo(PhoropterState next, Optional<EscalationReason> reason)
    {
        ControllerPhase old = state.phase();
        state = next;
        observabilitySink.onPhaseTransition(new PhaseTransitionEvent(
                clock.now(), sessionId, old, next.phase(), reason));
    }
}
