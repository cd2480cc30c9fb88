package com.questrail.refraction.engine;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.PatientResponseClassifier;
import com.questrail.refraction.api.PatientTurn;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.api.SlotKey;
import com.questrail.refraction.config.RefractionEngineConfig;
import com.questrail.refraction.controller.AdjustmentOutcome;
import com.questrail.refraction.controller.BalanceOutcome;
import com.questrail.refraction.controller.BinocularReport;
import com.questrail.refraction.controller.DeviceCommand;
import com.questrail.refraction.controller.DuochromeResult;
import com.questrail.refraction.controller.InvalidTransitionException;
import com.questrail.refraction.controller.JccChoice;
import com.questrail.refraction.controller.PhoropterController;
import com.questrail.refraction.model.AdjustmentRequest;
import com.questrail.refraction.model.ControllerPhase;
import com.questrail.refraction.model.PhoropterState;
import com.questrail.refraction.observability.NullObservabilitySink;
import com.questrail.refraction.observability.RefractionErrorEvent;
import com.questrail.refraction.observability.RefractionObservabilitySink;
import com.questrail.refraction.observability.StepTransitionEvent;
import com.questrail.refraction.protocol.ProtocolStep;
import com.questrail.refraction.protocol.ProtocolStepTable;
import com.questrail.refraction.protocol.SlotValues;
import com.questrail.refraction.protocol.StepId;
import com.questrail.refraction.protocol.StepProgression;
import com.questrail.refraction.quality.ResponseQualityGate;
import com.questrail.refraction.quality.ResponseVerdict;
import com.questrail.refraction.safety.ExamQualityMonitor;
import com.questrail.refraction.safety.FatigueAssessment;
import com.questrail.refraction.safety.SafetyMonitor;
import com.questrail.refraction.safety.SafetyVerdict;
import com.questrail.refraction.time.SystemWallClock;
import com.questrail.refraction.time.WallClock;
import com.questrail.refraction.validation.AdjustmentValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * RefractionEngine
 * -----------------------------------------------------------------------------
 * Session-scoped composition of the phoropter controller, quality gate, step
 * progression and safety monitor.
 *
 * <h2>Turn pipeline</h2>
 * <pre>
 *   turn → safety screen ─┬─ ESCALATE     → controller.escalate, escalate_to_professional
 *                         ├─ PERSONA_LOCK → repeat step, no adjustment
 *                         └─ CONTINUE     → quality gate → progression
 *                                              → decision mapping → validator/controller
 *                                              → command for the landing step
 * </pre>
 * The safety verdict overrides everything downstream of it. Rejections and
 * escalations are reported through distinct {@link TurnOutcome.Kind}s and are
 * never merged. A rejected turn still carries the command for the step it
 * lands on; the rejection messages travel in the adjustments.
 *
 * <h2>Decision mapping</h2>
 * Only a CLEAR verdict reaches the mapping, and the mapping is an exhaustive
 * switch over {@link com.questrail.refraction.protocol.StepCategory}:
 * <ul>
 *   <li>MONOCULAR_REFRACTION: first_better → +refraction step sphere,
 *       second_better → −refraction step, both_same → none</li>
 *   <li>JCC_DUOCHROME: clarity feedback → axis refinement; an optional
 *       colour preference → duochrome nudge</li>
 *   <li>BINOCULAR_BALANCE: one eye clearer → balance nudge and re-test,
 *       equal → finalize. A rejected nudge also keeps the step, so the
 *       session never leaves balance without agreement</li>
 *   <li>GENERAL, NEAR_VISION, TERMINAL: no adjustment</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * Once the controller is HALTED every turn is refused with
 * {@link TurnOutcome.Kind#SESSION_CLOSED}. A FINALIZED controller keeps
 * accepting turns so the remaining non-refractive steps (near vision,
 * recommendations) can complete.
 *
 * <h2>Threading</h2>
 * Single-writer. One engine per session; engines share nothing mutable.
 */
public final class RefractionEngine implements RefractionSession
{
    private final String sessionId;
    private final RefractionEngineConfig config;
    private final WallClock clock;
    private final RefractionObservabilitySink observabilitySink;

    private final PhoropterController controller;
    private final ResponseQualityGate gate;
    private final StepProgression progression;
    private final SafetyMonitor safety;
    private final ExamQualityMonitor quality = new ExamQualityMonitor();

    private StepId currentStep;

    public RefractionEngine(String sessionId,
                            RefractionEngineConfig config,
                            WallClock clock,
                            RefractionObservabilitySink observabilitySink) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.controller = new PhoropterController(
                sessionId,
                PhoropterState.initial(config.initialPupillaryDistance()),
                new AdjustmentValidator(config.safetyLimits()),
                config.nudgePolicy(),
                clock,
                this.observabilitySink);
        this.gate = new ResponseQualityGate(config.qualityThresholds());
        this.progression = new StepProgression(config.protocol());
        this.safety = new SafetyMonitor(
                sessionId, config.durationPolicy(), config.fatiguePolicy(), clock, this.observabilitySink);
        this.currentStep = config.protocol().firstStep();
    }

    public RefractionEngine(String sessionId, RefractionEngineConfig config) {
        this(sessionId, config, SystemWallClock.INSTANCE, null);
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    // ---------------------------------------------------------------------
    // Turn processing
    // ---------------------------------------------------------------------

    @Override
    public TurnOutcome processTurn(PatientTurn turn) {
        Objects.requireNonNull(turn, "turn");
        StepId from = currentStep;

        if (controller.phase() == ControllerPhase.HALTED) {
            return new TurnOutcome(TurnOutcome.Kind.SESSION_CLOSED, from, from,
                    Optional.empty(), Optional.empty(), List.of(),
                    new DeviceCommand.NoAction("session halted: "
                            + controller.snapshot().haltReason().map(EscalationReason::code).orElse("unknown")),
                    Optional.empty());
        }

        SafetyVerdict safetyVerdict = safety.screen(turn);

        switch (safetyVerdict.directive()) {
            case ESCALATE -> {
                EscalationReason reason = safetyVerdict.escalation().orElseThrow();
                DeviceCommand.Escalate command = controller.escalate(reason);
                moveTo(from, StepId.ESCALATE_TO_PROFESSIONAL, reason.code());
                return new TurnOutcome(TurnOutcome.Kind.ESCALATED, from, currentStep,
                        Optional.empty(), Optional.of(safetyVerdict), List.of(), command, Optional.empty());
            }
            case PERSONA_LOCK -> {
                moveTo(from, from, "persona_override");
                return new TurnOutcome(TurnOutcome.Kind.PERSONA_LOCKED, from, from,
                        Optional.empty(), Optional.of(safetyVerdict), List.of(),
                        new DeviceCommand.RepeatPresentation(from, "persona override"), Optional.empty());
            }
            case CONTINUE -> {
                // falls through to the quality gate
            }
        }

        ProtocolStep step = config.protocol().step(from);
        ResponseVerdict verdict = gate.assess(turn.confidence(), turn.intent(), turn.slots(), step);
        quality.recordResponse(turn.confidence(), verdict.quality());
        FatigueAssessment fatigue = safety.recordResponse(turn, verdict.quality());

        StepId next = progression.nextStep(from, verdict, false);

        if (!verdict.isClear()) {
            moveTo(from, next, verdict.quality().name().toLowerCase(Locale.ROOT));
            return new TurnOutcome(TurnOutcome.Kind.REPEAT, from, next,
                    Optional.of(verdict), Optional.of(safetyVerdict), List.of(),
                    new DeviceCommand.RepeatPresentation(from, verdict.reason()), Optional.of(fatigue));
        }

        Decision decision = decide(step, turn);
        decision.adjustments().forEach(a -> quality.recordAdjustment(a.isApplied()));

        boolean rejected = decision.adjustments().stream().anyMatch(a -> !a.isApplied());
        if (decision.retest()) {
            next = from;
        }

        TurnOutcome.Kind kind;
        DeviceCommand command;
        if (rejected) {
            kind = TurnOutcome.Kind.ADJUSTMENT_REJECTED;
            command = commandFor(config.protocol().step(next));
        } else if (decision.retest()) {
            kind = TurnOutcome.Kind.RETEST;
            command = decision.command().orElseThrow();
        } else if (decision.command().isPresent()) {
            kind = TurnOutcome.Kind.ADVANCED;
            command = decision.command().get();
        } else if (next.equals(from) && step.isTerminal()) {
            kind = TurnOutcome.Kind.SESSION_CLOSED;
            command = commandFor(config.protocol().step(next));
        } else {
            kind = TurnOutcome.Kind.ADVANCED;
            command = commandFor(config.protocol().step(next));
        }

        moveTo(from, next, kind.name().toLowerCase(Locale.ROOT));
        return new TurnOutcome(kind, from, next, Optional.of(verdict), Optional.of(safetyVerdict),
                decision.adjustments(), command, Optional.of(fatigue));
    }

    @Override
    public TurnOutcome processUtterance(PatientResponseClassifier classifier,
                                        String utterance,
                                        double elapsedSeconds,
                                        double responseLatencySeconds) {
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(utterance, "utterance");
        return processTurn(new PatientTurn(
                Objects.requireNonNull(classifier.classify(currentStep.value(), utterance), "classification"),
                elapsedSeconds,
                responseLatencySeconds));
    }

    // ---------------------------------------------------------------------
    // Decision mapping
    // ---------------------------------------------------------------------

    // command, when present, replaces the landing-step command; retest keeps the step.
    private record Decision(List<AdjustmentOutcome> adjustments, Optional<DeviceCommand> command, boolean retest) {
        static Decision none() {
            return new Decision(List.of(), Optional.empty(), false);
        }

        static Decision of(List<AdjustmentOutcome> adjustments) {
            return new Decision(adjustments, Optional.empty(), false);
        }
    }

    private Decision decide(ProtocolStep step, PatientTurn turn) {
        return switch (step.category()) {
            case MONOCULAR_REFRACTION -> refineSphere(step, turn);
            case JCC_DUOCHROME -> refineCylinderAxis(step, turn);
            case BINOCULAR_BALANCE -> balance(step, turn);
            case GENERAL, NEAR_VISION, TERMINAL -> Decision.none();
        };
    }

    private Decision refineSphere(ProtocolStep step, PatientTurn turn) {
        Eye eye = step.testedEye().orElseThrow();
        double nudge = config.nudgePolicy().refractionStep();
        String feedback = turn.slot(SlotKey.CLARITY_FEEDBACK).orElse(SlotValues.BOTH_SAME);

        double magnitude;
        switch (feedback) {
            case SlotValues.FIRST_BETTER:
                magnitude = nudge;
                break;
            case SlotValues.SECOND_BETTER:
                magnitude = -nudge;
                break;
            default:
                return Decision.none();
        }

        return Decision.of(List.of(
                controller.adjust(new AdjustmentRequest(eye, RefractiveParameter.SPHERE, magnitude, step.id()))));
    }

    private Decision refineCylinderAxis(ProtocolStep step, PatientTurn turn) {
        Eye eye = step.testedEye().orElseThrow();
        List<AdjustmentOutcome> outcomes = new ArrayList<>();

        try {
            turn.slot(SlotKey.CLARITY_FEEDBACK)
                    .flatMap(JccChoice::fromClarityFeedback)
                    .flatMap(choice -> controller.applyJccAxis(eye, choice, step.id()))
                    .ifPresent(outcomes::add);

            turn.slot(SlotKey.COLOR_PREFERENCE)
                    .flatMap(DuochromeResult::fromColorPreference)
                    .flatMap(result -> controller.applyDuochrome(eye, result, step.id()))
                    .ifPresent(outcomes::add);
        } catch (InvalidTransitionException e) {
            reportError("JCC refinement refused at step " + step.id(), e);
        }

        return Decision.of(outcomes);
    }

    private Decision balance(ProtocolStep step, PatientTurn turn) {
        Optional<BinocularReport> report = turn.slot(SlotKey.CLARITY_FEEDBACK)
                .flatMap(BinocularReport::fromClarityFeedback);
        if (report.isEmpty()) {
            return Decision.none();
        }

        try {
            BalanceOutcome outcome = controller.balanceBinocular(report.get(), step.id());
            List<AdjustmentOutcome> adjustments = outcome.adjustment().map(List::of).orElse(List.of());
            return switch (outcome.resolution()) {
                case RETEST -> new Decision(adjustments, Optional.of(outcome.command()), true);
                case FINALIZED -> new Decision(adjustments, Optional.of(outcome.command()), false);
                case REJECTED -> new Decision(adjustments, Optional.empty(), true);
            };
        } catch (InvalidTransitionException e) {
            reportError("Binocular balance refused at step " + step.id(), e);
            return Decision.none();
        }
    }

    // ---------------------------------------------------------------------
    // Landing-step commands
    // ---------------------------------------------------------------------

    private DeviceCommand commandFor(ProtocolStep landing) {
        try {
            return switch (landing.category()) {
                case MONOCULAR_REFRACTION -> {
                    Eye eye = landing.testedEye().orElseThrow();
                    controller.setOcclusion(Optional.of(eye.other()));
                    yield controller.presentLensPair(eye);
                }
                case JCC_DUOCHROME -> {
                    Eye eye = landing.testedEye().orElseThrow();
                    controller.setOcclusion(Optional.of(eye.other()));
                    yield controller.presentJcc(eye);
                }
                case BINOCULAR_BALANCE -> {
                    controller.setOcclusion(Optional.empty());
                    yield controller.presentBinocularBalance();
                }
                case TERMINAL -> landing.id().equals(StepId.COMPLETE)
                        ? complete()
                        : new DeviceCommand.NoAction("terminal step " + landing.id());
                case GENERAL, NEAR_VISION -> new DeviceCommand.NoAction("step " + landing.id());
            };
        } catch (InvalidTransitionException e) {
            reportError("Presentation for step " + landing.id() + " refused", e);
            return new DeviceCommand.NoAction(e.getMessage());
        }
    }

    // Only an agreed binocular balance finalizes; an ACTIVE controller here
    // means the table skipped it or it never agreed.
    private DeviceCommand complete() {
        if (controller.isActive()) {
            return new DeviceCommand.NoAction("prescription not finalized: binocular balance never agreed");
        }
        return new DeviceCommand.Finalize(controller.snapshot());
    }

    // ---------------------------------------------------------------------
    // External control and queries
    // ---------------------------------------------------------------------

    @Override
    public DeviceCommand.Escalate escalate(EscalationReason reason) {
        Objects.requireNonNull(reason, "reason");
        boolean alreadyHalted = controller.phase() == ControllerPhase.HALTED;
        DeviceCommand.Escalate command = controller.escalate(reason);
        if (!alreadyHalted) {
            moveTo(currentStep, StepId.ESCALATE_TO_PROFESSIONAL, reason.code());
        }
        return command;
    }

    @Override
    public StepId currentStep() {
        return currentStep;
    }

    public ControllerPhase phase() {
        return controller.phase();
    }

    @Override
    public SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, controller.snapshot(), currentStep, safety.snapshot(), quality.metrics());
    }

    public ProtocolStepTable protocol() {
        return config.protocol();
    }

    private void moveTo(StepId from, StepId to, String cause) {
        currentStep = to;
        observabilitySink.onStepTransition(new StepTransitionEvent(clock.now(), sessionId, from, to, cause));
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new RefractionErrorEvent(clock.now(), sessionId, message, cause));
    }
}
