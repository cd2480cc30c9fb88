package com.questrail.refraction.model;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.Eye;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PhoropterState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the phoropter for one examination session.
 *
 * <h2>Role in the architecture</h2>
 * The phoropter controller is the only component that produces new instances;
 * it holds the current snapshot and replaces it after each validated change.
 * Everything else (the engine, observability sinks, the persistence
 * collaborator) only ever reads snapshots, so handing one out never exposes
 * mutable session state.
 *
 * <h2>Adjustment history</h2>
 * {@link #adjustmentHistory()} is append-only: {@link #withAdjustment} is the
 * only way a record is added and no method removes one.
 */
public final class PhoropterState
{
    private final LensConfiguration od;
    private final LensConfiguration os;
    private final Optional<Eye> occludedEye;
    private final PupillaryDistance pupillaryDistance;
    private final List<AdjustmentRecord> adjustmentHistory;
    private final ControllerPhase phase;
    private final Optional<EscalationReason> haltReason;

    private PhoropterState(LensConfiguration od,
                           LensConfiguration os,
                           Optional<Eye> occludedEye,
                           PupillaryDistance pupillaryDistance,
                           List<AdjustmentRecord> adjustmentHistory,
                           ControllerPhase phase,
                           Optional<EscalationReason> haltReason) {
        this.od = Objects.requireNonNull(od, "od");
        this.os = Objects.requireNonNull(os, "os");
        this.occludedEye = Objects.requireNonNull(occludedEye, "occludedEye");
        this.pupillaryDistance = Objects.requireNonNull(pupillaryDistance, "pupillaryDistance");
        this.adjustmentHistory = List.copyOf(adjustmentHistory);
        this.phase = Objects.requireNonNull(phase, "phase");
        this.haltReason = Objects.requireNonNull(haltReason, "haltReason");
    }

    public LensConfiguration od() {
        return od;
    }

    public LensConfiguration os() {
        return os;
    }

    public LensConfiguration lens(Eye eye) {
        return Objects.requireNonNull(eye, "eye") == Eye.OD ? od : os;
    }

    public Optional<Eye> occludedEye() {
        return occludedEye;
    }

    public PupillaryDistance pupillaryDistance() {
        return pupillaryDistance;
    }

    /**
     * Applied adjustments in order of application (immutable).
     */
    public List<AdjustmentRecord> adjustmentHistory() {
        return adjustmentHistory;
    }

    public ControllerPhase phase() {
        return phase;
    }

    /**
     * Reason recorded by the first escalation, if the session is halted.
     */
    public Optional<EscalationReason> haltReason() {
        return haltReason;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * Start-of-session state: plano lenses both eyes, OS occluded (the exam
     * refracts OD first), given PD, empty history, ACTIVE.
     */
    public static PhoropterState initial(PupillaryDistance pupillaryDistance) {
        return new PhoropterState(
                LensConfiguration.plano(),
                LensConfiguration.plano(),
                Optional.of(Eye.OS),
                pupillaryDistance,
                List.of(),
                ControllerPhase.ACTIVE,
                Optional.empty()
        );
    }

    /**
     * Start-of-session state with explicit starting lenses, e.g. seeded from an
     * auto-refractor reading.
     */
    public static PhoropterState initial(LensConfiguration od,
                                         LensConfiguration os,
                                         PupillaryDistance pupillaryDistance) {
        return new PhoropterState(od, os, Optional.of(Eye.OS), pupillaryDistance,
                List.of(), ControllerPhase.ACTIVE, Optional.empty());
    }

    // ---------------------------------------------------------------------
    // State transition helpers
    // ---------------------------------------------------------------------

    public PhoropterState withLens(Eye eye, LensConfiguration lens) {
        Objects.requireNonNull(eye, "eye");
        return new PhoropterState(
                eye == Eye.OD ? lens : od,
                eye == Eye.OS ? lens : os,
                occludedEye,
                pupillaryDistance,
                adjustmentHistory,
                phase,
                haltReason
        );
    }

    public PhoropterState withAdjustment(AdjustmentRecord record) {
        Objects.requireNonNull(record, "record");
        List<AdjustmentRecord> appended = new ArrayList<>(adjustmentHistory.size() + 1);
        appended.addAll(adjustmentHistory);
        appended.add(record);
        return new PhoropterState(od, os, occludedEye, pupillaryDistance, appended, phase, haltReason);
    }

    public PhoropterState withOcclusion(Optional<Eye> occludedEye) {
        return new PhoropterState(od, os, occludedEye, pupillaryDistance, adjustmentHistory, phase, haltReason);
    }

    public PhoropterState withPupillaryDistance(PupillaryDistance pupillaryDistance) {
        return new PhoropterState(od, os, occludedEye, pupillaryDistance, adjustmentHistory, phase, haltReason);
    }

    public PhoropterState finalized() {
        return new PhoropterState(od, os, occludedEye, pupillaryDistance, adjustmentHistory,
                ControllerPhase.FINALIZED, haltReason);
    }

    public PhoropterState halted(EscalationReason reason) {
        Objects.requireNonNull(reason, "reason");
        return new PhoropterState(od, os, occludedEye, pupillaryDistance, adjustmentHistory,
                ControllerPhase.HALTED, Optional.of(reason));
    }

    @Override
    public String toString() {
        return "PhoropterState{" +
                "phase=" + phase +
                ", OD=" + od.notation() +
                ", OS=" + os.notation() +
                ", occluded=" + occludedEye.map(Enum::name).orElse("none") +
                ", adjustments=" + adjustmentHistory.size() +
                '}';
    }
}
