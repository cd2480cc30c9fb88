package com.questrail.refraction.controller;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.Eye;
import com.questrail.refraction.model.LensConfiguration;
import com.questrail.refraction.model.PhoropterState;
import com.questrail.refraction.protocol.StepId;

import java.util.List;
import java.util.Objects;

/**
 * DeviceCommand
 * -----------------------------------------------------------------------------
 * Abstract instruction for the device/orchestration collaborator.
 *
 * <h2>Role in the architecture</h2>
 * Commands are pure values. Constructing one never touches hardware and never
 * mutates controller state; a transport adapter outside this library maps them
 * to whatever the physical phoropter speaks.
 *
 * <p>Question text is not generated here. Commands carry an opaque
 * {@code questionKey} and option keys that the orchestration layer resolves
 * to patient-facing prose.</p>
 */
public sealed interface DeviceCommand
        permits DeviceCommand.PresentLensPair,
                DeviceCommand.PresentJcc,
                DeviceCommand.BalanceBinocular,
                DeviceCommand.Finalize,
                DeviceCommand.Escalate,
                DeviceCommand.NoAction,
                DeviceCommand.RepeatPresentation
{
    /**
     * Enumerates the kinds of command, with their wire names.
     */
    enum Kind {
        PRESENT_LENS_PAIR("present_lens_pair"),
        PRESENT_JCC("present_jcc"),
        BALANCE_BINOCULAR("balance_binocular"),
        FINALIZE("finalize"),
        ESCALATE("escalate"),
        NO_ACTION("no_action"),
        REPEAT_PRESENTATION("repeat_presentation");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    Kind kind();

    /** Show two lenses to one eye and ask which is sharper. */
    record PresentLensPair(Eye eye,
                           LensConfiguration lensA,
                           LensConfiguration lensB,
                           String questionKey,
                           List<String> options) implements DeviceCommand {
        public PresentLensPair {
            Objects.requireNonNull(eye, "eye");
            Objects.requireNonNull(lensA, "lensA");
            Objects.requireNonNull(lensB, "lensB");
            Objects.requireNonNull(questionKey, "questionKey");
            options = List.copyOf(options);
        }

        @Override
        public Kind kind() {
            return Kind.PRESENT_LENS_PAIR;
        }
    }

    /** Run the three-part JCC sequence on one eye. */
    record PresentJcc(Eye eye,
                      LensConfiguration currentPrescription,
                      List<JccTestPart> sequence) implements DeviceCommand {
        public PresentJcc {
            Objects.requireNonNull(eye, "eye");
            Objects.requireNonNull(currentPrescription, "currentPrescription");
            sequence = List.copyOf(sequence);
        }

        @Override
        public Kind kind() {
            return Kind.PRESENT_JCC;
        }
    }

    /** Open both eyes and ask whether one is clearer. */
    record BalanceBinocular(LensConfiguration od,
                            LensConfiguration os,
                            String questionKey,
                            List<String> options) implements DeviceCommand {
        public BalanceBinocular {
            Objects.requireNonNull(od, "od");
            Objects.requireNonNull(os, "os");
            Objects.requireNonNull(questionKey, "questionKey");
            options = List.copyOf(options);
        }

        @Override
        public Kind kind() {
            return Kind.BALANCE_BINOCULAR;
        }
    }

    /** The prescription is frozen; {@code prescription} is the final snapshot. */
    record Finalize(PhoropterState prescription) implements DeviceCommand {
        public Finalize {
            Objects.requireNonNull(prescription, "prescription");
        }

        @Override
        public Kind kind() {
            return Kind.FINALIZE;
        }
    }

    /** Shut the device down and hand the patient to a professional. */
    record Escalate(EscalationReason reason) implements DeviceCommand {
        public Escalate {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Kind kind() {
            return Kind.ESCALATE;
        }
    }

    /** Leave the device as it is. */
    record NoAction(String reason) implements DeviceCommand {
        public NoAction {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Kind kind() {
            return Kind.NO_ACTION;
        }
    }

    /** Present the current step's stimulus again. */
    record RepeatPresentation(StepId step, String reason) implements DeviceCommand {
        public RepeatPresentation {
            Objects.requireNonNull(step, "step");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Kind kind() {
            return Kind.REPEAT_PRESENTATION;
        }
    }
}
