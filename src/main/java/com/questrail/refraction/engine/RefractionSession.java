package com.questrail.refraction.engine;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.PatientResponseClassifier;
import com.questrail.refraction.api.PatientTurn;
import com.questrail.refraction.controller.DeviceCommand;
import com.questrail.refraction.protocol.StepId;

/**
 * RefractionSession
 * -----------------------------------------------------------------------------
 * One examination, driven turn by turn by the orchestration layer.
 *
 * <p>Implementations are single-writer: turns must be submitted in order from
 * one thread at a time. Separate sessions share no mutable state.</p>
 */
public interface RefractionSession
{
    String sessionId();

    /**
     * Processes one classified patient turn.
     */
    TurnOutcome processTurn(PatientTurn turn);

    /**
     * Classifies an utterance against the current step and processes it.
     */
    TurnOutcome processUtterance(PatientResponseClassifier classifier,
                                 String utterance,
                                 double elapsedSeconds,
                                 double responseLatencySeconds);

    /**
     * External abort. Idempotent.
     */
    DeviceCommand.Escalate escalate(EscalationReason reason);

    StepId currentStep();

    SessionSnapshot snapshot();
}
