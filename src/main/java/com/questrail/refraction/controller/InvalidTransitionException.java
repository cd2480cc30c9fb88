package com.questrail.refraction.controller;

import com.questrail.refraction.model.ControllerPhase;

/**
 * Indicates that a controller operation was invoked in a phase that does not
 * permit it (for example presenting a lens pair after finalize).
 *
 * A correctly driven session never triggers this; seeing it means the caller
 * lost track of the controller phase.
 */
public final class InvalidTransitionException extends RuntimeException
{
    private final ControllerPhase phase;

    public InvalidTransitionException(String operation, ControllerPhase phase) {
        super(operation + " is not permitted while the controller is " + phase);
        this.phase = phase;
    }

    public ControllerPhase phase() {
        return phase;
    }
}
