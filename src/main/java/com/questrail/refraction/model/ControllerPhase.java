package com.questrail.refraction.model;

/**
 * Lifecycle phase of a phoropter controller.
 *
 * <pre>
 *   ACTIVE ──finalize()──▶ FINALIZED
 *     │                        │
 *     └──────escalate()────────┴──▶ HALTED
 * </pre>
 */
public enum ControllerPhase
{
    /** Lenses may be adjusted and stimuli presented. */
    ACTIVE,

    /** Prescription frozen. No further adjustment or presentation. */
    FINALIZED,

    /** Session escalated and device shut down. Terminal. */
    HALTED;

    public boolean acceptsAdjustments() {
        return this == ACTIVE;
    }
}
