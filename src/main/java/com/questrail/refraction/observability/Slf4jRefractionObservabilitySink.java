package com.questrail.refraction.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RefractionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRefractionObservabilitySink implements RefractionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRefractionObservabilitySink.class);

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {
        if (event.reason().isPresent()) {
            log.warn("[{}] Phoropter phase: {} -> {} ({})",
                event.sessionId(),
                event.oldPhase(),
                event.newPhase(),
                event.reason().get().code());
        } else {
            log.info("[{}] Phoropter phase: {} -> {}",
                event.sessionId(),
                event.oldPhase(),
                event.newPhase());
        }
    }

    @Override
    public void onStepTransition(StepTransitionEvent event) {
        if (event.isRepeat()) {
            log.debug("[{}] Step {} repeated: {}", event.sessionId(), event.fromStep(), event.cause());
        } else {
            log.info("[{}] Step: {} -> {} ({})",
                event.sessionId(),
                event.fromStep(),
                event.toStep(),
                event.cause());
        }
    }

    @Override
    public void onAdjustment(AdjustmentEvent event) {
        if (event.isApplied()) {
            log.debug("[{}] {}", event.sessionId(), event.message());
        } else {
            log.info("[{}] Adjustment rejected ({}): {}",
                event.sessionId(),
                event.rejection().get(),
                event.message());
        }
    }

    @Override
    public void onSafetyEvent(SafetyEvent event) {
        switch (event.type()) {
            case RED_FLAG, HARD_STOP ->
                log.warn("[{}] Safety {} at {}s: {}",
                    event.sessionId(), event.type(), event.elapsedSeconds(), event.detail());
            default ->
                log.info("[{}] Safety {} at {}s: {}",
                    event.sessionId(), event.type(), event.elapsedSeconds(), event.detail());
        }
    }

    @Override
    public void onError(RefractionErrorEvent event) {
        log.error("[{}] Refraction error: {}", event.sessionId(), event.message(), event.cause());
    }
}
