package com.questrail.refraction.protocol;

import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.SlotKey;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ProtocolStep
 * -----------------------------------------------------------------------------
 * Immutable configuration of one examination step.
 *
 * @param id             step identifier
 * @param successor      next step on a clear response; empty for terminal steps
 * @param category       behavioral category
 * @param testedEye      eye under test for monocular and JCC steps
 * @param requiredSlots  slots a response must fill, with the accepted values
 *                       for each, before the step may advance
 */
public record ProtocolStep(
        StepId id,
        Optional<StepId> successor,
        StepCategory category,
        Optional<Eye> testedEye,
        Map<SlotKey, Set<String>> requiredSlots
) {
    public ProtocolStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(successor, "successor");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(testedEye, "testedEye");
        Objects.requireNonNull(requiredSlots, "requiredSlots");

        Map<SlotKey, Set<String>> copy = new HashMap<>();
        requiredSlots.forEach((key, values) -> copy.put(key, Set.copyOf(values)));
        requiredSlots = Map.copyOf(copy);

        if (category == StepCategory.TERMINAL && successor.isPresent()) {
            throw new ProtocolConfigurationException("Terminal step " + id + " must not declare a successor");
        }
        if (category != StepCategory.TERMINAL && successor.isEmpty()) {
            throw new ProtocolConfigurationException("Step " + id + " has no successor and is not terminal");
        }
        if ((category == StepCategory.MONOCULAR_REFRACTION || category == StepCategory.JCC_DUOCHROME)
                && testedEye.isEmpty()) {
            throw new ProtocolConfigurationException("Step " + id + " (" + category + ") must name the tested eye");
        }
    }

    public boolean isTerminal() {
        return category == StepCategory.TERMINAL;
    }

    public static ProtocolStep terminal(StepId id) {
        return new ProtocolStep(id, Optional.empty(), StepCategory.TERMINAL, Optional.empty(), Map.of());
    }

    public static ProtocolStep general(StepId id, StepId successor) {
        return new ProtocolStep(id, Optional.of(successor), StepCategory.GENERAL, Optional.empty(), Map.of());
    }
}
