package com.questrail.refraction.protocol;

import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.SlotKey;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ProtocolStepTable
 * -----------------------------------------------------------------------------
 * Immutable, validated step graph for one examination protocol.
 *
 * <h2>Load-time validation</h2>
 * {@link Builder#build()} rejects, with a {@link ProtocolConfigurationException}:
 * <ul>
 *   <li>duplicate step identifiers</li>
 *   <li>successors that name an unknown step</li>
 *   <li>cycles in the successor graph</li>
 *   <li>a first step that is not part of the table</li>
 *   <li>a table without the {@link StepId#ESCALATE_TO_PROFESSIONAL} terminal</li>
 * </ul>
 * "Exactly one successor or terminal" is enforced by {@link ProtocolStep}
 * itself. Because every check happens here, per-turn code may assume the graph
 * is well formed.
 */
public final class ProtocolStepTable
{
    private final StepId firstStep;
    private final Map<StepId, ProtocolStep> steps;

    private ProtocolStepTable(StepId firstStep, Map<StepId, ProtocolStep> steps) {
        this.firstStep = firstStep;
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    public StepId firstStep() {
        return firstStep;
    }

    /**
     * Returns the configured step.
     *
     * @throws IllegalArgumentException if the step is not part of this table
     */
    public ProtocolStep step(StepId id) {
        ProtocolStep step = steps.get(Objects.requireNonNull(id, "id"));
        if (step == null) {
            throw new IllegalArgumentException("Unknown protocol step: " + id);
        }
        return step;
    }

    public boolean contains(StepId id) {
        return steps.containsKey(id);
    }

    /**
     * All steps in declaration order.
     */
    public Collection<ProtocolStep> steps() {
        return steps.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<StepId, ProtocolStep> steps = new LinkedHashMap<>();
        private StepId firstStep;

        private Builder() {}

        public Builder firstStep(StepId firstStep) {
            this.firstStep = Objects.requireNonNull(firstStep, "firstStep");
            return this;
        }

        public Builder add(ProtocolStep step) {
            Objects.requireNonNull(step, "step");
            if (steps.putIfAbsent(step.id(), step) != null) {
                throw new ProtocolConfigurationException("Duplicate protocol step: " + step.id());
            }
            return this;
        }

        public ProtocolStepTable build() {
            if (steps.isEmpty()) {
                throw new ProtocolConfigurationException("At least one protocol step required");
            }
            if (firstStep == null) {
                firstStep = steps.keySet().iterator().next();
            }
            if (!steps.containsKey(firstStep)) {
                throw new ProtocolConfigurationException("First step " + firstStep + " is not in the table");
            }
            ProtocolStep escalation = steps.get(StepId.ESCALATE_TO_PROFESSIONAL);
            if (escalation == null || !escalation.isTerminal()) {
                throw new ProtocolConfigurationException(
                        "Table must contain terminal step " + StepId.ESCALATE_TO_PROFESSIONAL);
            }

            for (ProtocolStep step : steps.values()) {
                step.successor().ifPresent(next -> {
                    if (!steps.containsKey(next)) {
                        throw new ProtocolConfigurationException(
                                "Step " + step.id() + " names unknown successor " + next);
                    }
                });
            }

            assertAcyclic();
            return new ProtocolStepTable(firstStep, steps);
        }

        // Each step has at most one successor, so walking each chain once is
        // enough. Steps already proven to reach a terminal are skipped.
        private void assertAcyclic() {
            Set<StepId> proven = new HashSet<>();
            for (StepId start : steps.keySet()) {
                Set<StepId> path = new HashSet<>();
                StepId cursor = start;
                while (cursor != null && !proven.contains(cursor)) {
                    if (!path.add(cursor)) {
                        throw new ProtocolConfigurationException("Cycle detected through step " + cursor);
                    }
                    cursor = steps.get(cursor).successor().orElse(null);
                }
                proven.addAll(path);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Standard clinical protocol
    // ---------------------------------------------------------------------

    /**
     * The standard ten-step examination: greeting (0.x) through product
     * recommendation (9.x), ending in {@link StepId#COMPLETE}.
     */
    public static ProtocolStepTable standard() {
        Builder b = builder().firstStep(StepId.of("0.1"));

        chain(b, "0.1", "0.2", "1.1", "1.2",
                "2.1", "2.2", "2.3",
                "3.1", "3.2", "3.3",
                "4.1", "4.2", "4.3", "4.4",
                "5.1", "5.2", "6.1");

        Map<SlotKey, Set<String>> lensComparison = Map.of(SlotKey.CLARITY_FEEDBACK, SlotValues.LENS_COMPARISON);

        b.add(new ProtocolStep(StepId.of("6.1"), Optional.of(StepId.of("6.2")),
                StepCategory.MONOCULAR_REFRACTION, Optional.of(Eye.OD), lensComparison));
        b.add(new ProtocolStep(StepId.of("6.2"), Optional.of(StepId.of("6.3")),
                StepCategory.JCC_DUOCHROME, Optional.of(Eye.OD), lensComparison));
        b.add(new ProtocolStep(StepId.of("6.3"), Optional.of(StepId.of("6.4")),
                StepCategory.MONOCULAR_REFRACTION, Optional.of(Eye.OS), lensComparison));
        b.add(new ProtocolStep(StepId.of("6.4"), Optional.of(StepId.of("6.5")),
                StepCategory.JCC_DUOCHROME, Optional.of(Eye.OS), lensComparison));
        b.add(new ProtocolStep(StepId.of("6.5"), Optional.of(StepId.of("7.1")),
                StepCategory.BINOCULAR_BALANCE, Optional.empty(),
                Map.of(SlotKey.CLARITY_FEEDBACK, SlotValues.BINOCULAR_COMPARISON)));

        Map<SlotKey, Set<String>> colorComparison = Map.of(SlotKey.COLOR_PREFERENCE, SlotValues.COLOR_COMPARISON);
        b.add(new ProtocolStep(StepId.of("7.1"), Optional.of(StepId.of("7.2")),
                StepCategory.NEAR_VISION, Optional.empty(), colorComparison));
        b.add(new ProtocolStep(StepId.of("7.2"), Optional.of(StepId.of("8.1")),
                StepCategory.NEAR_VISION, Optional.empty(), colorComparison));

        chain(b, "8.1", "8.2", "9.1", "9.2", StepId.COMPLETE.value());

        b.add(ProtocolStep.terminal(StepId.COMPLETE));
        b.add(ProtocolStep.terminal(StepId.ESCALATE_TO_PROFESSIONAL));
        return b.build();
    }

    // Adds GENERAL steps ids[0] -> ids[1] -> ... ; the last id is only a target.
    private static void chain(Builder b, String... ids) {
        for (int i = 0; i + 1 < ids.length; i++) {
            b.add(ProtocolStep.general(StepId.of(ids[i]), StepId.of(ids[i + 1])));
        }
    }
}
