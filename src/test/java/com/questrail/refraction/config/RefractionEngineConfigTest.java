package com.questrail.refraction.config;

import com.questrail.refraction.controller.NudgePolicy;
import com.questrail.refraction.model.PupillaryDistance;
import com.questrail.refraction.protocol.ProtocolStep;
import com.questrail.refraction.protocol.ProtocolStepTable;
import com.questrail.refraction.protocol.StepId;
import com.questrail.refraction.quality.QualityThresholds;
import com.questrail.refraction.safety.DurationPolicy;
import com.questrail.refraction.safety.FatiguePolicy;
import com.questrail.refraction.validation.SafetyLimits;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RefractionEngineConfigTest {

    @Test
    void defaultsUseStandardProtocolAndPolicies() {
        RefractionEngineConfig config = RefractionEngineConfig.defaults();

        assertEquals(StepId.of("0.1"), config.protocol().firstStep());
        assertEquals(SafetyLimits.defaults(), config.safetyLimits());
        assertEquals(new QualityThresholds(0.3, 0.6), config.qualityThresholds());
        assertEquals(new DurationPolicy(720, 1200, 1500), config.durationPolicy());
        assertEquals(new FatiguePolicy(5, 0.2, 0.3, 3.0), config.fatiguePolicy());
        assertEquals(new NudgePolicy(0.25, 0.125, 5, -0.25), config.nudgePolicy());
        assertEquals(PupillaryDistance.averageAdult(), config.initialPupillaryDistance());
    }

    @Test
    void builderOverridesIndividualComponents() {
        ProtocolStepTable shortExam = ProtocolStepTable.builder()
                .add(ProtocolStep.general(StepId.of("1"), StepId.COMPLETE))
                .add(ProtocolStep.terminal(StepId.COMPLETE))
                .add(ProtocolStep.terminal(StepId.ESCALATE_TO_PROFESSIONAL))
                .build();

        RefractionEngineConfig config = RefractionEngineConfig.builder()
                .withProtocol(shortExam)
                .withNudgePolicy(new NudgePolicy(0.25, 0.25, 10, -0.5))
                .build();

        assertSame(shortExam, config.protocol());
        assertEquals(10, config.nudgePolicy().jccAxisStep());
        assertEquals(DurationPolicy.defaults(), config.durationPolicy());
    }

    @Test
    void invalidComponentsAreRejected() {
        assertThrows(NullPointerException.class,
                () -> RefractionEngineConfig.builder().withSafetyLimits(null).build());
        assertThrows(IllegalArgumentException.class, () -> new NudgePolicy(0.0, 0.125, 5, -0.25));
        assertThrows(IllegalArgumentException.class, () -> new FatiguePolicy(0, 0.2, 0.3, 3.0));
    }
}
