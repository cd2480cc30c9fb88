package com.questrail.refraction.validation;

import com.questrail.refraction.api.Eye;
import com.questrail.refraction.api.RefractiveParameter;
import com.questrail.refraction.model.AdjustmentRequest;
import com.questrail.refraction.model.LensConfiguration;
import com.questrail.refraction.model.PhoropterState;
import com.questrail.refraction.model.PupillaryDistance;
import com.questrail.refraction.protocol.StepId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdjustmentValidatorTest
 * -----------------------------------------------------------------------------
 * The validator is pure: these tests only ever build states and requests and
 * inspect the result.
 */
class AdjustmentValidatorTest {

    private static final StepId STEP = StepId.of("6.1");

    private AdjustmentValidator validator;
    private PhoropterState plano;

    @BeforeEach
    void setUp() {
        validator = new AdjustmentValidator(SafetyLimits.defaults());
        plano = PhoropterState.initial(PupillaryDistance.averageAdult());
    }

    private static AdjustmentRequest request(Eye eye, RefractiveParameter parameter, double magnitude) {
        return new AdjustmentRequest(eye, parameter, magnitude, STEP);
    }

    @Test
    void acceptsQuarterDiopterSphereStep() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.SPHERE, 0.25));

        assertTrue(result.isAccepted());
        assertEquals(0.25, ((ValidationResult.Accepted) result).newValue(), 1e-9);
    }

    @Test
    void acceptsMagnitudesThatAreNotQuarterDiopterMultiples() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.SPHERE, 0.37));

        assertTrue(result.isAccepted());
        assertEquals(0.37, ((ValidationResult.Accepted) result).newValue(), 1e-9);
    }

    @Test
    void acceptsExactlyTheMaximumStep() {
        assertTrue(validator.validate(plano, request(Eye.OS, RefractiveParameter.SPHERE, -0.50)).isAccepted());
        assertTrue(validator.validate(plano, request(Eye.OS, RefractiveParameter.CYLINDER, -0.50)).isAccepted());
        assertTrue(validator.validate(plano, request(Eye.OS, RefractiveParameter.AXIS, 10)).isAccepted());
    }

    @Test
    void rejectsSphereJumpAboveHalfDiopter() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.SPHERE, 0.75));

        ValidationResult.Rejected rejected = assertInstanceOf(ValidationResult.Rejected.class, result);
        assertEquals(RejectionReason.UNSAFE_JUMP, rejected.reason());
        assertTrue(rejected.message().startsWith("Unsafe jump"), rejected.message());
    }

    @Test
    void rejectsNegativeCylinderJumpAboveHalfDiopter() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.CYLINDER, -0.51));

        assertEquals(RejectionReason.UNSAFE_JUMP, ((ValidationResult.Rejected) result).reason());
    }

    @Test
    void rejectsAxisJumpAboveTenDegrees() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.AXIS, 11));

        assertEquals(RejectionReason.UNSAFE_JUMP, ((ValidationResult.Rejected) result).reason());
    }

    @Test
    void rejectsPositiveCylinderAsOutOfRange() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.CYLINDER, 0.25));

        ValidationResult.Rejected rejected = assertInstanceOf(ValidationResult.Rejected.class, result);
        assertEquals(RejectionReason.OUT_OF_RANGE, rejected.reason());
        assertTrue(rejected.message().startsWith("Out of range"), rejected.message());
    }

    @Test
    void rejectsSpherePastUpperBound() {
        PhoropterState high = PhoropterState.initial(
                new LensConfiguration(19.75, 0.0, 0), LensConfiguration.plano(), PupillaryDistance.averageAdult());

        assertTrue(validator.validate(high, request(Eye.OD, RefractiveParameter.SPHERE, 0.25)).isAccepted());
        assertEquals(RejectionReason.OUT_OF_RANGE,
                ((ValidationResult.Rejected) validator.validate(high, request(Eye.OD, RefractiveParameter.SPHERE, 0.50)))
                        .reason());
    }

    @Test
    void axisDoesNotWrapPastOneEighty() {
        PhoropterState state = PhoropterState.initial(
                new LensConfiguration(0.0, -1.0, 175), LensConfiguration.plano(), PupillaryDistance.averageAdult());

        ValidationResult result = validator.validate(state, request(Eye.OD, RefractiveParameter.AXIS, 10));

        assertEquals(RejectionReason.OUT_OF_RANGE, ((ValidationResult.Rejected) result).reason());
    }

    @Test
    void rejectsNonFiniteAndFractionalAxisMagnitudes() {
        assertEquals(RejectionReason.INVALID_MAGNITUDE,
                ((ValidationResult.Rejected) validator.validate(plano,
                        request(Eye.OD, RefractiveParameter.SPHERE, Double.NaN))).reason());
        assertEquals(RejectionReason.INVALID_MAGNITUDE,
                ((ValidationResult.Rejected) validator.validate(plano,
                        request(Eye.OD, RefractiveParameter.SPHERE, Double.POSITIVE_INFINITY))).reason());
        assertEquals(RejectionReason.INVALID_MAGNITUDE,
                ((ValidationResult.Rejected) validator.validate(plano,
                        request(Eye.OD, RefractiveParameter.AXIS, 2.5))).reason());
    }

    @Test
    void unsafeJumpIsCheckedBeforeRange() {
        ValidationResult result = validator.validate(plano, request(Eye.OD, RefractiveParameter.CYLINDER, 1.0));

        assertEquals(RejectionReason.UNSAFE_JUMP, ((ValidationResult.Rejected) result).reason());
    }

    @Test
    void honoursConfiguredLimits() {
        AdjustmentValidator strict = new AdjustmentValidator(new SafetyLimits(0.25, 0.25, 5));

        assertEquals(RejectionReason.UNSAFE_JUMP,
                ((ValidationResult.Rejected) strict.validate(plano,
                        request(Eye.OD, RefractiveParameter.SPHERE, 0.50))).reason());
    }

    @Test
    void safetyLimitsRejectNonPositiveSteps() {
        assertThrows(IllegalArgumentException.class, () -> new SafetyLimits(0.0, 0.5, 10));
        assertThrows(IllegalArgumentException.class, () -> new SafetyLimits(0.5, -0.5, 10));
        assertThrows(IllegalArgumentException.class, () -> new SafetyLimits(0.5, 0.5, 0));
    }
}
