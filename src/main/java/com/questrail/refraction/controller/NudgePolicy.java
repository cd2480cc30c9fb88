package com.questrail.refraction.controller;

/**
 * NudgePolicy
 * -----------------------------------------------------------------------------
 * Fixed-step magnitudes the controller applies in response to clinical
 * comparisons.
 *
 * <p>These magnitudes are clinical heuristics awaiting confirmation by a domain
 * expert, which is why they are configuration rather than constants. Every
 * nudge still passes through the adjustment validator, so no policy value can
 * push a lens past the safety limits.</p>
 *
 * @param refractionStep      sphere change per lens-pair preference (D, positive)
 * @param duochromeStep       sphere change per duochrome answer (D, positive)
 * @param jccAxisStep         axis change per JCC flip preference (degrees, positive)
 * @param binocularBalanceStep sphere change applied to the less clear eye's
 *                            fellow during binocular balance (D, signed)
 */
public record NudgePolicy(
        double refractionStep,
        double duochromeStep,
        int jccAxisStep,
        double binocularBalanceStep
) {
    public NudgePolicy {
        if (!(refractionStep > 0.0) || Double.isInfinite(refractionStep)) {
            throw new IllegalArgumentException("refractionStep must be positive and finite");
        }
        if (!(duochromeStep > 0.0) || Double.isInfinite(duochromeStep)) {
            throw new IllegalArgumentException("duochromeStep must be positive and finite");
        }
        if (jccAxisStep <= 0) {
            throw new IllegalArgumentException("jccAxisStep must be positive");
        }
        if (!Double.isFinite(binocularBalanceStep) || binocularBalanceStep == 0.0) {
            throw new IllegalArgumentException("binocularBalanceStep must be finite and non-zero");
        }
    }

    /**
     * 0.25 D refraction, 0.125 D duochrome, 5° JCC axis, -0.25 D binocular balance.
     */
    public static NudgePolicy defaults() {
        return new NudgePolicy(0.25, 0.125, 5, -0.25);
    }
}
