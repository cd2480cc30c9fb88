package com.questrail.refraction.protocol;

import java.util.Set;

/**
 * Slot values recognized by the standard protocol.
 */
public final class SlotValues
{
    public static final String FIRST_BETTER = "first_better";
    public static final String SECOND_BETTER = "second_better";
    public static final String BOTH_SAME = "both_same";

    public static final String RIGHT_CLEARER = "right_clearer";
    public static final String LEFT_CLEARER = "left_clearer";

    public static final String RED = "red";
    public static final String GREEN = "green";
    public static final String BOTH = "both";

    /** Lens pair and JCC flip answers. */
    public static final Set<String> LENS_COMPARISON = Set.of(FIRST_BETTER, SECOND_BETTER, BOTH_SAME);

    /**
     * Binocular balance answers. The lens-pair answers are accepted too; the
     * right eye's image is the first one shown.
     */
    public static final Set<String> BINOCULAR_COMPARISON =
            Set.of(FIRST_BETTER, SECOND_BETTER, BOTH_SAME, RIGHT_CLEARER, LEFT_CLEARER);

    /** Duochrome answers. */
    public static final Set<String> COLOR_COMPARISON = Set.of(RED, GREEN, BOTH);

    private SlotValues() {}
}
