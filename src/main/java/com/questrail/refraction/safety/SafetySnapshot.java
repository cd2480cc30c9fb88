package com.questrail.refraction.safety;

import java.util.List;

/**
 * Read-only view of the safety monitor.
 *
 * @param recentSamples        last samples, oldest first, at most one window
 * @param baselineSamples      first samples of the session, at most one window
 * @param totalSamples         samples recorded so far
 * @param elapsedSeconds       latest elapsed time supplied by the caller
 * @param redFlagCount         red flags observed, never decreases
 * @param personaOverrideCount persona overrides observed, never decreases
 * @param turnCount            turns screened
 * @param durationStatus       advisory for {@code elapsedSeconds}
 * @param fatigueScore         score over the recent window
 * @param incidents            incident log, oldest first
 */
public record SafetySnapshot(
        List<TurnSample> recentSamples,
        List<TurnSample> baselineSamples,
        int totalSamples,
        double elapsedSeconds,
        int redFlagCount,
        int personaOverrideCount,
        int turnCount,
        DurationStatus durationStatus,
        double fatigueScore,
        List<SafetyIncident> incidents
) {
    public SafetySnapshot {
        recentSamples = List.copyOf(recentSamples);
        baselineSamples = List.copyOf(baselineSamples);
        incidents = List.copyOf(incidents);
    }
}
