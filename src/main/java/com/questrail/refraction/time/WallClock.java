package com.questrail.refraction.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for timestamps on adjustment history entries
 * and observability events.
 *
 * <p>
 * The engine does not own a session clock. Duration thresholds are evaluated
 * against the elapsed time supplied with each turn, never against this clock.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
