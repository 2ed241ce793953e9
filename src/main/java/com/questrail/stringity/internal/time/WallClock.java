package com.questrail.stringity.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * No text operation depends on the time; the clock exists so that tests can
 * assert on event timestamps with a fixed instant.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
