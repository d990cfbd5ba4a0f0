package com.questrail.kmip.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for request time stamps and observability events.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * Nothing in the exchange engine times out against it.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
