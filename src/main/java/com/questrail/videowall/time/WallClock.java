package com.questrail.videowall.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock time source.
 *
 * <p>Used where a timestamp must be compared against one produced on another
 * host, notably the freshness window of remote commands, and for event
 * timestamps. Supervision timing (ticks, joins, playing timeouts) never reads
 * this clock; it is expressed as bounded waits instead.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
