package com.questrail.videowall.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the supervisor.
 */
public record ErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
