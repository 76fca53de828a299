package com.questrail.videowall.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * RotationPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for the rotation scheduler and its workers.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>tickInterval</b>: Length of one scheduler tick; also the longest the
 *       scheduler takes to notice a global stop.</li>
 *   <li><b>refreshPeriodTicks</b>: Ticks between two rotations. Each rotation
 *       replaces one slot, so a given tile is refreshed every
 *       {@code refreshPeriodTicks * tileCount} ticks.</li>
 *   <li><b>playingTimeout</b>: How long a fresh worker waits for its engine to
 *       report playback before giving up and releasing its predecessor.</li>
 *   <li><b>joinTimeout</b>: How long a retiring or shutting-down worker is given
 *       to exit before it is killed. Must exceed {@code playingTimeout}, otherwise
 *       the outgoing tile can be killed before its successor is ready.</li>
 *   <li><b>pollInterval</b>: Mailbox poll period of a running worker; bounds how
 *       late an engine crash is detected.</li>
 * </ul>
 */
public record RotationPolicy(
        Duration tickInterval,
        int refreshPeriodTicks,
        Duration playingTimeout,
        Duration joinTimeout,
        Duration pollInterval
) {
    public RotationPolicy {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(playingTimeout, "playingTimeout");
        Objects.requireNonNull(joinTimeout, "joinTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");

        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (refreshPeriodTicks <= 0) {
            throw new IllegalArgumentException("refreshPeriodTicks must be positive");
        }
        if (playingTimeout.isNegative()) {
            throw new IllegalArgumentException("playingTimeout must be non-negative");
        }
        if (joinTimeout.compareTo(playingTimeout) <= 0) {
            throw new IllegalArgumentException("joinTimeout must exceed playingTimeout");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>tickInterval: 1s</li>
     *   <li>refreshPeriodTicks: 300</li>
     *   <li>playingTimeout: 15s</li>
     *   <li>joinTimeout: 30s</li>
     *   <li>pollInterval: 1s</li>
     * </ul>
     */
    public static RotationPolicy defaults() {
        return new RotationPolicy(
                Duration.ofSeconds(1),
                300,
                Duration.ofSeconds(15),
                Duration.ofSeconds(30),
                Duration.ofSeconds(1)
        );
    }

    public RotationPolicy withRefreshPeriodTicks(int ticks) {
        return new RotationPolicy(tickInterval, ticks, playingTimeout, joinTimeout, pollInterval);
    }
}
