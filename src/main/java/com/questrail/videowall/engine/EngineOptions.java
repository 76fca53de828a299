package com.questrail.videowall.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * EngineOptions
 * -----------------------------------------------------------------------------
 * Pass-through tuning for the render engine. The supervisor never reads these.
 *
 * @param networkTimeout how long the engine may wait on a stalled stream
 * @param profile        engine profile name, e.g. {@code low-latency}
 * @param audioOutput    audio output driver, e.g. {@code pulseaudio}
 */
public record EngineOptions(
        Duration networkTimeout,
        String profile,
        String audioOutput
) {
    public EngineOptions {
        Objects.requireNonNull(networkTimeout, "networkTimeout");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(audioOutput, "audioOutput");
        if (networkTimeout.isNegative()) {
            throw new IllegalArgumentException("networkTimeout must be non-negative");
        }
    }

    /**
     * Security-monitor defaults: 10s network timeout, low-latency profile,
     * PulseAudio output.
     */
    public static EngineOptions defaults() {
        return new EngineOptions(Duration.ofSeconds(10), "low-latency", "pulseaudio");
    }
}
