package com.questrail.videowall.engine;

import java.time.Duration;

/**
 * RenderEngine
 * -----------------------------------------------------------------------------
 * Narrow handle on the external media engine that renders one tile.
 *
 * <p>The supervisor only needs to know whether an engine started playing,
 * whether it is still alive, and how to get rid of it. Decoding, output and
 * tuning are entirely the engine's business.</p>
 *
 * <p>Every blocking call is bounded: {@link #awaitPlaying(Duration)} by its
 * argument, {@link #stop()} by an implementation-defined grace period after
 * which it escalates to {@link #kill()}.</p>
 */
public interface RenderEngine
{
    /**
     * Launches the engine.
     *
     * @throws EngineException if the engine could not be launched at all
     */
    void start();

    /**
     * Waits until the engine reports playback.
     *
     * @return {@link PlaybackStart#PLAYING} on success, {@link PlaybackStart#ERROR}
     *         if the engine exited first, {@link PlaybackStart#TIMEOUT} otherwise
     */
    PlaybackStart awaitPlaying(Duration timeout) throws InterruptedException;

    boolean isAlive();

    /**
     * Stops the engine and releases its resources. Idempotent.
     */
    void stop();

    /**
     * Terminates the engine immediately. Idempotent.
     */
    void kill();
}
