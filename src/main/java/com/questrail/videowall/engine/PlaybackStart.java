package com.questrail.videowall.engine;

/**
 * Outcome of waiting for an engine to start playing.
 */
public enum PlaybackStart {
    PLAYING,
    TIMEOUT,
    ERROR
}
