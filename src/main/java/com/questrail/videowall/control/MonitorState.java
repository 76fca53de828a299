package com.questrail.videowall.control;

/**
 * Top-level state of the video wall monitor.
 */
public enum MonitorState
{
    /** A rotation scheduler is (or is about to be) on screen. */
    PLAYING,

    /** Display blanked; no workers running. */
    STOPPED,

    /** Wall torn down on request; a fresh one follows. */
    RESTART
}
