package com.questrail.videowall.observability;

import com.questrail.videowall.control.MonitorState;

import java.time.Instant;

/**
 * Top-level monitor state change.
 */
public record MonitorTransitionEvent(
    Instant timestamp,
    MonitorState oldState,
    MonitorState newState
) {
}
