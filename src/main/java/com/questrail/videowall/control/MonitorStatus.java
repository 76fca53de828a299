package com.questrail.videowall.control;

import com.questrail.videowall.layout.GridDivision;

import java.time.Duration;

/**
 * Point-in-time view of the monitor, used for checkup replies.
 */
public record MonitorStatus(
    MonitorState state,
    boolean automatic,
    boolean displayOff,
    GridDivision division,
    Duration uptime
) {
}
