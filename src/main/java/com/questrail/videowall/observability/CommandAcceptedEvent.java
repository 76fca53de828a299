package com.questrail.videowall.observability;

import com.questrail.videowall.command.RemoteCommand;

import java.time.Instant;

/**
 * A remote command that passed freshness and signature checks.
 */
public record CommandAcceptedEvent(
    Instant timestamp,
    RemoteCommand command
) {
}
