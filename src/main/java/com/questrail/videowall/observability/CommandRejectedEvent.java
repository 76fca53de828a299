package com.questrail.videowall.observability;

import com.questrail.videowall.command.CommandRejectedException;

import java.time.Instant;

/**
 * A framed remote command that was refused. {@code detail} is for local logs
 * only and is never echoed to the sender.
 */
public record CommandRejectedEvent(
    Instant timestamp,
    CommandRejectedException.Reason reason,
    String detail
) {
}
