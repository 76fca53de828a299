package com.questrail.videowall.command;

import java.util.Objects;

/**
 * Indicates that a well-framed remote command was refused.
 *
 * <p>Rejections are untrusted-input events: they are logged and reported as a
 * bare "NO" to the sender, never propagated past the transport boundary.</p>
 */
public class CommandRejectedException extends RuntimeException
{
    /**
     * Why a command was refused.
     */
    public enum Reason {
        /** Payload is not a JSON object or lacks a numeric {@code time}. */
        MALFORMED,
        /** Timestamp lies outside the freshness window. */
        STALE,
        /** Signature does not verify against any accepted secret. */
        UNAUTHENTICATED
    }

    private final Reason reason;

    public CommandRejectedException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public CommandRejectedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
