package com.questrail.videowall.command;

/**
 * Command matched the envelope wrapper but its payload is unusable.
 */
public final class MalformedCommandException extends CommandRejectedException
{
    public MalformedCommandException(String message) {
        super(Reason.MALFORMED, message);
    }

    public MalformedCommandException(String message, Throwable cause) {
        super(Reason.MALFORMED, message, cause);
    }
}
