package com.questrail.videowall.command;

/**
 * RemoteCommand
 * -----------------------------------------------------------------------------
 * Semantic meaning of an authenticated command payload.
 *
 * <p>Derived from the payload by field presence, in precedence order
 * {@code restart}, {@code auto}, {@code force}. A payload matching none of them
 * is still a valid command; it simply asks for nothing.</p>
 */
public sealed interface RemoteCommand
        permits RemoteCommand.Restart,
                RemoteCommand.EnableAutomatic,
                RemoteCommand.ForceDisplay,
                RemoteCommand.NoOp
{
    /** Restart the video wall. */
    record Restart() implements RemoteCommand {}

    /** Return display power to automatic control. */
    record EnableAutomatic() implements RemoteCommand {}

    /** Force the display on or off, leaving automatic control. */
    record ForceDisplay(boolean on) implements RemoteCommand {}

    /** Authenticated, but asks for nothing (including {@code restart: false}). */
    record NoOp() implements RemoteCommand {}
}
