package com.questrail.videowall.command;

import com.questrail.videowall.observability.CommandAcceptedEvent;
import com.questrail.videowall.observability.CommandRejectedEvent;
import com.questrail.videowall.observability.NullObservabilitySink;
import com.questrail.videowall.observability.VideoWallObservabilitySink;
import com.questrail.videowall.time.WallClock;

import java.util.Objects;
import java.util.Optional;

/**
 * RemoteCommandHandler
 * -----------------------------------------------------------------------------
 * Single entry point shared by every inbound transport.
 *
 * <pre>
 *   transport text
 *        → CommandEnvelopeParser   (frame, freshness, signature)
 *            → RemoteCommand        (field precedence)
 *                → DisplayCommands   (monitor actions)
 * </pre>
 *
 * <p>Never throws on untrusted input. The boolean result is all a transport
 * may reveal to the sender.</p>
 */
public final class RemoteCommandHandler
{
    private final CommandEnvelopeParser parser;
    private final DisplayCommands commands;
    private final WallClock clock;
    private final VideoWallObservabilitySink observabilitySink;

    public RemoteCommandHandler(CommandEnvelopeParser parser,
                                DisplayCommands commands,
                                WallClock clock,
                                VideoWallObservabilitySink observabilitySink)
    {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Validates and applies one command line.
     *
     * @return {@code true} if the command was fresh and authenticated
     */
    public boolean apply(String text)
    {
        if (text == null) {
            return false;
        }

        final Optional<CommandEnvelope> envelope;
        try {
            envelope = parser.parse(text);
        } catch (CommandRejectedException e) {
            observabilitySink.onCommandRejected(
                    new CommandRejectedEvent(clock.now(), e.reason(), e.getMessage()));
            return false;
        }
        if (envelope.isEmpty()) {
            return false;
        }

        RemoteCommand command = envelope.get().command();
        dispatch(command);
        observabilitySink.onCommandAccepted(new CommandAcceptedEvent(clock.now(), command));
        return true;
    }

    private void dispatch(RemoteCommand command)
    {
        if (command instanceof RemoteCommand.Restart) {
            commands.restart();
        } else if (command instanceof RemoteCommand.EnableAutomatic) {
            commands.enableAutomatic();
        } else if (command instanceof RemoteCommand.ForceDisplay f) {
            commands.forceDisplay(f.on());
        }
        // NoOp: authenticated, nothing to do.
    }
}
