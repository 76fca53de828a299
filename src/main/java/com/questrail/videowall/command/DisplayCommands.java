package com.questrail.videowall.command;

/**
 * Actions an authenticated remote command may trigger.
 *
 * <p>Implemented by the top-level monitor; injected into
 * {@link RemoteCommandHandler} so the command path carries no knowledge of
 * the state machine behind it.</p>
 */
public interface DisplayCommands
{
    /** Tear down the running video wall and start a fresh one. */
    void restart();

    /** Hand display power back to the automatic idle timer. */
    void enableAutomatic();

    /**
     * Take display power out of automatic control and force it.
     *
     * @param on {@code true} to show the wall, {@code false} to blank it
     */
    void forceDisplay(boolean on);
}
