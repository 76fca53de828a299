package com.questrail.videowall.supervisor;

/**
 * SlotMessage
 * -----------------------------------------------------------------------------
 * Messages delivered to a slot's mailbox. A running worker exits on receipt of
 * either kind; the distinction exists for diagnostics and tests.
 */
public sealed interface SlotMessage permits SlotMessage.Ready, SlotMessage.Stop
{
    /** The successor in {@code fromSlot} is playing (or has definitively failed). */
    record Ready(int fromSlot) implements SlotMessage {}

    /** Scheduler shutdown. */
    record Stop() implements SlotMessage {}
}
