package com.questrail.videowall.observability;

import java.time.Instant;

/**
 * Lifecycle step of one worker slot.
 *
 * @param slot   slot index in {@code [0, 2 * tileCount)}
 * @param tile   tile the slot renders
 * @param kind   what happened
 * @param detail free-form context (URL, error text); may be empty
 */
public record SlotEvent(
    Instant timestamp,
    int slot,
    int tile,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** Worker thread started for the slot. */
        STARTED,
        /** Engine reported playback; predecessor released. */
        PLAYING,
        /** Engine never reached playback; slot runs degraded, predecessor released anyway. */
        START_FAILED,
        /** Engine died on its own; the whole scheduler instance is being torn down. */
        CRASHED,
        /** Worker left its loop and released its engine. */
        STOPPED,
        /** Worker did not exit within the join timeout and was killed. */
        FORCE_KILLED
    }
}
