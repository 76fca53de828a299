package com.questrail.videowall.control;

import java.util.Objects;

/**
 * MonitorTransitions
 * =============================================================================
 * Pure transition function of the top-level monitor.
 *
 * <pre>
 *   PLAYING  ── display off ──→ STOPPED
 *   STOPPED  ── display on  ──→ PLAYING
 *   RESTART  ───────────────→ PLAYING
 * </pre>
 *
 * Everything else leaves the state unchanged. Restart requests enter through
 * {@link MonitorTop} rather than through this function because they arrive
 * asynchronously and must be consumed exactly once.
 */
public final class MonitorTransitions
{
    private MonitorTransitions()
    {
    }

    public static MonitorState next(MonitorState state, boolean displayPowerOff)
    {
        Objects.requireNonNull(state, "state");
        switch (state) {
            case PLAYING:
                return displayPowerOff ? MonitorState.STOPPED : MonitorState.PLAYING;
            case STOPPED:
                return displayPowerOff ? MonitorState.STOPPED : MonitorState.PLAYING;
            case RESTART:
                return MonitorState.PLAYING;
            default:
                throw new IllegalStateException("Unhandled state: " + state);
        }
    }
}
