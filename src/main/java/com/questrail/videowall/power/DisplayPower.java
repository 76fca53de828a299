package com.questrail.videowall.power;

/**
 * DisplayPower
 * -----------------------------------------------------------------------------
 * Port onto the display's power-management surface.
 *
 * <p>All operations are idempotent and best effort. Implementations log
 * failures and never throw: a display that cannot be blanked must not take the
 * supervisor down with it.</p>
 */
public interface DisplayPower
{
    /**
     * @return {@code true} if the display supports forced power states
     */
    boolean isSupported();

    /**
     * Prepares the display for explicit control (screensaver and automatic
     * power timers disabled). Called once at start-up.
     */
    void configure();

    void forceOn();

    void forceOff();
}
