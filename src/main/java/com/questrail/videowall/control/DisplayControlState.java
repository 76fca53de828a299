package com.questrail.videowall.control;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DisplayControlState
 * -----------------------------------------------------------------------------
 * Flags shared between the monitor, the idle timer and the transports.
 *
 * <table>
 *   <caption>Writers</caption>
 *   <tr><th>flag</th><th>set by</th><th>cleared by</th></tr>
 *   <tr><td>autoMode</td><td>remote commands</td><td>remote commands</td></tr>
 *   <tr><td>motionTrigger</td><td>event transport</td><td>idle timer</td></tr>
 *   <tr><td>displayPowerOff</td><td>monitor</td><td>monitor</td></tr>
 * </table>
 */
public final class DisplayControlState
{
    private final AtomicBoolean autoMode = new AtomicBoolean(true);
    private final AtomicBoolean motionTrigger = new AtomicBoolean(false);
    private final AtomicBoolean displayPowerOff = new AtomicBoolean(false);

    public boolean isAutoMode()
    {
        return autoMode.get();
    }

    public void setAutoMode(boolean enabled)
    {
        autoMode.set(enabled);
    }

    /** Records that motion was seen since the last idle timer tick. */
    public void triggerMotion()
    {
        motionTrigger.set(true);
    }

    /**
     * @return whether motion was seen since the previous call
     */
    public boolean consumeMotion()
    {
        return motionTrigger.getAndSet(false);
    }

    public boolean isDisplayPowerOff()
    {
        return displayPowerOff.get();
    }

    /**
     * @return {@code true} if the flag changed
     */
    boolean setDisplayPowerOff(boolean off)
    {
        return displayPowerOff.compareAndSet(!off, off);
    }
}
