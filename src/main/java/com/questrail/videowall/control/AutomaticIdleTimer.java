package com.questrail.videowall.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AutomaticIdleTimer
 * =============================================================================
 * Blanks the wall after a period without motion while automatic mode is on.
 *
 * <h2>Per tick</h2>
 * <ol>
 *   <li>The motion trigger is read and cleared, whatever the mode.</li>
 *   <li>In manual mode nothing else happens.</li>
 *   <li>On the tick automatic mode is (re)entered the counter resets and the
 *       "on" action fires.</li>
 *   <li>Motion resets the counter and fires "on".</li>
 *   <li>Otherwise the counter grows, saturating at {@code timeoutTicks}; the
 *       tick that reaches it fires "off" exactly once.</li>
 * </ol>
 *
 * <h2>Threading Model</h2>
 * {@link #start()} runs {@link #tick()} on a dedicated daemon thread once per
 * tick interval until {@link #stop()}. Tests call {@link #tick()} directly
 * without starting the thread.
 */
public final class AutomaticIdleTimer
{
    private static final Logger log = LoggerFactory.getLogger(AutomaticIdleTimer.class);

    public static final int DEFAULT_TIMEOUT_TICKS = 900;

    private final DisplayControlState control;
    private final Runnable onAction;
    private final Runnable offAction;
    private final int timeoutTicks;
    private final Duration tickInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    // Owned by whichever thread calls tick().
    private int counter;
    private boolean wasAutomatic = true;

    public AutomaticIdleTimer(DisplayControlState control,
                              Runnable onAction,
                              Runnable offAction,
                              int timeoutTicks,
                              Duration tickInterval)
    {
        this.control = Objects.requireNonNull(control, "control");
        this.onAction = Objects.requireNonNull(onAction, "onAction");
        this.offAction = Objects.requireNonNull(offAction, "offAction");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        if (timeoutTicks <= 0) {
            throw new IllegalArgumentException("timeoutTicks must be > 0");
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be > 0");
        }
        this.timeoutTicks = timeoutTicks;
    }

    public void start()
    {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::runLoop, "videowall-idle-timer");
            t.setDaemon(true);
            thread = t;
            t.start();
        }
    }

    /**
     * Stops the timer thread and waits up to 5 seconds for it to exit.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Evaluates one tick.
     */
    public void tick()
    {
        boolean motion = control.consumeMotion();
        boolean automatic = control.isAutoMode();
        boolean entered = automatic && !wasAutomatic;
        wasAutomatic = automatic;

        if (!automatic) {
            return;
        }
        if (entered) {
            log.debug("Automatic mode entered");
            counter = 0;
            onAction.run();
            return;
        }
        if (motion) {
            counter = 0;
            onAction.run();
            return;
        }
        if (counter < timeoutTicks) {
            counter++;
            if (counter == timeoutTicks) {
                log.info("No motion for {} ticks, blanking display", timeoutTicks);
                offAction.run();
            }
        }
    }

    int counter()
    {
        return counter;
    }

    private void runLoop()
    {
        while (running.get()) {
            try {
                Thread.sleep(tickInterval.toMillis());
            } catch (InterruptedException e) {
                // stop() interrupts; the loop condition decides.
                continue;
            }
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Idle timer tick failed", e);
            }
        }
    }
}
