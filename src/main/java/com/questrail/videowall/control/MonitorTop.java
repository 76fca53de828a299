package com.questrail.videowall.control;

import com.questrail.videowall.command.DisplayCommands;
import com.questrail.videowall.layout.GridDivision;
import com.questrail.videowall.observability.ErrorEvent;
import com.questrail.videowall.observability.MonitorTransitionEvent;
import com.questrail.videowall.observability.NullObservabilitySink;
import com.questrail.videowall.observability.VideoWallObservabilitySink;
import com.questrail.videowall.power.DisplayPower;
import com.questrail.videowall.supervisor.GlobalStopSignal;
import com.questrail.videowall.supervisor.RotationScheduler;
import com.questrail.videowall.time.SystemWallClock;
import com.questrail.videowall.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * MonitorTop
 * =============================================================================
 * Top-level state machine of the video wall.
 *
 * <h2>Loop</h2>
 * {@link #run()} evaluates the current {@link MonitorState} once per
 * iteration until {@link #requestExit()}:
 * <ul>
 *   <li><b>PLAYING</b>: a fresh {@link GlobalStopSignal} is installed, the
 *       display is powered on and a {@link RotationScheduler} runs on the
 *       calling thread until the signal is posted.</li>
 *   <li><b>STOPPED</b> / <b>RESTART</b>: wait up to the idle wait for an exit
 *       request.</li>
 * </ul>
 * After each evaluation a pending restart request turns the state into
 * RESTART; otherwise {@link MonitorTransitions#next} decides. Entering STOPPED
 * from PLAYING powers the display off.
 *
 * <h2>Control actions</h2>
 * Control actions may be called from any thread (transports, idle timer,
 * shutdown hook). Each one that needs the running wall gone posts the current
 * stop signal; the loop then re-evaluates. A stop signal posted before the
 * loop installs the next one is not lost: the loop re-checks every request
 * after installing the signal and skips the scheduler if one is pending.
 *
 * <h2>Exit</h2>
 * On return from {@link #run()} the display is always powered back on.
 */
public final class MonitorTop implements DisplayCommands
{
    private static final Logger log = LoggerFactory.getLogger(MonitorTop.class);

    public static final Duration DEFAULT_IDLE_WAIT = Duration.ofSeconds(1);

    /**
     * Creates the scheduler for one PLAYING period.
     */
    @FunctionalInterface
    public interface SchedulerFactory
    {
        RotationScheduler create(GlobalStopSignal globalStop);
    }

    private final DisplayControlState control;
    private final DisplayPower displayPower;
    private final SchedulerFactory schedulerFactory;
    private final GridDivision division;
    private final Duration idleWait;
    private final VideoWallObservabilitySink observabilitySink;
    private final WallClock clock;

    private final AtomicReference<GlobalStopSignal> currentStop = new AtomicReference<>(new GlobalStopSignal());
    private final AtomicBoolean restartRequested = new AtomicBoolean(false);
    private final AtomicBoolean exitRequested = new AtomicBoolean(false);
    private final CountDownLatch exitLatch = new CountDownLatch(1);

    private volatile MonitorState state = MonitorState.PLAYING;
    private volatile Instant startedAt;

    public MonitorTop(DisplayControlState control,
                      DisplayPower displayPower,
                      SchedulerFactory schedulerFactory,
                      GridDivision division,
                      Duration idleWait,
                      VideoWallObservabilitySink observabilitySink,
                      WallClock clock)
    {
        this.control = Objects.requireNonNull(control, "control");
        this.displayPower = Objects.requireNonNull(displayPower, "displayPower");
        this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory");
        this.division = Objects.requireNonNull(division, "division");
        this.idleWait = Objects.requireNonNullElse(idleWait, DEFAULT_IDLE_WAIT);
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(clock, SystemWallClock.INSTANCE);
        this.startedAt = this.clock.now();
    }

    /**
     * Runs the state machine on the calling thread until {@link #requestExit()}.
     */
    public void run()
    {
        startedAt = clock.now();
        try {
            while (!exitRequested.get()) {
                MonitorState current = state;
                evaluate(current);

                MonitorState next = restartRequested.getAndSet(false)
                        ? MonitorState.RESTART
                        : MonitorTransitions.next(current, control.isDisplayPowerOff());
                if (next != current) {
                    transition(current, next);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Monitor loop interrupted");
        } finally {
            control.setDisplayPowerOff(false);
            displayPower.forceOn();
            log.info("Monitor loop exited");
        }
    }

    public MonitorState state()
    {
        return state;
    }

    public MonitorStatus status()
    {
        return new MonitorStatus(
                state,
                control.isAutoMode(),
                control.isDisplayPowerOff(),
                division,
                Duration.between(startedAt, clock.now()));
    }

    /** Clears the display-off request. The running wall, if any, is untouched. */
    public void displayOn()
    {
        if (control.setDisplayPowerOff(false)) {
            log.info("Display on requested");
        }
    }

    /** Requests the display off and tears down the running wall. */
    public void displayOff()
    {
        if (control.setDisplayPowerOff(true)) {
            log.info("Display off requested");
            currentStop.get().post("display off");
        }
    }

    public void requestRestart()
    {
        log.info("Restart requested");
        restartRequested.set(true);
        currentStop.get().post("restart");
    }

    /** Ends {@link #run()} after tearing down the running wall. */
    public void requestExit()
    {
        if (exitRequested.compareAndSet(false, true)) {
            log.info("Exit requested");
        }
        exitLatch.countDown();
        currentStop.get().post("exit");
    }

    @Override
    public void restart()
    {
        requestRestart();
    }

    @Override
    public void enableAutomatic()
    {
        control.setAutoMode(true);
    }

    @Override
    public void forceDisplay(boolean on)
    {
        control.setAutoMode(false);
        if (on) {
            displayOn();
        } else {
            displayOff();
        }
    }

    private void evaluate(MonitorState current) throws InterruptedException
    {
        if (current != MonitorState.PLAYING) {
            exitLatch.await(idleWait.toNanos(), TimeUnit.NANOSECONDS);
            return;
        }

        GlobalStopSignal stop = new GlobalStopSignal();
        currentStop.set(stop);
        if (exitRequested.get() || restartRequested.get() || control.isDisplayPowerOff()) {
            return;
        }

        displayPower.forceOn();
        try {
            schedulerFactory.create(stop).run();
        } catch (RuntimeException e) {
            observabilitySink.onError(new ErrorEvent(clock.now(), "Video wall failed: " + e.getMessage(), e));
            // Avoid spinning on a scheduler that cannot be built.
            exitLatch.await(idleWait.toNanos(), TimeUnit.NANOSECONDS);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("scheduler interrupted");
        }
        stop.reason().ifPresent(r -> log.info("Video wall stopped: {}", r));
    }

    private void transition(MonitorState from, MonitorState to)
    {
        state = to;
        observabilitySink.onStateTransition(new MonitorTransitionEvent(clock.now(), from, to));
        if (from == MonitorState.PLAYING && to == MonitorState.STOPPED) {
            displayPower.forceOff();
        }
    }
}
