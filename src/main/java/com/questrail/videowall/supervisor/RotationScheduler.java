package com.questrail.videowall.supervisor;

import com.questrail.videowall.engine.RenderEngineFactory;
import com.questrail.videowall.layout.GridDivision;
import com.questrail.videowall.observability.NullObservabilitySink;
import com.questrail.videowall.observability.SlotEvent;
import com.questrail.videowall.observability.VideoWallObservabilitySink;
import com.questrail.videowall.time.SystemWallClock;
import com.questrail.videowall.time.WallClock;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RotationScheduler
 * =============================================================================
 * Keeps {@code N} video tiles on screen while periodically replacing the worker
 * behind each one.
 *
 * <h2>Double-buffered slots</h2>
 * For {@code N} visible tiles the scheduler owns {@code 2N} slots. Slot
 * {@code s} always renders tile {@code s mod N}; slots {@code s} and
 * {@code s + N} (mod {@code 2N}) take turns. A rotation starts the standby
 * slot and retires the live one only after the newcomer has reported ready
 * (playing, or definitively failed), so a tile is never blank during a
 * refresh.
 *
 * <pre>
 *   N = 2:   live {0, 1}  standby {2, 3}
 *   rotate p=0:  start 2 (pred 0) → 2 Ready → 0 exits → join 0     live {2, 1}
 *   rotate p=1:  start 3 (pred 1) → 3 Ready → 1 exits → join 1     live {2, 3}
 *   rotate p=2:  start 0 (pred 2) ...
 * </pre>
 *
 * <h2>Threading model</h2>
 * {@link #run()} executes on the caller's thread and owns all scheduling
 * state (cursor, tick counter, slot contents). Each slot worker runs on its
 * own thread and communicates only through slot mailboxes and the
 * {@link GlobalStopSignal}.
 *
 * <h2>Termination</h2>
 * {@link #run()} returns once the {@link GlobalStopSignal} is posted, whether
 * by a crashed engine or by an external request, after every worker has been
 * joined or killed.
 */
public final class RotationScheduler
{
    private final GridDivision division;
    private final List<String> urls;
    private final RenderEngineFactory engineFactory;
    private final RotationPolicy policy;
    private final GlobalStopSignal globalStop;
    private final VideoWallObservabilitySink observabilitySink;
    private final WallClock clock;

    private final Slot[] slots;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private int cursor;
    private int ticks;

    public RotationScheduler(GridDivision division,
                             List<String> urls,
                             RenderEngineFactory engineFactory,
                             RotationPolicy policy,
                             GlobalStopSignal globalStop,
                             VideoWallObservabilitySink observabilitySink,
                             WallClock clock)
    {
        this.division = Objects.requireNonNull(division, "division");
        this.urls = List.copyOf(Objects.requireNonNull(urls, "urls"));
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.globalStop = Objects.requireNonNull(globalStop, "globalStop");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(clock, SystemWallClock.INSTANCE);

        if (this.urls.size() < division.tileCount()) {
            throw new IllegalArgumentException("division " + division + " needs "
                    + division.tileCount() + " urls, got " + this.urls.size());
        }

        this.slots = new Slot[2 * division.tileCount()];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new Slot(i);
        }
    }

    /**
     * Starts the initial workers, then ticks until the global stop signal is
     * posted, then shuts every worker down. Blocks for the whole lifetime of
     * this instance and may be called only once.
     */
    public void run()
    {
        start();
        try {
            while (!globalStop.await(policy.tickInterval())) {
                tick();
            }
        } catch (InterruptedException e) {
            globalStop.post("scheduler interrupted");
            Thread.currentThread().interrupt();
        } finally {
            shutdown();
        }
    }

    /**
     * Starts workers in slots {@code [0, N)}. Their ready signals land in the
     * standby slots' mailboxes and are drained at the first rotation.
     */
    void start()
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler already started");
        }
        int n = division.tileCount();
        for (int i = 0; i < n; i++) {
            launch(i, i + n);
        }
    }

    /**
     * Advances the tick counter and rotates once every
     * {@link RotationPolicy#refreshPeriodTicks()} ticks.
     *
     * @return {@code true} if this tick rotated a slot
     */
    boolean tick() throws InterruptedException
    {
        ticks++;
        if (ticks < policy.refreshPeriodTicks()) {
            return false;
        }
        ticks = 0;
        rotate();
        return true;
    }

    /**
     * Replaces the worker at the cursor with a fresh one in its standby slot,
     * then retires the old worker.
     */
    void rotate() throws InterruptedException
    {
        int n = division.tileCount();
        int retiring = cursor;
        int next = (retiring + n) % (2 * n);

        slots[next].mailbox().clear();
        launch(next, retiring);

        // The retiring worker exits once the newcomer posts Ready into its mailbox.
        Slot old = slots[retiring];
        if (!old.join(policy.joinTimeout())) {
            killStraggler(old);
        }

        cursor = (retiring + 1) % (2 * n);
    }

    /**
     * Asks every slot to stop, then joins each with the join timeout and kills
     * whatever is left.
     */
    void shutdown()
    {
        for (Slot slot : slots) {
            slot.mailbox().offer(new SlotMessage.Stop());
        }
        boolean interrupted = false;
        for (Slot slot : slots) {
            try {
                if (!slot.join(policy.joinTimeout())) {
                    killStraggler(slot);
                }
            } catch (InterruptedException e) {
                interrupted = true;
                killStraggler(slot);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    int cursor()
    {
        return cursor;
    }

    Slot slot(int index)
    {
        return slots[index];
    }

    int slotCount()
    {
        return slots.length;
    }

    private void launch(int slotIndex, int predecessorIndex)
    {
        int tile = slotIndex % division.tileCount();
        Slot slot = slots[slotIndex];
        SlotWorker worker = new SlotWorker(
                slotIndex,
                tile,
                division.geometryOf(tile),
                urls.get(tile),
                slot.mailbox(),
                slots[predecessorIndex].mailbox(),
                globalStop,
                engineFactory,
                policy,
                observabilitySink,
                clock);
        slot.launch(worker);
    }

    private void killStraggler(Slot slot)
    {
        SlotWorker worker = slot.worker();
        slot.forceKill();
        observabilitySink.onSlotEvent(new SlotEvent(
                clock.now(),
                slot.index(),
                worker == null ? slot.index() % division.tileCount() : worker.tile(),
                SlotEvent.Kind.FORCE_KILLED,
                "did not exit within " + policy.joinTimeout()));
    }
}
