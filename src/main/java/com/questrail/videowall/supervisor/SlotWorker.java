package com.questrail.videowall.supervisor;

import com.questrail.videowall.engine.EngineException;
import com.questrail.videowall.engine.PlaybackStart;
import com.questrail.videowall.engine.RenderEngine;
import com.questrail.videowall.engine.RenderEngineFactory;
import com.questrail.videowall.layout.TileGeometry;
import com.questrail.videowall.observability.SlotEvent;
import com.questrail.videowall.observability.VideoWallObservabilitySink;
import com.questrail.videowall.time.WallClock;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * SlotWorker
 * =============================================================================
 * Body of the thread that owns one slot's render engine.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   create + start engine
 *        → await "playing" (bounded by playingTimeout)
 *            → Ready posted to the predecessor's mailbox   (always, even on failure)
 *                → poll own mailbox until any message arrives
 *                    → stop engine
 * </pre>
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>Engine never reaches playback: engine stopped, slot runs degraded, the
 *       predecessor is released anyway so rotation of the other tiles goes on.</li>
 *   <li>Healthy engine found dead while polling: fatal to the whole scheduler
 *       instance; the worker posts the {@link GlobalStopSignal} and exits.</li>
 * </ul>
 */
final class SlotWorker implements Runnable
{
    private final int slot;
    private final int tile;
    private final TileGeometry geometry;
    private final String url;
    private final BlockingQueue<SlotMessage> mailbox;
    private final BlockingQueue<SlotMessage> predecessorMailbox;
    private final GlobalStopSignal globalStop;
    private final RenderEngineFactory engineFactory;
    private final RotationPolicy policy;
    private final VideoWallObservabilitySink observabilitySink;
    private final WallClock clock;

    private volatile RenderEngine engine;

    SlotWorker(int slot,
               int tile,
               TileGeometry geometry,
               String url,
               BlockingQueue<SlotMessage> mailbox,
               BlockingQueue<SlotMessage> predecessorMailbox,
               GlobalStopSignal globalStop,
               RenderEngineFactory engineFactory,
               RotationPolicy policy,
               VideoWallObservabilitySink observabilitySink,
               WallClock clock)
    {
        this.slot = slot;
        this.tile = tile;
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.url = Objects.requireNonNull(url, "url");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.predecessorMailbox = Objects.requireNonNull(predecessorMailbox, "predecessorMailbox");
        this.globalStop = Objects.requireNonNull(globalStop, "globalStop");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void run()
    {
        try {
            boolean healthy = false;
            try {
                healthy = startEngine();
            } finally {
                // Handoff: the outgoing tile keeps rendering until this point.
                predecessorMailbox.offer(new SlotMessage.Ready(slot));
            }
            superviseUntilReleased(healthy);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            RenderEngine e = engine;
            if (e != null) {
                e.stop();
            }
            emit(SlotEvent.Kind.STOPPED, "");
        }
    }

    /**
     * Terminates the engine and interrupts the worker thread. Used when the
     * worker fails to exit within the join timeout.
     */
    void kill(Thread thread)
    {
        RenderEngine e = engine;
        if (e != null) {
            e.kill();
        }
        thread.interrupt();
    }

    int slot()
    {
        return slot;
    }

    int tile()
    {
        return tile;
    }

    private boolean startEngine() throws InterruptedException
    {
        emit(SlotEvent.Kind.STARTED, url);

        RenderEngine e;
        try {
            e = engineFactory.create("slot-" + slot, geometry, url);
            engine = e;
            e.start();
        } catch (EngineException ex) {
            emit(SlotEvent.Kind.START_FAILED, ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            emit(SlotEvent.Kind.START_FAILED, "engine setup failed: " + ex);
            return false;
        }

        PlaybackStart outcome;
        try {
            outcome = e.awaitPlaying(policy.playingTimeout());
        } catch (InterruptedException ex) {
            e.stop();
            throw ex;
        }

        if (outcome == PlaybackStart.PLAYING) {
            emit(SlotEvent.Kind.PLAYING, url);
            return true;
        }
        emit(SlotEvent.Kind.START_FAILED, outcome + " waiting for " + url);
        e.stop();
        return false;
    }

    private void superviseUntilReleased(boolean healthy) throws InterruptedException
    {
        long pollNanos = policy.pollInterval().toNanos();
        while (true) {
            SlotMessage message = mailbox.poll(pollNanos, TimeUnit.NANOSECONDS);
            if (message != null) {
                return;
            }
            RenderEngine e = engine;
            if (healthy && e != null && !e.isAlive()) {
                emit(SlotEvent.Kind.CRASHED, url);
                globalStop.post("engine in slot " + slot + " exited unexpectedly");
                return;
            }
        }
    }

    private void emit(SlotEvent.Kind kind, String detail)
    {
        observabilitySink.onSlotEvent(new SlotEvent(clock.now(), slot, tile, kind,
                detail == null ? "" : detail));
    }
}
