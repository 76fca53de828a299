package com.questrail.videowall.supervisor;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Slot
 * -----------------------------------------------------------------------------
 * One worker position of a {@link RotationScheduler}.
 *
 * <p>The mailbox is created with the slot and survives every worker that
 * occupies it; only the worker and its thread are replaced on rotation.</p>
 */
final class Slot
{
    private final int index;
    private final BlockingQueue<SlotMessage> mailbox = new LinkedBlockingQueue<>();

    private volatile SlotWorker worker;
    private volatile Thread thread;

    Slot(int index)
    {
        this.index = index;
    }

    int index()
    {
        return index;
    }

    BlockingQueue<SlotMessage> mailbox()
    {
        return mailbox;
    }

    SlotWorker worker()
    {
        return worker;
    }

    void launch(SlotWorker next)
    {
        Thread t = new Thread(next, "videowall-slot-" + index);
        t.setDaemon(true);
        worker = next;
        thread = t;
        t.start();
    }

    boolean isAlive()
    {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    /**
     * Waits at most {@code timeout} for the current worker to exit.
     *
     * @return {@code true} if no worker is running afterwards
     */
    boolean join(Duration timeout) throws InterruptedException
    {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    void forceKill()
    {
        SlotWorker w = worker;
        Thread t = thread;
        if (w != null && t != null) {
            w.kill(t);
        }
    }
}
