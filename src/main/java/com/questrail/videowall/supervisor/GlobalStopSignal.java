package com.questrail.videowall.supervisor;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * GlobalStopSignal
 * -----------------------------------------------------------------------------
 * One-shot request to tear down an entire {@link RotationScheduler} instance.
 *
 * <p>Any worker, the scheduler itself, or the top-level monitor may post.
 * Posting is idempotent; the first reason wins and is kept for diagnostics.
 * A fresh signal is created for every scheduler instance, so there is nothing
 * to reset.</p>
 */
public final class GlobalStopSignal
{
    private final CountDownLatch posted = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();

    public void post(String reason)
    {
        Objects.requireNonNull(reason, "reason");
        this.reason.compareAndSet(null, reason);
        posted.countDown();
    }

    public boolean isPosted()
    {
        return posted.getCount() == 0;
    }

    /**
     * Waits at most {@code timeout} for the signal.
     *
     * @return {@code true} if the signal has been posted
     */
    public boolean await(Duration timeout) throws InterruptedException
    {
        return posted.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public Optional<String> reason()
    {
        return Optional.ofNullable(reason.get());
    }
}
