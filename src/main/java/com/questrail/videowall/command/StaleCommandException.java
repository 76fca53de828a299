package com.questrail.videowall.command;

/**
 * Command timestamp differs from local time by more than the allowed skew.
 */
public final class StaleCommandException extends CommandRejectedException
{
    private final double skewSeconds;

    public StaleCommandException(double skewSeconds, long maxSkewSeconds) {
        super(Reason.STALE, String.format(
                "command time is %.1fs from now, limit %ds", skewSeconds, maxSkewSeconds));
        this.skewSeconds = skewSeconds;
    }

    public double skewSeconds() {
        return skewSeconds;
    }
}
