package com.questrail.videowall.observability;

/**
 * Main interface for receiving video wall supervision events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface VideoWallObservabilitySink {
    /**
     * Called when the top-level monitor changes state.
     * @param event the transition event details
     */
    void onStateTransition(MonitorTransitionEvent event);

    /**
     * Called on every slot lifecycle step (start, playing, failure, stop, kill).
     * @param event the slot event
     */
    void onSlotEvent(SlotEvent event);

    /**
     * Called when a remote command was authenticated and applied.
     * @param event the accepted command
     */
    void onCommandAccepted(CommandAcceptedEvent event);

    /**
     * Called when a framed remote command was refused.
     * @param event the rejection details
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called when an error or anomaly occurs outside the slot lifecycle.
     * @param event the error event
     */
    void onError(ErrorEvent event);
}
