package com.questrail.videowall.observability;

/**
 * No-op implementation of VideoWallObservabilitySink.
 */
public final class NullObservabilitySink implements VideoWallObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(MonitorTransitionEvent event) {}

    @Override
    public void onSlotEvent(SlotEvent event) {}

    @Override
    public void onCommandAccepted(CommandAcceptedEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onError(ErrorEvent event) {}
}
