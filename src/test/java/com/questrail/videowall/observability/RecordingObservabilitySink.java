package com.questrail.videowall.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements VideoWallObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(MonitorTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSlotEvent(SlotEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCommandAccepted(CommandAcceptedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCommandRejected(CommandRejectedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<MonitorTransitionEvent> getStateTransitions() {
        return ofType(MonitorTransitionEvent.class);
    }

    public synchronized List<SlotEvent> getSlotEvents() {
        return ofType(SlotEvent.class);
    }

    public synchronized List<SlotEvent> getSlotEvents(int slot, SlotEvent.Kind kind) {
        return ofType(SlotEvent.class).stream()
            .filter(e -> e.slot() == slot && e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
