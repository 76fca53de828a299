package com.questrail.videowall.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of VideoWallObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements VideoWallObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onStateTransition(MonitorTransitionEvent event) {
        log.info("Monitor state: {} -> {}", event.oldState(), event.newState());
    }

    @Override
    public void onSlotEvent(SlotEvent event) {
        switch (event.kind()) {
            case STARTED, PLAYING, STOPPED ->
                log.info("Slot {} (tile {}): {} {}", event.slot(), event.tile(), event.kind(), event.detail());
            case START_FAILED, FORCE_KILLED ->
                log.warn("Slot {} (tile {}): {} {}", event.slot(), event.tile(), event.kind(), event.detail());
            case CRASHED ->
                log.error("Slot {} (tile {}): {} {}", event.slot(), event.tile(), event.kind(), event.detail());
        }
    }

    @Override
    public void onCommandAccepted(CommandAcceptedEvent event) {
        log.info("Command accepted: {}", event.command());
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        log.info("Command rejected ({}): {}", event.reason(), event.detail());
    }

    @Override
    public void onError(ErrorEvent event) {
        log.error("Video wall error: {}", event.message(), event.cause());
    }
}
