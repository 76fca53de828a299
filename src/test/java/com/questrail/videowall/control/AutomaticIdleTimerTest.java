package com.questrail.videowall.control;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.questrail.videowall.testing.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

class AutomaticIdleTimerTest {

    private DisplayControlState control;
    private List<String> actions;
    private AutomaticIdleTimer timer;

    @BeforeEach
    void setUp() {
        control = new DisplayControlState();
        actions = new ArrayList<>();
        timer = new AutomaticIdleTimer(control, () -> actions.add("on"), () -> actions.add("off"),
                3, Duration.ofSeconds(1));
    }

    @Test
    void offFiresOnceWhenTimeoutReached() {
        timer.tick();
        timer.tick();
        assertTrue(actions.isEmpty());

        timer.tick();
        assertEquals(List.of("off"), actions);

        timer.tick();
        timer.tick();
        assertEquals(List.of("off"), actions, "off must not repeat while idle");
        assertEquals(3, timer.counter());
    }

    @Test
    void motionResetsCounterAndTurnsOn() {
        timer.tick();
        timer.tick();
        control.triggerMotion();
        timer.tick();
        assertEquals(List.of("on"), actions);
        assertEquals(0, timer.counter());

        timer.tick();
        timer.tick();
        assertEquals(List.of("on"), actions);
        timer.tick();
        assertEquals(List.of("on", "off"), actions);
    }

    @Test
    void motionIsConsumedEvenInManualMode() {
        control.setAutoMode(false);
        control.triggerMotion();
        timer.tick();

        assertTrue(actions.isEmpty());
        assertFalse(control.consumeMotion());
    }

    @Test
    void manualModeFreezesTimer() {
        control.setAutoMode(false);
        for (int i = 0; i < 10; i++) {
            timer.tick();
        }
        assertTrue(actions.isEmpty());
    }

    @Test
    void reenteringAutomaticTurnsOnAndRestartsCount() {
        timer.tick();
        timer.tick();
        control.setAutoMode(false);
        timer.tick();
        control.setAutoMode(true);
        timer.tick();
        assertEquals(List.of("on"), actions);
        assertEquals(0, timer.counter());

        timer.tick();
        timer.tick();
        timer.tick();
        assertEquals(List.of("on", "off"), actions);
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new AutomaticIdleTimer(
                control, () -> {}, () -> {}, 0, Duration.ofSeconds(1)));
    }

    @Test
    void threadTicksUntilStopped() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        AutomaticIdleTimer fast = new AutomaticIdleTimer(control, () -> seen.add("on"), () -> seen.add("off"),
                2, Duration.ofMillis(10));
        fast.start();
        try {
            await("idle timer fires off", () -> seen.contains("off"));
        } finally {
            fast.stop();
        }
        int size = seen.size();
        control.triggerMotion();
        try {
            Thread.sleep(50);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        assertEquals(size, seen.size(), "no ticks after stop()");
    }
}
