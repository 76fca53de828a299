package com.questrail.videowall.supervisor;

import com.questrail.videowall.engine.FakeRenderEngine;
import com.questrail.videowall.engine.FakeRenderEngineFactory;
import com.questrail.videowall.layout.GridDivision;
import com.questrail.videowall.observability.RecordingObservabilitySink;
import com.questrail.videowall.observability.SlotEvent;
import com.questrail.videowall.time.SystemWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.questrail.videowall.testing.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RotationSchedulerTest
 * -----------------------------------------------------------------------------
 * Runs the scheduler with real worker threads over fake engines and short
 * timeouts.
 */
class RotationSchedulerTest {

    private static final List<String> URLS = List.of("rtsp://cam/0", "rtsp://cam/1");

    private static final RotationPolicy FAST = new RotationPolicy(
            Duration.ofMillis(20),
            1000,
            Duration.ofMillis(100),
            Duration.ofMillis(300),
            Duration.ofMillis(10));

    private FakeRenderEngineFactory engines;
    private RecordingObservabilitySink sink;
    private GlobalStopSignal stop;
    private RotationScheduler scheduler;

    @BeforeEach
    void setUp() {
        engines = new FakeRenderEngineFactory();
        sink = new RecordingObservabilitySink();
        stop = new GlobalStopSignal();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            stop.post("test over");
            scheduler.shutdown();
        }
    }

    private RotationScheduler newScheduler(RotationPolicy policy) {
        scheduler = new RotationScheduler(GridDivision.fromIndex(1), URLS, engines, policy, stop,
                sink, SystemWallClock.INSTANCE);
        return scheduler;
    }

    private void awaitPlaying(int slot) {
        await("slot " + slot + " playing", () -> !sink.getSlotEvents(slot, SlotEvent.Kind.PLAYING).isEmpty());
    }

    @Test
    void rejectsFewerUrlsThanTiles() {
        assertThrows(IllegalArgumentException.class, () -> new RotationScheduler(
                GridDivision.fromIndex(1), List.of("rtsp://only"), engines, FAST, stop, sink, null));
    }

    @Test
    void startLaunchesFirstHalfOfSlots() {
        newScheduler(FAST).start();
        awaitPlaying(0);
        awaitPlaying(1);

        assertEquals(4, scheduler.slotCount());
        assertTrue(scheduler.slot(0).isAlive());
        assertTrue(scheduler.slot(1).isAlive());
        assertFalse(scheduler.slot(2).isAlive());
        assertFalse(scheduler.slot(3).isAlive());

        FakeRenderEngine left = engines.latest("slot-0").orElseThrow();
        FakeRenderEngine right = engines.latest("slot-1").orElseThrow();
        assertEquals("rtsp://cam/0", left.url());
        assertEquals("50%x100%+0+0", left.geometry().toGeometryString());
        assertEquals("50%x100%-0+0", right.geometry().toGeometryString());
    }

    @Test
    void startTwiceIsRejected() {
        newScheduler(FAST).start();
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void rotationStartsStandbyBeforeRetiringLiveSlot() throws InterruptedException {
        newScheduler(FAST).start();
        awaitPlaying(0);
        awaitPlaying(1);

        scheduler.rotate();

        // Slot 2 renders tile 0 and replaced slot 0, which was joined before rotate() returned.
        assertFalse(scheduler.slot(0).isAlive());
        assertTrue(scheduler.slot(2).isAlive());
        assertTrue(scheduler.slot(1).isAlive());
        assertEquals(1, scheduler.cursor());

        FakeRenderEngine replacement = engines.latest("slot-2").orElseThrow();
        assertEquals("rtsp://cam/0", replacement.url());
        assertTrue(engines.latest("slot-0").orElseThrow().isStopped());

        List<SlotEvent> events = sink.getSlotEvents();
        int playing2 = events.indexOf(sink.getSlotEvents(2, SlotEvent.Kind.PLAYING).get(0));
        int stopped0 = events.indexOf(sink.getSlotEvents(0, SlotEvent.Kind.STOPPED).get(0));
        assertTrue(playing2 < stopped0, "replacement must be playing before the old tile stops");
    }

    @Test
    void cursorWalksAllSlotsAndWraps() throws InterruptedException {
        newScheduler(FAST).start();
        awaitPlaying(0);
        awaitPlaying(1);

        for (int i = 0; i < 4; i++) {
            scheduler.rotate();
        }

        assertEquals(0, scheduler.cursor());
        assertTrue(scheduler.slot(0).isAlive());
        assertTrue(scheduler.slot(1).isAlive());
        assertFalse(scheduler.slot(2).isAlive());
        assertFalse(scheduler.slot(3).isAlive());
    }

    @Test
    void tickRotatesOncePerRefreshPeriod() throws InterruptedException {
        newScheduler(FAST.withRefreshPeriodTicks(3)).start();
        awaitPlaying(0);
        awaitPlaying(1);

        assertFalse(scheduler.tick());
        assertFalse(scheduler.tick());
        assertTrue(scheduler.tick());
        assertEquals(1, scheduler.cursor());
        assertFalse(scheduler.tick());
    }

    @Test
    void failedStartStillReleasesPredecessor() throws InterruptedException {
        engines.script("slot-2", FakeRenderEngine.Behavior.START_FAILS);
        newScheduler(FAST).start();
        awaitPlaying(0);

        long begin = System.nanoTime();
        scheduler.rotate();
        Duration took = Duration.ofNanos(System.nanoTime() - begin);

        assertFalse(scheduler.slot(0).isAlive());
        assertFalse(sink.getSlotEvents(2, SlotEvent.Kind.START_FAILED).isEmpty());
        assertTrue(sink.getSlotEvents(0, SlotEvent.Kind.FORCE_KILLED).isEmpty());
        assertTrue(took.compareTo(FAST.joinTimeout()) < 0, "rotation waited for a join timeout: " + took);
        assertFalse(stop.isPosted());
    }

    @Test
    void playingTimeoutDegradesSlotWithoutGlobalStop() throws InterruptedException {
        engines.script("slot-2", FakeRenderEngine.Behavior.NEVER_PLAYS);
        newScheduler(FAST).start();
        awaitPlaying(0);

        scheduler.rotate();

        assertFalse(scheduler.slot(0).isAlive());
        assertTrue(scheduler.slot(2).isAlive(), "degraded worker keeps its slot until released");
        assertFalse(sink.getSlotEvents(2, SlotEvent.Kind.START_FAILED).isEmpty());
        assertTrue(engines.latest("slot-2").orElseThrow().isStopped());

        Thread.sleep(50);
        assertFalse(stop.isPosted(), "a degraded slot is not a crash");
    }

    @Test
    void engineCrashPostsGlobalStopAndRunReturns() throws InterruptedException {
        newScheduler(FAST);
        AtomicBoolean returned = new AtomicBoolean(false);
        Thread runner = new Thread(() -> {
            scheduler.run();
            returned.set(true);
        }, "scheduler-under-test");
        runner.start();

        awaitPlaying(0);
        awaitPlaying(1);
        engines.latest("slot-1").orElseThrow().crash();

        runner.join(5000);
        assertTrue(returned.get(), "run() should return after a crash");
        assertTrue(stop.isPosted());
        assertTrue(stop.reason().orElseThrow().contains("slot 1"));
        assertFalse(sink.getSlotEvents(1, SlotEvent.Kind.CRASHED).isEmpty());
        for (int i = 0; i < scheduler.slotCount(); i++) {
            assertFalse(scheduler.slot(i).isAlive(), "slot " + i + " still alive");
        }
    }

    @Test
    void externalStopEndsRun() throws InterruptedException {
        newScheduler(FAST);
        Thread runner = new Thread(scheduler::run, "scheduler-under-test");
        runner.start();
        awaitPlaying(0);

        stop.post("requested");
        runner.join(5000);

        assertFalse(runner.isAlive());
        assertEquals("requested", stop.reason().orElseThrow());
        assertTrue(engines.latest("slot-0").orElseThrow().isStopped());
        assertTrue(engines.latest("slot-1").orElseThrow().isStopped());
    }

    @Test
    void stuckRetiringWorkerIsForceKilledAndRotationAdvances() throws InterruptedException {
        engines.script("slot-0", FakeRenderEngine.Behavior.STUCK_ON_STOP);
        newScheduler(FAST).start();
        awaitPlaying(0);
        awaitPlaying(1);

        long begin = System.nanoTime();
        scheduler.rotate();
        Duration took = Duration.ofNanos(System.nanoTime() - begin);

        assertTrue(took.compareTo(FAST.joinTimeout()) >= 0, "rotation returned before the join timeout");
        assertEquals(1, scheduler.cursor());
        assertFalse(sink.getSlotEvents(0, SlotEvent.Kind.FORCE_KILLED).isEmpty());
        assertTrue(engines.latest("slot-0").orElseThrow().wasKilled());
        await("slot 0 thread exits", () -> !scheduler.slot(0).isAlive());
        assertTrue(scheduler.slot(2).isAlive());
        assertFalse(stop.isPosted());
    }
}
