package com.questrail.videowall.runtime;

import com.questrail.videowall.auth.TokenCodec;
import com.questrail.videowall.config.VideoWallConfig;
import com.questrail.videowall.control.MonitorState;
import com.questrail.videowall.engine.FakeRenderEngineFactory;
import com.questrail.videowall.observability.RecordingObservabilitySink;
import com.questrail.videowall.power.RecordingDisplayPower;
import com.questrail.videowall.supervisor.RotationPolicy;
import com.questrail.videowall.time.FixedWallClock;
import com.questrail.videowall.transport.FakeDatagramEndpoint;
import com.questrail.videowall.transport.pubsub.FakePubSubEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.questrail.videowall.command.SignedCommands.NOW;
import static com.questrail.videowall.command.SignedCommands.SECRET;
import static com.questrail.videowall.command.SignedCommands.at;
import static com.questrail.videowall.testing.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * VideoWallRuntimeTest
 * -----------------------------------------------------------------------------
 * Wires the full runtime over fake transports, engines and display power.
 */
class VideoWallRuntimeTest {

    private static final InetSocketAddress SENDER = new InetSocketAddress("127.0.0.1", 40000);

    private FakeDatagramEndpoint udp;
    private FakePubSubEndpoint broker;
    private RecordingDisplayPower power;
    private FakeRenderEngineFactory engines;
    private VideoWallRuntime runtime;
    private Thread loop;

    @BeforeEach
    void setUp() {
        udp = new FakeDatagramEndpoint();
        broker = new FakePubSubEndpoint();
        power = new RecordingDisplayPower();
        engines = new FakeRenderEngineFactory();

        VideoWallConfig config = VideoWallConfig.builder()
                .withName("secmon00")
                .withUrls(List.of("rtsp://cam/0", "rtsp://cam/1"))
                .withTokens(List.of(TokenCodec.encode(SECRET)))
                .withMqttBroker("broker.local")
                .withRotationPolicy(new RotationPolicy(Duration.ofMillis(20), 1000,
                        Duration.ofMillis(100), Duration.ofMillis(300), Duration.ofMillis(10)))
                .build();

        runtime = VideoWallRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new RecordingObservabilitySink())
                .withClock(new FixedWallClock(Instant.ofEpochSecond(NOW)))
                .withDisplayPower(power)
                .withEngineFactory(engines)
                .withDatagramEndpoint(udp)
                .withPubSubEndpoint(broker)
                .withIdleTick(Duration.ofMillis(50))
                .build();

        loop = new Thread(runtime::run, "runtime-under-test");
        loop.setDaemon(true);
        loop.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runtime.requestExit();
        runtime.awaitTermination(Duration.ofSeconds(5));
        loop.join(5000);
    }

    @Test
    void startsTransportsAndPlays() {
        await("both tiles playing", () -> engines.created().size() >= 2);
        assertTrue(udp.isStarted());
        assertTrue(broker.isStarted());
        assertEquals("configure", power.calls().get(0));
        assertTrue(broker.subscriptions().contains("secmon00/cmd"));
        assertEquals(MonitorState.PLAYING, runtime.status().state());
    }

    @Test
    void udpCommandIsAcknowledged() {
        await("started", udp::isStarted);
        udp.injectDatagram(SENDER, at(NOW, "\"force\": 0").getBytes(StandardCharsets.UTF_8));

        List<FakeDatagramEndpoint.Sent> sent = udp.sent();
        assertEquals("OK", new String(sent.get(sent.size() - 1).payload(), StandardCharsets.US_ASCII));
        await("display forced off", () -> runtime.status().displayOff() && !runtime.status().automatic());
    }

    @Test
    void checkupRequestIsAnswered() {
        await("subscribed", () -> broker.subscriptions().contains("reporter/checkup_req"));
        broker.inject("reporter/checkup_req", "{}");

        await("checkup reply", () -> broker.published().stream()
                .anyMatch(p -> p.topic().equals("reporter/checkup") && p.text().contains("secmon00")));
    }

    @Test
    void exitStopsEverythingAndLeavesDisplayOn() throws InterruptedException {
        await("playing", () -> engines.created().size() >= 2);

        runtime.requestExit();

        assertTrue(runtime.awaitTermination(Duration.ofSeconds(5)));
        assertTrue(udp.isStopped());
        assertTrue(broker.isStopped());
        assertEquals("on", power.last());
        assertTrue(engines.created().stream().allMatch(e -> e.isStopped()));
    }
}
