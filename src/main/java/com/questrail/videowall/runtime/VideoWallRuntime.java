package com.questrail.videowall.runtime;

import com.questrail.videowall.auth.SecretSet;
import com.questrail.videowall.command.CommandEnvelopeParser;
import com.questrail.videowall.command.RemoteCommandHandler;
import com.questrail.videowall.config.VideoWallConfig;
import com.questrail.videowall.control.AutomaticIdleTimer;
import com.questrail.videowall.control.DisplayControlState;
import com.questrail.videowall.control.MonitorStatus;
import com.questrail.videowall.control.MonitorTop;
import com.questrail.videowall.engine.RenderEngineFactory;
import com.questrail.videowall.engine.mpv.MpvProcessEngineFactory;
import com.questrail.videowall.layout.GridDivision;
import com.questrail.videowall.observability.NullObservabilitySink;
import com.questrail.videowall.observability.VideoWallObservabilitySink;
import com.questrail.videowall.power.DisplayPower;
import com.questrail.videowall.power.XsetDisplayPower;
import com.questrail.videowall.supervisor.RotationScheduler;
import com.questrail.videowall.time.SystemWallClock;
import com.questrail.videowall.time.WallClock;
import com.questrail.videowall.transport.DatagramEndpoint;
import com.questrail.videowall.transport.pubsub.PubSubCommandAdapter;
import com.questrail.videowall.transport.pubsub.PubSubEndpoint;
import com.questrail.videowall.transport.pubsub.mqtt.NettyMqttPubSubEndpoint;
import com.questrail.videowall.transport.udp.UdpCommandAdapter;
import com.questrail.videowall.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * VideoWallRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a running video wall.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   run():  configure display power
 *           → start pub/sub, UDP, idle timer
 *           → display on
 *           → MonitorTop.run()              (blocks until requestExit)
 *           → display on, stop idle timer, UDP, pub/sub
 * </pre>
 *
 * {@link #requestExit()} may be called from any thread, typically a JVM
 * shutdown hook, which can then wait in {@link #awaitTermination(Duration)}.
 */
public final class VideoWallRuntime
{
    private static final Logger log = LoggerFactory.getLogger(VideoWallRuntime.class);

    private final String name;
    private final MonitorTop monitor;
    private final AutomaticIdleTimer idleTimer;
    private final UdpCommandAdapter udp;
    private final PubSubCommandAdapter pubSub;
    private final DisplayPower displayPower;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private VideoWallRuntime(String name,
                             MonitorTop monitor,
                             AutomaticIdleTimer idleTimer,
                             UdpCommandAdapter udp,
                             PubSubCommandAdapter pubSub,
                             DisplayPower displayPower)
    {
        this.name = name;
        this.monitor = monitor;
        this.idleTimer = idleTimer;
        this.udp = udp;
        this.pubSub = pubSub;
        this.displayPower = displayPower;
    }

    /**
     * Runs the video wall on the calling thread until {@link #requestExit()}.
     */
    public void run()
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("runtime already started");
        }
        log.info("Starting video wall {}", name);
        try {
            displayPower.configure();
            pubSub.start();
            udp.start();
            idleTimer.start();
            displayPower.forceOn();

            monitor.run();
        } finally {
            displayPower.forceOn();
            idleTimer.stop();
            udp.stop();
            pubSub.stop();
            log.info("Video wall {} stopped", name);
            terminated.countDown();
        }
    }

    public void requestExit()
    {
        monitor.requestExit();
    }

    /**
     * @return {@code true} if {@link #run()} finished within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException
    {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public MonitorStatus status()
    {
        return monitor.status();
    }

    MonitorTop monitor()
    {
        return monitor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private VideoWallConfig config;
        private VideoWallObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private DisplayPower displayPower;
        private RenderEngineFactory engineFactory;
        private DatagramEndpoint datagramEndpoint;
        private PubSubEndpoint pubSubEndpoint;
        private Duration idleTick = Duration.ofSeconds(1);

        public Builder withConfig(VideoWallConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(VideoWallObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withDisplayPower(DisplayPower displayPower) {
            this.displayPower = displayPower;
            return this;
        }

        public Builder withEngineFactory(RenderEngineFactory engineFactory) {
            this.engineFactory = engineFactory;
            return this;
        }

        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.datagramEndpoint = endpoint;
            return this;
        }

        public Builder withPubSubEndpoint(PubSubEndpoint endpoint) {
            this.pubSubEndpoint = endpoint;
            return this;
        }

        public Builder withIdleTick(Duration idleTick) {
            this.idleTick = idleTick;
            return this;
        }

        public VideoWallRuntime build() {
            Objects.requireNonNull(config, "config");
            VideoWallObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            WallClock wallClock = Objects.requireNonNullElse(clock, SystemWallClock.INSTANCE);

            // 1. Secrets and command parsing
            SecretSet secrets = SecretSet.fromTokens(config.tokens());
            CommandEnvelopeParser parser = new CommandEnvelopeParser(secrets, wallClock, config.maxCommandSkew());

            // 2. Rendering and display power
            DisplayPower power = displayPower != null ? displayPower : new XsetDisplayPower(config.display());
            RenderEngineFactory engines = engineFactory != null
                    ? engineFactory
                    : new MpvProcessEngineFactory(config.mpvExecutable(), config.engineOptions());

            // 3. Top state machine; every PLAYING period gets a fresh scheduler
            GridDivision division = config.division();
            DisplayControlState control = new DisplayControlState();
            MonitorTop monitor = new MonitorTop(
                    control,
                    power,
                    stop -> new RotationScheduler(division, config.urls(), engines,
                            config.rotationPolicy(), stop, sink, wallClock),
                    division,
                    MonitorTop.DEFAULT_IDLE_WAIT,
                    sink,
                    wallClock);

            RemoteCommandHandler handler = new RemoteCommandHandler(parser, monitor, wallClock, sink);

            // 4. Idle timer drives display power while in automatic mode
            AutomaticIdleTimer idleTimer = new AutomaticIdleTimer(
                    control,
                    monitor::displayOn,
                    monitor::displayOff,
                    config.idleTimeoutSeconds(),
                    idleTick);

            // 5. Transports
            DatagramEndpoint datagrams = datagramEndpoint != null
                    ? datagramEndpoint
                    : new NettyUdpDatagramEndpoint(new InetSocketAddress(config.udpBind(), config.udpPort()));
            UdpCommandAdapter udp = new UdpCommandAdapter(handler, datagrams);

            PubSubEndpoint broker = pubSubEndpoint != null
                    ? pubSubEndpoint
                    : new NettyMqttPubSubEndpoint(
                            InetSocketAddress.createUnresolved(config.mqttBroker(), config.mqttPort()),
                            "videowall-" + config.name(),
                            config.mqttKeepAlive(),
                            NettyMqttPubSubEndpoint.DEFAULT_RECONNECT_DELAY);
            PubSubCommandAdapter pubSub = new PubSubCommandAdapter(
                    config.name(),
                    broker,
                    config.topics(),
                    handler,
                    control,
                    monitor::status,
                    config.motionField());

            return new VideoWallRuntime(config.name(), monitor, idleTimer, udp, pubSub, power);
        }
    }
}
