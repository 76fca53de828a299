package com.questrail.videowall.transport.pubsub.mqtt;

import com.questrail.videowall.transport.pubsub.PubSubEndpoint;
import com.questrail.videowall.transport.pubsub.PubSubListener;
import com.questrail.videowall.transport.pubsub.PubSubListener.LogLevel;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyMqttPubSubEndpoint
 * =============================================================================
 * MQTT 3.1.1 client implementing the {@link PubSubEndpoint} port on Netty's
 * MQTT codec.
 *
 * <h2>Session</h2>
 * <ul>
 *   <li>Clean session, no credentials, no will.</li>
 *   <li>Subscriptions and publications at QoS 0 only, so no acknowledgement
 *       state is kept.</li>
 *   <li>PINGREQ is sent whenever nothing was written for the keep-alive
 *       period.</li>
 *   <li>A connection that has read nothing (not even PINGRESP) for 1.5
 *       keep-alive periods is closed as dead.</li>
 *   <li>A lost or refused connection is retried after the reconnect delay
 *       until {@link #stop()}.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package. Inbound payloads are copied into
 * {@code byte[]}; every callback runs on the single event loop thread.
 *
 * <p>Client diagnostics are reported through {@link PubSubListener#onLog}
 * rather than logged here.</p>
 */
public final class NettyMqttPubSubEndpoint implements PubSubEndpoint
{
    public static final int DEFAULT_PORT = 1883;
    public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(60);
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    private static final MqttMessage PINGREQ = new MqttMessage(
            new MqttFixedHeader(MqttMessageType.PINGREQ, false, MqttQoS.AT_MOST_ONCE, false, 0));
    private static final MqttMessage DISCONNECT = new MqttMessage(
            new MqttFixedHeader(MqttMessageType.DISCONNECT, false, MqttQoS.AT_MOST_ONCE, false, 0));

    private final InetSocketAddress broker;
    private final String clientId;
    private final Duration keepAlive;
    private final Duration reconnectDelay;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger messageIds = new AtomicInteger();

    private volatile PubSubListener listener;
    private volatile Channel channel;
    private volatile boolean sessionUp;

    public NettyMqttPubSubEndpoint(InetSocketAddress broker,
                                   String clientId,
                                   Duration keepAlive,
                                   Duration reconnectDelay)
    {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.keepAlive = Objects.requireNonNullElse(keepAlive, DEFAULT_KEEP_ALIVE);
        this.reconnectDelay = Objects.requireNonNullElse(reconnectDelay, DEFAULT_RECONNECT_DELAY);
        if (this.keepAlive.getSeconds() <= 0 || this.keepAlive.getSeconds() > 65535) {
            throw new IllegalArgumentException("keepAlive must be 1..65535 seconds");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new MqttDecoder());
                        p.addLast(MqttEncoder.INSTANCE);
                        p.addLast(new IdleStateHandler(
                                readerIdleMillis(), NettyMqttPubSubEndpoint.this.keepAlive.toMillis(), 0,
                                TimeUnit.MILLISECONDS));
                        p.addLast(newClientHandler());
                    }
                });
    }

    @Override
    public void setListener(PubSubListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (running.compareAndSet(false, true)) {
            connect();
        }
    }

    @Override
    public void stop()
    {
        if (!running.compareAndSet(true, false)) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            return;
        }
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            if (sessionUp) {
                ch.writeAndFlush(DISCONNECT).awaitUninterruptibly(1, TimeUnit.SECONDS);
            }
            ch.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
        }
        sessionUp = false;
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    @Override
    public void subscribe(String topic)
    {
        Objects.requireNonNull(topic, "topic");
        Channel ch = channel;
        if (ch == null || !sessionUp) {
            return;
        }
        ch.writeAndFlush(MqttMessageBuilders.subscribe()
                .messageId(nextMessageId())
                .addSubscription(MqttQoS.AT_MOST_ONCE, topic)
                .build());
        log(LogLevel.DEBUG, "Subscribing to " + topic);
    }

    @Override
    public void publish(String topic, byte[] payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        Channel ch = channel;
        if (ch == null || !sessionUp) {
            log(LogLevel.NOTICE, "Not connected, dropping publish to " + topic);
            return;
        }
        ch.writeAndFlush(MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_MOST_ONCE)
                .retained(false)
                .payload(Unpooled.wrappedBuffer(payload))
                .build());
    }

    private void connect()
    {
        if (!running.get()) {
            return;
        }
        log(LogLevel.INFO, "Connecting to " + broker);
        ChannelFuture f = bootstrap.connect(broker);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
            }
            else {
                log(LogLevel.ERROR, "Connection to " + broker + " failed: " + future.cause());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect()
    {
        if (running.get() && !group.isShuttingDown()) {
            group.schedule(this::connect, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Handler for one broker connection; the pipeline needs the MQTT codec
     * in front of it.
     */
    ChannelHandler newClientHandler()
    {
        return new ClientHandler();
    }

    long readerIdleMillis()
    {
        return keepAlive.toMillis() * 3 / 2;
    }

    private int nextMessageId()
    {
        // Message ids are 1..65535.
        return (messageIds.getAndIncrement() & 0xFFFF) % 0xFFFF + 1;
    }

    private void log(LogLevel level, String message)
    {
        PubSubListener l = listener;
        if (l != null) {
            l.onLog(level, message);
        }
    }

    private PubSubListener requireListener()
    {
        PubSubListener l = listener;
        if (l == null) {
            throw new IllegalStateException("PubSubListener must be set before start()");
        }
        return l;
    }

    /**
     * Drives one broker connection: CONNECT on activation, CONNACK to
     * {@code onConnected}, PUBLISH to {@code onMessage}, keep-alive pings.
     */
    private final class ClientHandler extends SimpleChannelInboundHandler<MqttMessage>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            ctx.writeAndFlush(MqttMessageBuilders.connect()
                    .protocolVersion(MqttVersion.MQTT_3_1_1)
                    .clientId(clientId)
                    .cleanSession(true)
                    .keepAlive((int) keepAlive.getSeconds())
                    .build());
            log(LogLevel.DEBUG, "Sending CONNECT (" + clientId + ")");
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg)
        {
            if (msg.decoderResult().isFailure()) {
                log(LogLevel.ERROR, "Undecodable packet: " + msg.decoderResult().cause());
                ctx.close();
                return;
            }

            MqttMessageType type = msg.fixedHeader().messageType();
            switch (type) {
                case CONNACK -> onConnAck(ctx, (MqttConnAckMessage) msg);
                case PUBLISH -> onPublish((MqttPublishMessage) msg);
                case SUBACK -> log(LogLevel.DEBUG, "Received SUBACK");
                case PINGRESP -> log(LogLevel.DEBUG, "Received PINGRESP");
                default -> log(LogLevel.DEBUG, "Ignoring " + type);
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent idle) {
                if (idle.state() == IdleState.WRITER_IDLE) {
                    ctx.writeAndFlush(PINGREQ);
                    log(LogLevel.DEBUG, "Sending PINGREQ");
                } else if (idle.state() == IdleState.READER_IDLE) {
                    log(LogLevel.ERROR, "Broker silent for " + readerIdleMillis() + " ms, closing connection");
                    ctx.close();
                }
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            boolean wasUp = sessionUp;
            sessionUp = false;
            if (channel == ctx.channel()) {
                channel = null;
            }
            PubSubListener l = listener;
            if (wasUp && l != null) {
                l.onDisconnected(null);
            }
            scheduleReconnect();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log(LogLevel.ERROR, "Connection error: " + cause);
            ctx.close();
        }

        private void onConnAck(ChannelHandlerContext ctx, MqttConnAckMessage ack)
        {
            MqttConnectReturnCode code = ack.variableHeader().connectReturnCode();
            if (code != MqttConnectReturnCode.CONNECTION_ACCEPTED) {
                log(LogLevel.ERROR, "Broker refused connection: " + code);
                ctx.close();
                return;
            }
            sessionUp = true;
            channel = ctx.channel();
            PubSubListener l = listener;
            if (l != null) {
                l.onConnected();
            }
        }

        private void onPublish(MqttPublishMessage publish)
        {
            PubSubListener l = listener;
            if (l == null) {
                return;
            }
            String topic = publish.variableHeader().topicName();
            ByteBuf content = publish.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onMessage(topic, bytes);
        }
    }
}
