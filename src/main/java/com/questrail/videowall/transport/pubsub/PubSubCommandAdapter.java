package com.questrail.videowall.transport.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.videowall.command.RemoteCommandHandler;
import com.questrail.videowall.control.DisplayControlState;
import com.questrail.videowall.control.MonitorStatus;
import com.questrail.videowall.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * PubSubCommandAdapter
 * =============================================================================
 * Connects a {@link PubSubEndpoint} to the monitor.
 *
 * <h2>Routing</h2>
 * <pre>
 *   checkup request topic  → JSON status summary on the checkup reply topic
 *   command topic          → RemoteCommandHandler (result is not published)
 *   event topics           → motion field == 1 sets the motion trigger
 * </pre>
 *
 * Subscriptions are (re)issued every time the endpoint reports a connection.
 * Payloads that cannot be parsed are logged and dropped; nothing a remote
 * publisher sends can escape this class as an exception.
 */
public final class PubSubCommandAdapter implements PubSubListener
{
    private static final Logger log = LoggerFactory.getLogger(PubSubCommandAdapter.class);

    public static final String DEFAULT_MOTION_FIELD = "ConfRm Motion";

    private final String name;
    private final PubSubEndpoint endpoint;
    private final PubSubTopics topics;
    private final RemoteCommandHandler handler;
    private final DisplayControlState control;
    private final Supplier<MonitorStatus> status;
    private final String motionField;

    public PubSubCommandAdapter(String name,
                                PubSubEndpoint endpoint,
                                PubSubTopics topics,
                                RemoteCommandHandler handler,
                                DisplayControlState control,
                                Supplier<MonitorStatus> status,
                                String motionField)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.control = Objects.requireNonNull(control, "control");
        this.status = Objects.requireNonNull(status, "status");
        this.motionField = Objects.requireNonNullElse(motionField, DEFAULT_MOTION_FIELD);

        this.endpoint.setListener(this);
    }

    public void start()
    {
        endpoint.start();
    }

    public void stop()
    {
        endpoint.stop();
    }

    @Override
    public void onConnected()
    {
        log.info("Connected to broker");
        for (String topic : topics.all()) {
            endpoint.subscribe(topic);
        }
    }

    @Override
    public void onDisconnected(Throwable cause)
    {
        if (cause != null) {
            log.warn("Disconnected from broker: {}", cause.toString());
        } else {
            log.info("Disconnected from broker");
        }
    }

    @Override
    public void onMessage(String topic, byte[] payload)
    {
        String text = new String(payload, StandardCharsets.UTF_8);
        try {
            if (topic.equals(topics.checkupRequest())) {
                log.info("Checkup requested");
                endpoint.publish(topics.checkupReply(), checkupReply());
            } else if (topic.equals(topics.command())) {
                log.info("Display commanded: {}", text);
                handler.apply(text);
            } else if (topics.events().contains(topic)) {
                log.debug("Event received on {}: {}", topic, text);
                if (isMotion(text)) {
                    log.info("Received motion");
                    control.triggerMotion();
                }
            } else {
                log.debug("Ignoring message on {}", topic);
            }
        } catch (RuntimeException e) {
            log.error("Handling message on {} failed", topic, e);
        }
    }

    @Override
    public void onLog(LogLevel level, String message)
    {
        switch (level) {
            case DEBUG -> log.debug("MQTT: {}", message);
            case INFO, NOTICE -> log.info("MQTT: {}", message);
            case ERROR -> log.error("MQTT: {}", message);
        }
    }

    /**
     * @return whether the event JSON carries the motion field with value 1
     */
    boolean isMotion(String json)
    {
        JsonNode data;
        try {
            data = Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed event: {}", e.getOriginalMessage());
            return false;
        }
        if (data == null || !data.isObject()) {
            return false;
        }
        JsonNode value = data.get(motionField);
        if (value == null) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.isNumber() && value.doubleValue() == 1.0;
    }

    byte[] checkupReply()
    {
        MonitorStatus s = status.get();
        ObjectNode reply = Jsons.mapper().createObjectNode();
        reply.put("name", name);
        reply.put("state", s.state().name());
        reply.put("automatic", s.automatic());
        reply.put("display_off", s.displayOff());
        reply.put("division", s.division().toString());
        reply.put("tiles", s.division().tileCount());
        reply.put("uptime_seconds", s.uptime().getSeconds());
        return Jsons.toJson(reply).getBytes(StandardCharsets.UTF_8);
    }
}
