package com.questrail.videowall.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.videowall.engine.EngineOptions;
import com.questrail.videowall.supervisor.RotationPolicy;
import com.questrail.videowall.transport.pubsub.PubSubTopics;
import com.questrail.videowall.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * VideoWallConfigLoader
 * =============================================================================
 * Reads a {@link VideoWallConfig} from a JSON document with snake_case keys.
 *
 * <pre>
 * {
 *   "name": "secmon00",
 *   "urls": ["rtsp://cam1/sub", "rtsp://cam2/sub"],
 *   "tokens": ["magld_..."],
 *   "mqtt_broker": "broker.local",
 *   "mqtt_port": 1883,
 *   "mqtt_timeout": 60,
 *   "splitter_refresh_rate": 300
 * }
 * </pre>
 *
 * Unknown keys are ignored. Every other problem (unreadable file, bad JSON,
 * missing or mistyped field, inconsistent values) is a {@link ConfigException}.
 */
public final class VideoWallConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(VideoWallConfigLoader.class);

    public static final Path DEFAULT_PATH = Path.of("mon_config.json");

    public VideoWallConfig load(Path file) throws ConfigException
    {
        log.debug("Loading configuration from {}", file);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        return parse(json);
    }

    public VideoWallConfig parse(String json) throws ConfigException
    {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Configuration must be a JSON object");
        }

        String name = requiredText(root, "name");
        try {
            RotationPolicy defaults = RotationPolicy.defaults();
            RotationPolicy rotation = new RotationPolicy(
                    defaults.tickInterval(),
                    optionalInt(root, "splitter_refresh_rate", defaults.refreshPeriodTicks()),
                    Duration.ofSeconds(optionalInt(root, "playing_timeout_seconds",
                            (int) defaults.playingTimeout().getSeconds())),
                    Duration.ofSeconds(optionalInt(root, "join_timeout_seconds",
                            (int) defaults.joinTimeout().getSeconds())),
                    defaults.pollInterval());

            EngineOptions engineDefaults = EngineOptions.defaults();
            EngineOptions engine = new EngineOptions(
                    Duration.ofSeconds(optionalInt(root, "network_timeout_seconds",
                            (int) engineDefaults.networkTimeout().getSeconds())),
                    optionalText(root, "mpv_profile", engineDefaults.profile()),
                    optionalText(root, "audio_output", engineDefaults.audioOutput()));

            PubSubTopics topicDefaults = PubSubTopics.defaults(name);
            PubSubTopics topics = new PubSubTopics(
                    optionalText(root, "checkup_request_topic", topicDefaults.checkupRequest()),
                    optionalText(root, "checkup_reply_topic", topicDefaults.checkupReply()),
                    optionalText(root, "command_topic", topicDefaults.command()),
                    root.has("event_topics") ? stringList(root, "event_topics") : topicDefaults.events());

            return VideoWallConfig.builder()
                    .withName(name)
                    .withUrls(stringList(root, "urls"))
                    .withTokens(stringList(root, "tokens"))
                    .withMqttBroker(requiredText(root, "mqtt_broker"))
                    .withMqttPort(optionalInt(root, "mqtt_port", VideoWallConfig.DEFAULT_MQTT_PORT))
                    .withMqttKeepAlive(Duration.ofSeconds(optionalInt(root, "mqtt_timeout",
                            (int) VideoWallConfig.DEFAULT_MQTT_KEEP_ALIVE.getSeconds())))
                    .withDivisionIndex(optionalInt(root, "division_index", VideoWallConfig.DEFAULT_DIVISION_INDEX))
                    .withUdpBind(optionalText(root, "udp_bind", VideoWallConfig.DEFAULT_UDP_BIND))
                    .withUdpPort(optionalInt(root, "udp_port", VideoWallConfig.DEFAULT_UDP_PORT))
                    .withMaxCommandSkew(Duration.ofSeconds(optionalInt(root, "max_command_skew_seconds",
                            (int) VideoWallConfig.DEFAULT_MAX_COMMAND_SKEW.getSeconds())))
                    .withIdleTimeoutSeconds(optionalInt(root, "idle_timeout_seconds",
                            VideoWallConfig.DEFAULT_IDLE_TIMEOUT_SECONDS))
                    .withMotionField(optionalText(root, "motion_field", "ConfRm Motion"))
                    .withTopics(topics)
                    .withMpvExecutable(optionalText(root, "mpv_executable", "mpv"))
                    .withEngineOptions(engine)
                    .withRotationPolicy(rotation)
                    .withDisplay(optionalText(root, "display", null))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static String requiredText(JsonNode root, String field) throws ConfigException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new ConfigException("Missing required field '" + field + "'");
        }
        if (!node.isTextual() || node.textValue().isBlank()) {
            throw new ConfigException("Field '" + field + "' must be a non-empty string");
        }
        return node.textValue();
    }

    private static String optionalText(JsonNode root, String field, String fallback) throws ConfigException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual()) {
            throw new ConfigException("Field '" + field + "' must be a string");
        }
        return node.textValue();
    }

    private static int optionalInt(JsonNode root, String field, int fallback) throws ConfigException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ConfigException("Field '" + field + "' must be an integer");
        }
        return node.intValue();
    }

    private static List<String> stringList(JsonNode root, String field) throws ConfigException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new ConfigException("Missing required field '" + field + "'");
        }
        if (!node.isArray()) {
            throw new ConfigException("Field '" + field + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ConfigException("Field '" + field + "' must be an array of strings");
            }
            out.add(element.textValue());
        }
        return out;
    }
}
