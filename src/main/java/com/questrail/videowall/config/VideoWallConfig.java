package com.questrail.videowall.config;

import com.questrail.videowall.engine.EngineOptions;
import com.questrail.videowall.layout.GridDivision;
import com.questrail.videowall.supervisor.RotationPolicy;
import com.questrail.videowall.transport.pubsub.PubSubTopics;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for the video wall runtime.
 *
 * <p>Only {@code name}, {@code urls}, {@code tokens} and {@code mqttBroker}
 * have no default.</p>
 */
public record VideoWallConfig(
    String name,
    List<String> urls,
    List<String> tokens,
    String mqttBroker,
    int mqttPort,
    Duration mqttKeepAlive,
    int divisionIndex,
    String udpBind,
    int udpPort,
    Duration maxCommandSkew,
    int idleTimeoutSeconds,
    String motionField,
    PubSubTopics topics,
    String mpvExecutable,
    EngineOptions engineOptions,
    RotationPolicy rotationPolicy,
    String display
) {
    public static final int DEFAULT_MQTT_PORT = 1883;
    public static final Duration DEFAULT_MQTT_KEEP_ALIVE = Duration.ofSeconds(60);
    public static final int DEFAULT_DIVISION_INDEX = 1;
    public static final String DEFAULT_UDP_BIND = "0.0.0.0";
    public static final int DEFAULT_UDP_PORT = 11017;
    public static final Duration DEFAULT_MAX_COMMAND_SKEW = Duration.ofSeconds(7200);
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 900;

    public VideoWallConfig {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        urls = List.copyOf(Objects.requireNonNull(urls, "urls"));
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        Objects.requireNonNull(mqttBroker, "mqttBroker");
        if (mqttBroker.isBlank()) {
            throw new IllegalArgumentException("mqttBroker must not be blank");
        }
        requirePort(mqttPort, "mqttPort");
        requirePort(udpPort, "udpPort");
        Objects.requireNonNull(mqttKeepAlive, "mqttKeepAlive");
        Objects.requireNonNull(udpBind, "udpBind");
        Objects.requireNonNull(maxCommandSkew, "maxCommandSkew");
        Objects.requireNonNull(motionField, "motionField");
        Objects.requireNonNull(topics, "topics");
        Objects.requireNonNull(mpvExecutable, "mpvExecutable");
        Objects.requireNonNull(engineOptions, "engineOptions");
        Objects.requireNonNull(rotationPolicy, "rotationPolicy");
        if (idleTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("idleTimeoutSeconds must be positive");
        }
        if (maxCommandSkew.isNegative()) {
            throw new IllegalArgumentException("maxCommandSkew must be non-negative");
        }

        GridDivision division = GridDivision.fromIndex(divisionIndex);
        if (urls.size() < division.tileCount()) {
            throw new IllegalArgumentException("division " + division + " needs "
                    + division.tileCount() + " urls, got " + urls.size());
        }
    }

    public GridDivision division()
    {
        return GridDivision.fromIndex(divisionIndex);
    }

    private static void requirePort(int port, String field)
    {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(field + " must be 1..65535, got " + port);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private List<String> urls;
        private List<String> tokens;
        private String mqttBroker;
        private int mqttPort = DEFAULT_MQTT_PORT;
        private Duration mqttKeepAlive = DEFAULT_MQTT_KEEP_ALIVE;
        private int divisionIndex = DEFAULT_DIVISION_INDEX;
        private String udpBind = DEFAULT_UDP_BIND;
        private int udpPort = DEFAULT_UDP_PORT;
        private Duration maxCommandSkew = DEFAULT_MAX_COMMAND_SKEW;
        private int idleTimeoutSeconds = DEFAULT_IDLE_TIMEOUT_SECONDS;
        private String motionField = "ConfRm Motion";
        private PubSubTopics topics;
        private String mpvExecutable = "mpv";
        private EngineOptions engineOptions = EngineOptions.defaults();
        private RotationPolicy rotationPolicy = RotationPolicy.defaults();
        private String display;

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withUrls(List<String> urls) {
            this.urls = urls;
            return this;
        }

        public Builder withTokens(List<String> tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder withMqttBroker(String mqttBroker) {
            this.mqttBroker = mqttBroker;
            return this;
        }

        public Builder withMqttPort(int mqttPort) {
            this.mqttPort = mqttPort;
            return this;
        }

        public Builder withMqttKeepAlive(Duration mqttKeepAlive) {
            this.mqttKeepAlive = mqttKeepAlive;
            return this;
        }

        public Builder withDivisionIndex(int divisionIndex) {
            this.divisionIndex = divisionIndex;
            return this;
        }

        public Builder withUdpBind(String udpBind) {
            this.udpBind = udpBind;
            return this;
        }

        public Builder withUdpPort(int udpPort) {
            this.udpPort = udpPort;
            return this;
        }

        public Builder withMaxCommandSkew(Duration maxCommandSkew) {
            this.maxCommandSkew = maxCommandSkew;
            return this;
        }

        public Builder withIdleTimeoutSeconds(int idleTimeoutSeconds) {
            this.idleTimeoutSeconds = idleTimeoutSeconds;
            return this;
        }

        public Builder withMotionField(String motionField) {
            this.motionField = motionField;
            return this;
        }

        public Builder withTopics(PubSubTopics topics) {
            this.topics = topics;
            return this;
        }

        public Builder withMpvExecutable(String mpvExecutable) {
            this.mpvExecutable = mpvExecutable;
            return this;
        }

        public Builder withEngineOptions(EngineOptions engineOptions) {
            this.engineOptions = engineOptions;
            return this;
        }

        public Builder withRotationPolicy(RotationPolicy rotationPolicy) {
            this.rotationPolicy = rotationPolicy;
            return this;
        }

        public Builder withDisplay(String display) {
            this.display = display;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is missing or invalid
         */
        public VideoWallConfig build() {
            if (name == null) {
                throw new IllegalArgumentException("name is required");
            }
            PubSubTopics t = topics != null ? topics : PubSubTopics.defaults(name);
            return new VideoWallConfig(name, urls, tokens, mqttBroker, mqttPort, mqttKeepAlive,
                    divisionIndex, udpBind, udpPort, maxCommandSkew, idleTimeoutSeconds, motionField,
                    t, mpvExecutable, engineOptions, rotationPolicy, display);
        }
    }
}
