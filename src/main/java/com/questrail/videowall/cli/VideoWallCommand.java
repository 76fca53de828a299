package com.questrail.videowall.cli;

import ch.qos.logback.classic.Level;
import com.questrail.videowall.config.ConfigException;
import com.questrail.videowall.config.VideoWallConfig;
import com.questrail.videowall.config.VideoWallConfigLoader;
import com.questrail.videowall.observability.Slf4jObservabilitySink;
import com.questrail.videowall.runtime.VideoWallRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(
        name = "videowall",
        mixinStandardHelpOptions = true,
        description = "Tiled video wall supervisor with signed remote control"
)
public final class VideoWallCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(VideoWallCommand.class);

    static final String BASE_LOGGER = "com.questrail.videowall";
    static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(45);

    @Option(names = {"-c", "--config"}, description = "Configuration file (JSON)", defaultValue = "mon_config.json")
    Path config;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG level")
    boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            setLevel(Level.DEBUG);
        }

        VideoWallConfig loaded;
        try {
            loaded = new VideoWallConfigLoader().load(config);
        } catch (ConfigException e) {
            log.error("Configuration error in {}: {}", config, e.getMessage());
            return 1;
        }

        VideoWallRuntime runtime = VideoWallRuntime.builder()
                .withConfig(loaded)
                .withObservabilitySink(new Slf4jObservabilitySink())
                .build();

        Thread hook = new Thread(() -> {
            log.warn("Caught shutdown signal");
            runtime.requestExit();
            try {
                if (!runtime.awaitTermination(SHUTDOWN_WAIT)) {
                    log.warn("Shutdown did not finish within {}", SHUTDOWN_WAIT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "videowall-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        runtime.run();

        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running.
            log.debug("Shutdown in progress");
        }
        return 0;
    }

    private static void setLevel(Level level) {
        org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(level);
        } else {
            log.warn("Cannot change log level: logback is not the SLF4J binding");
        }
    }
}
