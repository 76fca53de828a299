package com.questrail.videowall.engine.mpv;

import com.questrail.videowall.engine.EngineException;
import com.questrail.videowall.engine.EngineOptions;
import com.questrail.videowall.engine.PlaybackStart;
import com.questrail.videowall.engine.RenderEngine;
import com.questrail.videowall.layout.TileGeometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * MpvProcessEngine
 * =============================================================================
 * {@link RenderEngine} backed by an {@code mpv} child process.
 *
 * <h2>Playback detection</h2>
 * mpv prints {@code --term-playing-msg} once the file starts playing. The
 * engine passes a fixed marker and watches the process output for it; the
 * output is drained continuously so the child never blocks on a full pipe.
 *
 * <h2>Window</h2>
 * Borderless, aspect ratio ignored, placed by the tile geometry string.
 */
public final class MpvProcessEngine implements RenderEngine
{
    private static final Logger log = LoggerFactory.getLogger(MpvProcessEngine.class);

    static final String PLAYING_MARKER = "VIDEOWALL-PLAYING";

    private static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private final String name;
    private final List<String> command;
    private final CountDownLatch playing = new CountDownLatch(1);

    private volatile Process process;

    MpvProcessEngine(String executable, String name, TileGeometry geometry, String url, EngineOptions options)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.command = commandLine(
                Objects.requireNonNull(executable, "executable"),
                Objects.requireNonNull(geometry, "geometry"),
                Objects.requireNonNull(url, "url"),
                Objects.requireNonNull(options, "options"));
    }

    static List<String> commandLine(String executable, TileGeometry geometry, String url, EngineOptions options)
    {
        List<String> args = new ArrayList<>();
        args.add(executable);
        args.add("--no-border");
        args.add("--no-keepaspect");
        args.add("--geometry=" + geometry.toGeometryString());
        args.add("--network-timeout=" + options.networkTimeout().toSeconds());
        args.add("--profile=" + options.profile());
        args.add("--ao=" + options.audioOutput());
        args.add("--term-playing-msg=" + PLAYING_MARKER);
        args.add(url);
        return List.copyOf(args);
    }

    @Override
    public void start()
    {
        if (process != null) {
            throw new IllegalStateException("engine " + name + " already started");
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            throw new EngineException("Failed to start mpv for " + name, e);
        }
        startOutputReader(process);
    }

    @Override
    public PlaybackStart awaitPlaying(Duration timeout) throws InterruptedException
    {
        Process p = process;
        if (p == null) {
            return PlaybackStart.ERROR;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        // Poll so an early exit is reported as ERROR instead of waiting out the timeout.
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (playing.await(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(200)), TimeUnit.NANOSECONDS)) {
                return PlaybackStart.PLAYING;
            }
            if (!p.isAlive()) {
                return PlaybackStart.ERROR;
            }
            if (deadline - System.nanoTime() <= 0) {
                return PlaybackStart.TIMEOUT;
            }
        }
    }

    @Override
    public boolean isAlive()
    {
        Process p = process;
        return p != null && p.isAlive();
    }

    @Override
    public void stop()
    {
        Process p = process;
        if (p == null || !p.isAlive()) {
            return;
        }
        p.destroy();
        try {
            if (!p.waitFor(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("mpv {} ignored terminate, killing", name);
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void kill()
    {
        Process p = process;
        if (p != null) {
            p.destroyForcibly();
        }
    }

    private void startOutputReader(Process p)
    {
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    if (line.contains(PLAYING_MARKER)) {
                        playing.countDown();
                    } else {
                        log.debug("[mpv {}] {}", name, line);
                    }
                }
            } catch (IOException e) {
                log.debug("mpv {} output closed: {}", name, e.getMessage());
            }
        }, "mpv-output-" + name);
        reader.setDaemon(true);
        reader.start();
    }
}
