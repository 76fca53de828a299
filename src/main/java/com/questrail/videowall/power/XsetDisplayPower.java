package com.questrail.videowall.power;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * XsetDisplayPower
 * =============================================================================
 * X11 DPMS control through the {@code xset} utility.
 *
 * <h2>Configuration</h2>
 * <pre>
 *   xset s off          screensaver disabled
 *   xset +dpms          DPMS enabled
 *   xset dpms 0 0 0     standby / suspend / off timers disabled
 * </pre>
 * After that the display only changes power state when told to
 * ({@code xset dpms force on|off}).
 *
 * <p>Support is probed once, lazily, with {@code xset q}: the display must
 * answer and report DPMS capability.</p>
 */
public final class XsetDisplayPower implements DisplayPower
{
    private static final Logger log = LoggerFactory.getLogger(XsetDisplayPower.class);

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    static final String CAPABLE_MARKER = "Display is capable of DPMS";

    private final String executable;
    private final String display;

    private volatile Boolean supported;

    /**
     * @param display X display name (e.g. {@code :0}); {@code null} inherits
     *                {@code DISPLAY} from the environment
     */
    public XsetDisplayPower(String display)
    {
        this("xset", display);
    }

    XsetDisplayPower(String executable, String display)
    {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.display = display;
    }

    @Override
    public boolean isSupported()
    {
        Boolean s = supported;
        if (s == null) {
            String query = run("q");
            s = query != null && query.contains(CAPABLE_MARKER);
            supported = s;
            if (!s) {
                log.warn("Display is not DPMS capable");
            }
            log.debug("DPMS capable: {}", s);
        }
        return s;
    }

    @Override
    public void configure()
    {
        if (!isSupported()) {
            return;
        }
        log.debug("Configuring DPMS");
        run("s", "off");
        run("+dpms");
        run("dpms", "0", "0", "0");
    }

    @Override
    public void forceOn()
    {
        if (isSupported()) {
            run("dpms", "force", "on");
        }
    }

    @Override
    public void forceOff()
    {
        if (isSupported()) {
            run("dpms", "force", "off");
        }
    }

    /**
     * Runs xset with the given arguments.
     *
     * @return captured output, or {@code null} if the command failed
     */
    private String run(String... args)
    {
        List<String> command = new ArrayList<>();
        command.add(executable);
        if (display != null && !display.isBlank()) {
            command.add("-display");
            command.add(display);
        }
        command.addAll(List.of(args));

        try {
            Process p = new ProcessBuilder(command).redirectErrorStream(true).start();
            // xset output fits in the pipe buffer, so waiting before reading cannot stall.
            if (!p.waitFor(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                log.warn("{} timed out", command);
                return null;
            }
            String output;
            try (InputStream in = p.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (p.exitValue() != 0) {
                log.warn("{} exited with {}: {}", command, p.exitValue(), output.strip());
                return null;
            }
            return output;
        } catch (IOException e) {
            log.warn("{} failed: {}", command, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", command);
            return null;
        }
    }
}
