package com.questrail.videowall.command;

import com.questrail.videowall.auth.SecretSet;
import com.questrail.videowall.observability.CommandAcceptedEvent;
import com.questrail.videowall.observability.CommandRejectedEvent;
import com.questrail.videowall.observability.RecordingObservabilitySink;
import com.questrail.videowall.time.FixedWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.videowall.command.SignedCommands.NOW;
import static com.questrail.videowall.command.SignedCommands.SECRET;
import static com.questrail.videowall.command.SignedCommands.at;
import static org.junit.jupiter.api.Assertions.*;

class RemoteCommandHandlerTest {

    private final List<String> applied = new ArrayList<>();
    private final DisplayCommands commands = new DisplayCommands() {
        @Override
        public void restart() {
            applied.add("restart");
        }

        @Override
        public void enableAutomatic() {
            applied.add("auto");
        }

        @Override
        public void forceDisplay(boolean on) {
            applied.add(on ? "force-on" : "force-off");
        }
    };

    private FixedWallClock clock;
    private RecordingObservabilitySink sink;
    private RemoteCommandHandler handler;

    @BeforeEach
    void setUp() {
        clock = new FixedWallClock(Instant.ofEpochSecond(NOW));
        sink = new RecordingObservabilitySink();
        handler = new RemoteCommandHandler(
                new CommandEnvelopeParser(SecretSet.of(SECRET), clock, Duration.ofSeconds(7200)),
                commands, clock, sink);
    }

    @Test
    void dispatchesEachCommandKind() {
        assertTrue(handler.apply(at(NOW, "\"restart\": true")));
        assertTrue(handler.apply(at(NOW, "\"auto\": 1")));
        assertTrue(handler.apply(at(NOW, "\"force\": 1")));
        assertTrue(handler.apply(at(NOW, "\"force\": 0")));

        assertEquals(List.of("restart", "auto", "force-on", "force-off"), applied);
        assertEquals(4, sink.getAllEvents().stream().filter(CommandAcceptedEvent.class::isInstance).count());
    }

    @Test
    void authenticatedNoOpSucceedsWithoutAction() {
        assertTrue(handler.apply(at(NOW, "")));
        assertTrue(applied.isEmpty());
    }

    @Test
    void staleCommandReturnsFalseAndIsReported() {
        clock.advance(Duration.ofHours(3));
        assertFalse(handler.apply(at(NOW, "\"force\": 0")));
        assertTrue(applied.isEmpty());

        CommandRejectedEvent event = (CommandRejectedEvent) sink.getAllEvents().get(0);
        assertEquals(CommandRejectedException.Reason.STALE, event.reason());
    }

    @Test
    void garbageNeverThrows() {
        assertFalse(handler.apply(null));
        assertFalse(handler.apply(""));
        assertFalse(handler.apply("(not, json)"));
        assertFalse(handler.apply("({\"time\": 1}, AAAA)"));
        assertTrue(applied.isEmpty());
    }
}
