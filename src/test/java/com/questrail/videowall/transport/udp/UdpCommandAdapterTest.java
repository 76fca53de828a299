package com.questrail.videowall.transport.udp;

import com.questrail.videowall.auth.SecretSet;
import com.questrail.videowall.command.CommandEnvelopeParser;
import com.questrail.videowall.command.DisplayCommands;
import com.questrail.videowall.command.RemoteCommandHandler;
import com.questrail.videowall.time.FixedWallClock;
import com.questrail.videowall.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.videowall.command.SignedCommands.NOW;
import static com.questrail.videowall.command.SignedCommands.SECRET;
import static com.questrail.videowall.command.SignedCommands.at;
import static com.questrail.videowall.command.SignedCommands.frame;
import static org.junit.jupiter.api.Assertions.*;

class UdpCommandAdapterTest {

    private static final InetSocketAddress SENDER = new InetSocketAddress("127.0.0.1", 40000);

    private final List<Boolean> forced = new ArrayList<>();
    private FakeDatagramEndpoint endpoint;
    private UdpCommandAdapter adapter;

    @BeforeEach
    void setUp() {
        FixedWallClock clock = new FixedWallClock(Instant.ofEpochSecond(NOW));
        DisplayCommands commands = new DisplayCommands() {
            @Override public void restart() {}
            @Override public void enableAutomatic() {}
            @Override public void forceDisplay(boolean on) { forced.add(on); }
        };
        RemoteCommandHandler handler = new RemoteCommandHandler(
                new CommandEnvelopeParser(SecretSet.of(SECRET), clock, Duration.ofSeconds(7200)),
                commands, clock, null);
        endpoint = new FakeDatagramEndpoint();
        adapter = new UdpCommandAdapter(handler, endpoint);
        adapter.start();
    }

    private String lastReply() {
        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();
        FakeDatagramEndpoint.Sent last = sent.get(sent.size() - 1);
        assertEquals(SENDER, last.remote());
        return new String(last.payload(), StandardCharsets.US_ASCII);
    }

    @Test
    void acceptedCommandRepliesOk() {
        endpoint.injectDatagram(SENDER, at(NOW, "\"force\": 1").getBytes(StandardCharsets.UTF_8));

        assertEquals("OK", lastReply());
        assertEquals(List.of(true), forced);
    }

    @Test
    void staleCommandRepliesNo() {
        endpoint.injectDatagram(SENDER, at(NOW - 10_000, "\"force\": 1").getBytes(StandardCharsets.UTF_8));

        assertEquals("NO", lastReply());
        assertTrue(forced.isEmpty());
    }

    @Test
    void concatenatedJsonRepliesNo() {
        String line = frame("{\"time\": " + NOW + "} {\"force\": 0}");
        endpoint.injectDatagram(SENDER, line.getBytes(StandardCharsets.UTF_8));

        assertEquals("NO", lastReply());
        assertTrue(forced.isEmpty());
    }

    @Test
    void garbageRepliesNo() {
        endpoint.injectDatagram(SENDER, new byte[] {(byte) 0xff, 0x00, 0x41});
        assertEquals("NO", lastReply());
        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void stopStopsEndpoint() {
        adapter.stop();
        assertTrue(endpoint.isStopped());
    }
}
