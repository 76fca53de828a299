package com.questrail.videowall.transport.udp.netty;

import com.questrail.videowall.transport.DatagramEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.questrail.videowall.testing.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDatagramEndpointTest
 * -----------------------------------------------------------------------------
 * Exercises the real endpoint over the loopback interface.
 */
class NettyUdpDatagramEndpointTest {

    private final List<Received> received = new CopyOnWriteArrayList<>();
    private volatile boolean up;

    private NettyUdpDatagramEndpoint endpoint;
    private DatagramSocket client;

    record Received(SocketAddress remote, byte[] payload) {}

    @BeforeEach
    void setUp() throws Exception {
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        endpoint.setListener(new DatagramEndpointListener() {
            @Override public void onDatagram(SocketAddress remote, byte[] payload) {
                received.add(new Received(remote, payload));
            }
            @Override public void onTransportUp() { up = true; }
            @Override public void onTransportDown(Throwable cause) {}
        });
        endpoint.start();
        await("endpoint bound", () -> up && endpoint.localAddress() != null);

        client = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        client.setSoTimeout(5000);
    }

    @AfterEach
    void tearDown() {
        client.close();
        endpoint.stop();
    }

    private void sendFromClient(byte[] payload) throws Exception {
        client.send(new DatagramPacket(payload, payload.length, endpoint.localAddress()));
    }

    @Test
    void deliversDatagramWithSender() throws Exception {
        sendFromClient("(hello)".getBytes(StandardCharsets.UTF_8));

        await("datagram received", () -> !received.isEmpty());
        assertEquals("(hello)", new String(received.get(0).payload(), StandardCharsets.UTF_8));
        assertEquals(client.getLocalSocketAddress(), received.get(0).remote());
    }

    @Test
    void oversizedDatagramIsTruncated() throws Exception {
        byte[] big = new byte[1500];
        Arrays.fill(big, (byte) 'a');

        sendFromClient(big);

        await("datagram received", () -> !received.isEmpty());
        assertEquals(NettyUdpDatagramEndpoint.MAX_DATAGRAM_BYTES, received.get(0).payload().length);
    }

    @Test
    void repliesReachSender() throws Exception {
        sendFromClient("ping".getBytes(StandardCharsets.UTF_8));
        await("datagram received", () -> !received.isEmpty());

        endpoint.send(received.get(0).remote(), "OK".getBytes(StandardCharsets.US_ASCII));

        DatagramPacket reply = new DatagramPacket(new byte[16], 16);
        client.receive(reply);
        assertEquals("OK", new String(reply.getData(), 0, reply.getLength(), StandardCharsets.US_ASCII));
    }
}
