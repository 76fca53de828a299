package com.questrail.videowall.transport.udp;

import com.questrail.videowall.command.RemoteCommandHandler;
import com.questrail.videowall.transport.DatagramEndpoint;
import com.questrail.videowall.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * UdpCommandAdapter
 * =============================================================================
 * Connects a {@link DatagramEndpoint} to the {@link RemoteCommandHandler}.
 *
 * <pre>
 *   datagram bytes
 *        → UTF-8 text
 *            → RemoteCommandHandler.apply
 *                → "OK" | "NO"  back to the sender
 * </pre>
 *
 * Every datagram gets exactly one reply; the reply says nothing about why a
 * command was refused.
 */
public final class UdpCommandAdapter implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpCommandAdapter.class);

    static final byte[] ACCEPTED = "OK".getBytes(StandardCharsets.US_ASCII);
    static final byte[] REFUSED = "NO".getBytes(StandardCharsets.US_ASCII);

    private final RemoteCommandHandler handler;
    private final DatagramEndpoint endpoint;

    public UdpCommandAdapter(RemoteCommandHandler handler, DatagramEndpoint endpoint)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");

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
    public void onTransportUp()
    {
        log.debug("UDP command transport up");
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        if (cause != null) {
            log.warn("UDP command transport down: {}", cause.toString());
        } else {
            log.debug("UDP command transport down");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        log.info("Received packet from {}", remote);
        String text = new String(payload, StandardCharsets.UTF_8);
        log.debug("Data: {}", text);

        boolean accepted;
        try {
            accepted = handler.apply(text);
        } catch (RuntimeException e) {
            log.error("Command from {} failed", remote, e);
            accepted = false;
        }
        endpoint.send(remote, accepted ? ACCEPTED : REFUSED);
    }
}
