package com.questrail.videowall.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop, so a listener must not block.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called once per received datagram with a copy of its payload.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
