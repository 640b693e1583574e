package com.questrail.alpaca.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop, so listeners must not block.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called once the socket is bound.
     */
    void onTransportUp();

    /**
     * Called when the socket becomes unusable.
     *
     * @param cause failure cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for each received datagram.
     *
     * <p>The payload is a private copy of the whole datagram and may be kept by
     * the listener.</p>
     *
     * @param remote  sender address
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
