package com.questrail.alpaca.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a UDP socket.
 *
 * <p>Used on both sides of Alpaca discovery: the reflector binds one on the
 * discovery port and answers probes; the device pool engine binds an ephemeral
 * one and broadcasts a probe. Neither side sees the socket implementation.</p>
 *
 * <p>Implementations may be backed by Netty or a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket and begin receiving datagrams.
     *
     * <p>On successful bind the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()}; on a failed bind via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the socket and release transport resources. Returns within a
     * bounded time even if the receive side is idle.
     */
    void stop();

    /**
     * Send one datagram. Silently dropped when the endpoint is not bound.
     *
     * @param remote  destination (unicast or broadcast address)
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle
     * events. Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound local address, once the endpoint is up.
     */
    Optional<InetSocketAddress> localAddress();
}
