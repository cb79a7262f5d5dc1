package com.questrail.chamber.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Port for a connectionless, message-oriented transport.
 *
 * <p>Status snapshots leave the controller through this port and observers
 * read them through it. It carries opaque byte arrays; encoding, sequencing
 * and filtering happen above it. The production implementation is the Netty
 * UDP endpoint, tests use an in-memory one.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Brings the transport up. The listener must already be installed and is
     * told once through {@link DatagramEndpointListener#onTransportUp()} when
     * the endpoint can send.
     */
    void start();

    /**
     * Takes the transport down and releases its resources. The listener sees
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} with a
     * {@code null} cause.
     */
    void stop();

    /**
     * Sends one datagram. Best effort: dropped silently while the endpoint
     * is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    void setListener(DatagramEndpointListener listener);
}
