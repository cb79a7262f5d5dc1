package com.questrail.chamber.transport;

import java.net.SocketAddress;

/**
 * Callbacks from a {@link DatagramEndpoint}. Implementations deliver them one
 * at a time; the Netty endpoint uses its single event loop thread.
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause failure that took the transport down, {@code null} when it
     *              was stopped deliberately
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete inbound datagram. {@code payload} is owned by the callee.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
