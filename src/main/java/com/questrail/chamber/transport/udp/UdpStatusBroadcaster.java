package com.questrail.chamber.transport.udp;

import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.status.StatusBroadcaster;
import com.questrail.chamber.status.StatusSnapshotCodec;
import com.questrail.chamber.transport.DatagramEndpoint;
import com.questrail.chamber.transport.DatagramEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;

/**
 * UdpStatusBroadcaster
 * =============================================================================
 * Publishes every status snapshot as one JSON datagram to each configured
 * observer.
 *
 * <h2>Delivery</h2>
 * Fire and forget: UDP may drop, duplicate or reorder datagrams. Observers
 * restore order with the snapshot's sequence number (see
 * {@link com.questrail.chamber.status.SequencedStatusFilter}). Sends made
 * while the endpoint is down are dropped, never queued.
 *
 * <p>{@link #broadcast(StatusSnapshot)} only hands the payload to the
 * endpoint, so it never blocks the controller lock on the network.</p>
 */
public final class UdpStatusBroadcaster implements StatusBroadcaster, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpStatusBroadcaster.class);

    private final DatagramEndpoint endpoint;
    private final StatusSnapshotCodec codec;
    private final List<InetSocketAddress> observers;

    private volatile boolean up;

    public UdpStatusBroadcaster(DatagramEndpoint endpoint,
                                StatusSnapshotCodec codec,
                                List<InetSocketAddress> observers) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observers = List.copyOf(observers);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    @Override
    public void broadcast(StatusSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (!up || observers.isEmpty()) {
            return;
        }
        byte[] payload = codec.encode(snapshot);
        for (InetSocketAddress observer : observers) {
            endpoint.send(observer, payload);
        }
    }

    @Override
    public void onTransportUp() {
        up = true;
        log.info("Status broadcast up, {} observer(s)", observers.size());
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause != null) {
            log.warn("Status broadcast transport down", cause);
        } else {
            log.info("Status broadcast transport closed");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        // Outbound only.
        log.debug("Ignoring {} byte datagram from {}", payload.length, remote);
    }
}
