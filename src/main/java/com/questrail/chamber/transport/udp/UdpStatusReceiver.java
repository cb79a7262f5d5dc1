package com.questrail.chamber.transport.udp;

import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.status.SequencedStatusFilter;
import com.questrail.chamber.status.StatusSnapshotCodec;
import com.questrail.chamber.transport.DatagramEndpoint;
import com.questrail.chamber.transport.DatagramEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * UdpStatusReceiver
 * =============================================================================
 * Observer side of the status broadcast.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → StatusSnapshotCodec.decode
 *            → SequencedStatusFilter.accept
 *                → consumer
 * </pre>
 *
 * Undecodable datagrams are dropped. Snapshots not newer than the last one
 * accepted are dropped, so the consumer only ever sees increasing sequence
 * numbers.
 */
public final class UdpStatusReceiver implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpStatusReceiver.class);

    private final DatagramEndpoint endpoint;
    private final StatusSnapshotCodec codec;
    private final SequencedStatusFilter filter;
    private final Consumer<StatusSnapshot> consumer;

    public UdpStatusReceiver(DatagramEndpoint endpoint,
                             StatusSnapshotCodec codec,
                             Consumer<StatusSnapshot> consumer) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.filter = new SequencedStatusFilter();

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    /**
     * Latest accepted snapshot, {@code null} before the first one.
     */
    public StatusSnapshot latest() {
        return filter.latest();
    }

    @Override
    public void onTransportUp() {
        log.info("Status receiver listening");
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            log.warn("Status receiver transport down", cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        StatusSnapshot snapshot;
        try {
            snapshot = codec.decode(payload);
        } catch (IOException e) {
            log.debug("Dropping undecodable status datagram from {}: {}", remote, e.getMessage());
            return;
        }

        if (filter.accept(snapshot)) {
            consumer.accept(snapshot);
        } else {
            log.debug("Dropping stale status #{} (latest #{})",
                    snapshot.sequenceNumber(), filter.lastAcceptedSequence());
        }
    }
}
