package com.questrail.chamber.transport.udp.netty;

import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.status.StatusFixtures;
import com.questrail.chamber.status.StatusSnapshotCodec;
import com.questrail.chamber.transport.DatagramEndpointListener;
import com.questrail.chamber.transport.udp.UdpStatusBroadcaster;
import com.questrail.chamber.transport.udp.UdpStatusReceiver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDatagramEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback test: a broadcaster and a receiver, each on its own Netty endpoint
 * bound to an ephemeral port.
 */
class NettyUdpDatagramEndpointTest {

    private NettyUdpDatagramEndpoint receiverEndpoint;
    private NettyUdpDatagramEndpoint senderEndpoint;

    @AfterEach
    void tearDown() {
        if (senderEndpoint != null) {
            senderEndpoint.stop();
        }
        if (receiverEndpoint != null) {
            receiverEndpoint.stop();
        }
    }

    private static InetSocketAddress loopback() {
        return new InetSocketAddress("127.0.0.1", 0);
    }

    @Test
    void snapshotsCrossLoopback() throws Exception {
        StatusSnapshotCodec codec = new StatusSnapshotCodec();
        BlockingQueue<StatusSnapshot> received = new LinkedBlockingQueue<>();

        receiverEndpoint = new NettyUdpDatagramEndpoint(loopback());
        UdpStatusReceiver receiver = new UdpStatusReceiver(receiverEndpoint, codec, received::add);
        receiver.start();
        InetSocketAddress observer = receiverEndpoint.bound().get(5, TimeUnit.SECONDS);

        senderEndpoint = new NettyUdpDatagramEndpoint(loopback());
        UdpStatusBroadcaster broadcaster = new UdpStatusBroadcaster(senderEndpoint, codec, List.of(observer));
        broadcaster.start();
        senderEndpoint.bound().get(5, TimeUnit.SECONDS);

        // onTransportUp runs just after the bind future completes
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!broadcaster.isUp()) {
            assertTrue(System.nanoTime() < deadline, "broadcaster did not come up");
            Thread.sleep(10);
        }

        broadcaster.broadcast(StatusFixtures.snapshot(1));
        broadcaster.broadcast(StatusFixtures.snapshot(2));

        assertNotNull(received.poll(5, TimeUnit.SECONDS));
        assertNotNull(received.poll(5, TimeUnit.SECONDS));
        assertEquals(2, receiver.latest().sequenceNumber());
        assertEquals(observer, receiverEndpoint.localAddress());
    }

    @Test
    void startWithoutListenerFails() {
        receiverEndpoint = new NettyUdpDatagramEndpoint(loopback());

        assertThrows(IllegalStateException.class, () -> receiverEndpoint.start());
        assertNull(receiverEndpoint.localAddress());
    }

    @Test
    void bindConflictIsReportedAsTransportDown() throws Exception {
        receiverEndpoint = new NettyUdpDatagramEndpoint(loopback());
        receiverEndpoint.setListener(new QuietListener());
        receiverEndpoint.start();
        InetSocketAddress taken = receiverEndpoint.bound().get(5, TimeUnit.SECONDS);

        BlockingQueue<Throwable> downs = new LinkedBlockingQueue<>();
        senderEndpoint = new NettyUdpDatagramEndpoint(taken);
        senderEndpoint.setListener(new QuietListener() {
            @Override
            public void onTransportDown(Throwable cause) {
                downs.add(cause);
            }
        });
        senderEndpoint.start();

        assertThrows(ExecutionException.class, () -> senderEndpoint.bound().get(5, TimeUnit.SECONDS));
        assertNotNull(downs.poll(5, TimeUnit.SECONDS));
    }

    private static class QuietListener implements DatagramEndpointListener {
        @Override
        public void onTransportUp() {
        }

        @Override
        public void onTransportDown(Throwable cause) {
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
        }
    }
}
