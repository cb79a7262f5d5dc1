package com.questrail.chamber.transport.udp.netty;

import com.questrail.chamber.transport.DatagramEndpoint;
import com.questrail.chamber.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * Moves bytes and nothing else. Status snapshot encoding and sequence
 * filtering live in the broadcaster and receiver above the port.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound payloads are copied into {@code byte[]} before
 * they reach the listener.
 *
 * <h2>Lifecycle</h2>
 * One endpoint binds once. {@link #start()} binds asynchronously and completes
 * {@link #bound()} with the local address (useful with port 0);
 * {@link #stop()} closes the channel and releases the event loop thread.
 * Broadcast is enabled on the socket so observers may be a subnet broadcast
 * address.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;
    private final EventLoopGroup group;
    private final CompletableFuture<InetSocketAddress> bound = new CompletableFuture<>();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("chamber-udp", true));
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        if (bound.isDone()) {
            throw new IllegalStateException("endpoint already started");
        }

        new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                })
                .bind(bindAddress)
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        bound.completeExceptionally(future.cause());
                        l.onTransportDown(future.cause());
                        return;
                    }
                    channel = future.channel();
                    bound.complete((InetSocketAddress) channel.localAddress());
                    l.onTransportUp();
                });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            // channelInactive reports the transition to the listener.
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));
    }

    /**
     * Completes with the bound local address, or exceptionally if the bind
     * failed.
     */
    public CompletableFuture<InetSocketAddress> bound()
    {
        return bound;
    }

    /**
     * Local address once bound, {@code null} before.
     */
    public InetSocketAddress localAddress()
    {
        return bound.isDone() && !bound.isCompletedExceptionally() ? bound.join() : null;
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onDatagram(packet.sender(), ByteBufUtil.getBytes(packet.content()));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
