package com.questrail.alpaca.transport.udp.netty;

import com.questrail.alpaca.transport.DatagramEndpoint;
import com.questrail.alpaca.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It never looks at
 * payload contents.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) MUST NOT
 * escape this package. Inbound payloads are copied into {@code byte[]}; all
 * reference-counted buffers are released here.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds asynchronously and reports the outcome to the listener.
 * - {@link #stop()} closes the channel and shuts the event loop down, waiting at
 *   most the configured shutdown bound. Reads are event-driven, so stopping never
 *   waits on a blocked receive call.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    public static final Duration DEFAULT_SHUTDOWN_BOUND = Duration.ofSeconds(1);

    private final InetSocketAddress bindAddress;
    private final Duration shutdownBound;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, false, DEFAULT_SHUTDOWN_BOUND);
    }

    /**
     * @param bindAddress   local address; port 0 binds an ephemeral port
     * @param broadcast     enable {@code SO_BROADCAST}; needed only by the discovery scanner
     * @param shutdownBound upper bound on the time {@link #stop()} waits for the event loop
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, boolean broadcast, Duration shutdownBound)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.shutdownBound = Objects.requireNonNull(shutdownBound, "shutdownBound");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, broadcast)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onTransportUp();
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly(shutdownBound.toMillis(), TimeUnit.MILLISECONDS);
        }

        // Quiet period 0: there is nothing in flight worth waiting for on a UDP socket.
        boolean terminated = group.shutdownGracefully(0, shutdownBound.toMillis(), TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(shutdownBound.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
            log.warn("UDP event loop on {} did not terminate within {}", bindAddress, shutdownBound);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            log.debug("Dropping datagram to {}: endpoint not bound", remote);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        if (ch == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((InetSocketAddress) ch.localAddress());
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * Copies each {@link DatagramPacket} payload into a {@code byte[]} and hands
     * it to the port listener. {@link SimpleChannelInboundHandler} releases the
     * packet afterwards.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
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
