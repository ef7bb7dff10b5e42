package com.questrail.dap.protocol.transport.tcp.netty;

import com.questrail.dap.protocol.transport.ByteStreamEndpoint;
import com.questrail.dap.protocol.transport.ByteStreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpByteStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link ByteStreamEndpoint} port, connecting
 * to a debug adapter listening on a TCP socket.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse
 * frame headers or JSON; it moves bytes.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound buffers are copied into {@code byte[]}
 * and released internally.
 *
 * <h2>Ordering</h2>
 * All listener callbacks run on the channel's single event loop, so inbound
 * chunks are delivered serially and in stream order. Each outbound frame is
 * wrapped in one buffer and written with one {@code writeAndFlush}, which
 * keeps frames whole even with concurrent writers.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects asynchronously; the listener learns the outcome.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyTcpByteStreamEndpoint implements ByteStreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpByteStreamEndpoint.class);

    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean down = new AtomicBoolean();

    private volatile ByteStreamEndpointListener listener;
    private volatile Channel channel;

    /**
     * Construct an endpoint that connects to {@code remoteAddress} on {@link #start()}.
     *
     * <p>A dedicated single-threaded {@link NioEventLoopGroup} keeps the adapter
     * self-contained and gives the serialized delivery the port requires.</p>
     */
    public NettyTcpByteStreamEndpoint(InetSocketAddress remoteAddress)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(ByteStreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        ByteStreamEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.connect(remoteAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                down.set(false);
                l.onTransportUp();
            }
            else {
                reportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully();
        reportDown(null);
    }

    @Override
    public CompletableFuture<Void> write(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IllegalStateException("Not connected to " + remoteAddress);
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        ByteBuf buf = Unpooled.wrappedBuffer(frame);
        ch.writeAndFlush(buf).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            }
            else {
                written.completeExceptionally(future.cause());
            }
        }).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        return written;
    }

    private void reportDown(Throwable cause)
    {
        ByteStreamEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private ByteStreamEndpointListener requireListener()
    {
        ByteStreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("ByteStreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link ByteBuf}s and forwards raw bytes to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            ByteStreamEndpointListener l = listener;
            if (l == null || !content.isReadable()) {
                return;
            }

            // Copy out of the reference-counted buffer (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            try {
                l.onBytes(bytes);
            }
            catch (RuntimeException e) {
                // Not a channel fault; keep the connection open.
                log.warn("Listener for {} failed on {} inbound bytes", remoteAddress, bytes.length, e);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reportDown(cause);
            ctx.close();
        }
    }
}
