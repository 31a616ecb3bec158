package com.questrail.logic.transport.netty;

import com.questrail.logic.transport.ConnectionAcceptor;
import com.questrail.logic.transport.ListenerBinding;
import com.questrail.logic.transport.ServerEndpoint;
import com.questrail.logic.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyUnixServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link ServerEndpoint} port, listening on
 * a Unix domain stream socket through the native epoll transport.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode call envelopes</li>
 *   <li>Dispatch calls or interpret results</li>
 *   <li>Retry binds or writes</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound frames are delimited by {@link RequestFrameDecoder}, copied into
 * {@code byte[]} and handed to the {@link com.questrail.logic.transport.ConnectionListener}.
 * All reference-counted buffers are released internally.</p>
 *
 * <h2>Threading</h2>
 * A single {@link EpollEventLoopGroup} serves both the accept loop and every
 * connection's reads, so the acceptor and listeners are called on I/O threads
 * and must not block.
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind} may be called again after a previous binding closed.
 * - {@link #close()} shuts down the event loop group, closing every connection.
 */
public final class NettyUnixServerEndpoint implements ServerEndpoint
{
    private static final long SHUTDOWN_QUIET_PERIOD_MS = 0;
    private static final long SHUTDOWN_TIMEOUT_MS = 2_000;

    private final int maxPayloadLength;
    private final EventLoopGroup group;

    /**
     * @throws TransportException if the native epoll transport is not available
     *         on this platform
     */
    public NettyUnixServerEndpoint(int ioThreads, int maxPayloadLength)
    {
        if (!Epoll.isAvailable()) {
            throw new TransportException("native epoll transport unavailable", Epoll.unavailabilityCause());
        }
        if (ioThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be >= 1");
        }
        this.maxPayloadLength = maxPayloadLength;
        this.group = new EpollEventLoopGroup(ioThreads, new DefaultThreadFactory("logic-rpc-io"));
    }

    @Override
    public ListenerBinding bind(Path socketPath, ConnectionAcceptor acceptor) throws IOException
    {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(acceptor, "acceptor");

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(EpollServerDomainSocketChannel.class)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new RequestFrameDecoder(maxPayloadLength));
                        p.addLast(new ConnectionInboundHandler(acceptor));
                    }
                });

        ChannelFuture f = bootstrap.bind(new DomainSocketAddress(socketPath.toFile()));
        f.awaitUninterruptibly();

        if (!f.isSuccess()) {
            throw new IOException("bind failed on " + socketPath + ": " + f.cause().getMessage(), f.cause());
        }
        return new Binding(f.channel());
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(SHUTDOWN_QUIET_PERIOD_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly();
    }

    /**
     * Binding
     * -------------------------------------------------------------------------
     * Wraps the listening server channel. A close that {@link #close()} did not
     * ask for completes {@link #closeFuture()} exceptionally.
     */
    private static final class Binding implements ListenerBinding
    {
        private final Channel channel;
        private final CompletableFuture<Void> closed = new CompletableFuture<>();
        private volatile boolean closeRequested;

        Binding(Channel channel)
        {
            this.channel = channel;
            channel.closeFuture().addListener((ChannelFutureListener) ignored -> {
                if (closeRequested) {
                    closed.complete(null);
                }
                else {
                    closed.completeExceptionally(new TransportException("listener closed unexpectedly"));
                }
            });
        }

        @Override
        public CompletableFuture<Void> closeFuture()
        {
            return closed;
        }

        @Override
        public void close()
        {
            closeRequested = true;
            channel.close().awaitUninterruptibly();
        }
    }
}
