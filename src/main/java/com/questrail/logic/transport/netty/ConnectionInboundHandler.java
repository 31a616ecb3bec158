package com.questrail.logic.transport.netty;

import com.questrail.logic.transport.ConnectionAcceptor;
import com.questrail.logic.transport.ConnectionListener;
import com.questrail.logic.transport.TransportException;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;

import java.util.Objects;

/**
 * ConnectionInboundHandler
 * -------------------------------------------------------------------------
 * Bridges one child channel to the {@link ConnectionListener} obtained from
 * the acceptor.
 *
 * <p>The first failure seen on the channel is remembered and handed to
 * {@link ConnectionListener#onClosed(Throwable)} once the channel goes
 * inactive; a clean close reports {@code null}.</p>
 */
final class ConnectionInboundHandler extends SimpleChannelInboundHandler<byte[]>
{
    private final ConnectionAcceptor acceptor;

    private ConnectionListener listener;
    private Throwable failure;

    ConnectionInboundHandler(ConnectionAcceptor acceptor)
    {
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        listener = acceptor.onConnection(new NettyFrameChannel(ctx.channel()));
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, byte[] frame)
    {
        if (listener != null) {
            listener.onFrame(frame);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        if (failure == null) {
            failure = classify(cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        ConnectionListener l = listener;
        listener = null;
        if (l != null) {
            l.onClosed(failure);
        }
        super.channelInactive(ctx);
    }

    private static Throwable classify(Throwable cause)
    {
        if (cause instanceof TransportException) {
            return cause;
        }
        if (cause instanceof TooLongFrameException) {
            return new TransportException("frame too long: " + cause.getMessage(), cause);
        }
        return new TransportException("connection failed: " + cause.getMessage(), cause);
    }
}
