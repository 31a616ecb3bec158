package com.questrail.logic.transport.netty;

import com.questrail.logic.protocol.rpc.codec.RpcFraming;
import com.questrail.logic.transport.FrameChannel;
import com.questrail.logic.transport.TransportException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;

import java.util.Objects;

/**
 * {@link FrameChannel} over a Netty child channel.
 *
 * <p>Header and payload go into a single buffer handed to one
 * {@code writeAndFlush}. Netty never splits a message, so a frame written from
 * a worker thread cannot be broken up by a frame written on the event loop.</p>
 */
final class NettyFrameChannel implements FrameChannel
{
    private final Channel channel;

    NettyFrameChannel(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public String id()
    {
        return channel.id().asShortText();
    }

    @Override
    public void writeFrame(long requestId, byte[] payload)
    {
        if (!channel.isActive()) {
            throw new TransportException("connection " + id() + " is closed");
        }
        ByteBuf frame = channel.alloc().buffer(RpcFraming.HEADER_LENGTH + payload.length);
        frame.writeInt((int) requestId)
                .writeInt(payload.length)
                .writeBytes(payload);
        channel.writeAndFlush(frame);
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void close()
    {
        channel.close();
    }
}
