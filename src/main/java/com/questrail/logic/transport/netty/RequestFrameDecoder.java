package com.questrail.logic.transport.netty;

import com.questrail.logic.protocol.rpc.codec.RpcFraming;
import com.questrail.logic.transport.TransportException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

import java.util.List;

/**
 * Delimits request frames on the inbound byte stream.
 *
 * <p>Each complete frame, header included, is copied into a {@code byte[]} and
 * passed up the pipeline. The pooled buffer is released here so nothing
 * reference-counted leaves the decoder.</p>
 *
 * <p>A payload longer than the configured maximum fails fast with
 * {@link io.netty.handler.codec.TooLongFrameException}. Bytes still buffered
 * when the peer closes mean the stream ended inside a frame; that is reported
 * as a {@link TransportException}.</p>
 */
final class RequestFrameDecoder extends LengthFieldBasedFrameDecoder
{
    RequestFrameDecoder(int maxPayloadLength)
    {
        super(maxPayloadLength + RpcFraming.HEADER_LENGTH,
                RpcFraming.LENGTH_FIELD_OFFSET,
                4,
                0,
                0);
    }

    @Override
    protected Object decode(ChannelHandlerContext ctx, ByteBuf in) throws Exception
    {
        ByteBuf frame = (ByteBuf) super.decode(ctx, in);
        if (frame == null) {
            return null;
        }
        try {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.readBytes(bytes);
            return bytes;
        } finally {
            frame.release();
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception
    {
        super.decodeLast(ctx, in, out);

        if (in.isReadable()) {
            int pending = in.readableBytes();
            in.skipBytes(pending);
            ctx.fireExceptionCaught(new TransportException(
                    "connection closed mid-frame with " + pending + " bytes pending"));
        }
    }
}
