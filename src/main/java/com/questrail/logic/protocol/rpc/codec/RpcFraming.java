package com.questrail.logic.protocol.rpc.codec;

import com.questrail.logic.protocol.rpc.model.RequestFrame;
import com.questrail.logic.protocol.rpc.model.ResponseFrame;
import com.questrail.logic.transport.TransportException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * RpcFraming
 * -----------------------------------------------------------------------------
 * Wire framing for requests and responses.
 *
 * <p>Both directions share one layout, big-endian:</p>
 * <pre>
 *   request_id      uint32   caller-assigned, echoed in the response
 *   payload_length  uint32   byte length of the payload
 *   payload         bytes    MessagePack-encoded envelope
 * </pre>
 *
 * <p>The stream readers distinguish a clean end of stream before any header
 * byte, which is an ordinary close, from an end of stream inside a frame, which
 * is a {@link TransportException}.</p>
 */
public final class RpcFraming
{
    /** request_id plus payload_length. */
    public static final int HEADER_LENGTH = 8;

    /** Offset of payload_length within the header. */
    public static final int LENGTH_FIELD_OFFSET = 4;

    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 16 * 1024 * 1024;

    private RpcFraming() {}

    public static Optional<RequestFrame> readRequestFrame(InputStream in) throws IOException
    {
        return readRequestFrame(in, DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    /**
     * Read one request frame from a blocking stream.
     *
     * @return the frame, or {@link Optional#empty()} on clean end of stream
     * @throws TransportException on a truncated frame or an oversized payload
     */
    public static Optional<RequestFrame> readRequestFrame(InputStream in, int maxPayloadLength) throws IOException
    {
        return readRaw(in, maxPayloadLength).map(raw -> new RequestFrame(raw.requestId, raw.payload));
    }

    public static Optional<ResponseFrame> readResponseFrame(InputStream in) throws IOException
    {
        return readResponseFrame(in, DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    /**
     * Read one response frame from a blocking stream.
     *
     * @return the frame, or {@link Optional#empty()} on clean end of stream
     * @throws TransportException on a truncated frame or an oversized payload
     */
    public static Optional<ResponseFrame> readResponseFrame(InputStream in, int maxPayloadLength) throws IOException
    {
        return readRaw(in, maxPayloadLength).map(raw -> new ResponseFrame(raw.requestId, raw.payload));
    }

    /**
     * Parse a frame that the transport has already delimited.
     *
     * @throws TransportException if the declared length disagrees with the
     *         bytes supplied or exceeds {@code maxPayloadLength}
     */
    public static RequestFrame decodeRequestFrame(byte[] frame, int maxPayloadLength)
    {
        if (frame == null || frame.length < HEADER_LENGTH) {
            throw new TransportException("frame shorter than header: "
                    + (frame == null ? 0 : frame.length) + " bytes");
        }

        ByteBuffer buf = ByteBuffer.wrap(frame);
        long requestId = Integer.toUnsignedLong(buf.getInt());
        long payloadLength = Integer.toUnsignedLong(buf.getInt());

        checkLength(payloadLength, maxPayloadLength);
        if (payloadLength != frame.length - HEADER_LENGTH) {
            throw new TransportException("frame " + requestId + " declares " + payloadLength
                    + " payload bytes but carries " + (frame.length - HEADER_LENGTH));
        }

        byte[] payload = new byte[(int) payloadLength];
        buf.get(payload);
        return new RequestFrame(requestId, payload);
    }

    public static byte[] encodeRequestFrame(RequestFrame frame)
    {
        return encode(frame.requestId(), frame.payload());
    }

    public static byte[] encodeResponseFrame(ResponseFrame frame)
    {
        return encode(frame.requestId(), frame.payload());
    }

    private static byte[] encode(long requestId, byte[] payload)
    {
        return ByteBuffer.allocate(HEADER_LENGTH + payload.length)
                .putInt((int) requestId)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    private static void checkLength(long payloadLength, int maxPayloadLength)
    {
        if (payloadLength > maxPayloadLength) {
            throw new TransportException("payload length " + payloadLength
                    + " exceeds maximum " + maxPayloadLength);
        }
    }

    private static Optional<RawFrame> readRaw(InputStream in, int maxPayloadLength) throws IOException
    {
        int first = in.read();
        if (first < 0) {
            return Optional.empty();
        }

        byte[] header = new byte[HEADER_LENGTH];
        header[0] = (byte) first;
        readFully(in, header, 1, HEADER_LENGTH - 1, "header");

        ByteBuffer buf = ByteBuffer.wrap(header);
        long requestId = Integer.toUnsignedLong(buf.getInt());
        long payloadLength = Integer.toUnsignedLong(buf.getInt());
        checkLength(payloadLength, maxPayloadLength);

        byte[] payload = new byte[(int) payloadLength];
        readFully(in, payload, 0, payload.length, "payload of frame " + requestId);
        return Optional.of(new RawFrame(requestId, payload));
    }

    private static void readFully(InputStream in, byte[] dst, int off, int len, String what) throws IOException
    {
        int done = 0;
        while (done < len) {
            int n = in.read(dst, off + done, len - done);
            if (n < 0) {
                throw new TransportException("stream closed mid-frame: " + what + " truncated after "
                        + done + " of " + len + " bytes", new EOFException());
            }
            done += n;
        }
    }

    private record RawFrame(long requestId, byte[] payload) {}
}
