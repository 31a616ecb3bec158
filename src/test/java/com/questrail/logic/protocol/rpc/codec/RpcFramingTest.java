package com.questrail.logic.protocol.rpc.codec;

import com.questrail.logic.protocol.rpc.model.RequestFrame;
import com.questrail.logic.protocol.rpc.model.ResponseFrame;
import com.questrail.logic.transport.TransportException;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RpcFramingTest
{
    @Test
    void headerIsBigEndianIdThenLength()
    {
        byte[] frame = RpcFraming.encodeResponseFrame(new ResponseFrame(0x01020304L, new byte[] { 9, 8 }));

        assertArrayEquals(new byte[] { 1, 2, 3, 4, 0, 0, 0, 2, 9, 8 }, frame);
    }

    @Test
    void requestIdUsesFullUnsignedRange()
    {
        byte[] frame = RpcFraming.encodeRequestFrame(new RequestFrame(0xFFFF_FFFFL, new byte[0]));

        RequestFrame decoded = RpcFraming.decodeRequestFrame(frame, 16);
        assertEquals(0xFFFF_FFFFL, decoded.requestId());
        assertEquals(0, decoded.payload().length);
    }

    @Test
    void requestIdOutsideUInt32IsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new RequestFrame(-1, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new ResponseFrame(1L << 32, new byte[0]));
    }

    @Test
    void readsConsecutiveFramesUntilCleanEof() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(RpcFraming.encodeRequestFrame(new RequestFrame(1, new byte[] { 10 })));
        out.writeBytes(RpcFraming.encodeRequestFrame(new RequestFrame(2, new byte[] { 20, 21 })));
        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());

        RequestFrame first = RpcFraming.readRequestFrame(in).orElseThrow();
        RequestFrame second = RpcFraming.readRequestFrame(in).orElseThrow();
        Optional<RequestFrame> end = RpcFraming.readRequestFrame(in);

        assertEquals(1, first.requestId());
        assertArrayEquals(new byte[] { 10 }, first.payload());
        assertEquals(2, second.requestId());
        assertArrayEquals(new byte[] { 20, 21 }, second.payload());
        assertTrue(end.isEmpty());
    }

    @Test
    void truncatedHeaderIsAnError()
    {
        ByteArrayInputStream in = new ByteArrayInputStream(new byte[] { 0, 0, 0, 1, 0 });

        assertThrows(TransportException.class, () -> RpcFraming.readResponseFrame(in));
    }

    @Test
    void truncatedPayloadIsAnError()
    {
        byte[] frame = RpcFraming.encodeRequestFrame(new RequestFrame(7, new byte[] { 1, 2, 3 }));
        ByteArrayInputStream in = new ByteArrayInputStream(Arrays.copyOf(frame, frame.length - 1));

        TransportException e = assertThrows(TransportException.class, () -> RpcFraming.readRequestFrame(in));
        assertTrue(e.getMessage().contains("truncated"));
    }

    @Test
    void oversizePayloadIsRejectedBeforeReading()
    {
        byte[] header = { 0, 0, 0, 1, 0, 0, 1, 0 };

        assertThrows(TransportException.class,
                () -> RpcFraming.readRequestFrame(new ByteArrayInputStream(header), 255));
        assertThrows(TransportException.class, () -> RpcFraming.decodeRequestFrame(header, 255));
    }

    @Test
    void declaredLengthMustMatchFrame()
    {
        byte[] frame = RpcFraming.encodeRequestFrame(new RequestFrame(3, new byte[] { 1, 2 }));

        assertThrows(TransportException.class,
                () -> RpcFraming.decodeRequestFrame(Arrays.copyOf(frame, frame.length + 1), 64));
        assertThrows(TransportException.class, () -> RpcFraming.decodeRequestFrame(new byte[4], 64));
    }
}
