package com.questrail.logic.runtime;

import com.questrail.logic.protocol.rpc.codec.RpcFraming;
import com.questrail.logic.protocol.rpc.model.ResponseFrame;
import com.questrail.logic.transport.FakeFrameChannel;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseWriterTest
{
    @Test
    void writesHeaderAndPayloadAsOneFrame() throws IOException
    {
        FakeFrameChannel channel = new FakeFrameChannel();
        ResponseWriter writer = new ResponseWriter(channel);

        assertTrue(writer.write(77, new byte[] { 1, 2, 3 }));

        assertEquals(1, channel.frameCount());
        ResponseFrame frame = RpcFraming.readResponseFrame(new ByteArrayInputStream(channel.written())).orElseThrow();
        assertEquals(77, frame.requestId());
        assertArrayEquals(new byte[] { 1, 2, 3 }, frame.payload());
    }

    @Test
    void closedChannelDropsTheResponse()
    {
        FakeFrameChannel channel = new FakeFrameChannel();
        channel.close();

        assertFalse(new ResponseWriter(channel).write(1, new byte[] { 1 }));
        assertEquals(0, channel.written().length);
    }

    @Test
    void concurrentWritersNeverInterleaveFrames() throws Exception
    {
        FakeFrameChannel channel = new FakeFrameChannel();
        channel.setWriteDelayMillis(1);
        ResponseWriter writer = new ResponseWriter(channel);

        int writers = 8;
        int perWriter = 10;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            for (int w = 0; w < writers; w++) {
                final int base = w * perWriter;
                pool.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perWriter; i++) {
                        int id = base + i;
                        byte[] payload = new byte[id % 7 + 1];
                        Arrays.fill(payload, (byte) id);
                        writer.write(id, payload);
                    }
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        ByteArrayInputStream in = new ByteArrayInputStream(channel.written());
        Set<Long> seen = new HashSet<>();
        Optional<ResponseFrame> next;
        while ((next = RpcFraming.readResponseFrame(in)).isPresent()) {
            ResponseFrame frame = next.get();
            int id = (int) frame.requestId();
            assertEquals(id % 7 + 1, frame.payload().length);
            for (byte b : frame.payload()) {
                assertEquals((byte) id, b);
            }
            assertTrue(seen.add(frame.requestId()));
        }
        assertEquals(writers * perWriter, seen.size());
    }
}
