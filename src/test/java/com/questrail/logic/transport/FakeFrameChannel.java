package com.questrail.logic.transport;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FakeFrameChannel
 * -----------------------------------------------------------------------------
 * Test-only {@link FrameChannel} that appends every frame to an in-memory
 * buffer.
 *
 * <p>The header and payload of a frame are appended separately with no lock
 * held in between, so unserialized callers can interleave.
 * {@link #writeDelayMillis} widens that window.</p>
 */
public final class FakeFrameChannel implements FrameChannel {

    private final String id;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final AtomicInteger frames = new AtomicInteger();
    private volatile boolean open = true;
    private volatile long writeDelayMillis;

    public FakeFrameChannel() {
        this("fake");
    }

    public FakeFrameChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void writeFrame(long requestId, byte[] payload) {
        requireOpen();
        synchronized (out) {
            out.writeBytes(ByteBuffer.allocate(8).putInt((int) requestId).putInt(payload.length).array());
        }
        pause();
        synchronized (out) {
            out.writeBytes(payload);
        }
        frames.incrementAndGet();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public byte[] written() {
        synchronized (out) {
            return out.toByteArray();
        }
    }

    public int frameCount() {
        return frames.get();
    }

    public void setWriteDelayMillis(long millis) {
        this.writeDelayMillis = millis;
    }

    private void requireOpen() {
        if (!open) {
            throw new TransportException("channel " + id + " is closed");
        }
    }

    private void pause() {
        long delay = writeDelayMillis;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
