package com.questrail.logic.transport;

/**
 * FrameChannel
 * -----------------------------------------------------------------------------
 * Outbound half of one accepted connection.
 *
 * <p>Each {@link #writeFrame(long, byte[])} call reaches the peer as one
 * contiguous frame. Implementations do not order concurrent callers; callers
 * that share a channel across threads serialize their writes.</p>
 */
public interface FrameChannel
{
    /**
     * Short identifier used in log lines.
     */
    String id();

    /**
     * Write and flush one response frame: big-endian {@code request_id},
     * big-endian {@code payload_length}, then the payload bytes.
     *
     * @throws TransportException if the channel is closed
     */
    void writeFrame(long requestId, byte[] payload);

    boolean isOpen();

    void close();
}
