package com.questrail.logic.runtime;

import com.questrail.logic.transport.FrameChannel;
import com.questrail.logic.transport.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes response frames onto one connection.
 *
 * <p>Calls on a connection finish on arbitrary threads. Each writer takes the
 * connection's lock, checks the connection is still open and hands the whole
 * frame to {@link FrameChannel#writeFrame(long, byte[])} before releasing it.
 * The lock is per connection; writers on different connections do not
 * contend.</p>
 *
 * <p>A write to a closed connection is dropped and logged at debug level.
 * There is no retry.</p>
 */
final class ResponseWriter
{
    private static final Logger log = LoggerFactory.getLogger(ResponseWriter.class);

    private final FrameChannel channel;
    private final ReentrantLock lock = new ReentrantLock();

    ResponseWriter(FrameChannel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * @return {@code true} if the frame was handed to the transport
     */
    boolean write(long requestId, byte[] payload)
    {
        lock.lock();
        try {
            if (!channel.isOpen()) {
                log.debug("Dropping response {} for closed connection {}", requestId, channel.id());
                return false;
            }
            channel.writeFrame(requestId, payload);
            return true;
        } catch (TransportException e) {
            log.debug("Dropping response {} on connection {}: {}", requestId, channel.id(), e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }
}
