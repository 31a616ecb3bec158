package com.questrail.logic.transport;

/**
 * Receives each accepted connection from a {@link ServerEndpoint}.
 */
@FunctionalInterface
public interface ConnectionAcceptor
{
    /**
     * Called on the I/O thread once per accepted connection. Must not block.
     *
     * @return the listener that will receive the connection's frames
     */
    ConnectionListener onConnection(FrameChannel channel);
}
