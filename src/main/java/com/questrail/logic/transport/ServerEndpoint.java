package com.questrail.logic.transport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * ServerEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a stream-socket listener on a filesystem path.
 *
 * <p>The endpoint may be bound repeatedly; each successful {@link #bind} yields
 * a fresh {@link ListenerBinding}. Higher layers decide when to rebind after a
 * failure. The endpoint never retries on its own.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test double.</p>
 */
public interface ServerEndpoint extends AutoCloseable
{
    /**
     * Bind and start accepting on {@code socketPath}.
     *
     * <p>The caller removes any stale file at the path beforehand.</p>
     *
     * @throws IOException if the bind fails
     */
    ListenerBinding bind(Path socketPath, ConnectionAcceptor acceptor) throws IOException;

    /**
     * Release all transport resources, closing any open connections.
     */
    @Override
    void close();
}
