package com.questrail.logic.transport;

import java.util.concurrent.CompletableFuture;

/**
 * A bound, accepting listener.
 */
public interface ListenerBinding
{
    /**
     * Completes when the listener stops accepting, whether through
     * {@link #close()} or a failure. A failure completes it exceptionally.
     */
    CompletableFuture<Void> closeFuture();

    /**
     * Stop accepting new connections. Connections already accepted stay open.
     * Idempotent.
     */
    void close();
}
