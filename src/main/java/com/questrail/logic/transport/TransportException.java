package com.questrail.logic.transport;

/**
 * Connection-scoped transport failure: a truncated or oversized frame, or a
 * write to a closed connection.
 *
 * <p>It closes the affected connection only. Other connections and the
 * listener keep running.</p>
 */
public final class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
