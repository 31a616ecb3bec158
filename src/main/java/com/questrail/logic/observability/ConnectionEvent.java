package com.questrail.logic.observability;

import java.time.Instant;

/**
 * Record representing a connection lifecycle change.
 */
public record ConnectionEvent(
    Instant timestamp,
    String connectionId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        OPENED,
        /** Clean close at a frame boundary. */
        CLOSED,
        /** Closed because of a transport failure. */
        FAILED
    }
}
