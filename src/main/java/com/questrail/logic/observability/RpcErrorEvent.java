package com.questrail.logic.observability;

import java.time.Instant;

/**
 * Record representing a server- or connection-scoped error.
 */
public record RpcErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
