package com.questrail.logic.observability;

import com.questrail.logic.runtime.ServerState;

import java.time.Instant;

/**
 * Record representing a server loop state change.
 *
 * @param cause the failure behind a transition into {@code CRASHED}, otherwise {@code null}
 */
public record ServerStateTransitionEvent(
    Instant timestamp,
    ServerState oldState,
    ServerState newState,
    Throwable cause
) {
}
