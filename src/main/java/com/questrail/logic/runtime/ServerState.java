package com.questrail.logic.runtime;

/**
 * Server loop states.
 *
 * <pre>
 *   STOPPED → STARTING → SERVING → (CRASHED → STARTING)* → STOPPING → STOPPED
 * </pre>
 */
public enum ServerState
{
    STOPPED,

    /** Running start hooks and binding the socket. */
    STARTING,

    /** Accepting connections. */
    SERVING,

    /** The last attempt failed; waiting out the restart backoff. */
    CRASHED,

    /** Draining calls and running shutdown hooks. */
    STOPPING
}
