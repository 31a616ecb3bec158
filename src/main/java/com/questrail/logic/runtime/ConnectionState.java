package com.questrail.logic.runtime;

/**
 * Per-connection states.
 */
public enum ConnectionState
{
    /** Waiting for the next frame, no calls outstanding. */
    READING,

    /** One or more calls outstanding; reading continues meanwhile. */
    DISPATCHING,

    CLOSED
}
