package com.questrail.logic.transport;

/**
 * Inbound half of one accepted connection.
 *
 * <p>Callbacks for a single connection arrive on one thread and in order.</p>
 */
public interface ConnectionListener
{
    /**
     * A complete frame, header included, as delimited by the transport.
     */
    void onFrame(byte[] frame);

    /**
     * The connection closed.
     *
     * @param cause {@code null} on a clean close at a frame boundary,
     *              otherwise the failure that ended the connection
     */
    void onClosed(Throwable cause);
}
