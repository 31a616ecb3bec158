package com.questrail.logic.protocol.rpc.model;

/**
 * Range checks for unsigned 32-bit request ids.
 */
public final class FrameIds
{
    public static final long MAX_REQUEST_ID = 0xFFFF_FFFFL;

    private FrameIds() {}

    public static long requireUInt32(long requestId)
    {
        if (requestId < 0 || requestId > MAX_REQUEST_ID) {
            throw new IllegalArgumentException("requestId out of uint32 range: " + requestId);
        }
        return requestId;
    }
}
