package com.questrail.logic.protocol.rpc.model;

import java.util.Objects;

/**
 * One request frame: correlation id plus the encoded {@link CallRequest}.
 *
 * <p>The id is an unsigned 32-bit value held in a {@code long}.</p>
 */
public record RequestFrame(long requestId, byte[] payload) {
    public RequestFrame {
        FrameIds.requireUInt32(requestId);
        Objects.requireNonNull(payload, "payload");
    }
}
