package com.questrail.logic.protocol.rpc.model;

import java.util.Objects;

/**
 * One response frame: the echoed request id plus the encoded {@link CallResponse}.
 */
public record ResponseFrame(long requestId, byte[] payload) {
    public ResponseFrame {
        FrameIds.requireUInt32(requestId);
        Objects.requireNonNull(payload, "payload");
    }
}
