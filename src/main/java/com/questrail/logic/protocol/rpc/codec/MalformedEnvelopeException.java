package com.questrail.logic.protocol.rpc.codec;

import java.util.Optional;

/**
 * A frame payload that could not be read as a call envelope.
 *
 * <p>Carries whatever {@code unified_msg_origin} could be recovered before the
 * failure so the error response can still be correlated by the caller.</p>
 */
public final class MalformedEnvelopeException extends RuntimeException
{
    private final String unifiedMsgOrigin;

    public MalformedEnvelopeException(String message, String unifiedMsgOrigin) {
        super(message);
        this.unifiedMsgOrigin = unifiedMsgOrigin;
    }

    public MalformedEnvelopeException(String message, String unifiedMsgOrigin, Throwable cause) {
        super(message, cause);
        this.unifiedMsgOrigin = unifiedMsgOrigin;
    }

    public Optional<String> unifiedMsgOrigin() {
        return Optional.ofNullable(unifiedMsgOrigin);
    }
}
