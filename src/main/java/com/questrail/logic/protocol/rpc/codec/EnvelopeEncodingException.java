package com.questrail.logic.protocol.rpc.codec;

/**
 * An envelope that could not be serialized, typically because a map holds a
 * value type the wire format has no representation for.
 */
public final class EnvelopeEncodingException extends RuntimeException
{
    public EnvelopeEncodingException(String message) {
        super(message);
    }

    public EnvelopeEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
