package com.questrail.logic.protocol.rpc.codec;

import com.questrail.logic.protocol.rpc.model.CallRequest;
import com.questrail.logic.protocol.rpc.model.CallResponse;

/**
 * RpcEnvelopeCodec
 * -----------------------------------------------------------------------------
 * Payload codec for call envelopes.
 *
 * <p>Operates on the payload only; the frame header is handled by
 * {@link RpcFraming}. The concrete binary map format is an implementation
 * choice. Only round-trip fidelity of the envelope fields and of
 * {@code params}/{@code data} contents is part of the contract.</p>
 */
public interface RpcEnvelopeCodec
{
    byte[] encodeRequest(CallRequest request);

    /**
     * @throws MalformedEnvelopeException if the payload is not a well-formed
     *         request envelope
     */
    CallRequest decodeRequest(byte[] payload);

    /**
     * @throws EnvelopeEncodingException if {@code data} holds a value the
     *         format cannot carry
     */
    byte[] encodeResponse(CallResponse response);

    /**
     * @throws MalformedEnvelopeException if the payload is not a well-formed
     *         response envelope
     */
    CallResponse decodeResponse(byte[] payload);
}
