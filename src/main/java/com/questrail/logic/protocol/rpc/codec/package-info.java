/**
 * RPC Codec
 * =============================================================================
 *
 * <p>Wire-level encoding for the local RPC protocol, in two layers:</p>
 *
 * <pre>
 *   byte stream
 *        → RpcFraming          (request_id, payload_length, payload)
 *            → RpcEnvelopeCodec  (payload ↔ CallRequest / CallResponse)
 *                → Dispatcher
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Framing knows nothing about envelope contents.</li>
 *   <li>The envelope codec knows nothing about request ids.</li>
 *   <li>Neither layer validates {@code params} against a handler schema; that
 *       happens in the dispatcher.</li>
 * </ul>
 */
package com.questrail.logic.protocol.rpc.codec;
