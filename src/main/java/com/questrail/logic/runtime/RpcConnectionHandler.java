package com.questrail.logic.runtime;

import com.questrail.logic.observability.ConnectionEvent;
import com.questrail.logic.observability.RpcErrorEvent;
import com.questrail.logic.observability.RpcObservabilitySink;
import com.questrail.logic.protocol.rpc.codec.EnvelopeEncodingException;
import com.questrail.logic.protocol.rpc.codec.MalformedEnvelopeException;
import com.questrail.logic.protocol.rpc.codec.RpcEnvelopeCodec;
import com.questrail.logic.protocol.rpc.codec.RpcFraming;
import com.questrail.logic.protocol.rpc.internal.dispatch.Dispatcher;
import com.questrail.logic.protocol.rpc.internal.dispatch.InFlightTracker;
import com.questrail.logic.protocol.rpc.model.CallRequest;
import com.questrail.logic.protocol.rpc.model.CallResponse;
import com.questrail.logic.protocol.rpc.model.RequestFrame;
import com.questrail.logic.protocol.rpc.model.RpcErrorKind;
import com.questrail.logic.transport.ConnectionListener;
import com.questrail.logic.transport.FrameChannel;
import com.questrail.logic.transport.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RpcConnectionHandler
 * =============================================================================
 * Per-connection request pipeline.
 *
 * <h2>Inbound flow</h2>
 * <pre>
 *   complete frame (from transport, in arrival order)
 *        → RpcFraming.decodeRequestFrame
 *            → RpcEnvelopeCodec.decodeRequest
 *                → Dispatcher.dispatch   (not awaited)
 * </pre>
 *
 * <p>The handler returns to the transport as soon as a call has been started,
 * so the next frame is read while earlier calls are still running. Calls may
 * therefore complete out of order; the caller matches responses by
 * {@code request_id}.</p>
 *
 * <h2>Outbound flow</h2>
 * Each completed call is encoded and handed to the connection's
 * {@link ResponseWriter}, which serializes frames under a per-connection lock.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>a payload that is not a valid request envelope is answered with a
 *       {@code VALIDATION_ERROR} response under the frame's request id</li>
 *   <li>a frame whose header is inconsistent closes the connection</li>
 *   <li>a response that cannot be encoded is replaced by a failure response
 *       naming the encoding error</li>
 * </ul>
 */
public final class RpcConnectionHandler implements ConnectionListener
{
    private static final Logger log = LoggerFactory.getLogger(RpcConnectionHandler.class);

    private final FrameChannel channel;
    private final ResponseWriter writer;
    private final RpcEnvelopeCodec codec;
    private final Dispatcher dispatcher;
    private final InFlightTracker inFlight;
    private final RpcObservabilitySink sink;
    private final int maxPayloadLength;

    private final AtomicInteger outstanding = new AtomicInteger();
    private volatile boolean closed;

    public RpcConnectionHandler(FrameChannel channel,
                                RpcEnvelopeCodec codec,
                                Dispatcher dispatcher,
                                RpcObservabilitySink sink,
                                int maxPayloadLength)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.writer = new ResponseWriter(channel);
        this.codec = Objects.requireNonNull(codec, "codec");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.inFlight = dispatcher.inFlight();
        this.sink = Objects.requireNonNull(sink, "sink");
        this.maxPayloadLength = maxPayloadLength;
    }

    public ConnectionState state()
    {
        if (closed) {
            return ConnectionState.CLOSED;
        }
        return outstanding.get() > 0 ? ConnectionState.DISPATCHING : ConnectionState.READING;
    }

    @Override
    public void onFrame(byte[] frame)
    {
        final RequestFrame requestFrame;
        try {
            requestFrame = RpcFraming.decodeRequestFrame(frame, maxPayloadLength);
        } catch (TransportException e) {
            sink.onError(new RpcErrorEvent(Instant.now(), "Bad frame on connection " + channel.id(), e));
            channel.close();
            return;
        }

        final long requestId = requestFrame.requestId();
        final CallRequest request;
        try {
            request = codec.decodeRequest(requestFrame.payload());
        } catch (MalformedEnvelopeException e) {
            CallResponse rejected = dispatcher.reject(
                    e.unifiedMsgOrigin().orElse(""),
                    RpcErrorKind.VALIDATION_ERROR,
                    "Malformed request: " + e.getMessage());
            begin();
            try {
                respond(requestId, rejected);
            } finally {
                end();
            }
            return;
        }

        begin();
        dispatcher.dispatch(request).whenComplete((response, error) -> {
            try {
                if (error != null) {
                    log.error("Dispatch of {}.{} failed unexpectedly", request.moduleId(), request.method(), error);
                    respond(requestId, CallResponse.failure(request.unifiedMsgOrigin(),
                            error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName()));
                }
                else {
                    respond(requestId, response);
                }
            } finally {
                end();
            }
        });
    }

    @Override
    public void onClosed(Throwable cause)
    {
        closed = true;
        sink.onConnectionEvent(new ConnectionEvent(
                Instant.now(),
                channel.id(),
                cause == null ? ConnectionEvent.Kind.CLOSED : ConnectionEvent.Kind.FAILED,
                cause));

        int pending = outstanding.get();
        if (pending > 0) {
            log.debug("Connection {} closed with {} calls outstanding", channel.id(), pending);
        }
    }

    private void respond(long requestId, CallResponse response)
    {
        byte[] payload;
        try {
            payload = codec.encodeResponse(response);
        } catch (EnvelopeEncodingException e) {
            log.error("Failed to encode response {} on connection {}", requestId, channel.id(), e);
            payload = codec.encodeResponse(CallResponse.failure(response.unifiedMsgOrigin(),
                    "Failed to encode response: " + e.getMessage()));
        }
        writer.write(requestId, payload);
    }

    private void begin()
    {
        outstanding.incrementAndGet();
        inFlight.begin();
    }

    private void end()
    {
        outstanding.decrementAndGet();
        inFlight.end();
    }
}
