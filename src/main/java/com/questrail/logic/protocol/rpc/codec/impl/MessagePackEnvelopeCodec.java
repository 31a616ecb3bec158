package com.questrail.logic.protocol.rpc.codec.impl;

import com.questrail.logic.protocol.rpc.codec.EnvelopeEncodingException;
import com.questrail.logic.protocol.rpc.codec.MalformedEnvelopeException;
import com.questrail.logic.protocol.rpc.codec.RpcEnvelopeCodec;
import com.questrail.logic.protocol.rpc.model.CallRequest;
import com.questrail.logic.protocol.rpc.model.CallResponse;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.Value;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MessagePackEnvelopeCodec
 * -----------------------------------------------------------------------------
 * {@link RpcEnvelopeCodec} backed by msgpack-core.
 *
 * <p>Each envelope is a single MessagePack map with snake_case string keys:</p>
 * <ul>
 *   <li>request: {@code module_id}, {@code method}, {@code unified_msg_origin}, {@code params}</li>
 *   <li>response: {@code ok}, {@code unified_msg_origin}, {@code data}, {@code error_message}</li>
 * </ul>
 *
 * <p>An absent response {@code data} is written as nil. Unknown keys are
 * ignored when decoding. The codec is stateless and thread-safe.</p>
 */
public final class MessagePackEnvelopeCodec implements RpcEnvelopeCodec
{
    static final String MODULE_ID = "module_id";
    static final String METHOD = "method";
    static final String UNIFIED_MSG_ORIGIN = "unified_msg_origin";
    static final String PARAMS = "params";
    static final String OK = "ok";
    static final String DATA = "data";
    static final String ERROR_MESSAGE = "error_message";

    @Override
    public byte[] encodeRequest(CallRequest request)
    {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packMapHeader(4);
            packer.packString(MODULE_ID).packString(request.moduleId());
            packer.packString(METHOD).packString(request.method());
            packer.packString(UNIFIED_MSG_ORIGIN).packString(request.unifiedMsgOrigin());
            packer.packString(PARAMS);
            MessagePackValues.pack(packer, request.params());
            return packer.toByteArray();
        } catch (IOException e) {
            throw new EnvelopeEncodingException("failed to encode request " + request.moduleId()
                    + "." + request.method(), e);
        }
    }

    @Override
    public CallRequest decodeRequest(byte[] payload)
    {
        Map<String, Value> fields = readEnvelope(payload, "request");

        String umo = stringOrNull(fields.get(UNIFIED_MSG_ORIGIN));
        String moduleId = requireString(fields, MODULE_ID, umo);
        String method = requireString(fields, METHOD, umo);
        if (umo == null) {
            throw new MalformedEnvelopeException("request field '" + UNIFIED_MSG_ORIGIN
                    + "' is missing or not a string", null);
        }

        Value params = fields.get(PARAMS);
        if (params == null || !params.isMapValue()) {
            throw new MalformedEnvelopeException("request field '" + PARAMS + "' is missing or not a map", umo);
        }

        try {
            return new CallRequest(moduleId, method, umo, MessagePackValues.toStringKeyedMap(params));
        } catch (IllegalArgumentException | MessagePackException e) {
            throw new MalformedEnvelopeException("request params unreadable: " + e.getMessage(), umo, e);
        }
    }

    @Override
    public byte[] encodeResponse(CallResponse response)
    {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packMapHeader(4);
            packer.packString(OK).packBoolean(response.ok());
            packer.packString(UNIFIED_MSG_ORIGIN).packString(response.unifiedMsgOrigin());
            packer.packString(DATA);
            MessagePackValues.pack(packer, response.data());
            packer.packString(ERROR_MESSAGE).packString(response.errorMessage());
            return packer.toByteArray();
        } catch (IOException e) {
            throw new EnvelopeEncodingException("failed to encode response", e);
        }
    }

    @Override
    public CallResponse decodeResponse(byte[] payload)
    {
        Map<String, Value> fields = readEnvelope(payload, "response");

        String umo = stringOrNull(fields.get(UNIFIED_MSG_ORIGIN));
        Value ok = fields.get(OK);
        if (ok == null || !ok.isBooleanValue()) {
            throw new MalformedEnvelopeException("response field '" + OK + "' is missing or not a boolean", umo);
        }
        if (umo == null) {
            throw new MalformedEnvelopeException("response field '" + UNIFIED_MSG_ORIGIN
                    + "' is missing or not a string", null);
        }
        String error = requireString(fields, ERROR_MESSAGE, umo);

        Value data = fields.get(DATA);
        Map<String, Object> decoded = null;
        if (data != null && !data.isNilValue()) {
            if (!data.isMapValue()) {
                throw new MalformedEnvelopeException("response field '" + DATA + "' is not a map", umo);
            }
            try {
                decoded = MessagePackValues.toStringKeyedMap(data);
            } catch (IllegalArgumentException | MessagePackException e) {
                throw new MalformedEnvelopeException("response data unreadable: " + e.getMessage(), umo, e);
            }
        }
        return new CallResponse(ok.asBooleanValue().getBoolean(), umo, decoded, error);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static Map<String, Value> readEnvelope(byte[] payload, String what)
    {
        final Value root;
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(payload)) {
            if (!unpacker.hasNext()) {
                throw new MalformedEnvelopeException(what + " payload is empty", null);
            }
            root = unpacker.unpackValue();
            if (unpacker.hasNext()) {
                throw new MalformedEnvelopeException(what + " payload has trailing bytes", null);
            }
        } catch (IOException | MessagePackException e) {
            throw new MalformedEnvelopeException(what + " payload is not valid MessagePack: " + e.getMessage(), null, e);
        }

        if (!root.isMapValue()) {
            throw new MalformedEnvelopeException(what + " payload is a " + root.getValueType()
                    + ", expected a map", null);
        }

        Map<String, Value> fields = new LinkedHashMap<>();
        for (Map.Entry<Value, Value> e : root.asMapValue().entrySet()) {
            if (e.getKey().isStringValue()) {
                fields.put(e.getKey().asStringValue().asString(), e.getValue());
            }
        }
        return fields;
    }

    private static String requireString(Map<String, Value> fields, String key, String umo)
    {
        String s = stringOrNull(fields.get(key));
        if (s == null) {
            throw new MalformedEnvelopeException("field '" + key + "' is missing or not a string", umo);
        }
        return s;
    }

    private static String stringOrNull(Value v)
    {
        if (v == null || !v.isStringValue()) {
            return null;
        }
        try {
            return v.asStringValue().asString();
        } catch (MessagePackException e) {
            return null;
        }
    }
}
