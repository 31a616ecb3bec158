package com.questrail.logic.protocol.rpc.codec.impl;

import com.questrail.logic.protocol.rpc.codec.EnvelopeEncodingException;

import org.msgpack.core.MessagePacker;
import org.msgpack.value.IntegerValue;
import org.msgpack.value.Value;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between plain Java values and MessagePack.
 *
 * <p>Supported Java types: {@code null}, {@link String}, {@link Boolean},
 * integral boxes and {@link BigInteger}, {@link Float}/{@link Double},
 * {@code byte[]}, {@link Collection} and {@link Map}.</p>
 *
 * <p>Decoding yields {@code Long} for integers that fit (otherwise
 * {@code BigInteger}), {@code Double} for floats, {@code ArrayList} for arrays
 * and insertion-ordered {@code LinkedHashMap} for maps.</p>
 */
final class MessagePackValues
{
    private MessagePackValues() {}

    static void pack(MessagePacker packer, Object value) throws IOException
    {
        if (value == null) {
            packer.packNil();
        }
        else if (value instanceof String s) {
            packer.packString(s);
        }
        else if (value instanceof Boolean b) {
            packer.packBoolean(b);
        }
        else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            packer.packLong(((Number) value).longValue());
        }
        else if (value instanceof BigInteger big) {
            packer.packBigInteger(big);
        }
        else if (value instanceof Double d) {
            packer.packDouble(d);
        }
        else if (value instanceof Float f) {
            packer.packFloat(f);
        }
        else if (value instanceof byte[] bytes) {
            packer.packBinaryHeader(bytes.length);
            packer.writePayload(bytes);
        }
        else if (value instanceof Map<?, ?> map) {
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> e : map.entrySet()) {
                pack(packer, e.getKey());
                pack(packer, e.getValue());
            }
        }
        else if (value instanceof Collection<?> list) {
            packer.packArrayHeader(list.size());
            for (Object item : list) {
                pack(packer, item);
            }
        }
        else {
            throw new EnvelopeEncodingException("cannot encode value of type " + value.getClass().getName());
        }
    }

    /**
     * @throws IllegalArgumentException for extension values, which have no
     *         plain Java counterpart
     */
    static Object toObject(Value val)
    {
        if (val == null || val.isNilValue()) {
            return null;
        }
        switch (val.getValueType()) {
            case STRING:
                return val.asStringValue().asString();
            case BINARY:
                return val.asBinaryValue().asByteArray();
            case BOOLEAN:
                return val.asBooleanValue().getBoolean();
            case INTEGER: {
                IntegerValue iv = val.asIntegerValue();
                return iv.isInLongRange() ? (Object) iv.toLong() : (Object) iv.toBigInteger();
            }
            case FLOAT:
                return val.asFloatValue().toDouble();
            case ARRAY: {
                List<Object> list = new ArrayList<>();
                for (Value item : val.asArrayValue()) {
                    list.add(toObject(item));
                }
                return list;
            }
            case MAP: {
                Map<Object, Object> map = new LinkedHashMap<>();
                for (Map.Entry<Value, Value> entry : val.asMapValue().entrySet()) {
                    map.put(toObject(entry.getKey()), toObject(entry.getValue()));
                }
                return map;
            }
            default:
                throw new IllegalArgumentException("unsupported MessagePack type " + val.getValueType());
        }
    }

    /**
     * Convert a MessagePack map whose keys must all be strings.
     *
     * @throws IllegalArgumentException on a non-string key
     */
    static Map<String, Object> toStringKeyedMap(Value val)
    {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<Value, Value> entry : val.asMapValue().entrySet()) {
            if (!entry.getKey().isStringValue()) {
                throw new IllegalArgumentException("map key " + entry.getKey() + " is not a string");
            }
            map.put(entry.getKey().asStringValue().asString(), toObject(entry.getValue()));
        }
        return map;
    }
}
