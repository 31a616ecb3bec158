package com.questrail.logic.protocol.rpc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound call envelope.
 *
 * <p>On success {@code data} holds the encoded handler result and
 * {@code errorMessage} is empty. On failure {@code data} is {@code null} and
 * {@code errorMessage} carries the reason.</p>
 */
public record CallResponse(
    boolean ok,
    String unifiedMsgOrigin,
    Map<String, Object> data,
    String errorMessage
) {
    public CallResponse {
        Objects.requireNonNull(unifiedMsgOrigin, "unifiedMsgOrigin");
        Objects.requireNonNull(errorMessage, "errorMessage");
        if (data != null) {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public static CallResponse success(String unifiedMsgOrigin, Map<String, Object> data) {
        return new CallResponse(true, unifiedMsgOrigin, Objects.requireNonNull(data, "data"), "");
    }

    public static CallResponse failure(String unifiedMsgOrigin, String errorMessage) {
        return new CallResponse(false, unifiedMsgOrigin, null, errorMessage);
    }
}
