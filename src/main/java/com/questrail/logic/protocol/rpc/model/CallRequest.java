package com.questrail.logic.protocol.rpc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound call envelope.
 *
 * <p>{@code unifiedMsgOrigin} is an opaque tag owned by the caller and echoed
 * back unchanged. {@code params} is untyped until the dispatcher decodes it
 * against the target method's parameter schema.</p>
 */
public record CallRequest(
    String moduleId,
    String method,
    String unifiedMsgOrigin,
    Map<String, Object> params
) {
    public CallRequest {
        Objects.requireNonNull(moduleId, "moduleId");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(unifiedMsgOrigin, "unifiedMsgOrigin");
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
