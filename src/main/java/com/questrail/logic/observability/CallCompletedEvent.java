package com.questrail.logic.observability;

import com.questrail.logic.protocol.rpc.model.RpcErrorKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing the outcome of one dispatched call.
 *
 * @param errorKind {@code null} when {@code ok}
 * @param failure   the handler exception behind a {@code HANDLER_ERROR}, otherwise {@code null}
 */
public record CallCompletedEvent(
    Instant timestamp,
    String moduleId,
    String method,
    String unifiedMsgOrigin,
    boolean ok,
    RpcErrorKind errorKind,
    String errorMessage,
    Duration elapsed,
    Throwable failure
) {
}
