package com.questrail.logic.observability;

import com.questrail.logic.protocol.rpc.model.RpcErrorKind;
import com.questrail.logic.runtime.HookFailure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RpcObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRpcObservabilitySink implements RpcObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRpcObservabilitySink.class);

    @Override
    public void onStateTransition(ServerStateTransitionEvent event) {
        if (event.cause() != null) {
            log.error("RPC server state: {} -> {}", event.oldState(), event.newState(), event.cause());
        } else {
            log.info("RPC server state: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.kind()) {
            case OPENED -> log.debug("Connection {} opened", event.connectionId());
            case CLOSED -> log.debug("Connection {} closed", event.connectionId());
            case FAILED -> log.warn("Connection {} closed on transport error: {}",
                event.connectionId(),
                event.cause() != null ? event.cause().getMessage() : "unknown");
        }
    }

    @Override
    public void onCallCompleted(CallCompletedEvent event) {
        if (event.ok()) {
            log.debug("Call {}.{} [{}] ok in {} ms",
                event.moduleId(), event.method(), event.unifiedMsgOrigin(), event.elapsed().toMillis());
            return;
        }

        if (event.errorKind() == RpcErrorKind.HANDLER_ERROR) {
            log.error("Error calling {}.{} [{}]: {}",
                event.moduleId(), event.method(), event.unifiedMsgOrigin(), event.errorMessage(), event.failure());
        } else if (event.errorKind() == RpcErrorKind.TYPE_MISMATCH) {
            log.error("Call {}.{} [{}] violated its response contract: {}",
                event.moduleId(), event.method(), event.unifiedMsgOrigin(), event.errorMessage());
        } else {
            log.warn("Call {}.{} [{}] rejected ({}): {}",
                event.moduleId(), event.method(), event.unifiedMsgOrigin(), event.errorKind(), event.errorMessage());
        }
    }

    @Override
    public void onHookFailure(HookFailure failure) {
        log.error("Error in {} hook #{} of module {}",
            failure.phase(), failure.index(), failure.moduleId(), failure.cause());
    }

    @Override
    public void onError(RpcErrorEvent event) {
        log.error("RPC error: {}", event.message(), event.cause());
    }
}
