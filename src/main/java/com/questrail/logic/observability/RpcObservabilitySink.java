package com.questrail.logic.observability;

import com.questrail.logic.runtime.HookFailure;

/**
 * Receives observability events from the RPC server.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive concurrently from I/O, worker, and supervisor
 * threads. Implementations must be thread-safe and must not block.</p>
 */
public interface RpcObservabilitySink {
    /**
     * Called when the server loop changes state.
     * @param event the transition
     */
    void onStateTransition(ServerStateTransitionEvent event);

    /**
     * Called when a connection opens or closes.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called once per dispatched request, successful or not.
     * @param event the call outcome
     */
    void onCallCompleted(CallCompletedEvent event);

    /**
     * Called for each lifecycle hook that threw.
     * @param failure the failed hook
     */
    void onHookFailure(HookFailure failure);

    /**
     * Called when a server-scoped error occurs, e.g. a bind failure.
     * @param event the error event
     */
    void onError(RpcErrorEvent event);
}
