package com.questrail.logic.observability;

import com.questrail.logic.runtime.HookFailure;

/**
 * No-op implementation of RpcObservabilitySink.
 */
public final class NullObservabilitySink implements RpcObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ServerStateTransitionEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onCallCompleted(CallCompletedEvent event) {}

    @Override
    public void onHookFailure(HookFailure failure) {}

    @Override
    public void onError(RpcErrorEvent event) {}
}
