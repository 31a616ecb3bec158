package com.questrail.logic.observability;

import com.questrail.logic.runtime.HookFailure;
import com.questrail.logic.runtime.ServerState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements RpcObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ServerStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onConnectionEvent(ConnectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCallCompleted(CallCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onHookFailure(HookFailure failure) {
        events.add(failure);
    }

    @Override
    public synchronized void onError(RpcErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized List<ServerState> getStates() {
        return events.stream()
            .filter(e -> e instanceof ServerStateTransitionEvent)
            .map(e -> ((ServerStateTransitionEvent) e).newState())
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
