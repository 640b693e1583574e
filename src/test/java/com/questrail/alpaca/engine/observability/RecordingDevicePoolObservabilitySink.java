package com.questrail.alpaca.engine.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingDevicePoolObservabilitySink implements DevicePoolObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(DeviceStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onHealthCheck(DeviceHealthCheckEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(DevicePoolErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<DeviceStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof DeviceStateTransitionEvent)
            .map(e -> (DeviceStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<DeviceHealthCheckEvent> getHealthChecks() {
        return events.stream()
            .filter(e -> e instanceof DeviceHealthCheckEvent)
            .map(e -> (DeviceHealthCheckEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
