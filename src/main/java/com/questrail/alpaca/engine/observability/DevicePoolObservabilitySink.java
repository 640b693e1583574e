package com.questrail.alpaca.engine.observability;

/**
 * Receives device pool observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DevicePoolObservabilitySink {
    /**
     * Called when a managed device's connection state changes.
     * @param event the transition details
     */
    void onStateTransition(DeviceStateTransitionEvent event);

    /**
     * Called after each health check of a connected device.
     * @param event the probe outcome
     */
    void onHealthCheck(DeviceHealthCheckEvent event);

    /**
     * Called when a pool operation or probe fails unexpectedly.
     * @param event the error details
     */
    void onError(DevicePoolErrorEvent event);
}
