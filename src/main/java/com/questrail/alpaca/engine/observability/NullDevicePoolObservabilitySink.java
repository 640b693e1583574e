package com.questrail.alpaca.engine.observability;

/**
 * No-op implementation of {@link DevicePoolObservabilitySink}.
 */
public final class NullDevicePoolObservabilitySink implements DevicePoolObservabilitySink {
    public static final NullDevicePoolObservabilitySink INSTANCE = new NullDevicePoolObservabilitySink();

    private NullDevicePoolObservabilitySink() {}

    @Override
    public void onStateTransition(DeviceStateTransitionEvent event) {}

    @Override
    public void onHealthCheck(DeviceHealthCheckEvent event) {}

    @Override
    public void onError(DevicePoolErrorEvent event) {}
}
