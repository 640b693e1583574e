package com.questrail.alpaca.engine.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of {@link DevicePoolObservabilitySink} that emits logs via SLF4J.
 */
public final class Slf4jDevicePoolObservabilitySink implements DevicePoolObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDevicePoolObservabilitySink.class);

    @Override
    public void onStateTransition(DeviceStateTransitionEvent event) {
        if (event.isDemotion()) {
            log.error("Device {} marked disconnected after {} consecutive health check failures",
                event.deviceId(), event.oldState().failCount() + 1);
            return;
        }
        log.info("Device {}: {} -> {}",
            event.deviceId(),
            event.oldState().connectionState(),
            event.newState().connectionState());
    }

    @Override
    public void onHealthCheck(DeviceHealthCheckEvent event) {
        if (event.healthy()) {
            log.debug("Device {} healthy ({})", event.deviceId(), event.duration());
        } else {
            log.warn("Device health check failed: device={} failCount={} reason={}",
                event.deviceId(), event.failCount(), event.reason());
        }
    }

    @Override
    public void onError(DevicePoolErrorEvent event) {
        log.error("Device pool error{}: {}",
            event.deviceId() == null ? "" : " on " + event.deviceId(),
            event.message(), event.cause());
    }
}
