package com.questrail.alpaca.engine.state;

/**
 * Connection lifecycle of a managed device.
 */
public enum DeviceConnectionState {
    UNKNOWN,
    CONNECTING,
    CONNECTED,
    DISCONNECTED
}
