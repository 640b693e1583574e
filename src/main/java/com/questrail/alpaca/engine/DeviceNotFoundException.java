package com.questrail.alpaca.engine;

/**
 * A device id, telescope id or telescope role is not registered.
 */
public final class DeviceNotFoundException extends DeviceEngineException {

    public DeviceNotFoundException(String message) {
        super(Kind.NOT_FOUND, message);
    }
}
