package com.questrail.alpaca.engine;

import java.util.Objects;

/**
 * Checked failure at the device pool boundary: pool management and every
 * Alpaca REST client call.
 */
public class DeviceEngineException extends Exception {

    public enum Kind {
        /** Device or telescope id is not registered. */
        NOT_FOUND,
        /** Device id is already registered. */
        ALREADY_REGISTERED,
        /** Discovery could not run. */
        DISCOVERY_FAILED,
        /** Connect was refused or the device did not answer. */
        CONNECTION_FAILED,
        /** Transport failure or non-2xx HTTP status. */
        TRANSPORT,
        /** Response body could not be parsed, or the request URL is invalid. */
        PROTOCOL,
        /** Device answered with a non-zero ASCOM error number. */
        DEVICE_ERROR,
        /** Calling thread was interrupted. */
        INTERRUPTED
    }

    private final Kind kind;
    private final int ascomErrorNumber;

    public DeviceEngineException(Kind kind, String message) {
        this(kind, message, 0, null);
    }

    public DeviceEngineException(Kind kind, String message, Throwable cause) {
        this(kind, message, 0, cause);
    }

    public DeviceEngineException(Kind kind, String message, int ascomErrorNumber, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ascomErrorNumber = ascomErrorNumber;
    }

    public Kind kind() {
        return kind;
    }

    /** ASCOM error number for {@link Kind#DEVICE_ERROR}; 0 otherwise. */
    public int ascomErrorNumber() {
        return ascomErrorNumber;
    }
}
