package com.questrail.alpaca.server;

import com.questrail.alpaca.api.AlpacaErrorCode;

import java.util.Objects;

/**
 * ASCOM-level failure raised by a request handler and turned into an error
 * envelope with HTTP status 200.
 */
public class AlpacaException extends RuntimeException {

    private final int errorNumber;

    public AlpacaException(AlpacaErrorCode code, String message) {
        this(Objects.requireNonNull(code, "code").number(), message, null);
    }

    public AlpacaException(int errorNumber, String message, Throwable cause) {
        super(message, cause);
        if (errorNumber == 0) {
            throw new IllegalArgumentException("errorNumber must be non-zero");
        }
        this.errorNumber = errorNumber;
    }

    public int errorNumber() {
        return errorNumber;
    }
}
