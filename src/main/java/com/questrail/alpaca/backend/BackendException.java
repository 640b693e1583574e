package com.questrail.alpaca.backend;

import java.util.Objects;

/**
 * Failure of a backend call. The {@link Kind} decides which ASCOM error number
 * the caller sees.
 */
public final class BackendException extends Exception {

    public enum Kind {
        /** Backend transport is not connected. */
        NOT_CONNECTED,
        /** No answer within the configured timeout. */
        TIMEOUT,
        /** Backend unreachable or answered with a non-200 status. */
        UNAVAILABLE,
        /** Backend answered with a non-zero ASCOM error number. */
        REMOTE_ERROR,
        /** Backend answer could not be understood. */
        PROTOCOL,
        /** Backend mode has no implementation. */
        NOT_IMPLEMENTED,
        /** Calling thread was interrupted. */
        INTERRUPTED
    }

    private final Kind kind;
    private final int remoteErrorNumber;

    public BackendException(Kind kind, String message) {
        this(kind, message, 0, null);
    }

    public BackendException(Kind kind, String message, Throwable cause) {
        this(kind, message, 0, cause);
    }

    public BackendException(Kind kind, String message, int remoteErrorNumber, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.remoteErrorNumber = remoteErrorNumber;
    }

    public static BackendException remoteError(int errorNumber, String errorMessage) {
        return new BackendException(Kind.REMOTE_ERROR,
                "ASCOM error " + errorNumber + ": " + errorMessage, errorNumber, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * ASCOM error number reported by the backend; 0 unless {@link Kind#REMOTE_ERROR}.
     */
    public int remoteErrorNumber() {
        return remoteErrorNumber;
    }

    /**
     * Whether another attempt could succeed. Remote ASCOM errors and protocol
     * errors are deterministic and are not retried.
     */
    public boolean isRetryable() {
        return kind == Kind.TIMEOUT || kind == Kind.UNAVAILABLE;
    }
}
