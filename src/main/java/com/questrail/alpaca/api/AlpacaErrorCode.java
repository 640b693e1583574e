package com.questrail.alpaca.api;

/**
 * ASCOM Alpaca error numbers carried in the {@code ErrorNumber} field of every
 * response envelope.
 */
public enum AlpacaErrorCode {
    SUCCESS(0x000),
    NOT_IMPLEMENTED(0x400),
    INVALID_VALUE(0x401),
    VALUE_NOT_SET(0x402),
    NOT_CONNECTED(0x407),
    INVALID_WHILE_PARKED(0x408),
    INVALID_WHILE_SLAVED(0x409),
    INVALID_OPERATION(0x40B),
    ACTION_NOT_IMPLEMENTED(0x40C),
    UNSPECIFIED(0x4FF);

    private final int number;

    AlpacaErrorCode(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }
}
