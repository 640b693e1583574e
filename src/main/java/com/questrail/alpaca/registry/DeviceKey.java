package com.questrail.alpaca.registry;

import java.util.Locale;
import java.util.Objects;

/**
 * Registry key: lower-case device type plus device number.
 */
public record DeviceKey(String type, int number) {

    public DeviceKey {
        Objects.requireNonNull(type, "type");
        type = type.toLowerCase(Locale.ROOT);
        if (number < 0) {
            throw new IllegalArgumentException("device number must be non-negative: " + number);
        }
    }

    public static DeviceKey of(String type, int number) {
        return new DeviceKey(type, number);
    }

    @Override
    public String toString() {
        return type + "-" + number;
    }
}
