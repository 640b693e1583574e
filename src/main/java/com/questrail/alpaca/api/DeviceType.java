package com.questrail.alpaca.api;

import java.util.Locale;
import java.util.Optional;

/**
 * DeviceType
 * -----------------------------------------------------------------------------
 * ASCOM device types known to the reflector, with the interface version each
 * one reports from {@code GET interfaceversion}.
 *
 * <p>Device types travel as lower-case strings on the wire. The registry keeps
 * the string so that a type missing from this table can still be exposed; it
 * then reports interface version 1.</p>
 */
public enum DeviceType {
    TELESCOPE("telescope", 3),
    CAMERA("camera", 3),
    DOME("dome", 2),
    FOCUSER("focuser", 3),
    FILTER_WHEEL("filterwheel", 2),
    ROTATOR("rotator", 2),
    SWITCH("switch", 2),
    SAFETY_MONITOR("safetymonitor", 1),
    OBSERVING_CONDITIONS("observingconditions", 1),
    COVER_CALIBRATOR("covercalibrator", 1);

    public static final int DEFAULT_INTERFACE_VERSION = 1;

    private final String wireName;
    private final int interfaceVersion;

    DeviceType(String wireName, int interfaceVersion) {
        this.wireName = wireName;
        this.interfaceVersion = interfaceVersion;
    }

    public String wireName() {
        return wireName;
    }

    public int interfaceVersion() {
        return interfaceVersion;
    }

    public static Optional<DeviceType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (DeviceType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Interface version for a wire type name; unknown types report
     * {@link #DEFAULT_INTERFACE_VERSION}.
     */
    public static int interfaceVersionOf(String name) {
        return fromWireName(name).map(DeviceType::interfaceVersion).orElse(DEFAULT_INTERFACE_VERSION);
    }
}
