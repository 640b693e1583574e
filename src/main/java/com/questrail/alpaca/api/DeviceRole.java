package com.questrail.alpaca.api;

/**
 * Role a managed device plays inside a telescope pool.
 */
public enum DeviceRole {
    TELESCOPE("telescope"),
    CAMERA("camera"),
    DOME("dome"),
    FOCUSER("focuser"),
    FILTER_WHEEL("filterwheel"),
    ROTATOR("rotator"),
    SWITCH("switch"),
    SAFETY("safety"),
    OBSERVING_CONDITIONS("observingconditions"),
    COVER_CALIBRATOR("covercalibrator");

    private final String wireName;

    DeviceRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
