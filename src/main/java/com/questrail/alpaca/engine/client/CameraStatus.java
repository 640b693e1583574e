package com.questrail.alpaca.engine.client;

import java.util.List;

/**
 * Camera snapshot.
 *
 * @param cameraState  Idle, Waiting, Exposing, Reading, Download or Error; empty when unknown
 * @param ccdTemperature degrees Celsius
 * @param coolerPower  percent
 */
public record CameraStatus(boolean connected,
                           String cameraState,
                           double ccdTemperature,
                           boolean coolerOn,
                           double coolerPower,
                           boolean imageReady,
                           int percentCompleted) {

    static final List<String> STATES = List.of("Idle", "Waiting", "Exposing", "Reading", "Download", "Error");

    static CameraStatus disconnected() {
        return new CameraStatus(false, "", 0, false, 0, false, 0);
    }
}
