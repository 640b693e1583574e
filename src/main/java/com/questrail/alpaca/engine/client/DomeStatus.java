package com.questrail.alpaca.engine.client;

import java.util.List;

/**
 * Dome snapshot.
 *
 * @param shutterStatus Open, Closed, Opening, Closing or Error; empty when unknown
 */
public record DomeStatus(boolean connected,
                         boolean atHome,
                         boolean atPark,
                         boolean slewing,
                         double azimuth,
                         String shutterStatus) {

    static final List<String> SHUTTER_STATES = List.of("Open", "Closed", "Opening", "Closing", "Error");

    static DomeStatus disconnected() {
        return new DomeStatus(false, false, false, false, 0, "");
    }
}
