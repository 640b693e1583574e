package com.questrail.alpaca.engine.client;

/**
 * Telescope snapshot. Coordinates: right ascension in hours, the rest in degrees.
 * When {@code connected} is false the other fields keep their defaults.
 */
public record TelescopeStatus(boolean connected,
                              boolean tracking,
                              boolean slewing,
                              boolean atPark,
                              double rightAscension,
                              double declination,
                              double altitude,
                              double azimuth) {

    static TelescopeStatus disconnected() {
        return new TelescopeStatus(false, false, false, false, 0, 0, 0, 0);
    }
}
