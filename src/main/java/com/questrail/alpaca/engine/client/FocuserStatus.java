package com.questrail.alpaca.engine.client;

/**
 * Focuser snapshot; temperature in degrees Celsius.
 */
public record FocuserStatus(boolean connected,
                            boolean isMoving,
                            int position,
                            int maxStep,
                            boolean tempComp,
                            double temperature) {

    static FocuserStatus disconnected() {
        return new FocuserStatus(false, false, 0, 0, false, 0);
    }
}
