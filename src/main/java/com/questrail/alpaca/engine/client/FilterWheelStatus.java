package com.questrail.alpaca.engine.client;

import java.util.List;

/**
 * Filter wheel snapshot; {@code position} is zero-based.
 */
public record FilterWheelStatus(boolean connected, int position, List<String> names) {

    public FilterWheelStatus {
        names = names == null ? List.of() : List.copyOf(names);
    }

    static FilterWheelStatus disconnected() {
        return new FilterWheelStatus(false, 0, List.of());
    }
}
