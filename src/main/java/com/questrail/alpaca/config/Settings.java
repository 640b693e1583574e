package com.questrail.alpaca.config;

import java.util.List;

/**
 * Defaulting helpers shared by the settings records.
 */
final class Settings {

    private Settings() {}

    static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }

    static <T> List<T> orDefault(List<T> value, List<T> fallback) {
        return value == null || value.isEmpty() ? List.copyOf(fallback) : List.copyOf(value);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
