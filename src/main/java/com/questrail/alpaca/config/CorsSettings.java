package com.questrail.alpaca.config;

import java.util.List;

/**
 * Cross-origin settings. Defaults are filled only when CORS is enabled.
 */
public record CorsSettings(
        boolean enabled,
        List<String> allowedOrigins,
        List<String> allowedMethods,
        List<String> allowedHeaders,
        boolean allowCredentials,
        Integer maxAge
) {
    public static final List<String> DEFAULT_METHODS = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");
    public static final int DEFAULT_MAX_AGE_SECONDS = 3600;

    static CorsSettings disabled() {
        return new CorsSettings(false, List.of(), List.of(), List.of(), false, 0);
    }

    CorsSettings withDefaults() {
        if (!enabled) {
            return new CorsSettings(false,
                    Settings.orDefault(allowedOrigins, List.of()),
                    Settings.orDefault(allowedMethods, List.of()),
                    Settings.orDefault(allowedHeaders, List.of()),
                    allowCredentials,
                    maxAge == null ? 0 : maxAge);
        }
        return new CorsSettings(true,
                Settings.orDefault(allowedOrigins, List.of("*")),
                Settings.orDefault(allowedMethods, DEFAULT_METHODS),
                Settings.orDefault(allowedHeaders, List.of("*")),
                allowCredentials,
                maxAge == null || maxAge == 0 ? DEFAULT_MAX_AGE_SECONDS : maxAge);
    }
}
