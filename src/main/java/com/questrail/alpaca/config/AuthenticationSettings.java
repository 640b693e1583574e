package com.questrail.alpaca.config;

/**
 * HTTP Basic authentication settings. A single username/password pair guards
 * every route when enabled.
 */
public record AuthenticationSettings(
        boolean enabled,
        String username,
        String password,
        String realm
) {
    public static final String DEFAULT_REALM = "ASCOM Alpaca Server";

    static AuthenticationSettings disabled() {
        return new AuthenticationSettings(false, null, null, DEFAULT_REALM);
    }

    AuthenticationSettings withDefaults() {
        if (enabled && Settings.isBlank(username)) {
            throw new ConfigurationException("authentication.username is required when authentication is enabled");
        }
        return new AuthenticationSettings(
                enabled,
                username,
                password == null ? "" : password,
                Settings.orDefault(realm, DEFAULT_REALM));
    }

    @Override
    public String toString() {
        return "AuthenticationSettings[enabled=" + enabled + ", username=" + username + ", realm=" + realm + "]";
    }
}
