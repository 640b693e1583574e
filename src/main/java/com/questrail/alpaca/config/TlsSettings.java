package com.questrail.alpaca.config;

import java.util.List;

/**
 * HTTPS settings for the REST listener. Certificate provisioning is out of
 * scope; the files are read as-is.
 */
public record TlsSettings(
        boolean enabled,
        String certFile,
        String keyFile,
        String minVersion
) {
    public static final String DEFAULT_MIN_VERSION = "1.2";

    static TlsSettings disabled() {
        return new TlsSettings(false, null, null, DEFAULT_MIN_VERSION);
    }

    TlsSettings withDefaults() {
        String version = Settings.orDefault(minVersion, DEFAULT_MIN_VERSION);
        if (!enabled) {
            return new TlsSettings(false, certFile, keyFile, version);
        }
        if (Settings.isBlank(certFile) || Settings.isBlank(keyFile)) {
            throw new ConfigurationException("tls.cert_file and tls.key_file are required when TLS is enabled");
        }
        // Fails fast on an unsupported version.
        TlsSettings s = new TlsSettings(true, certFile, keyFile, version);
        s.enabledProtocols();
        return s;
    }

    /**
     * JSSE protocol names allowed by {@link #minVersion()}.
     */
    public List<String> enabledProtocols() {
        String v = minVersion.startsWith("TLSv") ? minVersion.substring(4) : minVersion;
        switch (v) {
            case "1.2":
                return List.of("TLSv1.3", "TLSv1.2");
            case "1.3":
                return List.of("TLSv1.3");
            default:
                throw new ConfigurationException("tls.min_version must be 1.2 or 1.3, got " + minVersion);
        }
    }
}
