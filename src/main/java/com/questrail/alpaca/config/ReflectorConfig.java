package com.questrail.alpaca.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ReflectorConfig
 * =============================================================================
 * Root of the reflector configuration, as bound from YAML by
 * {@link ReflectorConfigLoader}.
 *
 * <p>Instances straight from the loader may have missing sections and unset
 * fields. {@link #validate()} returns a normalized copy with every default
 * applied, or fails with a {@link ConfigurationException}. Everything
 * downstream only ever sees validated instances.</p>
 *
 * <h2>Fatal conditions</h2>
 * <ul>
 *   <li>no devices configured</li>
 *   <li>a repeated {@code (type, number)} pair</li>
 *   <li>an unknown global or per-device backend mode</li>
 *   <li>a network device without a URL; an mqtt device without a broker</li>
 * </ul>
 */
public record ReflectorConfig(
        ServerSettings server,
        AuthenticationSettings authentication,
        CorsSettings cors,
        TlsSettings tls,
        BackendSettings backend,
        List<DeviceSettings> devices
) {
    public ReflectorConfig validate() {
        ServerSettings s = (server == null ? ServerSettings.empty() : server).withDefaults();
        AuthenticationSettings a = (authentication == null ? AuthenticationSettings.disabled() : authentication).withDefaults();
        CorsSettings c = (cors == null ? CorsSettings.disabled() : cors).withDefaults();
        TlsSettings t = (tls == null ? TlsSettings.disabled() : tls).withDefaults();
        BackendSettings b = (backend == null ? BackendSettings.empty() : backend).withDefaults();

        if (devices == null || devices.isEmpty()) {
            throw new ConfigurationException("at least one device must be configured");
        }

        List<DeviceSettings> normalized = new ArrayList<>(devices.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < devices.size(); i++) {
            DeviceSettings raw = devices.get(i);
            if (raw == null) {
                throw new ConfigurationException("device " + i + ": empty entry");
            }
            DeviceSettings d = raw.withDefaults(i, b);
            String key = d.type() + "-" + d.number();
            if (!seen.add(key)) {
                throw new ConfigurationException(
                        "duplicate device: " + key + " (type=" + d.type() + ", number=" + d.number() + ")");
            }
            normalized.add(d);
        }

        return new ReflectorConfig(s, a, c, t, b, List.copyOf(normalized));
    }
}
