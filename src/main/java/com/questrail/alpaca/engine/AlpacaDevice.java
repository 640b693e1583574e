package com.questrail.alpaca.engine;

import java.util.Locale;
import java.util.Objects;

/**
 * A device on some Alpaca server, as found by discovery or registered by hand.
 *
 * @param deviceId     {@code "{serverUrl}-{type}-{number}"} for discovered devices
 * @param serverUrl    base URL of the hosting server, no trailing slash
 * @param deviceType   lower-case Alpaca device type
 * @param deviceNumber device number on that server
 * @param name         display name, may be empty
 * @param uniqueId     UniqueID reported by the server, may be empty
 */
public record AlpacaDevice(String deviceId,
                           String serverUrl,
                           String deviceType,
                           int deviceNumber,
                           String name,
                           String uniqueId) {

    public AlpacaDevice {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(serverUrl, "serverUrl");
        Objects.requireNonNull(deviceType, "deviceType");
        while (serverUrl.endsWith("/")) {
            serverUrl = serverUrl.substring(0, serverUrl.length() - 1);
        }
        deviceType = deviceType.toLowerCase(Locale.ROOT);
        name = name == null ? "" : name;
        uniqueId = uniqueId == null ? "" : uniqueId;
    }

    public static String idFor(String serverUrl, String deviceType, int deviceNumber) {
        return serverUrl + "-" + deviceType.toLowerCase(Locale.ROOT) + "-" + deviceNumber;
    }

    /**
     * Device with the conventional id.
     */
    public static AlpacaDevice of(String serverUrl, String deviceType, int deviceNumber, String name, String uniqueId) {
        String base = serverUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return new AlpacaDevice(idFor(base, deviceType, deviceNumber), base, deviceType, deviceNumber, name, uniqueId);
    }

    /** {@code {serverUrl}/api/v1/{type}/{number}}. */
    public String apiBase() {
        return serverUrl + "/api/v1/" + deviceType + "/" + deviceNumber;
    }
}
