package com.questrail.alpaca.engine.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.alpaca.engine.AlpacaDevice;
import com.questrail.alpaca.engine.DeviceEngineException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AlpacaDeviceClient
 * =============================================================================
 * Outbound Alpaca operations: the ones the device pool relies on and the
 * device verbs a coordinator issues through {@code DevicePoolEngine.client()}.
 *
 * <p>Implementations supply {@link #getConfiguredDevices}, {@link #get} and
 * {@link #put}; every verb and status getter is built on those three.</p>
 *
 * <h2>Errors</h2>
 * Every failure, whether transport, HTTP status, body format or an ASCOM
 * error, surfaces as a {@link DeviceEngineException}.
 *
 * <h2>Status getters</h2>
 * Status getters first read {@code connected}; a failure there is an error.
 * When the device is disconnected the remaining fields keep their defaults.
 * Every further property is best-effort: a failing read leaves its field at
 * the default.
 */
public interface AlpacaDeviceClient {

    /**
     * Devices listed by {@code GET {serverUrl}/management/v1/configureddevices}.
     */
    List<AlpacaDevice> getConfiguredDevices(String serverUrl) throws DeviceEngineException;

    /**
     * @return the {@code Value} of the response, or {@code null} when absent
     */
    JsonNode get(AlpacaDevice device, String member) throws DeviceEngineException;

    /**
     * @return the {@code Value} of the response, or {@code null} when absent
     */
    JsonNode put(AlpacaDevice device, String member, Map<String, String> params) throws DeviceEngineException;

    default void connect(AlpacaDevice device) throws DeviceEngineException {
        put(device, "connected", Map.of("Connected", "true"));
    }

    default void disconnect(AlpacaDevice device) throws DeviceEngineException {
        put(device, "connected", Map.of("Connected", "false"));
    }

    default boolean isConnected(AlpacaDevice device) throws DeviceEngineException {
        JsonNode value = get(device, "connected");
        if (value == null || !value.isBoolean()) {
            throw new DeviceEngineException(DeviceEngineException.Kind.PROTOCOL,
                    "connected of " + device.deviceId() + " is not a boolean: " + value);
        }
        return value.booleanValue();
    }

    default String getName(AlpacaDevice device) throws DeviceEngineException {
        return text(device, "name");
    }

    default String getDescription(AlpacaDevice device) throws DeviceEngineException {
        return text(device, "description");
    }

    private String text(AlpacaDevice device, String member) throws DeviceEngineException {
        JsonNode value = get(device, member);
        if (value == null || !value.isTextual()) {
            throw new DeviceEngineException(DeviceEngineException.Kind.PROTOCOL,
                    member + " of " + device.deviceId() + " is not a string: " + value);
        }
        return value.textValue();
    }

    // ---------------------------------------------------------------------
    // Telescope
    // ---------------------------------------------------------------------

    default TelescopeStatus getTelescopeStatus(AlpacaDevice device) throws DeviceEngineException {
        if (!isConnected(device)) {
            return TelescopeStatus.disconnected();
        }
        OptionalReads reads = new OptionalReads(this, device);
        return new TelescopeStatus(true,
                reads.bool("tracking"),
                reads.bool("slewing"),
                reads.bool("atpark"),
                reads.number("rightascension"),
                reads.number("declination"),
                reads.number("altitude"),
                reads.number("azimuth"));
    }

    default void slewToCoordinates(AlpacaDevice device, double rightAscension, double declination)
            throws DeviceEngineException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("RightAscension", Double.toString(rightAscension));
        params.put("Declination", Double.toString(declination));
        put(device, "slewtocoordinates", params);
    }

    default void park(AlpacaDevice device) throws DeviceEngineException {
        put(device, "park", Map.of());
    }

    default void unpark(AlpacaDevice device) throws DeviceEngineException {
        put(device, "unpark", Map.of());
    }

    default void setTracking(AlpacaDevice device, boolean tracking) throws DeviceEngineException {
        put(device, "tracking", Map.of("Tracking", Boolean.toString(tracking)));
    }

    default void abortSlew(AlpacaDevice device) throws DeviceEngineException {
        put(device, "abortslew", Map.of());
    }

    // ---------------------------------------------------------------------
    // Camera
    // ---------------------------------------------------------------------

    default CameraStatus getCameraStatus(AlpacaDevice device) throws DeviceEngineException {
        if (!isConnected(device)) {
            return CameraStatus.disconnected();
        }
        OptionalReads reads = new OptionalReads(this, device);
        int state = (int) reads.number("camerastate", -1);
        return new CameraStatus(true,
                state >= 0 && state < CameraStatus.STATES.size() ? CameraStatus.STATES.get(state) : "",
                reads.number("ccdtemperature"),
                reads.bool("cooleron"),
                reads.number("coolerpower"),
                reads.bool("imageready"),
                (int) reads.number("percentcompleted"));
    }

    default void startExposure(AlpacaDevice device, double durationSeconds, boolean light)
            throws DeviceEngineException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("Duration", Double.toString(durationSeconds));
        params.put("Light", Boolean.toString(light));
        put(device, "startexposure", params);
    }

    default void abortExposure(AlpacaDevice device) throws DeviceEngineException {
        put(device, "abortexposure", Map.of());
    }

    default void setCoolerOn(AlpacaDevice device, boolean coolerOn) throws DeviceEngineException {
        put(device, "cooleron", Map.of("CoolerOn", Boolean.toString(coolerOn)));
    }

    // ---------------------------------------------------------------------
    // Dome
    // ---------------------------------------------------------------------

    default DomeStatus getDomeStatus(AlpacaDevice device) throws DeviceEngineException {
        if (!isConnected(device)) {
            return DomeStatus.disconnected();
        }
        OptionalReads reads = new OptionalReads(this, device);
        boolean atHome = reads.bool("athome");
        boolean atPark = reads.bool("atpark");
        boolean slewing = reads.bool("slewing");
        double azimuth = reads.number("azimuth");
        int shutter = (int) reads.number("shutterstatus", -1);
        return new DomeStatus(true, atHome, atPark, slewing, azimuth,
                shutter >= 0 && shutter < DomeStatus.SHUTTER_STATES.size() ? DomeStatus.SHUTTER_STATES.get(shutter) : "");
    }

    default void slewDomeToAzimuth(AlpacaDevice device, double azimuth) throws DeviceEngineException {
        put(device, "slewtoazimuth", Map.of("Azimuth", Double.toString(azimuth)));
    }

    default void openShutter(AlpacaDevice device) throws DeviceEngineException {
        put(device, "openshutter", Map.of());
    }

    default void closeShutter(AlpacaDevice device) throws DeviceEngineException {
        put(device, "closeshutter", Map.of());
    }

    // ---------------------------------------------------------------------
    // Focuser
    // ---------------------------------------------------------------------

    default FocuserStatus getFocuserStatus(AlpacaDevice device) throws DeviceEngineException {
        if (!isConnected(device)) {
            return FocuserStatus.disconnected();
        }
        OptionalReads reads = new OptionalReads(this, device);
        return new FocuserStatus(true,
                reads.bool("ismoving"),
                (int) reads.number("position"),
                (int) reads.number("maxstep"),
                reads.bool("tempcomp"),
                reads.number("temperature"));
    }

    default void moveFocuser(AlpacaDevice device, int position) throws DeviceEngineException {
        put(device, "move", Map.of("Position", Integer.toString(position)));
    }

    default void haltFocuser(AlpacaDevice device) throws DeviceEngineException {
        put(device, "halt", Map.of());
    }

    // ---------------------------------------------------------------------
    // Filter wheel
    // ---------------------------------------------------------------------

    default FilterWheelStatus getFilterWheelStatus(AlpacaDevice device) throws DeviceEngineException {
        if (!isConnected(device)) {
            return FilterWheelStatus.disconnected();
        }
        OptionalReads reads = new OptionalReads(this, device);
        int position = (int) reads.number("position");
        return new FilterWheelStatus(true, position, reads.strings("names"));
    }

    default void setFilterWheelPosition(AlpacaDevice device, int position) throws DeviceEngineException {
        put(device, "position", Map.of("Position", Integer.toString(position)));
    }
}
