package com.questrail.alpaca.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.alpaca.api.AlpacaErrorCode;
import com.questrail.alpaca.backend.BackendDispatcher;
import com.questrail.alpaca.backend.BackendException;
import com.questrail.alpaca.backend.DeviceBackend;
import com.questrail.alpaca.registry.VirtualDevice;
import com.questrail.alpaca.registry.VirtualDeviceRegistry;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DeviceApi
 * =============================================================================
 * {@code GET|PUT /api/v1/{type}/{number}/{member}} for every virtual device.
 *
 * <h2>Member handling</h2>
 * <ul>
 *   <li>descriptive members ({@code name}, {@code description},
 *       {@code driverinfo}, {@code driverversion}, {@code interfaceversion},
 *       {@code supportedactions}) are answered from the registry</li>
 *   <li>{@code connected} goes through the backend's connection lifecycle and
 *       refreshes the device's cached flag</li>
 *   <li>every other member is forwarded through the {@link BackendDispatcher}</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * An unknown device is HTTP 400 with an invalid-value envelope. Device and
 * backend failures are HTTP 200 with the ASCOM error in the envelope:
 * not connected 0x407, a remote ASCOM error keeps its number, an unimplemented
 * backend 0x400, anything else 0x4FF.
 */
public final class DeviceApi {

    private static final Logger log = LoggerFactory.getLogger(DeviceApi.class);

    private static final Set<String> CLIENT_PARAMETERS = Set.of("clientid", "clienttransactionid");

    private final VirtualDeviceRegistry registry;
    private final BackendDispatcher dispatcher;
    private final AlpacaResponses responses;
    private final WallClock wallClock;

    public DeviceApi(VirtualDeviceRegistry registry,
                     BackendDispatcher dispatcher,
                     AlpacaResponses responses,
                     WallClock wallClock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.responses = Objects.requireNonNull(responses, "responses");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public void registerRoutes(Router router) {
        router.get("/api/v1/{type}/{number}/{member}", this::handle);
        router.put("/api/v1/{type}/{number}/{member}", this::handle);
    }

    AlpacaResponse handle(AlpacaRequest request) {
        Optional<VirtualDevice> found = lookup(request.pathVariable("type"), request.pathVariable("number"));
        if (found.isEmpty()) {
            return responses.error(400, request, AlpacaErrorCode.INVALID_VALUE,
                    "no device " + request.pathVariable("type") + "/" + request.pathVariable("number"));
        }
        VirtualDevice device = found.get();
        String member = request.pathVariable("member").toLowerCase(Locale.ROOT);

        try {
            Object value = "GET".equals(request.method())
                    ? get(device, member, request)
                    : put(device, member, request);
            return responses.value(request, value);
        } catch (AlpacaException e) {
            return responses.error(200, request, e.errorNumber(), e.getMessage());
        } catch (BackendException e) {
            log.warn("{} {} on {} failed: {}", request.method(), member, device.key(), e.getMessage());
            return toErrorResponse(request, e);
        }
    }

    private Object get(VirtualDevice device, String member, AlpacaRequest request) throws BackendException {
        switch (member) {
            case "name":
                return device.name();
            case "description":
                return device.description();
            case "driverinfo":
                return device.driverInfo();
            case "driverversion":
                return device.driverVersion();
            case "interfaceversion":
                return device.interfaceVersion();
            case "supportedactions":
                return List.of();
            case "connected":
                return getConnected(device, request);
            default:
                JsonNode value = dispatcher.get(device, member, forwardedParameters(request));
                device.cacheValue(member, value, wallClock.now());
                return value;
        }
    }

    private Object put(VirtualDevice device, String member, AlpacaRequest request) throws BackendException {
        if ("connected".equals(member)) {
            putConnected(device, request);
            return null;
        }
        return dispatcher.put(device, member, forwardedParameters(request));
    }

    private boolean getConnected(VirtualDevice device, AlpacaRequest request) throws BackendException {
        DeviceBackend backend = requireBackend(device);
        boolean connected = false;
        if (backend.isConnected()) {
            JsonNode value = backend.get("connected", forwardedParameters(request));
            connected = value != null && value.asBoolean(false);
        }
        device.markConnected(connected, wallClock.now());
        return connected;
    }

    private void putConnected(VirtualDevice device, AlpacaRequest request) throws BackendException {
        String raw = request.parameter("Connected");
        boolean target;
        if ("true".equalsIgnoreCase(raw)) {
            target = true;
        } else if ("false".equalsIgnoreCase(raw)) {
            target = false;
        } else {
            throw new AlpacaException(AlpacaErrorCode.INVALID_VALUE, "Connected must be true or false, got: " + raw);
        }

        DeviceBackend backend = requireBackend(device);
        Map<String, String> params = forwardedParameters(request);
        if (target) {
            if (!backend.isConnected()) {
                backend.connect();
            }
            backend.put("connected", params);
            device.markConnected(true, wallClock.now());
            log.info("{} connected", device.key());
        } else {
            try {
                if (backend.isConnected()) {
                    backend.put("connected", params);
                }
            } finally {
                backend.disconnect();
                device.markConnected(false, wallClock.now());
                log.info("{} disconnected", device.key());
            }
        }
    }

    private DeviceBackend requireBackend(VirtualDevice device) throws BackendException {
        return dispatcher.backendFor(device.key()).orElseThrow(() ->
                new BackendException(BackendException.Kind.NOT_IMPLEMENTED, "no backend for " + device.key()));
    }

    private Optional<VirtualDevice> lookup(String type, String number) {
        if (type == null || number == null) {
            return Optional.empty();
        }
        int n;
        try {
            n = Integer.parseInt(number);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (n < 0) {
            return Optional.empty();
        }
        return registry.find(type, n);
    }

    static Map<String, String> forwardedParameters(AlpacaRequest request) {
        Map<String, String> out = new LinkedHashMap<>();
        request.parameters().forEach((k, v) -> {
            if (!CLIENT_PARAMETERS.contains(k.toLowerCase(Locale.ROOT))) {
                out.put(k, v);
            }
        });
        return out;
    }

    private AlpacaResponse toErrorResponse(AlpacaRequest request, BackendException e) {
        switch (e.kind()) {
            case NOT_CONNECTED:
                return responses.error(200, request, AlpacaErrorCode.NOT_CONNECTED, "Not connected to device");
            case REMOTE_ERROR:
                return responses.error(200, request, e.remoteErrorNumber(), e.getMessage());
            case NOT_IMPLEMENTED:
                return responses.error(200, request, AlpacaErrorCode.NOT_IMPLEMENTED, e.getMessage());
            default:
                return responses.error(200, request, AlpacaErrorCode.UNSPECIFIED, e.getMessage());
        }
    }
}
