package com.questrail.alpaca.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.questrail.alpaca.config.ServerSettings;
import com.questrail.alpaca.registry.VirtualDevice;
import com.questrail.alpaca.registry.VirtualDeviceRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Alpaca management endpoints: supported API versions, server description and
 * the configured device list. All answers use the standard envelope.
 */
public final class ManagementApi {

    public static final List<Integer> API_VERSIONS = List.of(1);

    private final ServerSettings server;
    private final VirtualDeviceRegistry registry;
    private final AlpacaResponses responses;

    public ManagementApi(ServerSettings server, VirtualDeviceRegistry registry, AlpacaResponses responses) {
        this.server = Objects.requireNonNull(server, "server");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.responses = Objects.requireNonNull(responses, "responses");
    }

    public void registerRoutes(Router router) {
        router.get("/management/apiversions", request -> responses.value(request, API_VERSIONS));
        router.get("/management/v1/description", request -> responses.value(request, description()));
        router.get("/management/v1/configureddevices", request -> responses.value(request, configuredDevices()));
    }

    ServerDescription description() {
        return new ServerDescription(server.serverName(), server.manufacturer(), server.manufacturerVersion(),
                server.location());
    }

    List<ConfiguredDeviceEntry> configuredDevices() {
        List<ConfiguredDeviceEntry> out = new ArrayList<>();
        for (VirtualDevice d : registry.list()) {
            out.add(new ConfiguredDeviceEntry(d.name(), d.deviceType(), d.deviceNumber(), d.uniqueId()));
        }
        return out;
    }

    public record ServerDescription(
            @JsonProperty("ServerName") String serverName,
            @JsonProperty("Manufacturer") String manufacturer,
            @JsonProperty("ManufacturerVersion") String manufacturerVersion,
            @JsonProperty("Location") String location) {
    }

    public record ConfiguredDeviceEntry(
            @JsonProperty("DeviceName") String deviceName,
            @JsonProperty("DeviceType") String deviceType,
            @JsonProperty("DeviceNumber") int deviceNumber,
            @JsonProperty("UniqueID") String uniqueId) {
    }
}
