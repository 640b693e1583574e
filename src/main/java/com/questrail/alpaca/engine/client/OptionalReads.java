package com.questrail.alpaca.engine.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.alpaca.engine.AlpacaDevice;
import com.questrail.alpaca.engine.DeviceEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort property reads for one device's status snapshot. A failed or
 * mistyped read yields the fallback value.
 */
final class OptionalReads {

    private static final Logger log = LoggerFactory.getLogger(OptionalReads.class);

    private final AlpacaDeviceClient client;
    private final AlpacaDevice device;

    OptionalReads(AlpacaDeviceClient client, AlpacaDevice device) {
        this.client = client;
        this.device = device;
    }

    JsonNode value(String member) {
        try {
            return client.get(device, member);
        } catch (DeviceEngineException e) {
            if (e.kind() == DeviceEngineException.Kind.INTERRUPTED) {
                Thread.currentThread().interrupt();
            }
            log.debug("Optional property {} of {} unavailable: {}", member, device.deviceId(), e.getMessage());
            return null;
        }
    }

    boolean bool(String member) {
        JsonNode value = value(member);
        return value != null && value.isBoolean() && value.booleanValue();
    }

    double number(String member) {
        return number(member, 0);
    }

    double number(String member, double fallback) {
        JsonNode value = value(member);
        return value != null && value.isNumber() ? value.doubleValue() : fallback;
    }

    List<String> strings(String member) {
        List<String> out = new ArrayList<>();
        JsonNode value = value(member);
        if (value != null && value.isArray()) {
            for (JsonNode n : value) {
                out.add(n.asText(""));
            }
        }
        return out;
    }
}
