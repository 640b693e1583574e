package com.questrail.alpaca.engine.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaForms;
import com.questrail.alpaca.engine.AlpacaDevice;
import com.questrail.alpaca.engine.DeviceEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AlpacaRestClient
 * =============================================================================
 * Alpaca REST client over the JDK {@link HttpClient}.
 *
 * <h2>Protocol</h2>
 * Every call carries {@code ClientID} and an incrementing
 * {@code ClientTransactionID}: in the query string for GET, in a form-encoded
 * body for PUT. A non-2xx status, an unparsable body or a non-zero
 * {@code ErrorNumber} is a {@link DeviceEngineException}.
 *
 * <p>A server URL that does not form a valid http or https URI fails the call
 * as {@link DeviceEngineException.Kind#PROTOCOL}; nothing is sent.</p>
 */
public final class AlpacaRestClient implements AlpacaDeviceClient {

    private static final Logger log = LoggerFactory.getLogger(AlpacaRestClient.class);

    public static final int DEFAULT_CLIENT_ID = 1;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final int clientId;
    private final Duration timeout;
    private final AtomicInteger transactionIds = new AtomicInteger();

    public AlpacaRestClient(HttpClient http, ObjectMapper mapper) {
        this(http, mapper, DEFAULT_CLIENT_ID, DEFAULT_TIMEOUT);
    }

    public AlpacaRestClient(HttpClient http, ObjectMapper mapper, int clientId, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clientId = clientId;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    // ---------------------------------------------------------------------
    // Core
    // ---------------------------------------------------------------------

    @Override
    public List<AlpacaDevice> getConfiguredDevices(String serverUrl) throws DeviceEngineException {
        String base = stripSlash(serverUrl);
        HttpRequest request = newRequest(base + "/management/v1/configureddevices", "configureddevices on " + base)
                .timeout(timeout)
                .GET()
                .build();
        JsonNode value = send(request, "configureddevices on " + base);
        if (value == null || !value.isArray()) {
            throw new DeviceEngineException(DeviceEngineException.Kind.PROTOCOL,
                    "configureddevices on " + base + " is not an array");
        }

        List<AlpacaDevice> devices = new ArrayList<>();
        for (JsonNode entry : value) {
            String type = entry.path("DeviceType").asText("");
            if (type.isEmpty()) {
                log.debug("Skipping configured device without DeviceType on {}: {}", base, entry);
                continue;
            }
            devices.add(AlpacaDevice.of(base, type, entry.path("DeviceNumber").asInt(0),
                    entry.path("DeviceName").asText(""), entry.path("UniqueID").asText("")));
        }
        return devices;
    }

    @Override
    public JsonNode get(AlpacaDevice device, String member) throws DeviceEngineException {
        Map<String, String> params = clientParameters();
        HttpRequest request = newRequest(device.apiBase() + "/" + member + "?" + AlpacaForms.encode(params),
                        "GET " + member + " on " + device.deviceId())
                .timeout(timeout)
                .GET()
                .build();
        return send(request, "GET " + member + " on " + device.deviceId());
    }

    @Override
    public JsonNode put(AlpacaDevice device, String member, Map<String, String> params) throws DeviceEngineException {
        Map<String, String> form = clientParameters();
        form.putAll(params);
        HttpRequest request = newRequest(device.apiBase() + "/" + member, "PUT " + member + " on " + device.deviceId())
                .timeout(timeout)
                .header("Content-Type", AlpacaForms.CONTENT_TYPE)
                .PUT(HttpRequest.BodyPublishers.ofString(AlpacaForms.encode(form)))
                .build();
        return send(request, "PUT " + member + " on " + device.deviceId());
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Map<String, String> clientParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("ClientID", Integer.toString(clientId));
        params.put("ClientTransactionID", Integer.toString(transactionIds.incrementAndGet()));
        return params;
    }

    private static HttpRequest.Builder newRequest(String url, String what) throws DeviceEngineException {
        try {
            return HttpRequest.newBuilder(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new DeviceEngineException(DeviceEngineException.Kind.PROTOCOL,
                    what + ": invalid URL " + url + ": " + e.getMessage(), e);
        }
    }

    private JsonNode send(HttpRequest request, String what) throws DeviceEngineException {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeviceEngineException(DeviceEngineException.Kind.TRANSPORT,
                    what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeviceEngineException(DeviceEngineException.Kind.INTERRUPTED, what + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DeviceEngineException(DeviceEngineException.Kind.TRANSPORT,
                    what + ": HTTP " + status + ": " + response.body());
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new DeviceEngineException(DeviceEngineException.Kind.PROTOCOL,
                    what + ": malformed response: " + e.getOriginalMessage(), e);
        }
        if (body == null || !body.isObject()) {
            throw new DeviceEngineException(DeviceEngineException.Kind.PROTOCOL, what + ": response is not an object");
        }

        int errorNumber = body.path("ErrorNumber").asInt(0);
        if (errorNumber != 0) {
            throw new DeviceEngineException(DeviceEngineException.Kind.DEVICE_ERROR,
                    what + ": ASCOM error " + errorNumber + ": " + body.path("ErrorMessage").asText(""),
                    errorNumber, null);
        }
        JsonNode value = body.get("Value");
        return value == null || value.isNull() ? null : value;
    }

    private static String stripSlash(String url) {
        String out = Objects.requireNonNull(url, "serverUrl");
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
