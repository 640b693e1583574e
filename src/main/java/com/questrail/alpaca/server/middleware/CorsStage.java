package com.questrail.alpaca.server.middleware;

import com.questrail.alpaca.config.CorsSettings;
import com.questrail.alpaca.server.AlpacaRequest;
import com.questrail.alpaca.server.AlpacaResponse;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.RequestStage;

import java.util.Objects;

/**
 * Cross-origin headers and preflight handling.
 *
 * <p>An {@code Origin} matching a configured origin, or any origin when
 * {@code *} is configured, gets the {@code Access-Control-Allow-*} headers.
 * Every {@code OPTIONS} request is answered with 204 and no body here; later
 * stages (authentication included) never see it.</p>
 */
public final class CorsStage implements RequestStage {

    private final CorsSettings settings;

    public CorsStage(CorsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public AlpacaResponse apply(AlpacaRequest request, RequestHandler next) {
        String allowOrigin = allowedOrigin(request.header("Origin"));

        AlpacaResponse response = "OPTIONS".equals(request.method())
                ? AlpacaResponse.empty(204)
                : next.handle(request);

        if (allowOrigin == null) {
            return response;
        }
        response = response
                .withHeader("Access-Control-Allow-Origin", allowOrigin)
                .withHeader("Access-Control-Allow-Methods", String.join(", ", settings.allowedMethods()))
                .withHeader("Access-Control-Allow-Headers", String.join(", ", settings.allowedHeaders()))
                .withHeader("Access-Control-Max-Age", String.valueOf(settings.maxAge() == null ? 0 : settings.maxAge()));
        if (settings.allowCredentials()) {
            response = response.withHeader("Access-Control-Allow-Credentials", "true");
        }
        return response;
    }

    String allowedOrigin(String origin) {
        for (String allowed : settings.allowedOrigins()) {
            if ("*".equals(allowed)) {
                return "*";
            }
            if (origin != null && allowed.equals(origin)) {
                return origin;
            }
        }
        return null;
    }
}
