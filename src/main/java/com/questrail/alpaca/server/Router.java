package com.questrail.alpaca.server;

import com.questrail.alpaca.api.AlpacaErrorCode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Router
 * =============================================================================
 * Maps {@code (method, path)} to a handler.
 *
 * <p>Path templates are slash-separated; a segment written {@code {name}}
 * matches any single non-empty segment and is exposed through
 * {@link AlpacaRequest#pathVariable(String)}. Literal segments match
 * case-insensitively. Routes are tried in registration order.</p>
 *
 * <p>An unmatched path yields 404 with an invalid-operation envelope; a matched
 * path with an unregistered method yields 405 with an {@code Allow} header.</p>
 */
public final class Router implements RequestHandler {

    private final List<Route> routes = new ArrayList<>();
    private final AlpacaResponses responses;

    public Router(AlpacaResponses responses) {
        this.responses = Objects.requireNonNull(responses, "responses");
    }

    public Router get(String template, RequestHandler handler) {
        return add("GET", template, handler);
    }

    public Router put(String template, RequestHandler handler) {
        return add("PUT", template, handler);
    }

    public synchronized Router add(String method, String template, RequestHandler handler) {
        routes.add(new Route(method, split(template), Objects.requireNonNull(handler, "handler")));
        return this;
    }

    @Override
    public AlpacaResponse handle(AlpacaRequest request) {
        String[] path = split(request.path());
        Set<String> allowed = new LinkedHashSet<>();
        List<Route> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(routes);
        }
        for (Route route : snapshot) {
            Map<String, String> vars = route.match(path);
            if (vars == null) {
                continue;
            }
            if (route.method.equals(request.method())) {
                return route.handler.handle(request.withPathVariables(vars));
            }
            allowed.add(route.method);
        }
        if (!allowed.isEmpty()) {
            return responses.error(405, request, AlpacaErrorCode.INVALID_OPERATION,
                    "method " + request.method() + " not allowed on " + request.path())
                    .withHeader("Allow", String.join(", ", allowed));
        }
        return responses.error(404, request, AlpacaErrorCode.INVALID_OPERATION,
                "no such endpoint: " + request.path());
    }

    private static String[] split(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/");
    }

    private static final class Route {
        final String method;
        final String[] segments;
        final RequestHandler handler;

        Route(String method, String[] segments, RequestHandler handler) {
            this.method = method;
            this.segments = segments;
            this.handler = handler;
        }

        Map<String, String> match(String[] path) {
            if (path.length != segments.length) {
                return null;
            }
            Map<String, String> vars = new LinkedHashMap<>();
            for (int i = 0; i < segments.length; i++) {
                String s = segments[i];
                if (s.startsWith("{") && s.endsWith("}")) {
                    if (path[i].isEmpty()) {
                        return null;
                    }
                    vars.put(s.substring(1, s.length() - 1), path[i]);
                } else if (!s.equalsIgnoreCase(path[i])) {
                    return null;
                }
            }
            return vars;
        }
    }
}
