package com.questrail.alpaca.server;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link AlpacaRequest}s for handler and middleware tests.
 */
public final class TestRequests {

    private final String method;
    private final String path;
    private final Map<String, String> query = new LinkedHashMap<>();
    private final Map<String, String> form = new LinkedHashMap<>();
    private final Map<String, String> headers = new LinkedHashMap<>();

    private TestRequests(String method, String path) {
        this.method = method;
        this.path = path;
    }

    public static TestRequests get(String path) {
        return new TestRequests("GET", path);
    }

    public static TestRequests put(String path) {
        return new TestRequests("PUT", path);
    }

    public static TestRequests method(String method, String path) {
        return new TestRequests(method, path);
    }

    public TestRequests query(String name, String value) {
        query.put(name, value);
        return this;
    }

    public TestRequests form(String name, String value) {
        form.put(name, value);
        return this;
    }

    public TestRequests header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public AlpacaRequest build() {
        return AlpacaRequest.of(method, path, "", query, form, headers, "/127.0.0.1:50000");
    }
}
