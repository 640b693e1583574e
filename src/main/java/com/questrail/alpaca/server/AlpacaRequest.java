package com.questrail.alpaca.server;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * AlpacaRequest
 * =============================================================================
 * Transport-neutral view of one HTTP request.
 *
 * <h2>Parameters</h2>
 * Query parameters and form-body parameters are merged; a form value wins over
 * a query value with the same name. Lookup by name is case-insensitive, as
 * Alpaca requires, while {@link #parameters()} keeps the names as sent.
 *
 * <p>Instances are immutable; middleware derives new ones with the
 * {@code withX} methods.</p>
 */
public final class AlpacaRequest {

    private final String method;
    private final String path;
    private final String rawQuery;
    private final Map<String, String> parameters;
    private final Map<String, String> parametersByLowerName;
    private final Map<String, String> headers;
    private final String remoteAddress;
    private final TransactionIds transactionIds;
    private final Map<String, String> pathVariables;

    private AlpacaRequest(String method,
                          String path,
                          String rawQuery,
                          Map<String, String> parameters,
                          Map<String, String> headers,
                          String remoteAddress,
                          TransactionIds transactionIds,
                          Map<String, String> pathVariables) {
        this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        this.path = Objects.requireNonNull(path, "path");
        this.rawQuery = rawQuery == null ? "" : rawQuery;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        Map<String, String> lower = new LinkedHashMap<>();
        parameters.forEach((k, v) -> lower.putIfAbsent(k.toLowerCase(Locale.ROOT), v));
        this.parametersByLowerName = lower;
        TreeMap<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        h.putAll(headers);
        this.headers = Collections.unmodifiableMap(h);
        this.remoteAddress = remoteAddress == null ? "" : remoteAddress;
        this.transactionIds = transactionIds;
        this.pathVariables = Collections.unmodifiableMap(new LinkedHashMap<>(pathVariables));
    }

    /**
     * @param query   decoded query parameters, first value per name
     * @param form    decoded form-body parameters, first value per name
     */
    public static AlpacaRequest of(String method,
                                   String path,
                                   String rawQuery,
                                   Map<String, String> query,
                                   Map<String, String> form,
                                   Map<String, String> headers,
                                   String remoteAddress) {
        Map<String, String> merged = new LinkedHashMap<>(query);
        // Form wins; drop a query entry whose name differs only by case.
        form.forEach((k, v) -> {
            merged.keySet().removeIf(existing -> existing.equalsIgnoreCase(k));
            merged.put(k, v);
        });
        return new AlpacaRequest(method, path, rawQuery, merged, headers, remoteAddress, null, Map.of());
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public String rawQuery() {
        return rawQuery;
    }

    /** Case-insensitive parameter lookup; {@code null} when absent. */
    public String parameter(String name) {
        return parametersByLowerName.get(name.toLowerCase(Locale.ROOT));
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public Map<String, String> headers() {
        return headers;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    /** Assigned ids, or {@code null} before the transaction stage ran. */
    public TransactionIds transactionIds() {
        return transactionIds;
    }

    public String pathVariable(String name) {
        return pathVariables.get(name);
    }

    public AlpacaRequest withTransactionIds(TransactionIds ids) {
        return new AlpacaRequest(method, path, rawQuery, parameters, headers, remoteAddress,
                Objects.requireNonNull(ids, "ids"), pathVariables);
    }

    public AlpacaRequest withPathVariables(Map<String, String> vars) {
        return new AlpacaRequest(method, path, rawQuery, parameters, headers, remoteAddress, transactionIds, vars);
    }

    @Override
    public String toString() {
        return method + " " + path + (rawQuery.isEmpty() ? "" : "?" + rawQuery);
    }
}
