package com.questrail.alpaca.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@code application/x-www-form-urlencoded} encoding for Alpaca query strings
 * and PUT bodies.
 */
public final class AlpacaForms {

    public static final String CONTENT_TYPE = "application/x-www-form-urlencoded";

    private AlpacaForms() {}

    public static String encode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> e : params.entrySet()) {
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
