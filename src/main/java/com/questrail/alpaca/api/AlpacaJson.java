package com.questrail.alpaca.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the JSON mapper shared by the REST server, the REST client, the
 * discovery peers and the message-bus bridge.
 *
 * <p>Remote Alpaca servers add fields freely, so unknown properties are
 * ignored. Instants are written as ISO-8601 strings.</p>
 */
public final class AlpacaJson {

    private AlpacaJson() {}

    public static ObjectMapper newMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }
}
