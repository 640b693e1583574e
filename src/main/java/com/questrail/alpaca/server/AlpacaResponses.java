package com.questrail.alpaca.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaErrorCode;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Builds JSON responses with the shared mapper.
 */
public final class AlpacaResponses {

    private final ObjectMapper mapper;

    public AlpacaResponses(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public AlpacaResponse json(int status, Object body) {
        try {
            return AlpacaResponse.json(status, mapper.writeValueAsBytes(body));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("cannot serialize response body", e);
        }
    }

    public AlpacaResponse value(AlpacaRequest request, Object value) {
        return json(200, AlpacaEnvelope.success(TransactionIds.of(request), value));
    }

    public AlpacaResponse error(int status, AlpacaRequest request, AlpacaErrorCode code, String message) {
        return json(status, AlpacaEnvelope.error(TransactionIds.of(request), code, message));
    }

    public AlpacaResponse error(int status, AlpacaRequest request, int errorNumber, String message) {
        return json(status, AlpacaEnvelope.error(TransactionIds.of(request), errorNumber, message));
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
