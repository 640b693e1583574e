package com.questrail.alpaca.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.questrail.alpaca.api.AlpacaErrorCode;

/**
 * Standard Alpaca response body.
 *
 * <p>{@code ErrorNumber == 0} exactly when {@code ErrorMessage} is empty.
 * {@code Value} is omitted when null, which is always the case for errors.</p>
 */
@JsonPropertyOrder({"Value", "ClientTransactionID", "ServerTransactionID", "ErrorNumber", "ErrorMessage"})
public record AlpacaEnvelope(
        @JsonProperty("Value") @JsonInclude(JsonInclude.Include.NON_NULL) Object value,
        @JsonProperty("ClientTransactionID") int clientTransactionId,
        @JsonProperty("ServerTransactionID") int serverTransactionId,
        @JsonProperty("ErrorNumber") int errorNumber,
        @JsonProperty("ErrorMessage") String errorMessage
) {

    public static AlpacaEnvelope success(TransactionIds ids, Object value) {
        return new AlpacaEnvelope(value, ids.client(), ids.server(), 0, "");
    }

    public static AlpacaEnvelope error(TransactionIds ids, AlpacaErrorCode code, String message) {
        if (code == AlpacaErrorCode.SUCCESS) {
            throw new IllegalArgumentException("error envelope needs a non-zero code");
        }
        String text = message == null || message.isEmpty() ? code.name() : message;
        return new AlpacaEnvelope(null, ids.client(), ids.server(), code.number(), text);
    }

    public static AlpacaEnvelope error(TransactionIds ids, int errorNumber, String message) {
        if (errorNumber == 0) {
            throw new IllegalArgumentException("error envelope needs a non-zero code");
        }
        String text = message == null || message.isEmpty() ? "error " + errorNumber : message;
        return new AlpacaEnvelope(null, ids.client(), ids.server(), errorNumber, text);
    }
}
