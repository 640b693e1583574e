package com.questrail.alpaca.server.middleware;

import com.questrail.alpaca.api.AlpacaErrorCode;
import com.questrail.alpaca.server.AlpacaRequest;
import com.questrail.alpaca.server.AlpacaResponse;
import com.questrail.alpaca.server.AlpacaResponses;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.RequestStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Outermost stage. Any unchecked failure below it becomes HTTP 500 with an
 * unspecified-error envelope; the failure detail goes to the log only.
 */
public final class FaultRecoveryStage implements RequestStage {

    private static final Logger log = LoggerFactory.getLogger(FaultRecoveryStage.class);

    static final String MESSAGE = "Internal server error";

    private final AlpacaResponses responses;

    public FaultRecoveryStage(AlpacaResponses responses) {
        this.responses = Objects.requireNonNull(responses, "responses");
    }

    @Override
    public AlpacaResponse apply(AlpacaRequest request, RequestHandler next) {
        try {
            return next.handle(request);
        } catch (RuntimeException | Error e) {
            if (e instanceof VirtualMachineError) {
                throw e;
            }
            log.error("Recovered from handler fault on {} {}", request.method(), request.path(), e);
            return responses.error(500, request, AlpacaErrorCode.UNSPECIFIED, MESSAGE);
        }
    }
}
