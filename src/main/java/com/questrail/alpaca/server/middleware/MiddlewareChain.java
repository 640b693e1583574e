package com.questrail.alpaca.server.middleware;

import com.questrail.alpaca.config.AuthenticationSettings;
import com.questrail.alpaca.config.CorsSettings;
import com.questrail.alpaca.server.AlpacaResponses;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.RequestStage;
import com.questrail.alpaca.server.ServerTransactionCounter;
import com.questrail.alpaca.time.MonotonicClock;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MiddlewareChain
 * =============================================================================
 * Composes stages around a terminal handler. The first stage is outermost.
 *
 * <h2>Standard order</h2>
 * fault recovery, request logging, CORS (when enabled), Basic authentication
 * (when enabled), transaction assignment.
 */
public final class MiddlewareChain {

    private MiddlewareChain() {}

    public static RequestHandler compose(List<RequestStage> stages, RequestHandler terminal) {
        Objects.requireNonNull(terminal, "terminal");
        RequestHandler handler = terminal;
        for (int i = stages.size() - 1; i >= 0; i--) {
            RequestStage stage = stages.get(i);
            RequestHandler next = handler;
            handler = request -> stage.apply(request, next);
        }
        return handler;
    }

    public static List<RequestStage> standardStages(CorsSettings cors,
                                                    AuthenticationSettings auth,
                                                    ServerTransactionCounter counter,
                                                    AlpacaResponses responses,
                                                    MonotonicClock clock) {
        List<RequestStage> stages = new ArrayList<>();
        stages.add(new FaultRecoveryStage(responses));
        stages.add(new RequestLoggingStage(clock));
        if (cors != null && cors.enabled()) {
            stages.add(new CorsStage(cors));
        }
        if (auth != null && auth.enabled()) {
            stages.add(new BasicAuthStage(auth, responses));
        }
        stages.add(new TransactionStage(counter));
        return stages;
    }
}
