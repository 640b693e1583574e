package com.questrail.alpaca.server.middleware;

import com.questrail.alpaca.server.AlpacaRequest;
import com.questrail.alpaca.server.AlpacaResponse;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.RequestStage;
import com.questrail.alpaca.server.ServerTransactionCounter;
import com.questrail.alpaca.server.TransactionIds;

import java.util.Objects;

/**
 * Attaches the echoed client transaction id and a fresh server transaction id
 * to the request before it reaches the routes.
 */
public final class TransactionStage implements RequestStage {

    private final ServerTransactionCounter counter;

    public TransactionStage(ServerTransactionCounter counter) {
        this.counter = Objects.requireNonNull(counter, "counter");
    }

    @Override
    public AlpacaResponse apply(AlpacaRequest request, RequestHandler next) {
        int client = TransactionIds.of(request).client();
        return next.handle(request.withTransactionIds(new TransactionIds(client, counter.next())));
    }
}
