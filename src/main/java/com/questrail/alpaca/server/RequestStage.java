package com.questrail.alpaca.server;

/**
 * One middleware step. A stage either answers the request itself or delegates
 * to {@code next}, possibly with a derived request.
 */
@FunctionalInterface
public interface RequestStage {
    AlpacaResponse apply(AlpacaRequest request, RequestHandler next);
}
