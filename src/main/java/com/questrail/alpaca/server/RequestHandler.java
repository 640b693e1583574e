package com.questrail.alpaca.server;

/**
 * Terminal request processing step. Runs on the handler executor and may block.
 */
@FunctionalInterface
public interface RequestHandler {
    AlpacaResponse handle(AlpacaRequest request);
}
