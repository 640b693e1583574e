package com.questrail.alpaca.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Discovery reply payload: {@code {"AlpacaPort": n}}.
 */
public record DiscoveryResponse(@JsonProperty("AlpacaPort") int alpacaPort) {
}
