package com.questrail.alpaca.discovery;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Objects;

/**
 * An Alpaca server that answered a discovery probe.
 */
public record DiscoveredServer(InetAddress address, int alpacaPort) {

    public DiscoveredServer {
        Objects.requireNonNull(address, "address");
    }

    /**
     * Base URL of the server's REST API, e.g. {@code http://192.168.1.20:11111}.
     */
    public String baseUrl() {
        String host = address.getHostAddress();
        if (address instanceof Inet6Address) {
            host = "[" + host + "]";
        }
        return "http://" + host + ":" + alpacaPort;
    }
}
