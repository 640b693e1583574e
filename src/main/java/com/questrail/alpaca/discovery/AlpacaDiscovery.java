package com.questrail.alpaca.discovery;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Wire constants of the Alpaca UDP discovery protocol.
 */
public final class AlpacaDiscovery {

    /** Probe payload, compared byte for byte. */
    public static final String TOKEN = "alpacadiscovery1";

    public static final int DEFAULT_PORT = 32227;

    /** Receive buffer size used by discovery peers. Longer datagrams cannot be a probe. */
    public static final int MAX_DATAGRAM_SIZE = 1024;

    private static final byte[] TOKEN_BYTES = TOKEN.getBytes(StandardCharsets.US_ASCII);

    private AlpacaDiscovery() {}

    public static byte[] tokenBytes() {
        return TOKEN_BYTES.clone();
    }

    /**
     * Exact, case-sensitive comparison with the probe token. No trimming.
     */
    public static boolean isProbe(byte[] payload) {
        return Arrays.equals(payload, TOKEN_BYTES);
    }
}
