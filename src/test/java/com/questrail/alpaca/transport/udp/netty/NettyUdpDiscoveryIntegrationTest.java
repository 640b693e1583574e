package com.questrail.alpaca.transport.udp.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaJson;
import com.questrail.alpaca.discovery.AlpacaDiscovery;
import com.questrail.alpaca.discovery.AlpacaDiscoveryResponder;
import com.questrail.alpaca.discovery.AlpacaDiscoveryScanner;
import com.questrail.alpaca.discovery.DiscoveredServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDiscoveryIntegrationTest
 * -----------------------------------------------------------------------------
 * Discovery over real UDP sockets on loopback with ephemeral ports.
 */
class NettyUdpDiscoveryIntegrationTest {

    private final ObjectMapper mapper = AlpacaJson.newMapper();
    private NettyUdpDatagramEndpoint endpoint;
    private AlpacaDiscoveryResponder responder;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        responder = new AlpacaDiscoveryResponder(endpoint, 11111, mapper);
        responder.start();
        responder.awaitBound(Duration.ofSeconds(5));
        port = endpoint.localAddress().orElseThrow().getPort();
    }

    @AfterEach
    void tearDown() {
        responder.stop();
    }

    @Test
    void probeIsAnsweredOverTheWire() throws Exception {
        try (DatagramSocket client = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))) {
            client.setSoTimeout(2000);
            byte[] probe = AlpacaDiscovery.tokenBytes();
            client.send(new DatagramPacket(probe, probe.length, InetAddress.getLoopbackAddress(), port));

            byte[] buf = new byte[AlpacaDiscovery.MAX_DATAGRAM_SIZE];
            DatagramPacket reply = new DatagramPacket(buf, buf.length);
            client.receive(reply);

            String json = new String(reply.getData(), 0, reply.getLength(), StandardCharsets.UTF_8);
            assertEquals(11111, mapper.readTree(json).get("AlpacaPort").asInt());
        }
    }

    @Test
    void wrongTokenGetsNoReply() throws Exception {
        try (DatagramSocket client = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))) {
            client.setSoTimeout(300);
            byte[] probe = "alpacadiscovery2".getBytes(StandardCharsets.US_ASCII);
            client.send(new DatagramPacket(probe, probe.length, InetAddress.getLoopbackAddress(), port));

            DatagramPacket reply = new DatagramPacket(new byte[64], 64);
            assertThrows(SocketTimeoutException.class, () -> client.receive(reply));
        }
    }

    @Test
    void scannerFindsResponder() throws Exception {
        AlpacaDiscoveryScanner scanner = new AlpacaDiscoveryScanner(
                () -> new NettyUdpDatagramEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), true,
                        NettyUdpDatagramEndpoint.DEFAULT_SHUTDOWN_BOUND),
                InetAddress.getLoopbackAddress(),
                mapper);

        List<DiscoveredServer> servers = scanner.scan(port, Duration.ofMillis(500));

        assertEquals(1, servers.size());
        assertEquals("http://127.0.0.1:11111", servers.get(0).baseUrl());
    }

    @Test
    void stopReleasesThePort() throws Exception {
        responder.stop();
        assertFalse(endpoint.localAddress().isPresent());
        assertFalse(responder.isUp());

        try (DatagramSocket rebind = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), port))) {
            assertTrue(rebind.isBound());
        }
    }

    @Test
    void portInUseFailsTheBind() throws Exception {
        try (DatagramSocket holder = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))) {
            NettyUdpDatagramEndpoint busy = new NettyUdpDatagramEndpoint(
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), holder.getLocalPort()));
            AlpacaDiscoveryResponder second = new AlpacaDiscoveryResponder(busy, 11111, mapper);
            second.start();
            try {
                assertThrows(IOException.class, () -> second.awaitBound(Duration.ofSeconds(5)));
                assertFalse(second.isUp());
            } finally {
                second.stop();
            }
        }
    }
}
