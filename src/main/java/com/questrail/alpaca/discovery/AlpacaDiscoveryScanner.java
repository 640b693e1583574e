package com.questrail.alpaca.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.transport.DatagramEndpoint;
import com.questrail.alpaca.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * AlpacaDiscoveryScanner
 * =============================================================================
 * Client side of Alpaca discovery: broadcasts one probe and collects every
 * reply that arrives before the deadline.
 *
 * <p>Each scan binds a fresh ephemeral endpoint from the supplied factory and
 * closes it before returning. Replies that are not valid
 * {@link DiscoveryResponse} JSON are skipped. A server answering twice is
 * reported once.</p>
 */
public final class AlpacaDiscoveryScanner {

    private static final Logger log = LoggerFactory.getLogger(AlpacaDiscoveryScanner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(2);

    private final Supplier<DatagramEndpoint> endpointFactory;
    private final InetAddress broadcastAddress;
    private final ObjectMapper mapper;

    public AlpacaDiscoveryScanner(Supplier<DatagramEndpoint> endpointFactory,
                                  InetAddress broadcastAddress,
                                  ObjectMapper mapper) {
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.broadcastAddress = Objects.requireNonNull(broadcastAddress, "broadcastAddress");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Broadcast a probe to {@code port} and wait {@code timeout} for replies.
     *
     * @throws IOException          when the probe socket cannot be bound
     * @throws InterruptedException when interrupted while waiting
     */
    public List<DiscoveredServer> scan(int port, Duration timeout) throws IOException, InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }

        Collector collector = new Collector();
        DatagramEndpoint endpoint = endpointFactory.get();
        endpoint.setListener(collector);
        endpoint.start();
        try {
            if (!collector.bound.await(BIND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("discovery socket did not bind within " + BIND_TIMEOUT);
            }
            Throwable bindFailure = collector.failure.get();
            if (bindFailure != null) {
                throw new IOException("discovery socket failed to bind", bindFailure);
            }

            log.debug("Broadcasting discovery probe to {}:{}", broadcastAddress.getHostAddress(), port);
            endpoint.send(new InetSocketAddress(broadcastAddress, port), AlpacaDiscovery.tokenBytes());

            TimeUnit.NANOSECONDS.sleep(timeout.toNanos());
        } finally {
            endpoint.stop();
        }

        List<DiscoveredServer> servers = collector.snapshot();
        log.info("Discovery on port {} found {} server(s)", port, servers.size());
        return servers;
    }

    private final class Collector implements DatagramEndpointListener {
        private final CountDownLatch bound = new CountDownLatch(1);
        private final AtomicReference<Throwable> failure = new AtomicReference<>();
        private final Set<DiscoveredServer> servers = new LinkedHashSet<>();

        @Override
        public void onTransportUp() {
            bound.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (cause != null && bound.getCount() > 0) {
                failure.compareAndSet(null, cause);
            }
            bound.countDown();
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            if (!(remote instanceof InetSocketAddress inet) || inet.getAddress() == null) {
                return;
            }
            DiscoveryResponse response;
            try {
                response = mapper.readValue(payload, DiscoveryResponse.class);
            } catch (IOException e) {
                log.debug("Ignoring malformed discovery reply from {}: {}", remote, e.getMessage());
                return;
            }
            if (response.alpacaPort() <= 0 || response.alpacaPort() > 65535) {
                log.debug("Ignoring discovery reply from {} with port {}", remote, response.alpacaPort());
                return;
            }
            synchronized (servers) {
                servers.add(new DiscoveredServer(inet.getAddress(), response.alpacaPort()));
            }
        }

        List<DiscoveredServer> snapshot() {
            synchronized (servers) {
                return new ArrayList<>(servers);
            }
        }
    }
}
